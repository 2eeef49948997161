package lm;

import Jama.Matrix;
import org.junit.jupiter.api.Test;
import utilities.Utilities;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LinearRegressionPrimitiveTest {
    private static final double[][] W_TRUE = {{1.5, -2, 0.25, 3}, {-0.5, 0, 4, 1}};

    /**
     * @return M*W^T, one row per sample
     */
    private static double[][] targets(double[][] M, double[][] W) {
        return new Matrix(M).times(new Matrix(W).transpose()).getArray();
    }

    /**
     * M with the last column duplicating the first one.
     */
    private static double[][] rankDeficient(int rows, Random random) {
        double[][] M = Utilities.randomMatrix(rows, 4, -1, 1, random);
        for (double[] row : M) {
            row[3] = row[0];
        }
        return M;
    }

    @Test
    void exactLinearRelationIsRecovered() throws NumericalException {
        double[][] M = Utilities.randomMatrix(30, 4, -1, 1, new Random(1));
        double[][] T = targets(M, W_TRUE);

        Utilities.assertMatrixEquals(W_TRUE, LinearRegressionPrimitive.trainUsingPseudoinverse(M, T), 1e-10);
        Utilities.assertMatrixEquals(W_TRUE, LinearRegressionPrimitive.trainUsingLeastSquares(M, T), 1e-10);
        Utilities.assertMatrixEquals(W_TRUE, LinearRegressionPrimitive.trainUsingRidgeRegression(M, T, 0), 1e-8);
    }

    @Test
    void algorithmsDelegateToTheRegression() throws NumericalException {
        Random random = new Random(2);
        double[][] M = Utilities.randomMatrix(20, 4, -1, 1, random);
        double[][] T = Utilities.randomMatrix(20, 2, -1, 1, random);

        assertArrayEquals(LinearRegressionPrimitive.trainUsingPseudoinverse(M, T)[1], 
                TrainingAlgorithm.PI.fit(M, T, 5)[1]);
        assertArrayEquals(LinearRegressionPrimitive.trainUsingLeastSquares(M, T)[0], 
                TrainingAlgorithm.LS.fit(M, T, 5)[0]);
        assertArrayEquals(LinearRegressionPrimitive.trainUsingRidgeRegression(M, T, 0.5)[0], 
                TrainingAlgorithm.RIDGEREG.fit(M, T, 0.5)[0]);
    }

    @Test
    void regularizationShrinksTheWeights() throws NumericalException {
        Random random = new Random(3);
        double[][] M = Utilities.randomMatrix(25, 4, -1, 1, random);
        double[][] T = Utilities.randomMatrix(25, 1, -1, 1, random);

        double plain = new Matrix(LinearRegressionPrimitive.trainUsingRidgeRegression(M, T, 0)).normF();
        double regularized = new Matrix(LinearRegressionPrimitive.trainUsingRidgeRegression(M, T, 2)).normF();

        assertTrue(regularized < plain);
    }

    @Test
    void underdeterminedLeastSquaresGivesMinimumNorm() throws NumericalException {
        Random random = new Random(4);
        double[][] M = Utilities.randomMatrix(3, 6, -1, 1, random);
        double[][] T = Utilities.randomMatrix(3, 2, -1, 1, random);

        double[][] leastSquares = LinearRegressionPrimitive.trainUsingLeastSquares(M, T);

        Utilities.assertMatrixEquals(LinearRegressionPrimitive.trainUsingPseudoinverse(M, T), leastSquares, 1e-10);
        Utilities.assertMatrixEquals(T, targets(M, leastSquares), 1e-10);
    }

    @Test
    void pseudoinverseOfRankDeficientMatrices() {
        Random random = new Random(5);
        Matrix tall = new Matrix(rankDeficient(10, random));
        Matrix wide = tall.transpose();

        for (Matrix A : new Matrix[]{tall, wide}) {
            Matrix pinv = LinearRegressionPrimitive.pseudoinverse(A);
            assertEquals(A.getColumnDimension(), pinv.getRowDimension());
            Utilities.assertMatrixEquals(A.getArray(), A.times(pinv).times(A).getArray(), 1e-12);
            Utilities.assertMatrixEquals(pinv.getArray(), pinv.times(A).times(pinv).getArray(), 1e-10);
        }
        assertEquals(3, LinearRegressionPrimitive.rank(tall));
        assertEquals(3, LinearRegressionPrimitive.rank(wide));
    }

    @Test
    void rankDeficientSystems() throws NumericalException {
        Random random = new Random(6);
        double[][] M = rankDeficient(10, random);
        double[][] T = Utilities.randomMatrix(10, 1, -1, 1, random);

        assertThrows(NumericalException.class, () -> LinearRegressionPrimitive.trainUsingLeastSquares(M, T));
        assertThrows(NumericalException.class, () -> LinearRegressionPrimitive.trainUsingRidgeRegression(M, T, 0));
        assertEquals(4, LinearRegressionPrimitive.trainUsingRidgeRegression(M, T, 0.1)[0].length);
        // the duplicated columns share the weight equally
        double[][] W = LinearRegressionPrimitive.trainUsingPseudoinverse(M, T);
        assertEquals(W[0][0], W[0][3], 1e-10);
    }

    @Test
    void underdeterminedSystemWithDependentRows() {
        double[][] M = Utilities.randomMatrix(2, 4, -1, 1, new Random(7));
        M[1] = M[0].clone();
        double[][] T = {{1}, {2}};

        assertThrows(NumericalException.class, () -> LinearRegressionPrimitive.trainUsingLeastSquares(M, T));
    }

    @Test
    void mismatchedSampleCounts() {
        assertThrows(IllegalArgumentException.class, 
                () -> LinearRegressionPrimitive.trainUsingPseudoinverse(new double[3][2], new double[4][1]));
        assertThrows(IllegalArgumentException.class, 
                () -> LinearRegressionPrimitive.trainUsingLeastSquares(new double[0][2], new double[0][1]));
    }
}
