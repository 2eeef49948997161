package lm;

import Jama.LUDecomposition;
import Jama.Matrix;
import Jama.QRDecomposition;
import Jama.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline (multiple, multi-output) linear regression used for fitting the readout of an ESN.
 * A solution using primitive arrays (and Jama Matrix objects) in the background.
 * <p>
 * All methods accept the design matrix M (samples x features) and the target matrix T (samples x outputs) and
 * return the transposed solution W_out (outputs x features), so that y(t) = W_out * m(t).
 */
public class LinearRegressionPrimitive {
    private static final Logger LOG = LoggerFactory.getLogger(LinearRegressionPrimitive.class);

    private LinearRegressionPrimitive() {
    }

    /**
     * Least squares solution using the Moore-Penrose pseudoinverse: W_out = (pinv(M)*T)^T.
     * Defined for every matrix, including rank-deficient ones (minimum-norm solution is returned).
     */
    public static double[][] trainUsingPseudoinverse(double[][] input, double[][] output) {
        checkDimensions(input, output);
        Matrix X = new Matrix(input);
        Matrix Y = new Matrix(output);

        return pseudoinverse(X).times(Y).transpose().getArray();
    }

    /**
     * Least squares solution using Householder QR decomposition.
     * For an overdetermined (or square) M the solution minimizes ||M*W_out^T - T||. For an underdetermined M the
     * minimum-norm solution is computed from the QR decomposition of M^T (M = R^T*Q^T, W_out^T = Q*(R^T)^(-1)*T).
     *
     * @throws NumericalException if M doesn't have full rank (numerically, see {@link #rank(Matrix)})
     */
    public static double[][] trainUsingLeastSquares(double[][] input, double[][] output) throws NumericalException {
        checkDimensions(input, output);
        Matrix X = new Matrix(input);
        Matrix Y = new Matrix(output);
        Matrix solution;

        int rank = rank(X);

        if (X.getRowDimension() >= X.getColumnDimension()) {
            if (rank < X.getColumnDimension()) {
                throw new NumericalException("Least squares: the design matrix (" + X.getRowDimension() + "x"
                        + X.getColumnDimension() + ") is rank deficient (rank " + rank + ").");
            }
            solution = new QRDecomposition(X).solve(Y);
        }
        else {
            if (rank < X.getRowDimension()) {
                throw new NumericalException("Least squares: the underdetermined design matrix ("
                        + X.getRowDimension() + "x" + X.getColumnDimension() + ") doesn't have full row rank (rank "
                        + rank + ").");
            }
            LOG.debug("Least squares: underdetermined system, computing the minimum-norm solution.");
            QRDecomposition qr = new QRDecomposition(X.transpose());
            Matrix RTranspose = qr.getR().transpose();  // lower triangular, non-singular
            solution = qr.getQ().times(solveNonsingular(RTranspose, Y));
        }

        return solution.transpose().getArray();
    }

    /**
     * Ridge regression (Tikhonov regularization): W_out = ((M^T*M + lambda^2*I)^(-1)*M^T*T)^T.
     * With lambda == 0 this is the normal equations solution, equal to the pseudoinverse one if M has full column
     * rank.
     *
     * @param tikhonovFactor lambda (it is squared before being added to the diagonal)
     * @throws NumericalException if lambda == 0 and M is rank deficient, or the regularized matrix is singular
     */
    public static double[][] trainUsingRidgeRegression(double[][] input, double[][] output, double tikhonovFactor)
            throws NumericalException {
        checkDimensions(input, output);
        Matrix X = new Matrix(input);
        Matrix Y = new Matrix(output);
        int features = X.getColumnDimension();

        if (tikhonovFactor == 0 && rank(X) < features) {
            throw new NumericalException("Ridge regression without regularization: the design matrix ("
                    + X.getRowDimension() + "x" + features + ") is rank deficient, M^T*M is singular.");
        }

        Matrix XTranspose = X.transpose();
        Matrix regularized = XTranspose.times(X)
                .plus(Matrix.identity(features, features).times(tikhonovFactor*tikhonovFactor)); // M^T*M + lambda^2*I
        Matrix inverse = solveNonsingular(regularized, Matrix.identity(features, features));

        return inverse.times(XTranspose).times(Y).transpose().getArray();
    }

    /**
     * Computes the Moore-Penrose pseudoinverse using the singular value decomposition.
     * Singular values not larger than max(m, n)*s_max*eps are treated as zeros.
     */
    public static Matrix pseudoinverse(Matrix A) {
        int m = A.getRowDimension();
        int n = A.getColumnDimension();
        if (m < n) {    // Jama's SVD expects m >= n; pinv(A) = pinv(A^T)^T
            return pseudoinverse(A.transpose()).transpose();
        }

        SingularValueDecomposition svd = A.svd();
        double[] s = svd.getSingularValues();
        double tolerance = Math.max(m, n) * s[0] * Math.ulp(1.0);

        Matrix sInverse = new Matrix(n, n);
        int rank = 0;
        for (int k = 0; k < n; k++) {
            if (s[k] > tolerance) {
                sInverse.set(k, k, 1/s[k]);
                ++rank;
            }
        }
        if (rank < n) {
            LOG.debug("Pseudoinverse of a rank-deficient matrix ({}x{}, rank {}).", m, n, rank);
        }

        return svd.getV().times(sInverse).times(svd.getU().transpose()); // V * S^+ * U^T
    }

    /**
     * Numerical rank of the matrix (number of singular values above the pseudoinverse tolerance).
     */
    public static int rank(Matrix A) {
        if (A.getRowDimension() < A.getColumnDimension()) {
            return A.transpose().rank();
        }
        return A.rank();
    }

    private static Matrix solveNonsingular(Matrix A, Matrix B) throws NumericalException {
        LUDecomposition lu = new LUDecomposition(A);
        if (!lu.isNonsingular()) {
            throw new NumericalException("The matrix (" + A.getRowDimension() + "x" + A.getColumnDimension()
                    + ") is singular.");
        }
        return lu.solve(B);
    }

    private static void checkDimensions(double[][] input, double[][] output) {
        if (input.length != output.length) {
            throw new IllegalArgumentException("The amount of input and output data must agree! (inputs = "
                    + input.length + ", outputs = " + output.length + ")");
        }
        if (input.length == 0) {
            throw new IllegalArgumentException("At least one sample is needed for the regression.");
        }
    }
}
