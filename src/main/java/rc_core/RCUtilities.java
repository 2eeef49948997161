package rc_core;

import org.ojalgo.matrix.decomposition.Eigenvalue;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.Primitive64Store;
import org.ojalgo.scalar.ComplexNumber;
import org.ojalgo.structure.Access1D;
import org.ojalgo.structure.Access2D;

import java.util.ArrayList;
import java.util.List;

public class RCUtilities {

    private RCUtilities() {
    }

    /**
     * Computes the spectral radius of the given matrix which is defined as the largest of the absolute values of its 
     * eigenvalues.
     * I.e. spectralRadius = max{|eig_1|, ..., |eig_n|}.
     * 
     * @param matrix A real-valued (and square) matrix
     * @return the spectral radius (0 for a zero matrix)
     */
    public static double spectralRadius(MatrixStore<Double> matrix) {
        final Eigenvalue<Double> eigenvalueDecomposition = Eigenvalue.PRIMITIVE.make((int) matrix.countRows(), 
                (int) matrix.countColumns());
        eigenvalueDecomposition.decompose(matrix);
        List<ComplexNumber> eigenvalues = eigenvalueDecomposition.getEigenvalues();
        double spectralRadius = 0;
        for (ComplexNumber eigenvalue : eigenvalues) {  // selecting the largest absolute value of an eigenvalue
            double val = eigenvalue.norm();
            if (spectralRadius < val) {
                spectralRadius = val;
            }
        }
        return spectralRadius;
    }

    /**
     * Wraps a vector into a column matrix (N x 1).
     */
    public static Primitive64Store column(double[] vector) {
        Primitive64Store column = Primitive64Store.FACTORY.make(vector.length, 1);
        for (int i = 0; i < vector.length; i++) {
            column.set(i, 0, vector[i]);
        }
        return column;
    }

    /**
     * Copies a (column) vector of any ojAlgo structure into a primitive array. Matrices are read in column-major 
     * order.
     */
    public static double[] toVector(Access1D<?> vector) {
        double[] array = new double[(int) vector.count()];
        for (int i = 0; i < array.length; i++) {
            array[i] = vector.doubleValue(i);
        }
        return array;
    }

    /**
     * Copies a matrix of any ojAlgo structure into a primitive 2D array (row-major).
     */
    public static double[][] toArray(Access2D<?> matrix) {
        double[][] array = new double[(int) matrix.countRows()][(int) matrix.countColumns()];
        for (int i = 0; i < array.length; i++) {
            for (int j = 0; j < array[i].length; j++) {
                array[i][j] = matrix.doubleValue(i, j);
            }
        }
        return array;
    }

    /**
     * Creates a dense copy of a primitive 2D array (row-major).
     */
    public static Primitive64Store toStore(double[][] matrix) {
        int rows = matrix.length;
        int cols = rows == 0 ? 0 : matrix[0].length;
        Primitive64Store store = Primitive64Store.FACTORY.make(rows, cols);
        for (int i = 0; i < rows; i++) {
            if (matrix[i].length != cols) {
                throw new ConfigurationException("All rows of a matrix must have the same length.");
            }
            for (int j = 0; j < cols; j++) {
                store.set(i, j, matrix[i][j]);
            }
        }
        return store;
    }

    /**
     * Extracts the n-th column of a (channels x time) data matrix.
     */
    public static double[] column(double[][] data, int n) {
        double[] column = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            column[i] = data[i][n];
        }
        return column;
    }

    public static double[] listToArray(List<Double> input) {
        double[] inputPrimitive = new double[input.size()];
        for (int i = 0; i < inputPrimitive.length; i++) {
            inputPrimitive[i] = input.get(i);
        }
        return inputPrimitive;
    }

    public static List<Double> arrayToList(double[] input) {
        List<Double> inputList = new ArrayList<>(input.length);
        for (double value : input) {
            inputList.add(value);
        }
        return inputList;
    }

    /**
     * A convenience method that creates a comma-separated string of list contents.
     */
    public static <T> String listToString(List<T> list) {
        StringBuilder listString = new StringBuilder("{");
        for (int i = 0; i < list.size(); ++i) {
            if (i == list.size() - 1) {
                listString.append(list.get(i));
            }
            else {
                listString.append(list.get(i)).append(", ");
            }
        }
        listString.append('}');

        return listString.toString();
    }
}
