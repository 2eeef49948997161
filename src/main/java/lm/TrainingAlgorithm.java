package lm;

/**
 * Regression methods computing the readout weights from the design matrix M (rows = time steps) and the target
 * matrix T (rows = time steps). Every method returns W_out with one row per output.
 */
public enum TrainingAlgorithm {
    /** Moore-Penrose pseudoinverse: W_out = (pinv(M)*T)^T. Works for any M. */
    PI("Pseudoinverse") {
        @Override
        public double[][] fit(double[][] M, double[][] T, double tikhonovFactor) {
            return LinearRegressionPrimitive.trainUsingPseudoinverse(M, T);
        }
    },
    /** Least squares solution using the QR decomposition; fails for rank-deficient M. */
    LS("Least Squares") {
        @Override
        public double[][] fit(double[][] M, double[][] T, double tikhonovFactor) throws NumericalException {
            return LinearRegressionPrimitive.trainUsingLeastSquares(M, T);
        }
    },
    /** Ridge regression: W_out = ((M^T*M + lambda^2*I)^(-1)*M^T*T)^T. */
    RIDGEREG("Ridge Regression") {
        @Override
        public double[][] fit(double[][] M, double[][] T, double tikhonovFactor) throws NumericalException {
            return LinearRegressionPrimitive.trainUsingRidgeRegression(M, T, tikhonovFactor);
        }
    };

    private final String string;

    TrainingAlgorithm(String string) {
        this.string = string;
    }

    /**
     * @param M design matrix (samples x features)
     * @param T target matrix (samples x outputs)
     * @param tikhonovFactor regularization factor (used only by {@link #RIDGEREG})
     * @return W_out (outputs x features)
     * @throws NumericalException if the method can't produce a solution for the given data
     */
    public abstract double[][] fit(double[][] M, double[][] T, double tikhonovFactor) throws NumericalException;

    /**
     * @return a human-readable name (the constant name is kept for parsing, e.g. from a Flink configuration)
     */
    public String getDescription() {
        return string;
    }
}
