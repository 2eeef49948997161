package rc_core;

/**
 * Selects the feature set the readout is computed from. The state update of the reservoir is the same for all 
 * algorithms, only the extended state vector fed to the (linear) readout differs.
 */
public enum SimulationAlgorithm {
    /** Standard readout from [x(t) u(t)]. */
    STD("Standard") {
        @Override
        public int featureCount(int N_x, int N_u) {
            return N_x + N_u;
        }

        @Override
        public double[] features(double[] state, double[] input) {
            double[] features = new double[state.length + input.length];
            System.arraycopy(state, 0, features, 0, state.length);
            System.arraycopy(input, 0, features, state.length, input.length);
            return features;
        }
    },
    /** Readout from [x(t) u(t) x(t)^2 u(t)^2], the squares taken element-wise. */
    SQUARE("Square") {
        @Override
        public int featureCount(int N_x, int N_u) {
            return 2*(N_x + N_u);
        }

        @Override
        public double[] features(double[] state, double[] input) {
            int linearCount = state.length + input.length;
            double[] features = new double[2*linearCount];
            System.arraycopy(state, 0, features, 0, state.length);
            System.arraycopy(input, 0, features, state.length, input.length);
            for (int i = 0; i < linearCount; i++) {
                features[linearCount + i] = features[i]*features[i];
            }
            return features;
        }
    };

    private final String string;

    SimulationAlgorithm(String string) {
        this.string = string;
    }

    /**
     * @param N_x reservoir size
     * @param N_u input vector size
     * @return number of columns of the readout matrix (and of the design matrix used for training)
     */
    public abstract int featureCount(int N_x, int N_u);

    /**
     * Builds the extended state vector from the current state and input.
     */
    public abstract double[] features(double[] state, double[] input);

    /**
     * @return a human-readable name (the constant name is kept for parsing, e.g. from a Flink configuration)
     */
    public String getDescription() {
        return string;
    }
}
