package rc_core;

/**
 * Floating-point width of the network. The computation itself is implemented once (in double); the precision 
 * rounds every stored state, output and readout weight to the chosen width.
 */
public enum Precision {
    SINGLE("float32") {
        @Override
        public double round(double value) {
            return (float) value;
        }
    },
    DOUBLE("float64") {
        @Override
        public double round(double value) {
            return value;
        }
    };

    private final String string;

    Precision(String string) {
        this.string = string;
    }

    public abstract double round(double value);

    public void roundAll(double[] values) {
        if (this == DOUBLE) {
            return;
        }
        for (int i = 0; i < values.length; i++) {
            values[i] = round(values[i]);
        }
    }

    public void roundAll(double[][] values) {
        if (this == DOUBLE) {
            return;
        }
        for (double[] row : values) {
            roundAll(row);
        }
    }

    /**
     * @return a human-readable name (the constant name is kept for parsing, e.g. from a Flink configuration)
     */
    public String getDescription() {
        return string;
    }
}
