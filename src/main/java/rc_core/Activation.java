package rc_core;

import org.ojalgo.function.UnaryFunction;
import org.ojalgo.function.constant.PrimitiveMath;

/**
 * Activation functions available for the reservoir (state update) and for the readout (output).
 * Every activation knows its inverse, which is used to move the training targets into the linear pre-image 
 * of the output activation.
 */
public enum Activation {
    /** f(x) = x */
    IDENTITY("Identity") {
        @Override
        public double apply(double x) {
            return x;
        }

        @Override
        public double inverse(double y) {
            return y;
        }
    },
    /** f(x) = tanh(x), inverse atanh(y) defined on (-1; 1) */
    TANH("Tanh") {
        @Override
        public double apply(double x) {
            return Math.tanh(x);
        }

        @Override
        public double inverse(double y) {
            return PrimitiveMath.ATANH.invoke(y);
        }

        @Override
        public boolean isInRange(double y) {
            return y > -1 && y < 1;
        }
    };

    private final String string;

    Activation(String string) {
        this.string = string;
    }

    public abstract double apply(double x);

    public abstract double inverse(double y);

    /**
     * @return true if y is a value the activation can produce, i.e. its inverse is finite
     */
    public boolean isInRange(double y) {
        return Double.isFinite(y);
    }

    public boolean isLinear() {
        return this == IDENTITY;
    }

    public Transformation forward() {
        return this::apply;
    }

    public Transformation backward() {
        return this::inverse;
    }

    /**
     * Converts the activation to a function applicable on ojAlgo structures (e.g. {@code modifyAll}).
     */
    public UnaryFunction<Double> asUnaryFunction() {
        Transformation transformation = forward();
        return new UnaryFunction<Double>() {
            @Override
            public double invoke(double arg) {
                return transformation.transform(arg);
            }

            @Override
            public float invoke(float arg) {
                return (float) transformation.transform(arg);
            }

            @Override
            public Double invoke(Double arg) {
                return transformation.transform(arg);
            }
        };
    }

    /**
     * Applies the inverse in place on every element of the matrix.
     */
    public void inverseAll(double[][] values) {
        if (isLinear()) {
            return;
        }
        for (double[] row : values) {
            for (int j = 0; j < row.length; j++) {
                row[j] = inverse(row[j]);
            }
        }
    }

    /**
     * @return a human-readable name (the constant name is kept for parsing, e.g. from a Flink configuration)
     */
    public String getDescription() {
        return string;
    }
}
