package rc_core;

import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.Primitive64Store;

/**
 * The fixed (untrained) weights of an ESN reservoir:
 * W (N_x*N_x) internal connections, W_in (N_x*N_u) input weights and an optional W_back (N_x*N_y) feedback weights.
 * The matrices are treated as read-only once the network is initialized; {@link #copy()} creates an independent
 * deep copy.
 */
public class ReservoirWeights {
    private final MatrixStore<Double> W_internal;
    private final MatrixStore<Double> W_input;
    private final MatrixStore<Double> W_back;   // null if the network has no output feedback

    public ReservoirWeights(MatrixStore<Double> W_internal, MatrixStore<Double> W_input, MatrixStore<Double> W_back) {
        if (W_internal == null || W_input == null) {
            throw new ConfigurationException("The internal and input weight matrices are mandatory.");
        }
        if (W_internal.countRows() != W_internal.countColumns()) {
            throw new ConfigurationException("W has to be a square matrix, is " + W_internal.countRows() + "x"
                    + W_internal.countColumns());
        }
        if (W_input.countRows() != W_internal.countRows()) {
            throw new ConfigurationException("W_in must have N_x = " + W_internal.countRows() + " rows, has "
                    + W_input.countRows());
        }
        if (W_back != null && W_back.countRows() != W_internal.countRows()) {
            throw new ConfigurationException("W_back must have N_x = " + W_internal.countRows() + " rows, has "
                    + W_back.countRows());
        }
        this.W_internal = W_internal;
        this.W_input = W_input;
        this.W_back = W_back;
    }

    /**
     * Creates the weights from primitive (row-major) arrays. The arrays are copied.
     *
     * @param W_back may be null (no feedback)
     */
    public static ReservoirWeights of(double[][] W_internal, double[][] W_input, double[][] W_back) {
        return new ReservoirWeights(RCUtilities.toStore(W_internal), RCUtilities.toStore(W_input),
                W_back == null ? null : RCUtilities.toStore(W_back));
    }

    /**
     * Checks the dimensions against the configuration.
     *
     * @throws ConfigurationException if any of the dimensions doesn't match
     */
    public void checkDimensions(ESNConfiguration configuration) {
        if (W_internal.countRows() != configuration.getSize()) {
            throw new ConfigurationException("W is " + W_internal.countRows() + "x" + W_internal.countColumns()
                    + ", N_x = " + configuration.getSize());
        }
        if (W_input.countColumns() != configuration.getInputs()) {
            throw new ConfigurationException("W_in has " + W_input.countColumns() + " columns, N_u = "
                    + configuration.getInputs());
        }
        if (W_back != null && W_back.countColumns() != configuration.getOutputs()) {
            throw new ConfigurationException("W_back has " + W_back.countColumns() + " columns, N_y = "
                    + configuration.getOutputs());
        }
    }

    public ReservoirWeights copy() {
        return new ReservoirWeights(Primitive64Store.FACTORY.copy(W_internal), Primitive64Store.FACTORY.copy(W_input),
                W_back == null ? null : Primitive64Store.FACTORY.copy(W_back));
    }

    public MatrixStore<Double> getW_internal() {
        return W_internal;
    }

    public MatrixStore<Double> getW_input() {
        return W_input;
    }

    public MatrixStore<Double> getW_back() {
        return W_back;
    }

    public boolean hasFeedback() {
        return W_back != null;
    }
}
