package rc_core;

import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.Primitive64Store;

import java.util.Arrays;

/**
 * The state transition of an ESN reservoir. Owns the (internal) state vector x and the last output y which is fed
 * back into the reservoir.
 * It realizes the formula x(t) = f(W*x(t-1) + W_in*u(t) + W_back*y(t-1)), where f is the reservoir activation
 * applied element-wise and the feedback term is present only if the weights contain W_back.
 * <p>
 * The simulation is deterministic. One instance processes one sequence at a time; the weights may be shared between
 * instances, the state can't.
 */
public class Simulator {
    private final ReservoirWeights weights;
    private final Activation reservoirActivation;
    private final Precision precision;
    private final int N_x;
    private final int N_u;
    private final int N_y;
    private Primitive64Store state;   // x(t-1), N_x*1
    private double[] lastOutput;    // y(t-1), fed back through W_back

    public Simulator(ReservoirWeights weights, ESNConfiguration configuration) {
        weights.checkDimensions(configuration);
        this.weights = weights;
        this.reservoirActivation = configuration.getReservoirActivation();
        this.precision = configuration.getPrecision();
        this.N_x = configuration.getSize();
        this.N_u = configuration.getInputs();
        this.N_y = configuration.getOutputs();
        resetState();
    }

    /**
     * Advances the reservoir by one time step.
     *
     * @param input u(t), of size N_u
     * @param previousOutput y(t-1), of size N_y; if null, the stored last output is used
     * @return the new state x(t) (a copy)
     */
    public double[] step(double[] input, double[] previousOutput) {
        if (input.length != N_u) {
            throw new ConfigurationException("The current input vector size doesn't match the specified size N_u.\n"
                    + "N_u = " + N_u + ",\tinput size = " + input.length);
        }
        double[] feedback = previousOutput == null ? lastOutput : previousOutput;
        if (feedback.length != N_y) {
            throw new ConfigurationException("The previous output vector size doesn't match the specified size N_y."
                    + "\nN_y = " + N_y + ",\toutput size = " + feedback.length);
        }

        MatrixStore<Double> output = weights.getW_internal().multiply(state)
                .add(weights.getW_input().multiply(RCUtilities.column(input)));
        if (weights.hasFeedback()) {
            output = output.add(weights.getW_back().multiply(RCUtilities.column(feedback)));
        }

        Primitive64Store next = Primitive64Store.FACTORY.copy(output);
        next.modifyAll(reservoirActivation.asUnaryFunction());
        if (precision != Precision.DOUBLE) {
            for (int i = 0; i < N_x; i++) {
                next.set(i, 0, precision.round(next.doubleValue(i)));
            }
        }
        state = next;   // save the state for the next iteration

        return getState();
    }

    /**
     * Zeroes the state vector and the last output. The weights are kept.
     */
    public void resetState() {
        state = Primitive64Store.FACTORY.make(N_x, 1);
        lastOutput = new double[N_y];
    }

    public double[] getState() {
        return RCUtilities.toVector(state);
    }

    /**
     * Injects an external state vector (copied).
     *
     * @throws StateException if the vector doesn't have N_x elements
     */
    public void setState(double[] x) {
        if (x.length != N_x) {
            throw new StateException("The state vector must have N_x = " + N_x + " elements, has " + x.length);
        }
        double[] rounded = Arrays.copyOf(x, x.length);
        precision.roundAll(rounded);
        state = RCUtilities.column(rounded);
    }

    public double[] getLastOutput() {
        return Arrays.copyOf(lastOutput, lastOutput.length);
    }

    /**
     * Sets the output that is fed back in the next step (e.g. the teacher signal during teacher forcing).
     */
    public void setLastOutput(double[] y) {
        if (y.length != N_y) {
            throw new ConfigurationException("The output vector must have N_y = " + N_y + " elements, has "
                    + y.length);
        }
        lastOutput = Arrays.copyOf(y, y.length);
        precision.roundAll(lastOutput);
    }
}
