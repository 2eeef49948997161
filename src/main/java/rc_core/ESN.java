package rc_core;

import lm.NumericalException;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.Primitive64Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An Echo State Network: a fixed random reservoir with a trained linear readout.
 * <p>
 * Usage: configure ({@link ESNConfiguration}), initialize the weights ({@link #init()} or one of its variants),
 * train the readout ({@link #train(double[][], double[][], int)}) and run it ({@link #simulateStep(double[], double[])}
 * or {@link #simulate(double[][], double[][])}).
 * <p>
 * The output is computed as y(t) = g(W_out*[x(t) u(t)]) (or with the squared features appended for
 * {@link SimulationAlgorithm#SQUARE}), g being the output activation. The output is also stored as the last output
 * and fed back (through W_back) in the next step, so a network with feedback runs as a generator.
 * <p>
 * Data matrices are indexed as (channel, time step). An instance isn't thread-safe.
 */
public class ESN {
    private static final Logger LOG = LoggerFactory.getLogger(ESN.class);

    private final ESNConfiguration configuration;
    private final ReadoutTrainer trainer;
    private ReservoirWeights weights;
    private Simulator simulator;
    private MatrixStore<Double> W_out;  // N_y x features, null until trained

    public ESN(ESNConfiguration configuration) {
        configuration.argumentsCheck();
        this.configuration = new ESNConfiguration(configuration);
        this.trainer = new ReadoutTrainer(this);
    }

    /**
     * A deep copy of another network: configuration, weights and readout are copied, the state starts at zero.
     */
    public ESN(ESN other) {
        this(other.configuration);
        if (other.isInitialized()) {
            init(other.weights.copy());
        }
        if (other.isTrained()) {
            W_out = Primitive64Store.FACTORY.copy(other.W_out);
        }
    }

    /**
     * Initializes the weights using the default {@link RandomWeightInitializer} seeded with the configured seed.
     */
    public void init() {
        init(new RandomWeightInitializer(configuration.getSeed()));
    }

    public void init(WeightInitializer initializer) {
        init(initializer.initialize(new ESNConfiguration(configuration)));
    }

    /**
     * Initializes the network with externally supplied weights. A previously trained readout is discarded.
     *
     * @throws ConfigurationException if the dimensions don't match the configuration
     */
    public void init(ReservoirWeights weights) {
        this.simulator = new Simulator(weights, configuration);
        this.weights = weights;
        this.W_out = null;
        LOG.debug("ESN initialized: {}", configuration);
    }

    /**
     * Trains the readout weights and stores them. W_out is replaced only if the training succeeds.
     *
     * @param indata input sequence (N_u x steps)
     * @param outdata desired output sequence (N_y x steps)
     * @param washout number of initial time steps not used for the regression (0 <= washout < steps)
     * @throws NumericalException if the regression can't be computed (e.g. a singular system)
     */
    public void train(double[][] indata, double[][] outdata, int washout) throws NumericalException {
        double[][] trained = trainer.train(indata, outdata, washout);
        W_out = RCUtilities.toStore(trained);
        LOG.info("Trained readout ({}x{}) using {} on {} samples.", trained.length, trained[0].length,
                configuration.getTrainingAlgorithm().getDescription(), indata[0].length - washout);
    }

    /**
     * Computes one step of the network: the reservoir is updated using the input and the last output, then the
     * readout is applied. The output becomes the new last output.
     *
     * @param input u(t) of size N_u
     * @param outPlaceholder if not null, the output is copied into it (size N_y)
     * @return y(t)
     */
    public double[] simulateStep(double[] input, double[] outPlaceholder) {
        checkTrained();
        if (outPlaceholder != null && outPlaceholder.length != configuration.getOutputs()) {
            throw new ConfigurationException("The output placeholder must have N_y = " + configuration.getOutputs()
                    + " elements, has " + outPlaceholder.length);
        }
        double[] x = simulator.step(input, null);
        double[] y = readout(W_out, x, input);
        simulator.setLastOutput(y);
        if (outPlaceholder != null) {
            System.arraycopy(y, 0, outPlaceholder, 0, y.length);
        }
        return y;
    }

    /**
     * Runs {@link #simulateStep(double[], double[])} for every time step of the input.
     *
     * @param indata N_u x steps
     * @param outdata N_y x steps, filled with the outputs
     */
    public void simulate(double[][] indata, double[][] outdata) {
        checkTrained();
        if (indata.length != configuration.getInputs() || outdata.length != configuration.getOutputs()) {
            throw new ConfigurationException("Wrong data row size: input " + indata.length + " (N_u = "
                    + configuration.getInputs() + "), output " + outdata.length + " (N_y = "
                    + configuration.getOutputs() + ")");
        }
        int steps = indata[0].length;
        for (double[] row : outdata) {
            if (row.length != steps) {
                throw new ConfigurationException("Input and output must have the same number of time steps.");
            }
        }
        for (int n = 0; n < steps; n++) {
            double[] y = simulateStep(RCUtilities.column(indata, n), null);
            for (int j = 0; j < y.length; j++) {
                outdata[j][n] = y[j];
            }
        }
    }

    /**
     * Collects the reservoir states of a teacher-forced run with a zero teacher signal (identical to the states
     * used for training on the same input).
     *
     * @param indata N_u x steps
     * @param outStates N_x x (steps - washout), filled with the states after the washout
     */
    public void collectStates(double[][] indata, double[][] outStates, int washout) {
        double[][] states = collectStates(indata, washout);
        if (outStates.length != states.length) {
            throw new ConfigurationException("The state buffer must have N_x = " + states.length + " rows, has "
                    + outStates.length);
        }
        for (int i = 0; i < states.length; i++) {
            if (outStates[i].length != states[i].length) {
                throw new ConfigurationException("The state buffer must have steps - washout = " + states[i].length
                        + " columns, has " + outStates[i].length);
            }
            System.arraycopy(states[i], 0, outStates[i], 0, states[i].length);
        }
    }

    /**
     * @see #collectStates(double[][], double[][], int)
     * @return states (N_x x (steps - washout))
     */
    public double[][] collectStates(double[][] indata, int washout) {
        if (!isInitialized()) {
            throw new StateException("The network has to be initialized before collecting states.");
        }
        int steps = indata.length == 0 ? 0 : indata[0].length;
        double[][] zeroOutput = new double[configuration.getOutputs()][steps];
        return trainer.collectStates(indata, zeroOutput, washout);
    }

    /**
     * Applies a readout on the current state and input: g(W_out*features(x, u)).
     */
    double[] readout(MatrixStore<Double> readout, double[] x, double[] input) {
        double[] features = configuration.getSimulationAlgorithm().features(x, input);
        Primitive64Store output = Primitive64Store.FACTORY.copy(readout.multiply(RCUtilities.column(features)));
        output.modifyAll(configuration.getOutputActivation().asUnaryFunction());
        double[] y = RCUtilities.toVector(output);
        configuration.getPrecision().roundAll(y);
        return y;
    }

    public void resetState() {
        checkInitialized();
        simulator.resetState();
    }

    public void setState(double[] x) {
        checkInitialized();
        simulator.setState(x);
    }

    public double[] getState() {
        checkInitialized();
        return simulator.getState();
    }

    public void setLastOutput(double[] y) {
        checkInitialized();
        simulator.setLastOutput(y);
    }

    public double[] getLastOutput() {
        checkInitialized();
        return simulator.getLastOutput();
    }

    public MatrixStore<Double> getW() {
        checkInitialized();
        return weights.getW_internal();
    }

    public MatrixStore<Double> getWin() {
        checkInitialized();
        return weights.getW_input();
    }

    /**
     * @return W_back or null if the network has no feedback
     */
    public MatrixStore<Double> getWback() {
        checkInitialized();
        return weights.getW_back();
    }

    /**
     * @return W_out or null if the network isn't trained yet
     */
    public MatrixStore<Double> getWout() {
        return W_out;
    }

    /**
     * Sets an externally computed readout.
     *
     * @param W_out N_y x features
     */
    public void setWout(double[][] W_out) {
        if (W_out.length != configuration.getOutputs() || W_out[0].length != configuration.getFeatureCount()) {
            throw new ConfigurationException("W_out must be " + configuration.getOutputs() + "x"
                    + configuration.getFeatureCount());
        }
        double[][] rounded = new double[W_out.length][];
        for (int j = 0; j < W_out.length; j++) {
            rounded[j] = W_out[j].clone();
        }
        configuration.getPrecision().roundAll(rounded);
        this.W_out = RCUtilities.toStore(rounded);
    }

    /**
     * @return a copy of the configuration (the configuration can't be changed after construction)
     */
    public ESNConfiguration getConfiguration() {
        return new ESNConfiguration(configuration);
    }

    ESNConfiguration configuration() {
        return configuration;
    }

    public ReservoirWeights getWeights() {
        return weights;
    }

    public boolean isInitialized() {
        return simulator != null;
    }

    public boolean isTrained() {
        return W_out != null;
    }

    Simulator getSimulator() {
        return simulator;
    }

    private void checkInitialized() {
        if (!isInitialized()) {
            throw new StateException("The network isn't initialized, call init() first.");
        }
    }

    private void checkTrained() {
        checkInitialized();
        if (!isTrained()) {
            throw new StateException("The network has no readout, train it (or set W_out) first.");
        }
    }
}
