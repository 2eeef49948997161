package rc_core;

import lm.NumericalException;
import lm.TrainingAlgorithm;
import org.ojalgo.matrix.store.MatrixStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline training of the ESN readout.
 * <ol>
 *     <li>Teacher forcing: the reservoir is driven by the input and the desired output (fed back instead of the
 *     network's own output), the states after the washout are collected.</li>
 *     <li>The design matrix M ([x u] or [x u x^2 u^2] per time step) and the target matrix T (the desired outputs
 *     mapped through the inverse output activation) are built.</li>
 *     <li>W_out is computed by the configured {@link TrainingAlgorithm}.</li>
 * </ol>
 * Optionally, relaxation stages regenerate the teacher signal from the trained network (with the original teacher
 * still being fed back) and retrain on it, which tends to stabilize networks used as generators. This is a
 * heuristic, convergence isn't guaranteed.
 * <p>
 * Data matrices are indexed as (channel, time step), i.e. indata is N_u x steps and outdata is N_y x steps.
 */
public class ReadoutTrainer {
    private static final Logger LOG = LoggerFactory.getLogger(ReadoutTrainer.class);

    private final ESN esn;

    ReadoutTrainer(ESN esn) {
        this.esn = esn;
    }

    /**
     * Computes the readout weights (including all relaxation stages). The network's W_out isn't modified here.
     *
     * @return W_out (N_y x features)
     * @throws NumericalException if the regression can't be solved
     */
    public double[][] train(double[][] indata, double[][] outdata, int washout) throws NumericalException {
        checkParams(indata, outdata, washout);
        ESNConfiguration configuration = esn.configuration();

        double[][] W_out = fit(indata, outdata, washout);
        for (int stage = 1; stage <= configuration.getRelaxationStages(); stage++) {
            double[][] teacher = regenerateTeacher(indata, outdata, W_out);
            W_out = fit(indata, teacher, washout);
            LOG.debug("Relaxation stage {}/{} finished.", stage, configuration.getRelaxationStages());
        }
        return W_out;
    }

    /**
     * Runs the teacher-forced simulation and returns the states after the washout.
     *
     * @return states (N_x x (steps - washout)), column n holds x(n + washout)
     */
    public double[][] collectStates(double[][] indata, double[][] outdata, int washout) {
        checkParams(indata, outdata, washout);
        return teacherForcing(indata, outdata, washout);
    }

    /**
     * Builds the design matrix of the regression: one row per retained time step, consisting of the extended state
     * vector of the configured simulation algorithm.
     *
     * @param states N_x x (steps - washout)
     */
    double[][] designMatrix(double[][] states, double[][] indata, int washout) {
        SimulationAlgorithm algorithm = esn.configuration().getSimulationAlgorithm();
        int rows = states[0].length;
        double[][] M = new double[rows][];
        for (int n = 0; n < rows; n++) {
            M[n] = algorithm.features(RCUtilities.column(states, n), RCUtilities.column(indata, n + washout));
        }
        return M;
    }

    /**
     * The desired outputs after the washout (one row per time step) with the output activation undone.
     */
    double[][] targetMatrix(double[][] outdata, int washout) {
        int steps = outdata[0].length;
        double[][] T = new double[steps - washout][outdata.length];
        for (int n = washout; n < steps; n++) {
            for (int j = 0; j < outdata.length; j++) {
                T[n - washout][j] = outdata[j][n];
            }
        }
        esn.configuration().getOutputActivation().inverseAll(T);
        return T;
    }

    private double[][] fit(double[][] indata, double[][] outdata, int washout) throws NumericalException {
        ESNConfiguration configuration = esn.configuration();
        double[][] states = teacherForcing(indata, outdata, washout);
        double[][] M = designMatrix(states, indata, washout);
        double[][] T = targetMatrix(outdata, washout);

        double[][] W_out = configuration.getTrainingAlgorithm().fit(M, T, configuration.getTikhonovFactor());
        checkFinite(W_out, configuration.getTrainingAlgorithm());
        configuration.getPrecision().roundAll(W_out);
        return W_out;
    }

    /**
     * @throws NumericalException if any weight is infinite or NaN (e.g. an overflow in the regression)
     */
    static void checkFinite(double[][] W_out, TrainingAlgorithm algorithm) throws NumericalException {
        for (int j = 0; j < W_out.length; j++) {
            for (int k = 0; k < W_out[j].length; k++) {
                if (!Double.isFinite(W_out[j][k])) {
                    throw new NumericalException(algorithm.getDescription() + " produced a non-finite readout weight "
                            + W_out[j][k] + " at [" + j + "][" + k + "].");
                }
            }
        }
    }

    private double[][] teacherForcing(double[][] indata, double[][] outdata, int washout) {
        Simulator simulator = esn.getSimulator();
        int steps = indata[0].length;
        double[][] states = new double[esn.configuration().getSize()][steps - washout];

        simulator.resetState();
        for (int n = 0; n < steps; n++) {
            double[] x = simulator.step(RCUtilities.column(indata, n), null);
            // the desired output is fed back in the next step
            simulator.setLastOutput(RCUtilities.column(outdata, n));
            if (n >= washout) {
                for (int i = 0; i < x.length; i++) {
                    states[i][n - washout] = x[i];
                }
            }
        }
        return states;
    }

    /**
     * Runs the network with the given readout while feeding back the original teacher signal and collects the
     * produced outputs as a new teacher signal. The first time step keeps the original value.
     */
    private double[][] regenerateTeacher(double[][] indata, double[][] outdata, double[][] W_out) {
        Simulator simulator = esn.getSimulator();
        int steps = indata[0].length;
        double[][] teacher = new double[outdata.length][steps];
        MatrixStore<Double> readout = RCUtilities.toStore(W_out);

        simulator.resetState();
        for (int n = 0; n < steps; n++) {
            double[] input = RCUtilities.column(indata, n);
            double[] x = simulator.step(input, null);
            double[] y = n == 0 ? RCUtilities.column(outdata, 0) : esn.readout(readout, x, input);
            for (int j = 0; j < y.length; j++) {
                teacher[j][n] = y[j];
            }
            simulator.setLastOutput(RCUtilities.column(outdata, n));
        }
        return teacher;
    }

    private void checkParams(double[][] indata, double[][] outdata, int washout) {
        ESNConfiguration configuration = esn.configuration();
        if (!esn.isInitialized()) {
            throw new StateException("The network has to be initialized before training or collecting states.");
        }
        if (indata.length != configuration.getInputs()) {
            throw new ConfigurationException("Wrong input row size: " + indata.length + ", N_u = "
                    + configuration.getInputs());
        }
        if (outdata.length != configuration.getOutputs()) {
            throw new ConfigurationException("Wrong output row size: " + outdata.length + ", N_y = "
                    + configuration.getOutputs());
        }
        int steps = checkColumns(indata, "input");
        if (checkColumns(outdata, "output") != steps) {
            throw new ConfigurationException("Input and output must have the same number of time steps (columns).");
        }
        if (washout < 0 || washout >= steps) {
            throw new ConfigurationException("The washout has to satisfy 0 <= washout < steps. washout = " + washout
                    + ", steps = " + steps);
        }

        Activation outputActivation = configuration.getOutputActivation();
        for (int j = 0; j < outdata.length; j++) {
            for (int n = 0; n < steps; n++) {
                if (!outputActivation.isInRange(outdata[j][n])) {
                    throw new ConfigurationException("The desired output " + outdata[j][n] + " at [" + j + "][" + n
                            + "] is outside the range of the output activation (" + outputActivation + ").");
                }
            }
        }

        int rows = steps - washout;
        if (rows < configuration.getFeatureCount()) {
            LOG.warn("Too few training data: {} samples for {} features, the regression is underdetermined.",
                    rows, configuration.getFeatureCount());
        }
    }

    private static int checkColumns(double[][] data, String name) {
        int steps = data[0].length;
        for (double[] row : data) {
            if (row.length != steps) {
                throw new ConfigurationException("All rows of the " + name + " data must have the same length.");
            }
        }
        if (steps == 0) {
            throw new ConfigurationException("The " + name + " data contain no time steps.");
        }
        return steps;
    }
}
