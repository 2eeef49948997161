package rc;

import lm.TrainingAlgorithm;
import org.apache.flink.configuration.ConfigOption;
import org.apache.flink.configuration.ConfigOptions;
import org.apache.flink.configuration.Configuration;
import rc_core.Activation;
import rc_core.ESNConfiguration;
import rc_core.Precision;
import rc_core.SimulationAlgorithm;

/**
 * Flink configuration keys of an Echo State Network. Allows the hyperparameters to be passed through a Flink
 * {@link Configuration} (e.g. the job parameters). The defaults are the ones of {@link ESNConfiguration}.
 */
public class ESNOptions {
    private static final ESNConfiguration DEFAULTS = new ESNConfiguration();

    public static final ConfigOption<Integer> SIZE = ConfigOptions.key("esn.size")
            .intType().defaultValue(DEFAULTS.getSize())
            .withDescription("Number of reservoir neurons (N_x).");
    public static final ConfigOption<Integer> INPUTS = ConfigOptions.key("esn.inputs")
            .intType().defaultValue(DEFAULTS.getInputs())
            .withDescription("Size of the input vector (N_u).");
    public static final ConfigOption<Integer> OUTPUTS = ConfigOptions.key("esn.outputs")
            .intType().defaultValue(DEFAULTS.getOutputs())
            .withDescription("Size of the output vector (N_y).");
    public static final ConfigOption<Activation> RESERVOIR_ACTIVATION = ConfigOptions.key("esn.reservoir-activation")
            .enumType(Activation.class).defaultValue(DEFAULTS.getReservoirActivation())
            .withDescription("Activation function of the reservoir neurons.");
    public static final ConfigOption<Activation> OUTPUT_ACTIVATION = ConfigOptions.key("esn.output-activation")
            .enumType(Activation.class).defaultValue(DEFAULTS.getOutputActivation())
            .withDescription("Activation function of the readout.");
    public static final ConfigOption<SimulationAlgorithm> SIMULATION_ALGORITHM =
            ConfigOptions.key("esn.simulation-algorithm")
            .enumType(SimulationAlgorithm.class).defaultValue(DEFAULTS.getSimulationAlgorithm())
            .withDescription("Feature set of the readout (STD or SQUARE).");
    public static final ConfigOption<TrainingAlgorithm> TRAINING_ALGORITHM =
            ConfigOptions.key("esn.training-algorithm")
            .enumType(TrainingAlgorithm.class).defaultValue(DEFAULTS.getTrainingAlgorithm())
            .withDescription("Regression method of the readout training (PI, LS or RIDGEREG).");
    public static final ConfigOption<Double> CONNECTIVITY = ConfigOptions.key("esn.connectivity")
            .doubleType().defaultValue(DEFAULTS.getConnectivity())
            .withDescription("Share of non-zero internal weights.");
    public static final ConfigOption<Double> FEEDBACK_CONNECTIVITY = ConfigOptions.key("esn.feedback-connectivity")
            .doubleType().defaultValue(DEFAULTS.getFeedbackConnectivity())
            .withDescription("Share of non-zero feedback weights, 0 disables the output feedback.");
    public static final ConfigOption<Double> SPECTRAL_RADIUS = ConfigOptions.key("esn.spectral-radius")
            .doubleType().defaultValue(DEFAULTS.getSpectralRadius())
            .withDescription("Spectral radius the internal weights are scaled to.");
    public static final ConfigOption<Double> TIKHONOV_FACTOR = ConfigOptions.key("esn.tikhonov-factor")
            .doubleType().defaultValue(DEFAULTS.getTikhonovFactor())
            .withDescription("Regularization factor of ridge regression.");
    public static final ConfigOption<Integer> RELAXATION_STAGES = ConfigOptions.key("esn.relaxation-stages")
            .intType().defaultValue(DEFAULTS.getRelaxationStages())
            .withDescription("Number of teacher signal refinements after the first training.");
    public static final ConfigOption<Precision> PRECISION = ConfigOptions.key("esn.precision")
            .enumType(Precision.class).defaultValue(DEFAULTS.getPrecision())
            .withDescription("Floating-point width of the network (SINGLE or DOUBLE).");
    public static final ConfigOption<Long> SEED = ConfigOptions.key("esn.seed")
            .longType().defaultValue(DEFAULTS.getSeed())
            .withDescription("Seed of the random weight initialization.");

    private ESNOptions() {
    }

    /**
     * Reads all ESN options from the Flink configuration (missing keys get their defaults).
     *
     * @throws rc_core.ConfigurationException if the resulting configuration isn't valid
     */
    public static ESNConfiguration toESNConfiguration(Configuration parameters) {
        ESNConfiguration configuration = new ESNConfiguration()
                .setSize(parameters.get(SIZE))
                .setInputs(parameters.get(INPUTS))
                .setOutputs(parameters.get(OUTPUTS))
                .setReservoirActivation(parameters.get(RESERVOIR_ACTIVATION))
                .setOutputActivation(parameters.get(OUTPUT_ACTIVATION))
                .setSimulationAlgorithm(parameters.get(SIMULATION_ALGORITHM))
                .setTrainingAlgorithm(parameters.get(TRAINING_ALGORITHM))
                .setConnectivity(parameters.get(CONNECTIVITY))
                .setFeedbackConnectivity(parameters.get(FEEDBACK_CONNECTIVITY))
                .setSpectralRadius(parameters.get(SPECTRAL_RADIUS))
                .setTikhonovFactor(parameters.get(TIKHONOV_FACTOR))
                .setRelaxationStages(parameters.get(RELAXATION_STAGES))
                .setPrecision(parameters.get(PRECISION))
                .setSeed(parameters.get(SEED));
        configuration.argumentsCheck();
        return configuration;
    }
}
