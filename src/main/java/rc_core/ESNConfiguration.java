package rc_core;

import lm.TrainingAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;

/**
 * All hyperparameters of an Echo State Network. Set before the network is initialized; the dimensions
 * (N_x, N_u, N_y) are fixed from that moment on.
 * The setters can be chained. Call {@link #argumentsCheck()} to validate the whole configuration.
 */
public class ESNConfiguration implements Serializable {
    private static final Logger LOG = LoggerFactory.getLogger(ESNConfiguration.class);

    private int N_x = 10;   // reservoir size
    private int N_u = 1;    // input vector size
    private int N_y = 1;    // output vector size
    private Activation reservoirActivation = Activation.TANH;
    private Activation outputActivation = Activation.IDENTITY;
    private SimulationAlgorithm simulationAlgorithm = SimulationAlgorithm.STD;
    private TrainingAlgorithm trainingAlgorithm = TrainingAlgorithm.PI;
    private double connectivity = 0.8;  // share of non-zero elements of W, used by the initializer
    private double feedbackConnectivity = 0;    // share of non-zero elements of W_back; 0 means no feedback
    private double spectralRadius = 0.8;    // W is scaled to have this spectral radius
    private double tikhonovFactor = 0;  // regularization of ridge regression (lambda)
    private int relaxationStages = 0;
    private Precision precision = Precision.DOUBLE;
    private long seed = 42;   // seed of the default (random) initializer

    public ESNConfiguration() {
    }

    public ESNConfiguration(ESNConfiguration other) {
        this.N_x = other.N_x;
        this.N_u = other.N_u;
        this.N_y = other.N_y;
        this.reservoirActivation = other.reservoirActivation;
        this.outputActivation = other.outputActivation;
        this.simulationAlgorithm = other.simulationAlgorithm;
        this.trainingAlgorithm = other.trainingAlgorithm;
        this.connectivity = other.connectivity;
        this.feedbackConnectivity = other.feedbackConnectivity;
        this.spectralRadius = other.spectralRadius;
        this.tikhonovFactor = other.tikhonovFactor;
        this.relaxationStages = other.relaxationStages;
        this.precision = other.precision;
        this.seed = other.seed;
    }

    /**
     * Checks the validity of all arguments.
     *
     * @throws ConfigurationException if any of the options is out of its range or a selector is missing
     */
    public void argumentsCheck() {
        if (N_x < 1 || N_u < 1 || N_y < 1) {
            throw new ConfigurationException("The reservoir/input/output vector size has to be positive. N_x = "
                    + N_x + ", N_u = " + N_u + ", N_y = " + N_y);
        }
        else if (reservoirActivation == null || outputActivation == null) {
            throw new ConfigurationException("Both the reservoir and the output activation have to be chosen.");
        }
        else if (simulationAlgorithm == null) {
            throw new ConfigurationException("A simulation algorithm has to be chosen.");
        }
        else if (trainingAlgorithm == null) {
            throw new ConfigurationException("A training algorithm has to be chosen.");
        }
        else if (precision == null) {
            throw new ConfigurationException("A precision has to be chosen.");
        }
        else if (connectivity < 0 || connectivity > 1 || feedbackConnectivity < 0 || feedbackConnectivity > 1) {
            throw new ConfigurationException("The (feedback) connectivity has to be a value between 0-1 (inclusive).");
        }
        else if (spectralRadius < 0) {
            throw new ConfigurationException("The spectral radius can't be negative: " + spectralRadius);
        }
        else if (tikhonovFactor < 0) {
            throw new ConfigurationException("The Tikhonov factor can't be negative: " + tikhonovFactor);
        }
        else if (relaxationStages < 0) {
            throw new ConfigurationException("The number of relaxation stages can't be negative: "
                    + relaxationStages);
        }

        if (spectralRadius >= 1) {
            LOG.warn("The spectral radius ({}) should be lower than 1, the echo state property isn't guaranteed.",
                    spectralRadius);
        }
    }

    public int getSize() {
        return N_x;
    }

    public ESNConfiguration setSize(int N_x) {
        this.N_x = N_x;
        return this;
    }

    public int getInputs() {
        return N_u;
    }

    public ESNConfiguration setInputs(int N_u) {
        this.N_u = N_u;
        return this;
    }

    public int getOutputs() {
        return N_y;
    }

    public ESNConfiguration setOutputs(int N_y) {
        this.N_y = N_y;
        return this;
    }

    public Activation getReservoirActivation() {
        return reservoirActivation;
    }

    public ESNConfiguration setReservoirActivation(Activation reservoirActivation) {
        this.reservoirActivation = reservoirActivation;
        return this;
    }

    public Activation getOutputActivation() {
        return outputActivation;
    }

    public ESNConfiguration setOutputActivation(Activation outputActivation) {
        this.outputActivation = outputActivation;
        return this;
    }

    public SimulationAlgorithm getSimulationAlgorithm() {
        return simulationAlgorithm;
    }

    public ESNConfiguration setSimulationAlgorithm(SimulationAlgorithm simulationAlgorithm) {
        this.simulationAlgorithm = simulationAlgorithm;
        return this;
    }

    public TrainingAlgorithm getTrainingAlgorithm() {
        return trainingAlgorithm;
    }

    public ESNConfiguration setTrainingAlgorithm(TrainingAlgorithm trainingAlgorithm) {
        this.trainingAlgorithm = trainingAlgorithm;
        return this;
    }

    public double getConnectivity() {
        return connectivity;
    }

    public ESNConfiguration setConnectivity(double connectivity) {
        this.connectivity = connectivity;
        return this;
    }

    public double getFeedbackConnectivity() {
        return feedbackConnectivity;
    }

    public ESNConfiguration setFeedbackConnectivity(double feedbackConnectivity) {
        this.feedbackConnectivity = feedbackConnectivity;
        return this;
    }

    public double getSpectralRadius() {
        return spectralRadius;
    }

    public ESNConfiguration setSpectralRadius(double spectralRadius) {
        this.spectralRadius = spectralRadius;
        return this;
    }

    public double getTikhonovFactor() {
        return tikhonovFactor;
    }

    public ESNConfiguration setTikhonovFactor(double tikhonovFactor) {
        this.tikhonovFactor = tikhonovFactor;
        return this;
    }

    public int getRelaxationStages() {
        return relaxationStages;
    }

    public ESNConfiguration setRelaxationStages(int relaxationStages) {
        this.relaxationStages = relaxationStages;
        return this;
    }

    public Precision getPrecision() {
        return precision;
    }

    public ESNConfiguration setPrecision(Precision precision) {
        this.precision = precision;
        return this;
    }

    public long getSeed() {
        return seed;
    }

    public ESNConfiguration setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    /**
     * @return number of readout features (columns of W_out)
     */
    public int getFeatureCount() {
        return simulationAlgorithm.featureCount(N_x, N_u);
    }

    @Override
    public String toString() {
        return "ESNConfiguration{N_x=" + N_x + ", N_u=" + N_u + ", N_y=" + N_y
                + ", reservoirActivation=" + reservoirActivation + ", outputActivation=" + outputActivation
                + ", simulation=" + simulationAlgorithm + ", training=" + trainingAlgorithm
                + ", connectivity=" + connectivity + ", feedbackConnectivity=" + feedbackConnectivity
                + ", spectralRadius=" + spectralRadius + ", tikhonovFactor=" + tikhonovFactor
                + ", relaxationStages=" + relaxationStages + ", precision=" + precision + ", seed=" + seed + '}';
    }
}
