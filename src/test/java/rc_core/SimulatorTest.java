package rc_core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulatorTest {
    private static final double[][] W = {{0.1, -0.2}, {0.3, 0.05}};
    private static final double[][] W_IN = {{1}, {-0.5}};
    private static final double[][] W_BACK = {{0.4}, {0.2}};

    private static Simulator simulator(double[][] W_back, Activation activation) {
        ESNConfiguration configuration = new ESNConfiguration().setSize(2).setReservoirActivation(activation);
        return new Simulator(ReservoirWeights.of(W, W_IN, W_back), configuration);
    }

    @Test
    void stateUpdate() {
        Simulator simulator = simulator(W_BACK, Activation.TANH);

        double[] x1 = simulator.step(new double[]{0.5}, null);
        assertEquals(Math.tanh(0.5), x1[0], 1e-14);
        assertEquals(Math.tanh(-0.25), x1[1], 1e-14);

        double[] x2 = simulator.step(new double[]{-1}, new double[]{2});
        assertEquals(Math.tanh(0.1*x1[0] - 0.2*x1[1] - 1 + 0.8), x2[0], 1e-14);
        assertEquals(Math.tanh(0.3*x1[0] + 0.05*x1[1] + 0.5 + 0.4), x2[1], 1e-14);
    }

    @Test
    void storedLastOutputIsFedBack() {
        Simulator explicit = simulator(W_BACK, Activation.IDENTITY);
        Simulator stored = simulator(W_BACK, Activation.IDENTITY);

        stored.setLastOutput(new double[]{0.7});
        assertArrayEquals(explicit.step(new double[]{0.3}, new double[]{0.7}), stored.step(new double[]{0.3}, null));
        assertArrayEquals(new double[]{0.7}, stored.getLastOutput());
    }

    @Test
    void feedbackIsIgnoredWithoutFeedbackWeights() {
        Simulator withOutput = simulator(null, Activation.TANH);
        Simulator withoutOutput = simulator(null, Activation.TANH);

        assertArrayEquals(withoutOutput.step(new double[]{0.3}, null), 
                withOutput.step(new double[]{0.3}, new double[]{5}));
    }

    @Test
    void resetAndInjectState() {
        Simulator simulator = simulator(W_BACK, Activation.TANH);
        simulator.setState(new double[]{0.25, -0.75});
        simulator.setLastOutput(new double[]{1});
        assertArrayEquals(new double[]{0.25, -0.75}, simulator.getState());

        simulator.resetState();

        assertArrayEquals(new double[2], simulator.getState());
        assertArrayEquals(new double[1], simulator.getLastOutput());
    }

    @Test
    void returnedStateIsACopy() {
        Simulator simulator = simulator(W_BACK, Activation.TANH);
        double[] x = simulator.step(new double[]{0.5}, null);
        x[0] = 100;

        assertNotEquals(100, simulator.getState()[0]);
    }

    @Test
    void wrongVectorSizes() {
        Simulator simulator = simulator(W_BACK, Activation.TANH);

        assertThrows(ConfigurationException.class, () -> simulator.step(new double[2], null));
        assertThrows(ConfigurationException.class, () -> simulator.step(new double[1], new double[2]));
        assertThrows(StateException.class, () -> simulator.setState(new double[3]));
        assertThrows(ConfigurationException.class, () -> new Simulator(ReservoirWeights.of(W, W_IN, W_BACK), 
                new ESNConfiguration().setSize(3)));
    }
}
