package rc_core;

import org.junit.jupiter.api.Test;
import org.ojalgo.function.UnaryFunction;

import static org.junit.jupiter.api.Assertions.*;

class ActivationTest {

    @Test
    void inverseOfTanh() {
        for (double x = -3; x <= 3; x += 0.25) {
            assertEquals(x, Activation.TANH.inverse(Activation.TANH.apply(x)), 1e-12);
        }
    }

    @Test
    void identityIsLinear() {
        assertTrue(Activation.IDENTITY.isLinear());
        assertFalse(Activation.TANH.isLinear());

        double[][] values = {{-2, 5}};
        Activation.IDENTITY.inverseAll(values);
        assertArrayEquals(new double[]{-2, 5}, values[0]);
    }

    @Test
    void unaryFunctionMatchesApply() {
        UnaryFunction<Double> function = Activation.TANH.asUnaryFunction();

        assertEquals(Math.tanh(0.4), function.invoke(0.4));
        assertEquals(Math.tanh(-1.5), function.invoke(Double.valueOf(-1.5)));
        assertEquals((float) Math.tanh(0.5), function.invoke(0.5f));
    }

    @Test
    void transformations() {
        assertEquals(Math.tanh(0.3), Activation.TANH.forward().transform(0.3));
        assertEquals(0.3, Activation.TANH.backward().transform(Math.tanh(0.3)), 1e-15);
    }

    @Test
    void namesParseFromConstants() {
        assertEquals(Activation.TANH, Activation.valueOf("TANH"));
        assertEquals("Tanh", Activation.TANH.getDescription());
    }

    @Test
    void singlePrecisionRounding() {
        double[] values = {0.1, 1.0/3};
        Precision.SINGLE.roundAll(values);

        assertEquals((double) 0.1f, values[0]);
        assertEquals((double) (float) (1.0/3), values[1]);
        assertEquals(0.1, Precision.DOUBLE.round(0.1));
    }

    @Test
    void featureCounts() {
        assertEquals(13, SimulationAlgorithm.STD.featureCount(10, 3));
        assertEquals(26, SimulationAlgorithm.SQUARE.featureCount(10, 3));
        assertArrayEquals(new double[]{1, -2, 3}, SimulationAlgorithm.STD.features(new double[]{1, -2}, 
                new double[]{3}));
    }
}
