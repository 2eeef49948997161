package rc;

import lm.NumericalException;
import org.apache.flink.api.java.tuple.Tuple2;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.util.InstantiationUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import rc_core.ConfigurationException;
import rc_core.ESN;
import rc_core.ESNConfiguration;
import rc_core.RCUtilities;
import rc_core.StateException;
import utilities.Utilities;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ESNMapFunctionTest {
    private static final int STEPS = 50;

    private ESN esn;
    private double[][] indata;

    @BeforeEach
    void setUp() throws NumericalException {
        Random random = new Random(19);
        indata = Utilities.randomMatrix(2, STEPS, -1, 1, random);
        double[][] outdata = Utilities.randomMatrix(1, STEPS, -0.5, 0.5, random);
        esn = new ESN(new ESNConfiguration().setSize(6).setInputs(2).setFeedbackConnectivity(0.5));
        esn.init();
        esn.train(indata, outdata, 5);
        esn.resetState();
    }

    private static Tuple2<Long, List<Double>> input(double[][] indata, int n) {
        return Tuple2.of((long) n, RCUtilities.arrayToList(RCUtilities.column(indata, n)));
    }

    private static ESNMapFunction opened(ESNMapFunction function) throws Exception {
        function.open(new Configuration());
        return function;
    }

    @Test
    void mapsLikeTheNetwork() throws Exception {
        ESNMapFunction function = opened(new ESNMapFunction(esn));

        for (int n = 0; n < STEPS; n++) {
            double[] expected = esn.simulateStep(RCUtilities.column(indata, n), null);
            Tuple2<Long, List<Double>> output = function.map(input(indata, n));
            assertEquals(Long.valueOf(n), output.f0);
            assertEquals(expected[0], output.f1.get(0), 1e-12);
        }
    }

    @Test
    void survivesSerialization() throws Exception {
        ESNMapFunction function = InstantiationUtil.clone(new ESNMapFunction(esn));
        opened(function);

        double[] expected = esn.simulateStep(RCUtilities.column(indata, 0), null);
        assertEquals(expected[0], function.map(input(indata, 0)).f1.get(0), 1e-12);
    }

    @Test
    void restoredStateContinuesTheSequence() throws Exception {
        ESNMapFunction original = opened(new ESNMapFunction(esn));
        for (int n = 0; n < 10; n++) {
            original.map(input(indata, n));
        }
        List<double[]> checkpoint = original.currentState();

        ESNMapFunction restored = new ESNMapFunction(esn);
        restored.restoreState(new ArrayList<>(checkpoint));
        opened(restored);

        assertArrayEquals(checkpoint.get(0), restored.currentState().get(0));
        for (int n = 10; n < STEPS; n++) {
            assertEquals(original.map(input(indata, n)).f1, restored.map(input(indata, n)).f1);
        }
    }

    @Test
    void checkpointKeepsStateAndOutputTogether() throws Exception {
        ESNMapFunction original = opened(new ESNMapFunction(esn));
        for (int n = 0; n < 10; n++) {
            original.map(input(indata, n));
        }
        List<double[]> state = original.currentState();
        double[] packed = original.pack(state);
        assertEquals(7, packed.length);

        // after a rescaling, one subtask may receive the elements of several former subtasks
        ESNMapFunction restored = new ESNMapFunction(esn);
        restored.restoreFromCheckpoint(Arrays.asList(packed, new double[7]));
        opened(restored);

        assertArrayEquals(state.get(0), restored.currentState().get(0));
        assertArrayEquals(state.get(1), restored.currentState().get(1));
        assertEquals(original.map(input(indata, 10)).f1, restored.map(input(indata, 10)).f1);
    }

    @Test
    void subtaskWithoutCheckpointedStateStartsAtRest() throws Exception {
        ESNMapFunction function = new ESNMapFunction(esn);
        function.restoreFromCheckpoint(new ArrayList<>());
        opened(function);

        assertArrayEquals(new double[6], function.currentState().get(0));
        assertArrayEquals(new double[1], function.currentState().get(1));
    }

    @Test
    void malformedStateIsRejected() {
        ESNMapFunction function = new ESNMapFunction(esn);

        assertThrows(StateException.class, () -> function.restoreState(Arrays.asList(new double[6])));
        assertThrows(StateException.class, () -> function.unpack(new double[6]));
    }

    @Test
    void laterTrainingDoesNotAffectTheFunction() throws Exception {
        ESNMapFunction function = opened(new ESNMapFunction(esn));
        ESN copy = new ESN(esn);
        esn.train(indata, Utilities.randomMatrix(1, STEPS, -0.5, 0.5, new Random(20)), 5);

        double[] expected = copy.simulateStep(RCUtilities.column(indata, 0), null);
        assertEquals(expected[0], function.map(input(indata, 0)).f1.get(0), 1e-12);
    }

    @Test
    void invalidUse() throws Exception {
        assertThrows(StateException.class, () -> new ESNMapFunction(new ESN(new ESNConfiguration())));
        assertThrows(StateException.class, () -> new ESNMapFunction(esn).currentState());

        ESNMapFunction function = opened(new ESNMapFunction(esn));
        assertThrows(ConfigurationException.class, () -> function.map(Tuple2.of(0L, Arrays.asList(1.0, 2.0, 3.0))));
    }
}
