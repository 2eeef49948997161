package rc;

import org.apache.flink.api.common.functions.RichMapFunction;
import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.java.tuple.Tuple2;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.runtime.state.FunctionInitializationContext;
import org.apache.flink.runtime.state.FunctionSnapshotContext;
import org.apache.flink.streaming.api.checkpoint.CheckpointedFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rc_core.ConfigurationException;
import rc_core.ESN;
import rc_core.ESNConfiguration;
import rc_core.RCUtilities;
import rc_core.ReservoirWeights;
import rc_core.StateException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A Flink map function that transforms a stream of indexed input vectors (u(t)) to a stream of indexed output 
 * vectors (y(t)) using a trained ESN.
 * The network is carried as a serializable snapshot (configuration and raw matrices) and rebuilt in 
 * {@link #open(Configuration)}. The reservoir state and the last output are checkpointed together as one operator 
 * state element, so a restored job continues the (generator) dynamics where it stopped.
 * <p>
 * The elements have to arrive in the order of their indices; each parallel instance runs its own copy of the 
 * network.
 */
public class ESNMapFunction extends RichMapFunction<Tuple2<Long, List<Double>>, Tuple2<Long, List<Double>>> 
        implements CheckpointedFunction {
    private static final Logger LOG = LoggerFactory.getLogger(ESNMapFunction.class);

    private final ESNConfiguration configuration;
    private final double[][] W_internal;
    private final double[][] W_input;
    private final double[][] W_back; // null if the network has no feedback
    private final double[][] W_out;
    private transient ESN esn;
    private transient ListState<double[]> reservoirState;
    private transient List<double[]> restoredState;

    /**
     * @param esn a trained network; its matrices are copied, later changes of the network don't affect the function
     */
    public ESNMapFunction(ESN esn) {
        if (!esn.isTrained()) {
            throw new StateException("Only a trained network can be used for predictions.");
        }
        this.configuration = esn.getConfiguration();
        this.W_internal = RCUtilities.toArray(esn.getW());
        this.W_input = RCUtilities.toArray(esn.getWin());
        this.W_back = esn.getWback() == null ? null : RCUtilities.toArray(esn.getWback());
        this.W_out = RCUtilities.toArray(esn.getWout());
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        super.open(parameters);

        esn = new ESN(configuration);
        esn.init(ReservoirWeights.of(W_internal, W_input, W_back));
        esn.setWout(W_out);
        if (restoredState != null) {
            applyState(restoredState);
        }
    }

    @Override
    public Tuple2<Long, List<Double>> map(Tuple2<Long, List<Double>> input) throws Exception {
        if (input.f1.size() != configuration.getInputs()) {
            throw new ConfigurationException("The current input vector size doesn't match the specified size N_u.\n"
                    + "N_u = " + configuration.getInputs() + ",\t" + input.f0 + ". input = "
                    + RCUtilities.listToString(input.f1));
        }
        double[] output = esn.simulateStep(RCUtilities.listToArray(input.f1), null);
        return Tuple2.of(input.f0, RCUtilities.arrayToList(output));
    }

    @Override
    public void snapshotState(FunctionSnapshotContext context) throws Exception {
        reservoirState.clear();
        reservoirState.add(pack(currentState()));
    }

    @Override
    public void initializeState(FunctionInitializationContext context) throws Exception {
        ListStateDescriptor<double[]> descriptor = new ListStateDescriptor<>("reservoir state", 
                TypeInformation.of(double[].class));
        reservoirState = context.getOperatorStateStore().getListState(descriptor);

        if (context.isRestored()) {
            restoreFromCheckpoint(reservoirState.get());
        }
    }

    /**
     * Restores the network from the checkpointed elements. Each element holds the state followed by the last output 
     * of one subtask, so a changed parallelism never splits them. A subtask receiving several elements continues 
     * from the first one; a subtask receiving none starts at rest.
     */
    void restoreFromCheckpoint(Iterable<double[]> elements) {
        List<double[]> packed = new ArrayList<>();
        for (double[] element : elements) {
            packed.add(element);
        }
        if (packed.isEmpty()) {
            LOG.info("No reservoir state to restore, starting at rest.");
            return;
        }
        if (packed.size() > 1) {
            LOG.info("{} reservoir states restored after rescaling, continuing from the first one.", packed.size());
        }
        restoreState(unpack(packed.get(0)));
    }

    /**
     * @return [x(t) y(t)] as a single vector
     */
    double[] pack(List<double[]> state) {
        double[] x = state.get(0);
        double[] y = state.get(1);
        double[] packed = new double[x.length + y.length];
        System.arraycopy(x, 0, packed, 0, x.length);
        System.arraycopy(y, 0, packed, x.length, y.length);
        return packed;
    }

    List<double[]> unpack(double[] packed) {
        int N_x = configuration.getSize();
        if (packed.length != N_x + configuration.getOutputs()) {
            throw new StateException("A checkpointed reservoir state must have N_x + N_y = " 
                    + (N_x + configuration.getOutputs()) + " elements, has " + packed.length);
        }
        List<double[]> state = new ArrayList<>(2);
        state.add(Arrays.copyOfRange(packed, 0, N_x));
        state.add(Arrays.copyOfRange(packed, N_x, packed.length));
        return state;
    }

    /**
     * Restores the reservoir state and the last output (in this order). Before {@link #open(Configuration)} the 
     * state is kept and applied once the network is built.
     *
     * @throws StateException if the list doesn't hold exactly the two vectors
     */
    public void restoreState(List<double[]> state) {
        if (state.size() != 2) {
            throw new StateException("A restored ESN state must consist of the state and the last output, has " 
                    + state.size() + " elements.");
        }
        if (esn == null) {
            restoredState = state;
        }
        else {
            applyState(state);
        }
    }

    /**
     * @return the reservoir state x(t) and the last output y(t)
     */
    public List<double[]> currentState() {
        if (esn == null) {
            throw new StateException("The function isn't opened yet.");
        }
        List<double[]> state = new ArrayList<>(2);
        state.add(esn.getState());
        state.add(esn.getLastOutput());
        return state;
    }

    private void applyState(List<double[]> state) {
        esn.setState(state.get(0));
        esn.setLastOutput(state.get(1));
        restoredState = null;
    }
}
