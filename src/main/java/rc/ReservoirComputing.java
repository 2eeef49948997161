package rc;

import lm.NumericalException;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.api.java.tuple.Tuple2;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import rc_core.ESN;

import java.util.List;

/**
 * Provides a general RC framework consisting of reservoir and readout phase.
 * The readout is trained offline, the trained network is then run over a stream.
 */
public class ReservoirComputing {

    private ReservoirComputing() {
    }

    /**
     * Build the concrete RC model: create the network from the configuration, initialize its weights and train the 
     * linear readout.
     *
     * @param parameters ESN hyperparameters (see {@link ESNOptions})
     * @param indata training input (N_u x steps)
     * @param outdata desired output (N_y x steps)
     * @param washout number of initial steps left out of the regression
     */
    public static ESN build(Configuration parameters, double[][] indata, double[][] outdata, int washout) 
            throws NumericalException {
        ESN esn = new ESN(ESNOptions.toESNConfiguration(parameters));
        esn.init();
        esn.train(indata, outdata, washout);
        return esn;
    }

    /**
     * Start the Reservoir Computing.
     * @param inputStream indexed input vectors u(t)
     * @param esn a trained network
     * @return A stream of output predictions y(t)
     */
    public static SingleOutputStreamOperator<Tuple2<Long, List<Double>>> run(
            DataStream<Tuple2<Long, List<Double>>> inputStream, ESN esn) {
        return inputStream.map(new ESNMapFunction(esn)).returns(Types.TUPLE(Types.LONG, Types.LIST(Types.DOUBLE)));
    }
}
