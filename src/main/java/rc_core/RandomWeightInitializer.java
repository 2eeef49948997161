package rc_core;

import org.ojalgo.matrix.store.Primitive64Store;
import org.ojalgo.matrix.store.SparseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * The default initializer with a random sparse reservoir.
 * <ul>
 *     <li>W: {@code connectivity} share of randomly placed non-zero weights from [-0.5; 0.5), scaled to have the
 *     configured spectral radius</li>
 *     <li>W_in: dense, weights from [-1; 1)</li>
 *     <li>W_back: {@code feedbackConnectivity} share of non-zero weights from [-1; 1); no matrix for 0</li>
 * </ul>
 * The same seed and configuration always produce the same weights.
 */
public class RandomWeightInitializer implements WeightInitializer {
    private static final Logger LOG = LoggerFactory.getLogger(RandomWeightInitializer.class);

    private final long seed;

    public RandomWeightInitializer(long seed) {
        this.seed = seed;
    }

    @Override
    public ReservoirWeights initialize(ESNConfiguration configuration) {
        configuration.argumentsCheck();
        Random random = new Random(seed);
        int N_x = configuration.getSize();
        int N_u = configuration.getInputs();
        int N_y = configuration.getOutputs();

        /* W */
        double[][] internal = sparseRandom(N_x, N_x, configuration.getConnectivity(), 1, random);
        Primitive64Store W_dense = RCUtilities.toStore(internal);
        double spectralRadius = RCUtilities.spectralRadius(W_dense);
        double scale = spectralRadius > 0 ? configuration.getSpectralRadius() / spectralRadius : 1;
        LOG.debug("Reservoir W: spectral radius {} scaled by {}", spectralRadius, scale);
        SparseStore<Double> W_internal = SparseStore.PRIMITIVE64.make(N_x, N_x);
        for (int i = 0; i < N_x; i++) {
            for (int j = 0; j < N_x; j++) {
                if (internal[i][j] != 0) {
                    W_internal.set(i, j, internal[i][j] * scale);
                }
            }
        }

        /* W_in */
        Primitive64Store W_input = Primitive64Store.FACTORY.make(N_x, N_u);
        for (int i = 0; i < N_x; i++) {
            for (int j = 0; j < N_u; j++) {
                W_input.set(i, j, 2*random.nextDouble() - 1);
            }
        }

        /* W_back */
        SparseStore<Double> W_back = null;
        if (configuration.getFeedbackConnectivity() > 0) {
            double[][] back = sparseRandom(N_x, N_y, configuration.getFeedbackConnectivity(), 2, random);
            W_back = SparseStore.PRIMITIVE64.make(N_x, N_y);
            for (int i = 0; i < N_x; i++) {
                for (int j = 0; j < N_y; j++) {
                    if (back[i][j] != 0) {
                        W_back.set(i, j, back[i][j]);
                    }
                }
            }
        }

        return new ReservoirWeights(W_internal, W_input, W_back);
    }

    /**
     * Places round(density*rows*cols) random non-zero values (uniform, centered at 0) at random positions.
     */
    private static double[][] sparseRandom(int rows, int cols, double density, double range, Random random) {
        double[][] matrix = new double[rows][cols];
        List<Integer> indices = new ArrayList<>(rows*cols);
        for (int i = 0; i < rows*cols; i++) {
            indices.add(i); // represents the matrix indices in a serialized (row-major) fashion
        }
        Collections.shuffle(indices, random);
        long nonZeros = Math.round(density*rows*cols);
        for (int i = 0; i < nonZeros; ++i) {
            int index = indices.get(i);
            double value;
            do {
                value = random.nextDouble()*range - (range/2);
            } while (value == 0);
            matrix[index / cols][index % cols] = value;
        }
        return matrix;
    }
}
