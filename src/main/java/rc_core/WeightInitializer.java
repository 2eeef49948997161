package rc_core;

/**
 * Produces the reservoir weights for a given configuration. The way the matrices are generated (topology, 
 * distribution, scaling) is entirely up to the implementation.
 */
public interface WeightInitializer {
    ReservoirWeights initialize(ESNConfiguration configuration);
}
