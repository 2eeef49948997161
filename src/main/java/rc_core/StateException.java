package rc_core;

/**
 * Thrown when the network is used in a state that doesn't allow the operation (not initialized, not trained, 
 * or a state vector of a wrong size).
 */
public class StateException extends IllegalStateException {
    public StateException(String message) {
        super(message);
    }
}
