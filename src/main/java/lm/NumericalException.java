package lm;

/**
 * Signals that a regression couldn't be computed because the system is singular or rank-deficient.
 * Retrying with a (higher) regularization or a different training method is up to the caller.
 */
public class NumericalException extends Exception {
    public NumericalException(String message) {
        super(message);
    }

    public NumericalException(String message, Throwable cause) {
        super(message, cause);
    }
}
