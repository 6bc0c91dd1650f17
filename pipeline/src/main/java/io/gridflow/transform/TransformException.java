package io.gridflow.transform;

/**
 * Raised when a transform step cannot produce its output. Always fatal for the table being transformed.
 */
public class TransformException extends Exception {
    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
