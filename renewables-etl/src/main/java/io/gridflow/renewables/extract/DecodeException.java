package io.gridflow.renewables.extract;

/** The response body could not be decoded in its declared format. */
public class DecodeException extends FetchException {
    public DecodeException(String resourcePath, String message) {
        super(resourcePath, "Cannot decode " + resourcePath + ": " + message, null);
    }

    public DecodeException(String resourcePath, String message, Throwable cause) {
        super(resourcePath, "Cannot decode " + resourcePath + ": " + message, cause);
    }
}
