package io.gridflow.renewables.extract;

/**
 * Failure to obtain one day of data. Only {@link OverloadException} is ever retried.
 */
public abstract class FetchException extends Exception {
    private final String resourcePath;

    protected FetchException(String resourcePath, String message, Throwable cause) {
        super(message, cause);
        this.resourcePath = resourcePath;
    }

    public String resourcePath() { return resourcePath; }
}
