package io.gridflow.renewables.extract;

/** The data source answered 429 Too Many Requests. */
public class OverloadException extends FetchException {
    public OverloadException(String resourcePath) {
        super(resourcePath, "Received 429 Too Many Requests for " + resourcePath, null);
    }
}
