package io.gridflow.renewables.extract;

public class HttpStatusException extends FetchException {
    private final int statusCode;

    public HttpStatusException(String resourcePath, int statusCode) {
        super(resourcePath, "Unexpected HTTP status " + statusCode + " for " + resourcePath, null);
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }
}
