package io.gridflow.renewables.extract;

import java.io.IOException;

/** Network or connection failure before a response was received. */
public class TransportException extends FetchException {
    public TransportException(String resourcePath, IOException cause) {
        super(resourcePath, "Request for " + resourcePath + " failed: " + cause, cause);
    }
}
