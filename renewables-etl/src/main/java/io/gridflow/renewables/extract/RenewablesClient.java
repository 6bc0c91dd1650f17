package io.gridflow.renewables.extract;

import io.gridflow.core.Table;

/**
 * Fetches one resource from the renewables data source. A single attempt; retrying is the caller's concern.
 */
public interface RenewablesClient {
    Table fetch(String resourcePath, String apiKey, ResponseFormat format) throws FetchException, InterruptedException;
}
