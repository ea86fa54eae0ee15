package com.pitwall.client;

import com.pitwall.domain.DataCategory;
import com.pitwall.domain.FetchParams;

import java.util.List;

/**
 * Upstream telemetry API transport.
 *
 * Issues {@code GET <base>/<category path>?<params>} and decodes the JSON array body.
 * Resilience (circuit breaker, cache) is layered on top by the caller.
 */
public interface UpstreamClient {

    /**
     * @throws UpstreamException non-2xx response, I/O error, timeout or non-array body
     */
    <T> List<T> call(DataCategory category, FetchParams params, Class<T> recordType);
}
