package com.passage.proxy.core.fetch;

import com.passage.proxy.core.exceptions.UpstreamException;

/**
 * Fetches a resource from the upstream site. Implementations follow redirects,
 * enforce their own timeouts and hand back an identity-encoded body.
 */
public interface UpstreamFetcher {
    /**
     * Performs the request.
     *
     * @param request Target and forwarded client headers.
     * @return Status, headers, body and effective URL of the final response.
     * @throws UpstreamException On any transport failure. Never retried.
     */
    FetchResult fetch(FetchRequest request) throws UpstreamException;
}
