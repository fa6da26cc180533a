/**
 * HTTP client providers.
 *
 * <p>A transport either takes a pooled client from a {@link com.mimecast.courier.http.client.HttpClientFactory}
 * <br>by profile name or builds a fresh one per call with {@link com.mimecast.courier.http.client.AdHocClientProvider}.
 * <br>The latter is used when a client certificate or a per call timeout is needed.
 */
package com.mimecast.courier.http.client;
