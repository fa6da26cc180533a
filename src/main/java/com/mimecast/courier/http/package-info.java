/**
 * HTTP request/response transport.
 *
 * <p>The {@link com.mimecast.courier.http.HttpTransport} wraps one HTTP call:
 * <ol>
 *   <li>{@link com.mimecast.courier.http.RequestFactory} builds the request from configuration.</li>
 *   <li>A {@link com.mimecast.courier.http.client.ClientProvider} supplies the OkHttp client to send it with.</li>
 *   <li>{@link com.mimecast.courier.http.ResponseCapture} keeps headers, cookies and body of successful responses.</li>
 *   <li>{@link com.mimecast.courier.http.TransportLog} renders human readable request and response logs.</li>
 *   <li>Listeners are notified of the request, the response and the outcome.</li>
 * </ol>
 *
 * <p>Network I/O, TLS, redirects and connection pooling are left to OkHttp.
 *
 * @see com.mimecast.courier.http.HttpTransport
 * @see com.mimecast.courier.http.event.TransportListener
 */
package com.mimecast.courier.http;
