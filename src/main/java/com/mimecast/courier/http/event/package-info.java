/**
 * Transport lifecycle notifications.
 *
 * <p>Register a {@link com.mimecast.courier.http.event.TransportListener} on a transport to observe
 * <br>the request, the response and the final outcome of each execution.
 *
 * <pre>
 * transport.addListener(new TransportListener() {
 *     &#64;Override
 *     public void onFail(TransportFailEvent event) {
 *         log.warn("Call failed: {}", event.getMessage());
 *     }
 * });
 * </pre>
 */
package com.mimecast.courier.http.event;
