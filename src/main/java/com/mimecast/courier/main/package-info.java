/**
 * Static containers shared by all transports.
 *
 * <h2>Config</h2>
 * <p>Holds the client profiles file.
 * <br>Profiles tune the pooled clients: timeouts, redirects, pool size and TLS verification.
 *
 * <h2>Factories</h2>
 * <p>For all pluggable components.
 * <ul>
 *     <li><b>HttpClientFactory</b> - Provides pooled clients by profile name.</li>
 *     <li><b>X509TrustManager</b> - Validates server certificates for clients presenting a client certificate.</li>
 * </ul>
 */
package com.mimecast.courier.main;
