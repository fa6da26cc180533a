/**
 * Configuration containers for Courier.
 *
 * <p>Provides the configuration foundation and the typed containers built on it.
 * <br>Configuration files are JSON5 and are parsed with a lenient Gson into generic maps.
 *
 * <ul>
 *   <li><b>TransportConfig</b>: method, URI, headers, encoding and client selection for one transport.</li>
 *   <li><b>ProfilesConfig</b>: named client profiles used to build pooled HTTP clients.</li>
 *   <li><b>CertificateConfig</b>: client certificate key store for ad hoc clients.</li>
 * </ul>
 *
 * <p>The profiles file can be given on the command line.
 * <br><b>Example:</b>
 * <pre>java -jar courier.jar -c cfg/profiles.json5 -j cfg/transport.json5</pre>
 */
package com.mimecast.courier.config;
