/**
 * The main package for Courier, a thin HTTP request/response transport.
 *
 * <p>Courier builds a request from a JSON5 transport configuration, sends it through a pooled or ad hoc OkHttp client,
 * <br>captures the response and renders readable request and response logs.
 * <br>Listeners are notified of the request, the response and the outcome of every execution.
 *
 * <p>This project can be compiled into a runnable JAR.
 * <br>A CLI interface is implemented to run a single transport from the command line.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar courier.jar
 *      HTTP request/response transport
 *
 *      usage:   [-b &lt;arg&gt;] [-c &lt;arg&gt;] [-f &lt;arg&gt;] [-h] [-j &lt;arg&gt;] [-v]
 *      -b,--body &lt;arg&gt;   Text body to send
 *      -c,--conf &lt;arg&gt;   Path to client profiles JSON5
 *      -f,--file &lt;arg&gt;   File to send as body bytes
 *      -h,--help         Show usage help
 *      -j,--json &lt;arg&gt;   Path to transport JSON5
 *      -v,--verbose      Keep logging enabled
 * </pre>
 *
 * <h2>Transport JSON5:</h2>
 * <pre>
 * {
 *   method: "POST",
 *   baseAddress: "https://api.example.com/",
 *   uri: "v1/orders",
 *   headers: {
 *     "Content-Type": "application/json",
 *     "Accept": "application/json"
 *   },
 *   clientName: "api"
 * }
 * </pre>
 *
 * <p>Exit status is 0 on success, 1 on transport failure and 2 on bad usage.
 */
package com.mimecast.courier;
