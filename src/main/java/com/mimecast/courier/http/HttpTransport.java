package com.mimecast.courier.http;

import com.mimecast.courier.config.TransportConfig;
import com.mimecast.courier.http.client.AdHocClientProvider;
import com.mimecast.courier.http.client.ClientProvider;
import com.mimecast.courier.http.client.FactoryClientProvider;
import com.mimecast.courier.http.event.TransportEvent;
import com.mimecast.courier.http.event.TransportFailEvent;
import com.mimecast.courier.http.event.TransportListener;
import com.mimecast.courier.http.event.TransportNotifier;
import com.mimecast.courier.http.event.TransportRequestEvent;
import com.mimecast.courier.http.event.TransportResponseEvent;
import com.mimecast.courier.main.Factories;
import okhttp3.Cookie;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Single call HTTP transport.
 *
 * <p>Builds a request from {@link TransportConfig}, sends it, captures the response,
 * <br>renders request and response logs and notifies listeners of the outcome.
 *
 * <p>Client selection is configuration driven:
 * <ul>
 *   <li>By default a pooled client is taken from {@link Factories#getClientFactory()} by client name.</li>
 *   <li>In ad hoc mode, implied by a client certificate, a fresh client is built per call.</li>
 * </ul>
 *
 * <p>Execution never throws. Failures are reported via {@link TransportResult} and the fail notification.
 * <p>Captured state is reset at the start of each execution and reflects the most recent one only.
 * <br>Instances are NOT thread-safe and must not be executed concurrently.
 *
 * <p>Example usage:
 * <pre>
 * HttpTransport&lt;String&gt; transport = new HttpTransport&lt;&gt;(new TransportConfig()
 *         .setMethod("POST")
 *         .setUri("https://api.example.com/v1/orders")
 *         .addHeader("Accept", "application/json"));
 *
 * if (transport.execute("{\"id\": 1}")) {
 *     String body = transport.getResponseBody().getValue();
 * }
 * </pre>
 *
 * @param <B> Request body type, one of String, byte[] or InputStream.
 */
public class HttpTransport<B> {
    private static final Logger log = LogManager.getLogger(HttpTransport.class);

    private final TransportConfig config;
    private final RequestFactory requestFactory;
    private final ClientProvider clientProvider;
    private final List<Cookie> cookies;
    private final TransportNotifier notifier = new TransportNotifier();

    private int statusCode;
    private String request;
    private String response;
    private ResponseBody responseBody = ResponseBody.EMPTY;
    private Map<String, String> responseHeaders;
    private List<Cookie> responseCookies;
    private TransportResult result;

    /**
     * Constructs a new HttpTransport instance.
     *
     * @param config Transport configuration.
     */
    public HttpTransport(TransportConfig config) {
        this(config, null);
    }

    /**
     * Constructs a new HttpTransport instance with request cookies.
     *
     * @param config  Transport configuration.
     * @param cookies Request cookies, may be null.
     */
    public HttpTransport(TransportConfig config, List<Cookie> cookies) {
        this(config, cookies, providerFor(config));
    }

    /**
     * Constructs a new HttpTransport instance with request cookies and client provider.
     *
     * @param config         Transport configuration.
     * @param cookies        Request cookies, may be null.
     * @param clientProvider Client provider.
     */
    public HttpTransport(TransportConfig config, List<Cookie> cookies, ClientProvider clientProvider) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clientProvider = Objects.requireNonNull(clientProvider, "clientProvider must not be null");
        this.cookies = cookies != null ? List.copyOf(cookies) : Collections.emptyList();
        this.requestFactory = new RequestFactory(config);
    }

    /**
     * Selects client provider from configuration.
     *
     * @param config Transport configuration.
     * @return ClientProvider instance.
     */
    static ClientProvider providerFor(TransportConfig config) {
        return config.isAdHoc()
                ? new AdHocClientProvider(Factories::getTrustManager)
                : new FactoryClientProvider(Factories.getClientFactory());
    }

    /**
     * Registers lifecycle listener.
     *
     * @param listener TransportListener instance.
     * @return Self.
     */
    public HttpTransport<B> addListener(TransportListener listener) {
        notifier.add(listener);
        return this;
    }

    /**
     * Removes lifecycle listener.
     *
     * @param listener TransportListener instance.
     * @return Boolean, true if it was registered.
     */
    public boolean removeListener(TransportListener listener) {
        return notifier.remove(listener);
    }

    /**
     * Resets captured state.
     */
    protected void init() {
        statusCode = 0;
        request = null;
        response = null;
        responseBody = ResponseBody.EMPTY;
        responseHeaders = null;
        responseCookies = null;
        result = null;
    }

    /**
     * Executes without a body.
     *
     * @return Boolean, true on success.
     */
    public boolean execute() {
        return execute(null);
    }

    /**
     * Executes with given body.
     *
     * @param body Request body, may be null.
     * @return Boolean, true on success.
     */
    public boolean execute(B body) {
        return send(body).isSuccess();
    }

    /**
     * Sends request and captures response.
     *
     * @param body Request body, may be null.
     * @return TransportResult instance.
     */
    public TransportResult send(B body) {
        try {
            init();

            Request httpRequest = requestFactory.create(body, cookies);
            request = TransportLog.request(httpRequest, body);
            log.debug("Request:\r\n{}", request);
            notifier.request(new TransportRequestEvent(this, request));

            OkHttpClient client = clientProvider.getClient(config);
            try (Response httpResponse = client.newCall(httpRequest).execute()) {
                statusCode = httpResponse.code();

                if (httpResponse.isSuccessful()) {
                    responseHeaders = ResponseCapture.headers(httpResponse);
                    responseCookies = ResponseCapture.cookies(httpResponse);
                    responseBody = ResponseCapture.body(httpResponse, requestFactory.getEncoding());
                }

                response = TransportLog.response(httpResponse, responseHeaders, responseBody);
                log.debug("Response:\r\n{}", response);

                ensureSuccess(httpResponse);

                if (!processResponse(httpResponse)) {
                    throw new TransportException(ErrorKind.REJECTED,
                            "Response rejected: " + TransportLog.statusLine(httpResponse));
                }
            } finally {
                clientProvider.release(client);
            }

            return complete(TransportResult.success());
        } catch (TransportException e) {
            return complete(TransportResult.failure(e.getKind(), fullMessage(e)));
        } catch (IOException | RuntimeException e) {
            return complete(TransportResult.failure(ErrorKind.TRANSPORT, fullMessage(e)));
        }
    }

    /**
     * Throws if the response status is not a success.
     *
     * @param httpResponse Response instance.
     * @throws TransportException On non-success status.
     */
    private void ensureSuccess(Response httpResponse) throws TransportException {
        if (!httpResponse.isSuccessful()) {
            String reason = StringUtils.isNotBlank(httpResponse.message())
                    ? httpResponse.message()
                    : StatusNames.get(httpResponse.code());
            throw new TransportException(ErrorKind.HTTP_STATUS,
                    "Response status code does not indicate success: " + httpResponse.code() + " (" + reason + ").");
        }
    }

    /**
     * Processes a successful response.
     * <p>Captured headers, cookies and body are available here.
     * <p>Override to accept or refuse responses by content.
     *
     * @param httpResponse Response instance.
     * @return Boolean, false to fail the execution.
     * @throws IOException On I/O error.
     */
    protected boolean processResponse(Response httpResponse) throws IOException {
        return true;
    }

    /**
     * Records result and notifies listeners.
     *
     * @param outcome TransportResult instance.
     * @return The same TransportResult.
     */
    protected TransportResult complete(TransportResult outcome) {
        result = outcome;

        notifier.response(new TransportResponseEvent(this, outcome.isSuccess() ? response : outcome.getMessage()));

        if (outcome.isSuccess()) {
            log.info("{} {} succeeded with status {}", config.getMethod(), target(), statusCode);
            notifier.success(new TransportEvent(this));
        } else {
            log.warn("{} {} failed: {}", config.getMethod(), target(), outcome);
            notifier.fail(new TransportFailEvent(this, outcome.getErrorKind(), outcome.getMessage()));
        }

        return outcome;
    }

    /**
     * Gets configured target for logging.
     *
     * @return Target string.
     */
    private String target() {
        return StringUtils.defaultString(config.getBaseAddress()) + StringUtils.defaultString(config.getUri());
    }

    /**
     * Joins the messages of an exception and its causes.
     *
     * @param e Throwable instance.
     * @return Message string.
     */
    static String fullMessage(Throwable e) {
        String message = ExceptionUtils.getThrowableList(e).stream()
                .map(t -> StringUtils.defaultIfBlank(t.getMessage(), t.getClass().getSimpleName()))
                .distinct()
                .collect(Collectors.joining(" ---> "));
        return StringUtils.defaultIfBlank(message, e.getClass().getSimpleName());
    }

    public TransportConfig getConfig() {
        return config;
    }

    public Charset getTransportEncoding() {
        return config.getEncoding();
    }

    public List<Cookie> getCookies() {
        return cookies;
    }

    /**
     * Gets rendered request log of the last execution.
     *
     * @return Request log string or null.
     */
    public String getRequest() {
        return request;
    }

    /**
     * Gets rendered response log of the last execution.
     *
     * @return Response log string or null.
     */
    public String getResponse() {
        return response;
    }

    public ResponseBody getResponseBody() {
        return responseBody;
    }

    /**
     * Gets response headers of the last successful execution.
     *
     * @return Map of String, String or null.
     */
    public Map<String, String> getResponseHeaders() {
        return responseHeaders;
    }

    /**
     * Gets response cookies of the last successful execution.
     *
     * @return List of Cookie or null.
     */
    public List<Cookie> getResponseCookies() {
        return responseCookies;
    }

    /**
     * Gets status code of the last execution.
     *
     * @return Status code, 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Gets result of the last execution.
     *
     * @return TransportResult or null before the first execution.
     */
    public TransportResult getResult() {
        return result;
    }
}
