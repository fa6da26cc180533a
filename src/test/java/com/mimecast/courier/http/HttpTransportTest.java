package com.mimecast.courier.http;

import com.mimecast.courier.config.TransportConfig;
import com.mimecast.courier.http.client.ClientProvider;
import com.mimecast.courier.http.event.TransportEvent;
import com.mimecast.courier.http.event.TransportFailEvent;
import com.mimecast.courier.http.event.TransportListener;
import com.mimecast.courier.http.event.TransportRequestEvent;
import com.mimecast.courier.http.event.TransportResponseEvent;
import okhttp3.Cookie;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for HttpTransport.
 * <p>
 * These tests use MockWebServer to answer the requests sent by the transport
 * and a recording listener to check the lifecycle notifications.
 */
class HttpTransportTest {

    private MockWebServer mockWebServer;
    private RecordingListener listener;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private TransportConfig config(String method, String path) {
        return new TransportConfig()
                .setMethod(method)
                .setUri(mockWebServer.url(path).toString());
    }

    @Test
    void getText() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "text/plain")
                .setBody("hi"));

        HttpTransport<String> transport = new HttpTransport<String>(config("GET", "/ok")).addListener(listener);

        assertTrue(transport.execute());
        assertEquals(ResponseBody.text("hi"), transport.getResponseBody());
        assertEquals(200, transport.getStatusCode());
        assertTrue(transport.getResult().isSuccess());

        assertTrue(transport.getRequest().startsWith("GET " + mockWebServer.url("/ok") + "\r\n"));
        assertTrue(transport.getResponse().startsWith("HTTP 1.1 200 OK\r\n"));
        assertTrue(transport.getResponse().endsWith("\r\n\r\nhi\r\n"));

        assertEquals("text/plain", transport.getResponseHeaders().get("Content-Type"));
        assertTrue(transport.getResponseCookies().isEmpty());

        assertEquals(List.of("request", "response", "success"), listener.events);
        assertEquals(transport.getRequest(), listener.request);
        assertEquals(transport.getResponse(), listener.response);

        RecordedRequest recorded = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("GET", recorded.getMethod());
        assertEquals("/ok", recorded.getPath());
    }

    @Test
    void postServerError() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));

        HttpTransport<String> transport = new HttpTransport<String>(config("POST", "/err")).addListener(listener);

        assertFalse(transport.execute("{}"));
        assertEquals(500, transport.getStatusCode());
        assertTrue(transport.getResponse().contains("HTTP 1.1 500 InternalServerError"));

        // Nothing captured for non-success status.
        assertNull(transport.getResponseHeaders());
        assertNull(transport.getResponseCookies());
        assertEquals(ResponseBody.EMPTY, transport.getResponseBody());

        assertEquals(ErrorKind.HTTP_STATUS, transport.getResult().getErrorKind());
        assertTrue(transport.getResult().getMessage().startsWith("Response status code does not indicate success: 500"));

        assertEquals(List.of("request", "response", "fail"), listener.events);
        assertEquals(ErrorKind.HTTP_STATUS, listener.fail.getErrorKind());
        assertEquals(transport.getResult().getMessage(), listener.response);
    }

    @Test
    void missingUri() {
        HttpTransport<String> transport = new HttpTransport<String>(new TransportConfig()).addListener(listener);

        assertFalse(transport.execute());
        assertEquals(0, mockWebServer.getRequestCount());
        assertEquals(ErrorKind.CONFIGURATION, transport.getResult().getErrorKind());
        assertNull(transport.getRequest());
        assertEquals(0, transport.getStatusCode());

        assertEquals(List.of("response", "fail"), listener.events);
    }

    @Test
    void unsupportedBody() {
        HttpTransport<Object> transport = new HttpTransport<>(config("POST", "/any")).addListener(listener);

        TransportResult result = transport.send(42L);
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.UNSUPPORTED_BODY, result.getErrorKind());
        assertEquals("Body of type Long is not supported", result.getMessage());
        assertEquals(0, mockWebServer.getRequestCount());
        assertEquals(1, listener.count("fail"));
    }

    @Test
    void unsupportedEncoding() {
        mockWebServer.enqueue(new MockResponse().addHeader("Content-Type", "text/plain").setBody("hi"));

        HttpTransport<String> transport = new HttpTransport<String>(config("GET", "/ok").setEncoding("no-such-charset"))
                .addListener(listener);

        TransportResult result = transport.send(null);
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.CONFIGURATION, result.getErrorKind());
        assertEquals("Unsupported encoding: no-such-charset", result.getMessage());
        assertEquals(0, mockWebServer.getRequestCount());
        assertEquals(List.of("response", "fail"), listener.events);
    }

    @Test
    void bodyOnGet() {
        HttpTransport<String> transport = new HttpTransport<>(config("GET", "/ok"));

        TransportResult result = transport.send("{}");
        assertEquals(ErrorKind.UNSUPPORTED_BODY, result.getErrorKind());
        assertEquals("Method GET does not permit a request body", result.getMessage());
        assertEquals(0, mockWebServer.getRequestCount());
    }

    @Test
    void connectionRefused() throws IOException {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String url = closed.url("/gone").toString();
        closed.shutdown();

        HttpTransport<String> transport = new HttpTransport<String>(new TransportConfig().setUri(url)).addListener(listener);

        assertFalse(transport.execute());
        assertEquals(ErrorKind.TRANSPORT, transport.getResult().getErrorKind());
        assertNull(transport.getResponse());
        assertEquals(List.of("request", "response", "fail"), listener.events);
    }

    @Test
    void rawBody() {
        byte[] pdf = "%PDF-1.4".getBytes(StandardCharsets.US_ASCII);
        mockWebServer.enqueue(new MockResponse()
                .addHeader("Content-Type", "application/pdf")
                .setBody(new Buffer().write(pdf)));

        HttpTransport<String> transport = new HttpTransport<>(config("GET", "/doc.pdf"));

        assertTrue(transport.execute());
        assertEquals(ResponseBody.raw(pdf), transport.getResponseBody());
        assertNull(transport.getResponseBody().getValue());
    }

    @Test
    void rawBodyWithoutContentType() {
        mockWebServer.enqueue(new MockResponse().setBody("opaque"));

        HttpTransport<String> transport = new HttpTransport<>(config("GET", "/blob"));

        assertTrue(transport.execute());
        assertTrue(transport.getResponseBody().isRaw());
        assertArrayEquals("opaque".getBytes(StandardCharsets.UTF_8), transport.getResponseBody().getRawValue());
    }

    @Test
    void textBodyEncoding() {
        mockWebServer.enqueue(new MockResponse()
                .addHeader("Content-Type", "text/plain")
                .setBody(new Buffer().write("café".getBytes(StandardCharsets.ISO_8859_1))));

        HttpTransport<String> transport = new HttpTransport<>(config("GET", "/latin").setEncoding("ISO-8859-1"));

        assertTrue(transport.execute());
        assertEquals("café", transport.getResponseBody().getValue());
        assertEquals(StandardCharsets.ISO_8859_1, transport.getTransportEncoding());
    }

    @Test
    void responseHeaders() {
        mockWebServer.enqueue(new MockResponse()
                .addHeader("X-Id", "1")
                .addHeader("Vary", "Accept")
                .addHeader("Vary", "Origin")
                .addHeader("Content-Type", "application/json")
                .setBody("{}"));

        HttpTransport<String> transport = new HttpTransport<>(config("GET", "/headers"));

        assertTrue(transport.execute());
        assertEquals("1", transport.getResponseHeaders().get("X-Id"));
        assertEquals("Accept, Origin", transport.getResponseHeaders().get("Vary"));
        assertEquals("application/json", transport.getResponseHeaders().get("Content-Type"));
        assertTrue(transport.getResponse().contains("Vary: Accept, Origin\r\n"));
    }

    @Test
    void responseCookies() {
        mockWebServer.enqueue(new MockResponse()
                .addHeader("Set-Cookie", "session=abc; Path=/")
                .addHeader("Set-Cookie", "theme=dark; Path=/")
                .addHeader("Content-Type", "text/plain")
                .setBody("ok"));

        HttpTransport<String> transport = new HttpTransport<>(config("GET", "/login"));

        assertTrue(transport.execute());
        List<Cookie> cookies = transport.getResponseCookies();
        assertEquals(2, cookies.size());
        assertEquals("session", cookies.get(0).name());
        assertEquals("theme", cookies.get(1).name());
    }

    @Test
    void requestCookiesAndHeaders() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setBody("ok"));

        String host = mockWebServer.getHostName();
        List<Cookie> cookies = List.of(
                new Cookie.Builder().name("a").value("1").domain(host).build(),
                new Cookie.Builder().name("b").value("2").domain(host).build());

        TransportConfig config = config("GET", "/cookies")
                .addHeader("Accept", "text/plain")
                .addHeader("X-Trace", "one");
        HttpTransport<String> transport = new HttpTransport<>(config, cookies);

        assertTrue(transport.execute());
        assertEquals(cookies, transport.getCookies());

        RecordedRequest recorded = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("a=1; b=2", recorded.getHeader("Cookie"));
        assertEquals("text/plain", recorded.getHeader("Accept"));
        assertEquals("one", recorded.getHeader("X-Trace"));
        assertTrue(transport.getRequest().contains("Cookie: a=1; b=2\r\nAccept: text/plain\r\n"));
    }

    @Test
    void baseAndRelative() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setBody("ok"));

        TransportConfig config = new TransportConfig()
                .setBaseAddress(mockWebServer.url("/api/").toString())
                .setUri("orders?limit=1");

        assertTrue(new HttpTransport<String>(config).execute());

        RecordedRequest recorded = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("/api/orders?limit=1", recorded.getPath());
    }

    @Test
    void textRequestBody() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setResponseCode(201).setBody("created"));

        HttpTransport<String> transport = new HttpTransport<>(config("POST", "/orders"));

        assertTrue(transport.execute("{\"id\": 1}"));
        assertTrue(transport.getRequest().endsWith("\r\n\r\n{\"id\": 1}\r\n"));

        RecordedRequest recorded = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("application/json; charset=utf-8", recorded.getHeader("Content-Type"));
        assertEquals("{\"id\": 1}", recorded.getBody().readUtf8());
    }

    @Test
    void bytesRequestBody() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setBody("ok"));

        TransportConfig config = config("PUT", "/upload").addHeader("Content-Type", "application/octet-stream");
        HttpTransport<byte[]> transport = new HttpTransport<>(config);

        assertTrue(transport.execute(new byte[]{1, 2, 3}));
        assertTrue(transport.getRequest().endsWith("\r\n\r\nAQID\r\n"));

        RecordedRequest recorded = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("application/octet-stream", recorded.getHeader("Content-Type"));
        assertArrayEquals(new byte[]{1, 2, 3}, recorded.getBody().readByteArray());
    }

    @Test
    void streamRequestBody() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setBody("ok"));

        HttpTransport<ByteArrayInputStream> transport = new HttpTransport<>(config("POST", "/stream"));

        assertTrue(transport.execute(new ByteArrayInputStream("streamed".getBytes(StandardCharsets.UTF_8))));
        assertTrue(transport.getRequest().endsWith(TransportLog.STREAM_BODY + "\r\n"));

        RecordedRequest recorded = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("streamed", recorded.getBody().readUtf8());
    }

    @Test
    void adHocClient() {
        mockWebServer.enqueue(new MockResponse().addHeader("Content-Type", "text/plain").setBody("hi"));

        HttpTransport<String> transport = new HttpTransport<>(config("GET", "/adhoc").setAdHoc(true).setTimeout(5));

        assertTrue(transport.execute());
        assertEquals("hi", transport.getResponseBody().getValue());
    }

    @Test
    void rejectedResponse() {
        mockWebServer.enqueue(new MockResponse().addHeader("Content-Type", "text/plain").setBody("denied"));

        HttpTransport<String> transport = new HttpTransport<String>(config("GET", "/check")) {
            @Override
            protected boolean processResponse(Response httpResponse) {
                return !"denied".equals(getResponseBody().getValue());
            }
        }.addListener(listener);

        assertFalse(transport.execute());
        assertEquals(ErrorKind.REJECTED, transport.getResult().getErrorKind());
        assertEquals("Response rejected: HTTP 1.1 200 OK", transport.getResult().getMessage());
        assertEquals(List.of("request", "response", "fail"), listener.events);
    }

    @Test
    void listenerFailureIsolated() {
        mockWebServer.enqueue(new MockResponse().setBody("ok"));

        TransportListener failing = new TransportListener() {
            @Override
            public void onRequest(TransportRequestEvent event) {
                throw new IllegalStateException("request listener failed");
            }

            @Override
            public void onSuccess(TransportEvent event) {
                throw new IllegalStateException("success listener failed");
            }
        };

        HttpTransport<String> transport = new HttpTransport<String>(config("GET", "/ok"))
                .addListener(failing)
                .addListener(listener);

        assertTrue(transport.execute());
        assertEquals(List.of("request", "response", "success"), listener.events);
    }

    @Test
    void removeListener() {
        mockWebServer.enqueue(new MockResponse().setBody("ok"));

        HttpTransport<String> transport = new HttpTransport<String>(config("GET", "/ok")).addListener(listener);
        assertTrue(transport.removeListener(listener));
        assertFalse(transport.removeListener(listener));

        assertTrue(transport.execute());
        assertTrue(listener.events.isEmpty());
    }

    @Test
    void stateReset() {
        mockWebServer.enqueue(new MockResponse()
                .addHeader("Content-Type", "text/plain")
                .addHeader("Set-Cookie", "session=abc")
                .setBody("first"));
        mockWebServer.enqueue(new MockResponse().setResponseCode(503));

        HttpTransport<String> transport = new HttpTransport<String>(config("GET", "/twice")).addListener(listener);

        assertTrue(transport.execute());
        assertEquals("first", transport.getResponseBody().getValue());
        assertEquals(1, transport.getResponseCookies().size());

        assertFalse(transport.execute());
        assertEquals(503, transport.getStatusCode());
        assertEquals(ResponseBody.EMPTY, transport.getResponseBody());
        assertNull(transport.getResponseHeaders());
        assertNull(transport.getResponseCookies());
        assertTrue(transport.getResponse().startsWith("HTTP 1.1 503 ServiceUnavailable"));

        // Exactly one outcome per execution.
        assertEquals(1, listener.count("success"));
        assertEquals(1, listener.count("fail"));
    }

    @Test
    void clientReleased() throws TransportException {
        mockWebServer.enqueue(new MockResponse().setBody("ok"));

        OkHttpClient client = new OkHttpClient();
        ClientProvider provider = mock(ClientProvider.class);
        when(provider.getClient(any())).thenReturn(client);

        HttpTransport<String> transport = new HttpTransport<>(config("GET", "/ok"), null, provider);

        assertTrue(transport.execute());
        verify(provider).getClient(transport.getConfig());
        verify(provider).release(client);
    }

    @Test
    void clientUnavailable() throws TransportException {
        ClientProvider provider = mock(ClientProvider.class);
        when(provider.getClient(any())).thenThrow(new TransportException(ErrorKind.CONFIGURATION, "No client"));

        HttpTransport<String> transport = new HttpTransport<String>(config("GET", "/ok"), null, provider).addListener(listener);

        assertFalse(transport.execute());
        assertEquals(ErrorKind.CONFIGURATION, transport.getResult().getErrorKind());
        assertEquals("No client", transport.getResult().getMessage());
        assertEquals(0, mockWebServer.getRequestCount());
        verify(provider, never()).release(any());
    }

    @Test
    void fullMessage() {
        assertEquals("outer ---> inner",
                HttpTransport.fullMessage(new IOException("outer", new IllegalStateException("inner"))));
        assertEquals("NullPointerException", HttpTransport.fullMessage(new NullPointerException()));
    }

    /**
     * Listener recording notification order.
     */
    private static class RecordingListener implements TransportListener {
        private final List<String> events = new ArrayList<>();
        private String request;
        private String response;
        private TransportFailEvent fail;

        @Override
        public void onRequest(TransportRequestEvent event) {
            events.add("request");
            request = event.getRequest();
        }

        @Override
        public void onResponse(TransportResponseEvent event) {
            events.add("response");
            response = event.getResponse();
        }

        @Override
        public void onSuccess(TransportEvent event) {
            events.add("success");
        }

        @Override
        public void onFail(TransportFailEvent event) {
            events.add("fail");
            fail = event;
        }

        long count(String name) {
            return events.stream().filter(name::equals).count();
        }
    }
}
