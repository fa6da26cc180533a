package com.mimecast.courier.config;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransportConfigTest {

    private static TransportConfig config;

    @BeforeAll
    static void before() throws IOException {
        config = new TransportConfig("src/test/resources/cfg/transport.json5");
    }

    @Test
    void getMethod() {
        assertEquals("POST", config.getMethod());
        assertEquals("GET", new TransportConfig().getMethod());
        assertEquals("DELETE", new TransportConfig().setMethod(" delete ").getMethod());
    }

    @Test
    void getAddress() {
        assertEquals("https://api.example.com/v1/", config.getBaseAddress());
        assertEquals("orders?limit=10", config.getUri());
        assertEquals("", new TransportConfig().getUri());
    }

    @Test
    void getHeadersFromList() {
        List<Pair<String, String>> headers = config.getHeaders();
        assertEquals(4, headers.size());
        assertEquals("Accept", headers.get(0).getKey());
        assertEquals("X-Trace", headers.get(1).getKey());
        assertEquals("one", headers.get(1).getValue());
        assertEquals("two", headers.get(2).getValue());
        assertEquals("content-type", headers.get(3).getKey());
    }

    @Test
    void getHeadersFromObject() {
        TransportConfig objectConfig = new TransportConfig(ConfigFoundation.fromJson(
                "{headers: {\"Accept\": \"text/plain\", \"X-Id\": 1}}"));

        List<Pair<String, String>> headers = objectConfig.getHeaders();
        assertEquals(2, headers.size());
        assertEquals("Accept", headers.get(0).getKey());
        assertEquals("text/plain", headers.get(0).getValue());
        assertEquals("X-Id", headers.get(1).getKey());
    }

    @Test
    void addHeader() {
        TransportConfig built = new TransportConfig()
                .addHeader("Accept", "text/plain")
                .addHeader("Accept", "text/html");

        assertEquals(2, built.getHeaders().size());
        assertEquals("text/html", built.getHeaders().get(1).getValue());
    }

    @Test
    void getClientName() {
        assertEquals("slow", config.getClientName());
        assertEquals(TransportConfig.DEFAULT_CLIENT, new TransportConfig().getClientName());
    }

    @Test
    void getEncoding() {
        assertEquals(StandardCharsets.ISO_8859_1, config.getEncoding());
        assertEquals(StandardCharsets.UTF_8, new TransportConfig().getEncoding());
    }

    @Test
    void getTimeout() {
        assertEquals(15L, config.getTimeout());
        assertEquals(0L, new TransportConfig().getTimeout());
        assertEquals(5L, new TransportConfig().setTimeout(5).getTimeout());
    }

    @Test
    void getCertificate() {
        CertificateConfig certificate = config.getCertificate();
        assertNotNull(certificate);
        assertEquals("cfg/client.p12", certificate.getPath());
        assertEquals("secret", certificate.getPassword());
        assertEquals("PKCS12", certificate.getType());
        assertEquals("", certificate.getTrustStore());

        assertNull(new TransportConfig().getCertificate());
    }

    @Test
    void isAdHoc() {
        // Certificate implies ad hoc.
        assertTrue(config.isAdHoc());

        assertFalse(new TransportConfig().isAdHoc());
        assertTrue(new TransportConfig().setAdHoc(true).isAdHoc());
        assertTrue(new TransportConfig().setCertificate("client.p12", "secret").isAdHoc());
    }

    @Test
    void missingFile() {
        assertThrows(IOException.class, () -> new TransportConfig("src/test/resources/cfg/missing.json5"));
    }

    @Test
    void brokenFile() {
        IOException e = assertThrows(IOException.class, () -> new TransportConfig("src/test/resources/cfg/broken.json5"));
        assertTrue(e.getMessage().startsWith("Unable to parse configuration file"));
    }
}
