package com.mimecast.courier.http;

import okhttp3.MediaType;
import okhttp3.RequestBody;
import okio.BufferedSink;
import okio.Okio;
import okio.Source;

import java.io.IOException;
import java.io.InputStream;

/**
 * Streamed request body.
 *
 * <p>Writes the input stream as is without buffering it into memory.
 * <br>The stream can be consumed only once so the body is one shot.
 */
public class StreamRequestBody extends RequestBody {
    private final InputStream stream;
    private final MediaType contentType;

    /**
     * Constructs a new StreamRequestBody instance.
     *
     * @param stream      Body stream.
     * @param contentType Content type, may be null.
     */
    public StreamRequestBody(InputStream stream, MediaType contentType) {
        this.stream = stream;
        this.contentType = contentType;
    }

    @Override
    public MediaType contentType() {
        return contentType;
    }

    @Override
    public boolean isOneShot() {
        return true;
    }

    @Override
    public void writeTo(BufferedSink sink) throws IOException {
        try (Source source = Okio.source(stream)) {
            sink.writeAll(source);
        }
    }
}
