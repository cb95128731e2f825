package api.impl;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpResponseWriterTest {

    @Test
    void writesStatusHeadersAndUtf8Body() throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(201, "Created");
        res.header("Content-Type", "application/json; charset=utf-8");
        res.body("{\"title\":\"café\"}");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.write(out, res);
        String raw = out.toString(StandardCharsets.UTF_8);

        assertTrue(raw.startsWith("HTTP/1.1 201 Created\r\n"));
        assertTrue(raw.contains("Content-Type: application/json; charset=utf-8\r\n"));
        assertTrue(raw.contains("Connection: close\r\n"));
        // byte length, not char length
        assertTrue(raw.contains("Content-Length: 17\r\n"));
        assertTrue(raw.endsWith("\r\n\r\n{\"title\":\"café\"}"));
    }

    @Test
    void noContentOmitsContentLengthAndBody() throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(204, null);
        res.header("Content-Length", "0");
        res.body("ignored");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.write(out, res);
        String raw = out.toString(StandardCharsets.US_ASCII);
        assertEquals("HTTP/1.1 204 No Content\r\nConnection: close\r\n\r\n", raw);
    }

    @Test
    void emptyOkBodyStillHasZeroLength() throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(200);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.write(out, res);
        String raw = out.toString(StandardCharsets.US_ASCII);
        assertTrue(raw.startsWith("HTTP/1.1 200 OK\r\n"));
        assertTrue(raw.endsWith("Content-Length: 0\r\n\r\n"));
    }

    @Test
    void plainAndContinue() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.writeContinue(out);
        HttpResponseWriter.writePlain(out, 400, "empty request line");
        String raw = out.toString(StandardCharsets.US_ASCII);
        assertTrue(raw.startsWith("HTTP/1.1 100 Continue\r\n\r\nHTTP/1.1 400 Bad Request\r\n"));
        assertTrue(raw.contains("Content-Type: text/plain; charset=utf-8\r\n"));
        assertTrue(raw.endsWith("empty request line"));
    }
}
