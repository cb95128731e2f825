package api.impl;

import api.interfaces.http.HttpStatus;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/** Serializes responses as HTTP/1.1, one response per connection. */
public final class HttpResponseWriter {

    private HttpResponseWriter() {}

    public static void write(OutputStream out, HttpResponseImpl res) throws IOException {
        if (!res.headers().containsKey("Connection")) {
            res.header("Connection", "close");
        }
        if (res.status() == HttpStatus.NO_CONTENT) {
            // a 204 carries neither a body nor Content-Length (RFC 9110 8.6)
            res.headers().remove("Content-Length");
        } else if (!res.headers().containsKey("Content-Length")) {
            res.header("Content-Length", String.valueOf(res.body().length));
        }

        StringBuilder head = new StringBuilder(128);
        head.append("HTTP/1.1 ").append(res.status()).append(' ').append(res.reason()).append("\r\n");
        for (Map.Entry<String, String> e : res.headers().entrySet()) {
            head.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
        }
        head.append("\r\n");

        out.write(head.toString().getBytes(StandardCharsets.US_ASCII));
        if (res.status() != HttpStatus.NO_CONTENT) {
            out.write(res.body());
        }
        out.flush();
    }

    /** Interim reply for clients that sent {@code Expect: 100-continue}. */
    public static void writeContinue(OutputStream out) throws IOException {
        out.write("HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
        out.flush();
    }

    /** Used before a request could be parsed, so no handler is involved. */
    public static void writePlain(OutputStream out, int code, String text) throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(code);
        res.header("Content-Type", "text/plain; charset=utf-8");
        res.body(text);
        write(out, res);
    }
}
