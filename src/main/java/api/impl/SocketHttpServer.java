package api.impl;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.IHttpServer;
import api.interfaces.http.HttpStatus;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking HTTP/1.1 server: one accept thread hands each connection to a
 * fixed worker pool, so requests are served concurrently. One request per
 * connection ({@code Connection: close}).
 */
public class SocketHttpServer implements IHttpServer {

    private static final int MAX_LINE = 8 * 1024;
    private static final int MAX_BODY = 1024 * 1024;
    static final int DEFAULT_READ_TIMEOUT_MS = 5_000;
    static final long ACCEPT_BACKOFF_MS = 100;

    private final IHandlerFactory factory;
    private final int workers;
    private final int readTimeoutMs;

    private volatile ServerSocket serverSocket;
    private ExecutorService pool;
    private Thread acceptor;

    public SocketHttpServer(IHandlerFactory factory, int workers) {
        this(factory, workers, DEFAULT_READ_TIMEOUT_MS);
    }

    /**
     * @param readTimeoutMs how long a worker waits on a silent client before
     *                      dropping the connection
     */
    public SocketHttpServer(IHandlerFactory factory, int workers, int readTimeoutMs) {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        if (readTimeoutMs < 1) throw new IllegalArgumentException("readTimeoutMs must be >= 1");
        this.factory = factory;
        this.workers = workers;
        this.readTimeoutMs = readTimeoutMs;
    }

    @Override
    public synchronized void start(int port) throws IOException {
        if (serverSocket != null) throw new IllegalStateException("already started");
        serverSocket = new ServerSocket(port);

        AtomicInteger n = new AtomicInteger();
        pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "http-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        acceptor = new Thread(this::acceptLoop, "http-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        System.out.println("[Server] listening on port " + serverSocket.getLocalPort());
    }

    @Override
    public int port() {
        ServerSocket ss = serverSocket;
        if (ss == null) throw new IllegalStateException("not started");
        return ss.getLocalPort();
    }

    @Override
    public synchronized void close() throws IOException, InterruptedException {
        if (serverSocket == null || serverSocket.isClosed()) return;
        try {
            serverSocket.close(); // unblocks accept()
        } finally {
            pool.shutdown();
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
            acceptor.join(1000);
            System.out.println("[Server] stopped");
        }
    }

    private void acceptLoop() {
        ServerSocket ss = serverSocket;
        while (!ss.isClosed()) {
            Socket client;
            try {
                client = ss.accept();
            } catch (IOException e) {
                if (ss.isClosed()) break;
                System.err.println("[Server] accept failed: " + e.getMessage());
                // e.g. out of file descriptors; don't spin on it
                if (!backOff(ACCEPT_BACKOFF_MS)) break;
                continue;
            }
            try {
                pool.execute(() -> serve(client));
            } catch (RejectedExecutionException e) {
                // shutting down
                closeQuietly(client);
            }
        }
    }

    /** @return false if the thread was interrupted while waiting */
    static boolean backOff(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Reads one request, runs its handler and writes the response. */
    void serve(Socket socket) {
        try {
            socket.setSoTimeout(readTimeoutMs);
        } catch (SocketException e) {
            System.err.println("[Server] cannot set read timeout: " + e.getMessage());
            closeQuietly(socket);
            return;
        }
        try (socket;
             InputStream rawIn = socket.getInputStream();
             BufferedInputStream in = new BufferedInputStream(rawIn);
             OutputStream out = socket.getOutputStream()) {

            String start = readLineAscii(in); // e.g. "GET /posts?term=go HTTP/1.1"
            if (start == null || start.isBlank()) {
                HttpResponseWriter.writePlain(out, HttpStatus.BAD_REQUEST, "empty request line");
                return;
            }
            String[] p = start.split(" ", 3);
            if (p.length < 2 || p[1].isEmpty() || p[1].charAt(0) != '/') {
                HttpResponseWriter.writePlain(out, HttpStatus.BAD_REQUEST, "malformed request line");
                return;
            }
            String method = p[0];
            // the line was read byte-per-char; raw UTF-8 in the target is restored here
            String target = new String(p[1].getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
            String ver    = p.length > 2 ? p[2] : "HTTP/1.1";

            Map<String,String> headers = new LinkedHashMap<>();
            String line;
            while ((line = readLineAscii(in)) != null && !line.isEmpty()) {
                int idx = line.indexOf(':');
                if (idx > 0) {
                    String k = line.substring(0, idx).trim();
                    String v = line.substring(idx + 1).trim();
                    headers.put(k, v);
                    headers.put(k.toLowerCase(Locale.ROOT), v);
                }
            }

            int len;
            try {
                len = Integer.parseInt(headers.getOrDefault("content-length", "0"));
            } catch (NumberFormatException e) {
                HttpResponseWriter.writePlain(out, HttpStatus.BAD_REQUEST, "invalid Content-Length");
                return;
            }
            if (len < 0 || len > MAX_BODY) {
                HttpResponseWriter.writePlain(out, HttpStatus.BAD_REQUEST, "unsupported Content-Length");
                return;
            }

            String expect = headers.get("expect");
            if (len > 0 && "100-continue".equalsIgnoreCase(expect)) {
                HttpResponseWriter.writeContinue(out);
            }
            byte[] body = in.readNBytes(len);

            MinimalHttpRequest req = new MinimalHttpRequest(method, target, ver, headers, body);
            HttpResponseImpl res = new HttpResponseImpl();

            IHttpHandler handler = factory.create(req);
            try {
                handler.handle(req, res);
            } catch (Exception e) {
                System.err.println("[Server] " + method + " " + req.path() + " failed: " + e);
                res = new HttpResponseImpl();
                res.status(HttpStatus.INTERNAL_SERVER_ERROR);
                res.header("Content-Type", "application/json; charset=utf-8");
                res.body("{\"error\":\"internal server error\"}");
            }

            HttpResponseWriter.write(out, res);

        } catch (SocketTimeoutException te) {
            // idle or slow client; the worker is freed and the connection dropped
            System.out.println("[Server] dropped idle connection from " + socket.getRemoteSocketAddress());
        } catch (SocketException se) {
            String msg = String.valueOf(se.getMessage()).toLowerCase(Locale.ROOT);
            if (!(msg.contains("connection reset") || msg.contains("broken pipe")
                    || msg.contains("socket closed"))) {
                System.err.println("[Server] socket error: " + se.getMessage());
            }
        } catch (IOException e) {
            System.err.println("[Server] error: " + e.getMessage());
        }
    }

    /** Reads up to CRLF (or bare LF); {@code null} at end of stream. */
    static String readLineAscii(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = bytes.length;
                if (len > 0 && bytes[len - 1] == '\r') len--;
                return new String(bytes, 0, len, StandardCharsets.ISO_8859_1);
            }
            if (buf.size() >= MAX_LINE) {
                throw new IOException("header line too long");
            }
            buf.write(b);
        }
        return (buf.size() == 0) ? null : buf.toString(StandardCharsets.ISO_8859_1);
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            System.err.println("[Server] close failed: " + e.getMessage());
        }
    }
}
