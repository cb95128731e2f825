package app;

import java.util.HashMap;
import java.util.Map;

/**
 * Startup settings. Lookup order: command-line argument (port only),
 * system property, environment variable, default.
 */
public final class ServerConfig {

    static final int DEFAULT_PORT = 8080;
    static final int DEFAULT_WORKERS = 16;
    static final int DEFAULT_READ_TIMEOUT_MS = 5_000;

    private final int port;
    private final int workers;
    private final int readTimeoutMs;

    public ServerConfig(int port, int workers, int readTimeoutMs) {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
        if (readTimeoutMs < 1) throw new IllegalArgumentException("read timeout must be >= 1: " + readTimeoutMs);
        this.port = port;
        this.workers = workers;
        this.readTimeoutMs = readTimeoutMs;
    }

    public int port() { return port; }
    public int workers() { return workers; }
    public int readTimeoutMs() { return readTimeoutMs; }

    public static ServerConfig load(String[] args) {
        Map<String, String> props = new HashMap<>();
        for (String name : System.getProperties().stringPropertyNames()) {
            props.put(name, System.getProperty(name));
        }
        return load(args, props, System.getenv());
    }

    static ServerConfig load(String[] args, Map<String, String> props, Map<String, String> env) {
        String portText = args != null && args.length > 0
                ? args[0]
                : lookup(props, env, "posts.port", "POSTS_PORT");
        String workersText = lookup(props, env, "posts.workers", "POSTS_WORKERS");
        String timeoutText = lookup(props, env, "posts.readTimeoutMs", "POSTS_READ_TIMEOUT_MS");

        int port = portText == null ? DEFAULT_PORT : parse("port", portText);
        int workers = workersText == null ? DEFAULT_WORKERS : parse("workers", workersText);
        int readTimeoutMs = timeoutText == null ? DEFAULT_READ_TIMEOUT_MS : parse("read timeout", timeoutText);
        return new ServerConfig(port, workers, readTimeoutMs);
    }

    private static String lookup(Map<String, String> props, Map<String, String> env,
                                 String property, String variable) {
        String v = props.get(property);
        if (v == null || v.isBlank()) v = env.get(variable);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static int parse(String name, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + name + ": " + text, e);
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{port=" + port + ", workers=" + workers + ", readTimeoutMs=" + readTimeoutMs + '}';
    }
}
