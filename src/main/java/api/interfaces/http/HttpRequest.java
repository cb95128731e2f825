package api.interfaces.http;

/** Minimal request contract */
public interface HttpRequest {
    String method();

    /** Request path without the query string, e.g. {@code /posts/7}. */
    String path();

    /** Decoded value of a query parameter, or {@code null} when absent. */
    String query(String name);

    // extras we need for handlers
    String version();
    String header(String name);
    byte[] body();
}
