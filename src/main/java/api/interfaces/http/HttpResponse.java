package api.interfaces.http;

/** Minimal response contract */
public interface HttpResponse {
    void status(int code, String reason);

    /** Status with the standard reason phrase from {@link HttpStatus}. */
    default void status(int code) {
        status(code, HttpStatus.reason(code));
    }

    void header(String name, String value);
    void body(String text);
}
