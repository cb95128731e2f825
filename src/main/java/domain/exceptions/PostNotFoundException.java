package domain.exceptions;

/** No live post has the requested id. */
public class PostNotFoundException extends StoreException {
    private final long id;

    public PostNotFoundException(long id) {
        super("post with id " + id + " not found");
        this.id = id;
    }

    public long id() { return id; }
}
