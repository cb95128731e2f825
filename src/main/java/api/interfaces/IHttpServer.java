package api.interfaces;

/*
AutoCloseable so tests and the shutdown hook can stop it with close()
 */
public interface IHttpServer extends AutoCloseable {
    /** Binds and starts accepting; port 0 picks a free port. */
    void start(int port) throws Exception;

    /** The bound port, valid after {@link #start}. */
    int port();

    @Override void close() throws Exception;
}
