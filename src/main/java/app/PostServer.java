package app;

import api.impl.SocketHttpServer;
import api.impl.handlers.HandlerFactory;
import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpServer;
import domain.interfaces.IPostStore;
import infrastructure.impl.InMemoryPostStore;

import java.util.concurrent.CountDownLatch;

/** Entry point: {@code java app.PostServer [port]}. */
public class PostServer {

    public static void main(String[] args) throws Exception {
        ServerConfig config = ServerConfig.load(args);

        IPostStore store = new InMemoryPostStore();
        IHandlerFactory factory = new HandlerFactory(store);
        IHttpServer server = new SocketHttpServer(factory, config.workers(), config.readTimeoutMs());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                System.err.println("[Server] shutdown failed: " + e.getMessage());
            } finally {
                stopped.countDown();
            }
        }, "shutdown"));

        System.out.println("[Server] starting with " + config);
        server.start(config.port());
        stopped.await();
    }
}
