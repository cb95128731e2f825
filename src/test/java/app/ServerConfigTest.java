package app;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void defaults() {
        ServerConfig c = ServerConfig.load(new String[0], Map.of(), Map.of());
        assertEquals(8080, c.port());
        assertEquals(16, c.workers());
        assertEquals(5000, c.readTimeoutMs());
    }

    @Test
    void readTimeoutFromPropertyOrEnvironment() {
        assertEquals(250, ServerConfig.load(null, Map.of("posts.readTimeoutMs", "250"), Map.of()).readTimeoutMs());
        assertEquals(750, ServerConfig.load(null, Map.of(), Map.of("POSTS_READ_TIMEOUT_MS", "750")).readTimeoutMs());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.load(null, Map.of("posts.readTimeoutMs", "0"), Map.of()));
    }

    @Test
    void argumentBeatsPropertyBeatsEnvironment() {
        Map<String, String> props = Map.of("posts.port", "9001");
        Map<String, String> env = Map.of("POSTS_PORT", "9002", "POSTS_WORKERS", "4");

        assertEquals(9000, ServerConfig.load(new String[]{"9000"}, props, env).port());
        assertEquals(9001, ServerConfig.load(null, props, env).port());
        assertEquals(9002, ServerConfig.load(null, Map.of(), env).port());
        assertEquals(4, ServerConfig.load(null, props, env).workers());
    }

    @Test
    void invalidValuesFailFast() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.load(new String[]{"http"}, Map.of(), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.load(null, Map.of("posts.workers", "0"), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new ServerConfig(70000, 1, 1000));
    }
}
