package api.impl;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MinimalHttpRequestTest {

    @Test
    void splitsPathAndQuery() {
        MinimalHttpRequest r = new MinimalHttpRequest("GET", "/posts?term=Go%20Basics&x=1", "HTTP/1.1", Map.of(), null);
        assertEquals("/posts", r.path());
        assertEquals("Go Basics", r.query("term"));
        assertEquals("1", r.query("x"));
        assertNull(r.query("missing"));
        assertEquals(0, r.body().length);
    }

    @Test
    void queryEdgeCases() {
        Map<String, String> q = MinimalHttpRequest.parseQuery("term=a+b&term=second&flag&&bad=%zz");
        assertEquals("a b", q.get("term"));
        assertEquals("", q.get("flag"));
        assertEquals("%zz", q.get("bad"));
        assertTrue(MinimalHttpRequest.parseQuery("").isEmpty());
    }

    @Test
    void noQueryString() {
        MinimalHttpRequest r = new MinimalHttpRequest("GET", "/posts/1", "HTTP/1.1", null, null);
        assertEquals("/posts/1", r.path());
        assertNull(r.query("term"));
        assertNull(r.header("Host"));
    }

    @Test
    void headerLookupFallsBackToLowerCase() {
        MinimalHttpRequest r = new MinimalHttpRequest("GET", "/", "HTTP/1.1", Map.of("content-type", "application/json"), null);
        assertEquals("application/json", r.header("Content-Type"));
        assertNull(r.header(null));
    }
}
