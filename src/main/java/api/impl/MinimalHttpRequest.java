package api.impl;

import api.interfaces.http.HttpRequest;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final Map<String,String> query;
    private final String version;
    private final Map<String,String> headers;
    private final byte[] body;

    /**
     * @param target request target as it appears on the request line,
     *               e.g. {@code /posts?term=go}
     */
    public MinimalHttpRequest(String method, String target, String version,
                              Map<String,String> headers, byte[] body){
        this.method = method;
        int q = target.indexOf('?');
        this.path = q < 0 ? target : target.substring(0, q);
        this.query = q < 0 ? Map.of() : parseQuery(target.substring(q + 1));
        this.version = version;
        this.headers = headers == null ? Map.of() : headers;
        this.body = body == null ? new byte[0] : body;
    }

    @Override public String method(){ return method; }
    @Override public String path(){ return path; }
    @Override public String query(String name){ return query.get(name); }
    @Override public String version(){ return version; }

    @Override
    public String header(String name){
        if (name == null) return null;
        return headers.getOrDefault(name, headers.getOrDefault(name.toLowerCase(), null));
    }

    @Override public byte[] body() { return body; }

    /** First occurrence of a key wins. */
    static Map<String,String> parseQuery(String raw) {
        Map<String,String> out = new LinkedHashMap<>();
        if (raw.isEmpty()) return out;
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String k = decode(eq < 0 ? pair : pair.substring(0, eq));
            String v = eq < 0 ? "" : decode(pair.substring(eq + 1));
            out.putIfAbsent(k, v);
        }
        return out;
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // broken %-escape: keep the raw text
            return s;
        }
    }
}
