package api.impl.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import domain.model.PostDraft;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The one place that knows the JSON wire format. Field names come straight
 * from the model classes: id, title, content, category, tags, createdAt, updatedAt.
 */
public final class PostJson {

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(Instant.class, new InstantTypeAdapter().nullSafe())
            .registerTypeAdapter(String.class, new StrictStringTypeAdapter())
            .disableHtmlEscaping()
            .create();

    private PostJson() {}

    public static Gson gson() { return GSON; }

    public static String toJson(Object value) {
        return GSON.toJson(value);
    }

    /**
     * Decodes a create/update body.
     * <p>Parsing is strict: unquoted names, single quotes and trailing data are errors.</p>
     *
     * @throws JsonParseException if the body is empty, not JSON, not an object,
     *                            or a field has the wrong type
     */
    public static PostDraft readDraft(byte[] body) {
        String text = body == null ? "" : new String(body, StandardCharsets.UTF_8).trim();
        if (text.isEmpty()) {
            throw new JsonParseException("empty body");
        }
        JsonElement root = parseStrict(text);
        if (root == null || !root.isJsonObject()) {
            throw new JsonParseException("expected a JSON object");
        }
        return GSON.fromJson(root, PostDraft.class);
    }

    private static JsonElement parseStrict(String text) {
        JsonReader reader = new JsonReader(new StringReader(text));
        reader.setLenient(false);
        try {
            JsonElement root = GSON.getAdapter(JsonElement.class).read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonParseException("trailing data after JSON value");
            }
            return root;
        } catch (IOException e) {
            // MalformedJsonException and EOFException both land here
            throw new JsonParseException("malformed JSON: " + e.getMessage(), e);
        }
    }

    public static String error(String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("error", message);
        return GSON.toJson(m);
    }

    public static String error(String message, List<String> missing) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("error", message);
        m.put("missing", missing);
        return GSON.toJson(m);
    }
}
