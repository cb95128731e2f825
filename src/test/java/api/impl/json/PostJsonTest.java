package api.impl.json;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import domain.model.Post;
import domain.model.PostDraft;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostJsonTest {

    @Test
    void postUsesWireFieldNamesAndRfc3339Timestamps() {
        Post p = new Post(7, "T", "C", "Cat", List.of("a", "b"),
                Instant.parse("2024-05-01T10:15:30.123456Z"), Instant.parse("2024-05-02T00:00:00Z"));

        JsonObject o = JsonParser.parseString(PostJson.toJson(p)).getAsJsonObject();

        assertEquals(7L, o.get("id").getAsLong());
        assertEquals("T", o.get("title").getAsString());
        assertEquals("C", o.get("content").getAsString());
        assertEquals("Cat", o.get("category").getAsString());
        assertEquals("b", o.getAsJsonArray("tags").get(1).getAsString());
        assertEquals("2024-05-01T10:15:30.123456Z", o.get("createdAt").getAsString());
        assertEquals("2024-05-02T00:00:00Z", o.get("updatedAt").getAsString());
        assertEquals(7, o.size());
    }

    @Test
    void htmlCharactersAreNotEscaped() {
        Post p = new Post(1, "<b>&'", "c", "", List.of(), Instant.EPOCH, Instant.EPOCH);
        assertTrue(PostJson.toJson(p).contains("\"<b>&'\""));
    }

    @Test
    void readDraftIgnoresServerOwnedFields() {
        byte[] body = ("{\"id\":5,\"title\":\"t\",\"content\":\"c\",\"createdAt\":\"2020-01-01T00:00:00Z\",\"extra\":true}")
                .getBytes(StandardCharsets.UTF_8);
        PostDraft d = PostJson.readDraft(body);
        assertEquals("t", d.getTitle());
        assertEquals("c", d.getContent());
        assertEquals("", d.getCategory());
        assertTrue(d.getTags().isEmpty());
        assertTrue(d.missingRequiredFields().isEmpty());
    }

    @Test
    void readDraftRejectsNonObjects() {
        assertThrows(JsonParseException.class, () -> PostJson.readDraft(null));
        assertThrows(JsonParseException.class, () -> PostJson.readDraft("   ".getBytes(StandardCharsets.UTF_8)));
        assertThrows(JsonParseException.class, () -> PostJson.readDraft("null".getBytes(StandardCharsets.UTF_8)));
        assertThrows(JsonParseException.class, () -> PostJson.readDraft("[]".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void readDraftRejectsNumbersAndBooleansInTextFields() {
        assertThrows(JsonParseException.class,
                () -> PostJson.readDraft("{\"title\":123,\"content\":true}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(JsonParseException.class,
                () -> PostJson.readDraft("{\"title\":\"t\",\"content\":\"c\",\"tags\":[\"ok\",1]}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void readDraftRejectsLenientSyntax() {
        assertThrows(JsonParseException.class,
                () -> PostJson.readDraft("{title:'t',content:c}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(JsonParseException.class,
                () -> PostJson.readDraft("{\"title\":\"t\",\"content\":\"c\"}{}".getBytes(StandardCharsets.UTF_8)));
        PostDraft ok = PostJson.readDraft(" {\"title\":\"t\",\"content\":\"c\",\"tags\":[\"a\"]}\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(List.of("a"), ok.getTags());
    }

    @Test
    void instantAdapterReadsOffsetsAsUtc() {
        Instant i = PostJson.gson().fromJson("\"2024-05-01T12:00:00+02:00\"", Instant.class);
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), i);
        assertThrows(JsonParseException.class, () -> PostJson.gson().fromJson("\"yesterday\"", Instant.class));
    }

    @Test
    void errorBodies() {
        assertEquals("{\"error\":\"boom\"}", PostJson.error("boom"));
        assertEquals("{\"error\":\"x\",\"missing\":[\"title\"]}", PostJson.error("x", List.of("title")));
    }
}
