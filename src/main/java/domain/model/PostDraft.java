package domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-supplied post fields, decoded from a create or update body.
 * Ids and timestamps are owned by the store and have no place here.
 */
public class PostDraft {
    private String title;
    private String content;
    private String category;
    private List<String> tags;

    // used by Gson
    PostDraft() {}

    public PostDraft(String title, String content, String category, List<String> tags) {
        this.title = title;
        this.content = content;
        this.category = category;
        this.tags = tags == null ? null : new ArrayList<>(tags);
    }

    public String getTitle() { return title; }
    public String getContent() { return content; }
    public String getCategory() { return category == null ? "" : category; }
    public List<String> getTags() { return tags == null ? List.of() : tags; }

    /** @return names of the required text fields that are missing or empty, in field order */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>(2);
        if (title == null || title.isEmpty()) missing.add("title");
        if (content == null || content.isEmpty()) missing.add("content");
        return missing;
    }

    /** A JSON {@code null} inside the tags array cannot be stored. */
    public boolean hasNullTag() {
        return tags != null && tags.contains(null);
    }
}
