package domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One stored post. Instances are immutable, so the store can hand them out
 * without exposing its own state.
 */
public final class Post {
    private final long id;
    private final String title;
    private final String content;
    private final String category;
    private final List<String> tags;
    private final Instant createdAt;
    private final Instant updatedAt;

    public Post(long id,
                String title,
                String content,
                String category,
                List<String> tags,
                Instant createdAt,
                Instant updatedAt) {
        this.id = id;
        this.title = title;
        this.content = content;
        this.category = category == null ? "" : category;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /** Builds the stored form of a draft. */
    public static Post fromDraft(long id, PostDraft draft, Instant createdAt, Instant updatedAt) {
        return new Post(id, draft.getTitle(), draft.getContent(), draft.getCategory(),
                draft.getTags(), createdAt, updatedAt);
    }

    public long getId() { return id; }
    public String getTitle() { return title; }
    public String getContent() { return content; }
    public String getCategory() { return category; }
    public List<String> getTags() { return tags; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Post)) {
            return false;
        }
        Post that = (Post) o;
        return id == that.id
                && Objects.equals(title, that.title)
                && Objects.equals(content, that.content)
                && Objects.equals(category, that.category)
                && Objects.equals(tags, that.tags)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, content, category, tags, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "Post{" +
                "id=" + id +
                ", title='" + title + '\'' +
                ", category='" + category + '\'' +
                ", tags=" + tags +
                ", createdAt=" + createdAt +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
