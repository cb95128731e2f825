package domain.interfaces;

import domain.exceptions.PostNotFoundException;
import domain.exceptions.StoreException;
import domain.model.Post;
import domain.model.PostDraft;

import java.util.List;

/**
 * Storage contract for posts. Implementations must be safe to call from
 * many request threads at once.
 */
public interface IPostStore {

    /**
     * Stores a new post built from the draft.
     * @return the id assigned to it; ids start at 1 and are never reused
     */
    long create(PostDraft draft) throws StoreException;

    Post get(long id) throws PostNotFoundException, StoreException;

    /**
     * Posts whose title, content or category contain {@code term}, ignoring case.
     * An empty or null term matches every post. Order is unspecified.
     */
    List<Post> list(String term) throws StoreException;

    /**
     * Replaces title, content, category and tags and refreshes updatedAt.
     * The id and createdAt are kept.
     */
    Post update(long id, PostDraft draft) throws PostNotFoundException, StoreException;

    void delete(long id) throws PostNotFoundException, StoreException;
}
