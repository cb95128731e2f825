package infrastructure.impl;

import domain.exceptions.PostNotFoundException;
import domain.interfaces.IPostStore;
import domain.model.Post;
import domain.model.PostDraft;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local post store. Everything is lost when the JVM exits.
 * <p>
 * One fair read-write lock guards both the map and the id counter:
 * create/update/delete hold the write lock, get/list/size the read lock.
 */
public class InMemoryPostStore implements IPostStore {

    // fair, so a stream of readers cannot starve a writer (and the other way round)
    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final Map<Long, Post> posts = new HashMap<>();
    private final Clock clock;
    private long nextId = 1;

    public InMemoryPostStore() {
        this(Clock.systemUTC());
    }

    public InMemoryPostStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long create(PostDraft draft) {
        lock.writeLock().lock();
        try {
            long id = nextId++;
            Instant now = clock.instant();
            posts.put(id, Post.fromDraft(id, draft, now, now));
            return id;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Post get(long id) throws PostNotFoundException {
        lock.readLock().lock();
        try {
            Post post = posts.get(id);
            if (post == null) {
                throw new PostNotFoundException(id);
            }
            return post;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Post> list(String term) {
        String needle = term == null ? "" : term.toLowerCase(Locale.ROOT);
        lock.readLock().lock();
        try {
            List<Post> out = new ArrayList<>(posts.size());
            for (Post post : posts.values()) {
                if (needle.isEmpty() || matches(post, needle)) {
                    out.add(post);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Post update(long id, PostDraft draft) throws PostNotFoundException {
        lock.writeLock().lock();
        try {
            Post existing = posts.get(id);
            if (existing == null) {
                throw new PostNotFoundException(id);
            }
            Instant now = clock.instant();
            // a clock stepping backwards must not make updatedAt go back
            if (now.isBefore(existing.getUpdatedAt())) {
                now = existing.getUpdatedAt();
            }
            Post updated = Post.fromDraft(id, draft, existing.getCreatedAt(), now);
            posts.put(id, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(long id) throws PostNotFoundException {
        lock.writeLock().lock();
        try {
            if (posts.remove(id) == null) {
                throw new PostNotFoundException(id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Number of live posts. */
    public int size() {
        lock.readLock().lock();
        try {
            return posts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static boolean matches(Post post, String lowerTerm) {
        return contains(post.getTitle(), lowerTerm)
                || contains(post.getContent(), lowerTerm)
                || contains(post.getCategory(), lowerTerm);
    }

    private static boolean contains(String text, String lowerTerm) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerTerm);
    }
}
