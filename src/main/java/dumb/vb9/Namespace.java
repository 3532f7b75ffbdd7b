package dumb.vb9;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * In-process, path-keyed store with a FIFO message channel and an append-only event log.
 * <p>
 * Every store operation is one critical section on a single lock; nothing spans two calls, so
 * check-then-write sequences are not atomic against other writers. The message queue is
 * unbounded and synchronized independently of the store.
 */
public class Namespace implements AutoCloseable {

    private final Map<String, Object> entries = new HashMap<>();
    private final Map<String, String> mounts = new HashMap<>();
    private final Object lock = new Object();
    private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
    private final List<Event> events = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    /**
     * Forces a leading slash, collapses repeated slashes, and drops a trailing slash except on the root.
     */
    public static String normalize(String path) {
        requireNonNull(path);
        var p = path.startsWith("/") ? path : "/" + path;
        p = p.replaceAll("/{2,}", "/");
        if (p.length() > 1 && p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }

    public void write(String path, Object value) {
        requireNonNull(value);
        var p = normalize(path);
        synchronized (lock) {
            ensureOpen();
            entries.put(p, value);
        }
    }

    public Optional<Object> read(String path) {
        var p = normalize(path);
        synchronized (lock) {
            ensureOpen();
            return Optional.ofNullable(entries.get(p));
        }
    }

    /** Reads a value only if it is an instance of {@code type}. */
    public <T> Optional<T> read(String path, Class<T> type) {
        return read(path).filter(type::isInstance).map(type::cast);
    }

    public boolean exists(String path) {
        var p = normalize(path);
        synchronized (lock) {
            ensureOpen();
            return entries.containsKey(p);
        }
    }

    /**
     * Records that {@code mountPoint} overlays {@code src}. Bookkeeping only: reads and writes
     * are never redirected through mounts.
     */
    public void mount(String src, String mountPoint) {
        var s = normalize(src);
        var m = normalize(mountPoint);
        synchronized (lock) {
            ensureOpen();
            mounts.put(m, s);
        }
    }

    public Map<String, String> mounts() {
        synchronized (lock) {
            return Map.copyOf(mounts);
        }
    }

    public void enqueue(String message) {
        requireNonNull(message);
        ensureOpen();
        messages.add(message);
    }

    /**
     * Takes the oldest message, waiting up to {@code timeout}; empty when none arrives in time.
     */
    public Optional<String> dequeue(long timeout, TimeUnit unit) throws InterruptedException {
        ensureOpen();
        return Optional.ofNullable(messages.poll(timeout, unit));
    }

    public int pending() {
        return messages.size();
    }

    public void log(String kind, String detail) {
        events.add(new Event(kind, detail));
    }

    /** Snapshot of the event log in append order. */
    public List<Event> events() {
        return List.copyOf(events);
    }

    public List<Event> events(String kind) {
        return events.stream().filter(e -> e.kind().equals(kind)).toList();
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        synchronized (lock) {
            open = false;
            entries.clear();
            mounts.clear();
        }
        messages.clear();
    }

    private void ensureOpen() {
        if (!open) throw new IllegalStateException("Namespace is closed");
    }

    public record Event(String kind, @Nullable String detail) {
        public Event {
            requireNonNull(kind);
        }
    }
}
