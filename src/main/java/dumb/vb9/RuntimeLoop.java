package dumb.vb9;

import org.jetbrains.annotations.Nullable;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static dumb.vb9.Log.error;
import static dumb.vb9.Log.message;
import static dumb.vb9.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Background consumer of namespace messages. Each message is parsed and the path derived from it
 * is written to {@link #LAST_PATH}; malformed messages are logged and skipped.
 * <p>
 * The queue it drains is unbounded, so a consumer slower than its producers lets the backlog grow
 * without limit.
 */
public class RuntimeLoop {

    public static final String LAST_PATH = "/last/msg.path";
    public static final String RUNTIME = "runtime";
    public static final String RUNTIME_MSG = "runtime-msg";
    public static final String RUNTIME_ERROR = "runtime-error";

    private final Namespace ns;
    private final long pollTimeoutMillis;
    private final long stopTimeoutMillis;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile State state = State.IDLE;
    private volatile @Nullable Thread worker;

    public RuntimeLoop(Namespace ns, long pollTimeoutMillis, long stopTimeoutMillis) {
        this.ns = requireNonNull(ns);
        if (pollTimeoutMillis <= 0 || stopTimeoutMillis <= 0)
            throw new IllegalArgumentException("Timeouts must be positive");
        this.pollTimeoutMillis = pollTimeoutMillis;
        this.stopTimeoutMillis = stopTimeoutMillis;
    }

    /**
     * Starts the worker thread. Returns false, doing nothing, if a worker is already running or
     * if a timed-out {@link #stop()} left one that is still finishing its last message.
     */
    public synchronized boolean start() {
        if (worker != null && worker.isAlive()) {
            if (cancelled.get()) warning("Runtime loop is still stopping; not restarted.");
            return false;
        }
        cancelled.set(false);
        var t = new Thread(this::run, "vb9-runtime");
        t.setDaemon(true);
        worker = t;
        state = State.POLLING;
        t.start();
        return true;
    }

    /**
     * Requests cancellation and waits up to the stop timeout for the worker to exit.
     * Returns true if the worker has exited; false if it was never started or is still running.
     */
    public synchronized boolean stop() {
        var t = worker;
        if (t == null) return false;
        cancelled.set(true);
        try {
            t.join(stopTimeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error("Interrupted while waiting for runtime loop to stop.");
        }
        if (t.isAlive()) {
            error("Runtime loop did not stop within " + stopTimeoutMillis + "ms.");
            return false;
        }
        worker = null;
        return true;
    }

    public boolean isRunning() {
        var t = worker;
        return t != null && t.isAlive();
    }

    /** True while a worker that has been asked to stop has not exited yet. */
    public boolean isStopping() {
        return cancelled.get() && isRunning();
    }

    public State state() {
        return state;
    }

    private void run() {
        ns.log(RUNTIME, "start");
        message("Runtime loop started.");
        try {
            while (!cancelled.get() && ns.isOpen()) {
                String msg;
                try {
                    msg = ns.dequeue(pollTimeoutMillis, TimeUnit.MILLISECONDS).orElse(null);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (IllegalStateException closed) {
                    break;
                }
                if (msg != null) handle(msg);
            }
        } finally {
            state = State.STOPPED;
            ns.log(RUNTIME, "stop");
            message("Runtime loop stopped.");
        }
    }

    void handle(String msg) {
        try {
            var path = Canon.path(SexpParser.parse(msg));
            ns.write(LAST_PATH, path);
            ns.log(RUNTIME_MSG, path);
        } catch (SexpParser.ParseException e) {
            ns.log(RUNTIME_ERROR, e.getMessage());
        } catch (RuntimeException | StackOverflowError e) {
            if (!ns.isOpen()) return;
            error("Runtime loop failed to handle '" + abbreviate(msg) + "'", e);
            ns.log(RUNTIME_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static String abbreviate(String msg) {
        return msg.length() <= 80 ? msg : msg.substring(0, 80) + "...";
    }

    public enum State {
        IDLE, POLLING, STOPPED
    }
}
