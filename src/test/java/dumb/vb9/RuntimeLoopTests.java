package dumb.vb9;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeLoopTests {

    private Namespace ns;
    private RuntimeLoop loop;

    @BeforeEach
    void setUp() {
        ns = new Namespace();
        loop = new RuntimeLoop(ns, 20, 1000);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
        ns.close();
    }

    private Optional<Object> lastPath() {
        return ns.read(RuntimeLoop.LAST_PATH);
    }

    @Test
    void derivesPathFromMessage() {
        loop.start();
        ns.enqueue("(button ok click)");
        Waits.until(() -> lastPath().isPresent(), "last path");
        assertEquals(Optional.of("/button/ok/click"), lastPath());
        assertEquals(List.of("/button/ok/click"),
                ns.events(RuntimeLoop.RUNTIME_MSG).stream().map(Namespace.Event::detail).toList());
    }

    @Test
    void atomMessageMapsToRootRelativePath() {
        loop.handle("ping");
        assertEquals(Optional.of("/ping"), lastPath());
        loop.handle("()");
        assertEquals(Optional.of("/"), lastPath());
    }

    @Test
    void malformedMessageIsLoggedAndSkipped() {
        loop.start();
        ns.enqueue("(unclosed");
        ns.enqueue(")");
        ns.enqueue("(textbox name focus)");
        Waits.until(() -> lastPath().isPresent(), "last path");

        assertEquals(Optional.of("/textbox/name/focus"), lastPath());
        assertEquals(2, ns.events(RuntimeLoop.RUNTIME_ERROR).size());
        assertTrue(loop.isRunning());
    }

    @Test
    void deeplyNestedMessageDoesNotKillTheLoop() {
        loop.start();
        ns.enqueue("(".repeat(200_000));
        ns.enqueue("(after ok)");
        Waits.until(() -> lastPath().isPresent(), "last path");

        assertEquals(Optional.of("/after/ok"), lastPath());
        var errors = ns.events(RuntimeLoop.RUNTIME_ERROR);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).detail().startsWith("Nesting too deep"), errors.get(0).detail());
        assertTrue(loop.isRunning());
    }

    @Test
    void messagesAreProcessedInOrder() {
        loop.start();
        ns.enqueue("(m 1)");
        ns.enqueue("(m 2)");
        ns.enqueue("(m 3)");
        Waits.until(() -> ns.events(RuntimeLoop.RUNTIME_MSG).size() == 3, "three messages");

        assertEquals(List.of("/m/1", "/m/2", "/m/3"),
                ns.events(RuntimeLoop.RUNTIME_MSG).stream().map(Namespace.Event::detail).toList());
        assertEquals(Optional.of("/m/3"), lastPath());
    }

    @Test
    void startIsIdempotent() {
        assertEquals(RuntimeLoop.State.IDLE, loop.state());
        assertTrue(loop.start());
        assertFalse(loop.start());
        assertEquals(RuntimeLoop.State.POLLING, loop.state());
        Waits.until(() -> !ns.events(RuntimeLoop.RUNTIME).isEmpty(), "start event");
        assertEquals(1, ns.events(RuntimeLoop.RUNTIME).size());
    }

    @Test
    void stopWithoutStartDoesNothing() {
        assertFalse(loop.stop());
        assertEquals(RuntimeLoop.State.IDLE, loop.state());
    }

    @Test
    void stopEndsTheWorker() {
        loop.start();
        assertTrue(loop.stop());
        assertFalse(loop.isRunning());
        assertEquals(RuntimeLoop.State.STOPPED, loop.state());
        assertEquals(List.of("start", "stop"),
                ns.events(RuntimeLoop.RUNTIME).stream().map(Namespace.Event::detail).toList());
    }

    @Test
    void canRestartAfterStop() {
        loop.start();
        loop.stop();
        assertTrue(loop.start());
        ns.enqueue("(again)");
        Waits.until(() -> lastPath().isPresent(), "last path");
        assertEquals(Optional.of("/again"), lastPath());
    }

    @Test
    void startDuringSlowStopReportsStopping() throws InterruptedException {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var slow = new RuntimeLoop(ns, 20, 50) {
            @Override
            void handle(String msg) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        try {
            slow.start();
            ns.enqueue("(busy)");
            assertTrue(entered.await(3, TimeUnit.SECONDS));

            assertFalse(slow.stop());
            assertTrue(slow.isStopping());
            assertFalse(slow.start());

            release.countDown();
            Waits.until(() -> !slow.isRunning(), "worker exit");
            assertFalse(slow.isStopping());
            assertTrue(slow.start());
        } finally {
            release.countDown();
            slow.stop();
        }
    }

    @Test
    void timeoutsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RuntimeLoop(ns, 0, 1000));
        assertThrows(IllegalArgumentException.class, () -> new RuntimeLoop(ns, 10, -1));
    }
}
