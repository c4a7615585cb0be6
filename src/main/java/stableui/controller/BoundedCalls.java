package stableui.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.driver.DriverException;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs blocking collaborator calls with a hard timeout.
 *
 * <p>A call that does not complete in time is cancelled (its worker is interrupted)
 * and reported as {@link DriverException.Kind#TIMEOUT}. Failures other than
 * {@link DriverException} are wrapped as {@link DriverException.Kind#EXECUTION}.
 */
final class BoundedCalls implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedCalls.class);

    private final ExecutorService executor;

    BoundedCalls(String surfaceId) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "stableui-" + surfaceId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newCachedThreadPool(factory);
    }

    <T> T call(String what, long timeoutMs, Callable<T> task) {
        if (timeoutMs <= 0) {
            throw new DriverException(DriverException.Kind.TIMEOUT, what + ": no time left");
        }
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("BoundedCalls: {} did not complete within {} ms, cancelled", what, timeoutMs);
            throw new DriverException(DriverException.Kind.TIMEOUT, what + " timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DriverException de) throw de;
            throw new DriverException(DriverException.Kind.EXECUTION,
                    what + " failed: " + (cause == null ? e.getMessage() : cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DriverException(DriverException.Kind.EXECUTION, what + " interrupted", e);
        }
    }

    void run(String what, long timeoutMs, Runnable task) {
        call(what, timeoutMs, () -> {
            task.run();
            return null;
        });
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
