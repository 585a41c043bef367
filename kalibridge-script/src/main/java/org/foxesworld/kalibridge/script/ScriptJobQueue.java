package org.foxesworld.kalibridge.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Any thread → isolate thread job hand-off.
 *
 * <ul>
 *   <li>{@link #post(Runnable)}: fire-and-forget</li>
 *   <li>{@link #call(Supplier)}: result through a {@link CompletableFuture}</li>
 *   <li>{@link #drainBudgeted(int, long)}: isolate thread only</li>
 * </ul>
 */
public final class ScriptJobQueue {
    private static final Logger log = LogManager.getLogger(ScriptJobQueue.class);

    private final AtomicLong ids = new AtomicLong(1);
    private final Queue<Job> q = new ConcurrentLinkedQueue<>();
    private volatile Runnable onPost;

    private record Job(long id, Runnable run) {}

    public void post(Runnable run) {
        Objects.requireNonNull(run, "run");
        q.add(new Job(ids.getAndIncrement(), run));
        Runnable wake = onPost;
        if (wake != null) wake.run();
    }

    /** Runs {@code supplier} on the draining thread; failures complete the future exceptionally. */
    public <T> CompletableFuture<T> call(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        CompletableFuture<T> f = new CompletableFuture<>();
        post(() -> {
            try {
                f.complete(supplier.get());
            } catch (Throwable t) {
                f.completeExceptionally(t);
            }
        });
        return f;
    }

    /** Called after every {@link #post}, on the posting thread. */
    public ScriptJobQueue setOnPost(Runnable onPost) {
        this.onPost = onPost;
        return this;
    }

    public int drain(int maxJobs) {
        return drainBudgeted(maxJobs, 0L);
    }

    /**
     * @param maxJobs         cap on jobs run by this call
     * @param timeBudgetNanos 0 for no budget; otherwise stop once it is spent (checked every 64 jobs)
     * @return jobs run
     */
    public int drainBudgeted(int maxJobs, long timeBudgetNanos) {
        int limit = Math.max(0, maxJobs);
        long deadline = timeBudgetNanos > 0L ? System.nanoTime() + timeBudgetNanos : Long.MAX_VALUE;

        int n = 0;
        while (n < limit) {
            Job j = q.poll();
            if (j == null) break;
            try {
                j.run().run();
            } catch (Throwable t) {
                report(j, t);
            }
            n++;
            if ((n & 0x3F) == 0 && System.nanoTime() >= deadline) break;
        }
        return n;
    }

    private static void report(Job j, Throwable t) {
        log.error("Script job #{} failed", j.id(), t);
    }

    public void clear() {
        q.clear();
    }

    public boolean isEmpty() {
        return q.isEmpty();
    }

    public int size() {
        return q.size();
    }
}
