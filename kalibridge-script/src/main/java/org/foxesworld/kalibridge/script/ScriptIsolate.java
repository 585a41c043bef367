package org.foxesworld.kalibridge.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.engine.config.BridgeConfig;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * GraalJS context confined to one dedicated thread.
 *
 * <p>The thread loops draining a {@link ScriptJobQueue}; other threads reach the context only by
 * posting jobs. {@link #call(Supplier)} blocks until the job ran and runs inline when already on
 * the isolate thread, so handlers that call back into the host and back again do not deadlock.</p>
 *
 * <p>Security: host class lookup is disabled; host access is restricted to members annotated
 * with {@link HostAccess.Export}.</p>
 */
public final class ScriptIsolate implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ScriptIsolate.class);

    public static final String LANGUAGE = "js";

    private static final HostAccess HOST_ACCESS = HostAccess.newBuilder(HostAccess.NONE)
            .allowAccessAnnotatedBy(HostAccess.Export.class)
            .build();

    private final BridgeConfig config;
    private final ScriptJobQueue jobs = new ScriptJobQueue();
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    /** Read side: check running and queue a job. Write side: stop. */
    private final ReadWriteLock lifecycle = new ReentrantReadWriteLock();

    private volatile Thread thread;
    private volatile boolean running;

    /** Isolate thread only. */
    private Context ctx;

    public ScriptIsolate(BridgeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Starts the isolate thread and waits until its context exists. */
    public synchronized ScriptIsolate start() {
        if (thread != null) throw new IllegalStateException("Isolate already started");
        Thread t = new Thread(this::loop, config.isolateThreadName());
        t.setDaemon(true);
        jobs.setOnPost(() -> LockSupport.unpark(t));
        running = true;
        thread = t;
        t.start();
        try {
            ready.join();
        } catch (CompletionException e) {
            throw new ScriptException("Isolate '" + t.getName() + "' failed to start", e.getCause());
        }
        return this;
    }

    private void loop() {
        try {
            ctx = Context.newBuilder(LANGUAGE)
                    .allowExperimentalOptions(true)
                    .option("engine.WarnInterpreterOnly", "false")
                    .allowHostAccess(HOST_ACCESS)
                    .allowHostClassLookup(className -> false)
                    .allowAllAccess(false)
                    .build();
        } catch (RuntimeException e) {
            running = false;
            ready.completeExceptionally(e);
            return;
        }
        ready.complete(null);
        log.info("Script isolate '{}' started", Thread.currentThread().getName());

        try {
            while (running) {
                int n = jobs.drainBudgeted(config.maxJobsPerDrain(), config.jobBudgetNanos());
                if (n == 0 && running && jobs.isEmpty()) {
                    LockSupport.park(this);
                }
            }
            // every job queued before close is answered here
            jobs.drain(Integer.MAX_VALUE);
        } finally {
            ctx.close();
            ctx = null;
            log.info("Script isolate '{}' stopped", Thread.currentThread().getName());
        }
    }

    public boolean isIsolateThread() {
        return Thread.currentThread() == thread;
    }

    public boolean isRunning() {
        return running;
    }

    public ScriptJobQueue jobs() {
        return jobs;
    }

    /**
     * Runs {@code work} on the isolate thread and waits for it. No timeout.
     *
     * @throws ScriptException if the isolate is not running
     */
    public <T> T call(Supplier<T> work) {
        Objects.requireNonNull(work, "work");
        if (isIsolateThread()) return work.get();
        CompletableFuture<T> result;
        lifecycle.readLock().lock();
        try {
            requireRunning();
            result = jobs.call(work);
        } finally {
            lifecycle.readLock().unlock();
        }
        try {
            return result.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new ScriptException("Isolate job failed", cause);
        }
    }

    /** Fire-and-forget. */
    public void post(Runnable work) {
        Objects.requireNonNull(work, "work");
        lifecycle.readLock().lock();
        try {
            requireRunning();
            jobs.post(work);
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    private void requireRunning() {
        if (!running) throw new ScriptException("Script isolate is not running");
    }

    /**
     * Evaluates a script in the isolate.
     *
     * @param name source name shown in stack traces
     * @return the completion value converted with {@link ScriptValues#toJava}
     */
    public Object eval(String name, String code) {
        Objects.requireNonNull(code, "code");
        return call(() -> {
            Source src = Source.newBuilder(LANGUAGE, code, name).buildLiteral();
            try {
                return ScriptValues.toJava(ctx.eval(src));
            } catch (PolyglotException e) {
                throw new ScriptException(name + ": " + e.getMessage(), e);
            }
        });
    }

    /** Binds {@code value} as a global; only its exported members are visible to scripts. */
    public void putGlobal(String name, Object value) {
        call(() -> {
            ctx.getBindings(LANGUAGE).putMember(name, value);
            return null;
        });
    }

    /** The context itself. Isolate thread only. */
    public Context context() {
        if (!isIsolateThread()) {
            throw new IllegalStateException("Script context is thread confined. Owner="
                    + (thread == null ? "none" : thread.getName()) + ", current=" + Thread.currentThread().getName());
        }
        return ctx;
    }

    @Override
    public void close() {
        Thread t = thread;
        if (t == null) return;
        lifecycle.writeLock().lock();
        try {
            if (!running) return;
            running = false;
        } finally {
            lifecycle.writeLock().unlock();
        }
        LockSupport.unpark(t);
        if (isIsolateThread()) return;
        try {
            t.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping script isolate '{}'", t.getName());
        }
    }
}
