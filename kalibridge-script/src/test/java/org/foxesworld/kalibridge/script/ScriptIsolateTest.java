package org.foxesworld.kalibridge.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.foxesworld.kalibridge.engine.config.BridgeConfig;
import org.graalvm.polyglot.HostAccess;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

final class ScriptIsolateTest {

    public static final class Greeter {
        @HostAccess.Export
        public String greet(String who) {
            return "hello " + who;
        }

        public String secret() {
            return "hidden";
        }
    }

    private final ScriptIsolate isolate =
            new ScriptIsolate(new BridgeConfig(1_000, 64, 0, 16, "test-isolate")).start();

    @AfterEach
    void stop() {
        isolate.close();
    }

    @Test
    void evaluatesOnItsOwnThread() {
        assertThat(isolate.eval("sum.js", "1 + 2")).isEqualTo(3);
        assertThat(isolate.eval("str.js", "'a' + 'b'")).isEqualTo("ab");
        assertThat(isolate.eval("undef.js", "undefined")).isNull();
        assertThat(isolate.call(() -> Thread.currentThread().getName())).isEqualTo("test-isolate");
        assertThat(isolate.isIsolateThread()).isFalse();
    }

    @Test
    void globalsPersistBetweenEvaluations() {
        isolate.eval("a.js", "var counter = 40;");
        isolate.eval("b.js", "counter += 2;");

        assertThat(isolate.eval("c.js", "counter")).isEqualTo(42);
    }

    @Test
    void nestedCallsRunInline() {
        Object v = isolate.call(() -> isolate.call(() -> isolate.eval("inner.js", "7 * 6")));

        assertThat(v).isEqualTo(42);
    }

    @Test
    void scriptErrorsSurfaceAsScriptException() {
        assertThatThrownBy(() -> isolate.eval("broken.js", "throw new Error('nope')"))
                .isInstanceOf(ScriptException.class)
                .hasMessageContaining("broken.js")
                .hasMessageContaining("nope");
        assertThat(isolate.eval("after.js", "1")).isEqualTo(1);
    }

    @Test
    void hostClassesAreNotReachable() {
        assertThatThrownBy(() -> isolate.eval("escape.js", "Java.type('java.lang.System').exit(1)"))
                .isInstanceOf(ScriptException.class);
    }

    @Test
    void contextIsConfinedToTheIsolateThread() {
        assertThatThrownBy(isolate::context).isInstanceOf(IllegalStateException.class);
        assertThat(isolate.call(() -> isolate.context() != null)).isTrue();
    }

    @Test
    void closedIsolateRefusesWork() {
        isolate.close();

        assertThat(isolate.isRunning()).isFalse();
        assertThatThrownBy(() -> isolate.eval("late.js", "1")).isInstanceOf(ScriptException.class);
        assertThatThrownBy(() -> isolate.post(() -> {})).isInstanceOf(ScriptException.class);
    }

    @Test
    void onlyExportedMembersOfGlobalsAreVisible() {
        isolate.putGlobal("g", new Greeter());

        assertThat(isolate.eval("greet.js", "g.greet('world')")).isEqualTo("hello world");
        assertThat(isolate.eval("peek.js", "typeof g.secret")).isEqualTo("undefined");
        assertThatThrownBy(() -> isolate.eval("secret.js", "g.secret()")).isInstanceOf(ScriptException.class);
    }

    @Test
    void closeLeavesNoCallerWaiting() throws InterruptedException {
        int callers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch started = new CountDownLatch(callers);
        AtomicInteger answered = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();
        for (int i = 0; i < callers; i++) {
            pool.execute(() -> {
                started.countDown();
                while (true) {
                    try {
                        isolate.call(() -> 1);
                        answered.incrementAndGet();
                    } catch (ScriptException e) {
                        refused.incrementAndGet();
                        return;
                    }
                }
            });
        }
        started.await();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (answered.get() < 200 && System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }

        isolate.close();
        pool.shutdown();

        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(refused).hasValue(callers);
        assertThat(answered.get()).isPositive();
    }
}
