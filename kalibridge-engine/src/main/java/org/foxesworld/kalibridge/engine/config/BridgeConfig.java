package org.foxesworld.kalibridge.engine.config;

/**
 * Runtime knobs, read from JVM system properties.
 *
 * <pre>
 *   -Dkalibridge.registration.awaitMillis=5000
 *   -Dkalibridge.jobs.maxPerDrain=4096
 *   -Dkalibridge.jobs.budgetNanos=2000000
 *   -Dkalibridge.behaviors.cacheSize=256
 *   -Dkalibridge.isolate.threadName=kalibridge-isolate
 * </pre>
 */
public record BridgeConfig(long registrationAwaitMillis,
                           int maxJobsPerDrain,
                           long jobBudgetNanos,
                           int behaviorCacheSize,
                           String isolateThreadName) {

    public static final String AWAIT_MILLIS_PROP = "kalibridge.registration.awaitMillis";
    public static final String MAX_JOBS_PROP = "kalibridge.jobs.maxPerDrain";
    public static final String BUDGET_NANOS_PROP = "kalibridge.jobs.budgetNanos";
    public static final String CACHE_SIZE_PROP = "kalibridge.behaviors.cacheSize";
    public static final String THREAD_NAME_PROP = "kalibridge.isolate.threadName";

    public BridgeConfig {
        if (registrationAwaitMillis < 0) throw new IllegalArgumentException("registrationAwaitMillis < 0");
        if (maxJobsPerDrain <= 0) throw new IllegalArgumentException("maxJobsPerDrain <= 0");
        if (jobBudgetNanos < 0) throw new IllegalArgumentException("jobBudgetNanos < 0");
        if (behaviorCacheSize < 0) throw new IllegalArgumentException("behaviorCacheSize < 0");
        if (isolateThreadName == null || isolateThreadName.isBlank()) isolateThreadName = "kalibridge-isolate";
    }

    public static BridgeConfig defaults() {
        return new BridgeConfig(5_000L, 4_096, 2_000_000L, 256, "kalibridge-isolate");
    }

    public static BridgeConfig fromSystemProperties() {
        BridgeConfig d = defaults();
        return new BridgeConfig(
                Long.getLong(AWAIT_MILLIS_PROP, d.registrationAwaitMillis()),
                Integer.getInteger(MAX_JOBS_PROP, d.maxJobsPerDrain()),
                Long.getLong(BUDGET_NANOS_PROP, d.jobBudgetNanos()),
                Integer.getInteger(CACHE_SIZE_PROP, d.behaviorCacheSize()),
                System.getProperty(THREAD_NAME_PROP, d.isolateThreadName()));
    }
}
