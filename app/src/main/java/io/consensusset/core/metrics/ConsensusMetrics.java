package io.consensusset.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class ConsensusMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksAccepted = registry.counter("consensus.blocks.accepted");
    private static final Counter reorgs = registry.counter("consensus.reorgs");
    private static final Counter faults = registry.counter("consensus.faults");
    private static final Counter diffsCommitted = registry.counter("consensus.diffs.committed");
    private static final Timer acceptTime = registry.timer("consensus.accept.time");
    private static final DistributionSummary reorgDepth = DistributionSummary.builder("consensus.reorg.depth")
            .baseUnit("blocks")
            .description("Blocks reverted per reorganization")
            .register(registry);

    private ConsensusMetrics() {}

    public static void recordAccept(long nanos) {
        acceptTime.record(nanos, TimeUnit.NANOSECONDS);
    }

    public static void blockAccepted(int diffCount) {
        blocksAccepted.increment();
        diffsCommitted.increment(diffCount);
    }

    public static void blockRejected(String reason) {
        registry.counter("consensus.blocks.rejected", "reason", reason).increment();
    }

    public static void reorg(int depth) {
        reorgs.increment();
        reorgDepth.record(depth);
    }

    public static void fault() {
        faults.increment();
    }

    public static double count(String name, String... tags) {
        Counter c = registry.find(name).tags(tags).counter();
        return c == null ? 0.0 : c.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
