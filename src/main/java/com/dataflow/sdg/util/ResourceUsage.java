package com.dataflow.sdg.util;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.lang.management.OperatingSystemMXBean;
import java.util.concurrent.TimeUnit;

import lombok.extern.log4j.Log4j2;

/**
 * Measures wall time and process CPU time between construction and
 * {@link #close()}, and reports them together with the peak heap usage.
 *
 * <pre>
 * try (ResourceUsage usage = new ResourceUsage()) {
 *     // work
 * }
 * </pre>
 */
@Log4j2
public final class ResourceUsage implements AutoCloseable {
    private final com.sun.management.OperatingSystemMXBean osBean;
    private final long beginWall;
    private final long beginCpu;
    private long elapsedNanos = -1;

    public ResourceUsage() {
        OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        this.osBean = bean instanceof com.sun.management.OperatingSystemMXBean sun ? sun : null;
        this.beginCpu = processCpuNanos();
        this.beginWall = System.nanoTime();
    }

    /** Wall time so far, or the final wall time once closed. */
    public long wallNanos() {
        return elapsedNanos >= 0 ? elapsedNanos : System.nanoTime() - beginWall;
    }

    /** Process CPU time so far; -1 if the platform does not report it. */
    public long cpuNanos() {
        long now = processCpuNanos();
        return now < 0 || beginCpu < 0 ? -1 : now - beginCpu;
    }

    private long processCpuNanos() {
        return osBean == null ? -1 : osBean.getProcessCpuTime();
    }

    /** Largest heap usage seen by any heap pool since the JVM started. */
    public static long peakHeapBytes() {
        long peak = 0;
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.getType() == MemoryType.HEAP && pool.getPeakUsage() != null)
                peak += pool.getPeakUsage().getUsed();
        }
        return peak;
    }

    @Override
    public void close() {
        if (elapsedNanos >= 0)
            return;
        elapsedNanos = System.nanoTime() - beginWall;
        long cpu = cpuNanos();
        double wallSec = elapsedNanos / 1e9;
        if (cpu >= 0) {
            log.info(String.format("Real time: %.3fs  CPU time: %.3fs  CPU efficiency: %.1f%%  Peak heap: %d MB",
                    wallSec, cpu / 1e9, wallSec > 0 ? 100.0 * cpu / elapsedNanos : 0.0,
                    peakHeapBytes() / (1024 * 1024)));
        } else {
            log.info(String.format("Real time: %.3fs  Peak heap: %d MB", wallSec, peakHeapBytes() / (1024 * 1024)));
        }
        if (log.isDebugEnabled())
            log.debug("Elapsed {} ms", TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
    }
}
