package com.autopilot.runtime.watchdog;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads process resource usage for the watchdog.
 */
@FunctionalInterface
public interface ResourceSampler {

    /**
     * @param cpuPercent process CPU load in percent, NaN when the platform does not report it
     */
    record Usage(double heapMb, double cpuPercent) {}

    Usage sample();

    static ResourceSampler jvm() {
        return () -> {
            Runtime rt = Runtime.getRuntime();
            double usedMb = (rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0);
            double cpu = Double.NaN;
            OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
            if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
                double load = sun.getProcessCpuLoad();
                if (load >= 0) {
                    cpu = load * 100.0;
                }
            }
            return new Usage(usedMb, cpu);
        };
    }
}
