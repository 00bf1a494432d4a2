package com.scholary.media.transcriber.memory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads memory figures from the host.
 *
 * <p>On Linux {@code MemAvailable} from /proc/meminfo is used, since it accounts for reclaimable
 * page cache. Elsewhere the JVM's operating system bean supplies free physical memory. When neither
 * is readable a conservative 8 GB total / 4 GB available is assumed.
 */
@Component
public class SystemMemoryTelemetry implements MemoryTelemetry {

  private static final Logger LOGGER = LoggerFactory.getLogger(SystemMemoryTelemetry.class);

  private static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;
  private static final double FALLBACK_TOTAL_GB = 8.0;
  private static final double FALLBACK_AVAILABLE_GB = 4.0;

  private final Path meminfo;

  public SystemMemoryTelemetry() {
    this(Paths.get("/proc/meminfo"));
  }

  SystemMemoryTelemetry(Path meminfo) {
    this.meminfo = meminfo;
  }

  @Override
  public MemorySnapshot snapshot() {
    double totalGb;
    double availableGb;

    List<String> lines = readMeminfo();
    OptionalLong totalKb = meminfoValue(lines, "MemTotal");
    OptionalLong availableKb = meminfoValue(lines, "MemAvailable");

    if (totalKb.isPresent() && availableKb.isPresent()) {
      totalGb = totalKb.getAsLong() * 1024 / BYTES_PER_GB;
      availableGb = availableKb.getAsLong() * 1024 / BYTES_PER_GB;
    } else {
      double[] fromBean = readOperatingSystemBean();
      totalGb = fromBean[0];
      availableGb = fromBean[1];
    }

    double usedPercent = totalGb > 0 ? (totalGb - availableGb) / totalGb * 100.0 : 0.0;

    Runtime runtime = Runtime.getRuntime();
    double processUsedMb = (runtime.totalMemory() - runtime.freeMemory()) / (1024.0 * 1024.0);

    return new MemorySnapshot(
        totalGb, availableGb, usedPercent, processUsedMb, runtime.availableProcessors());
  }

  private List<String> readMeminfo() {
    if (!Files.isReadable(meminfo)) {
      return List.of();
    }
    try {
      return Files.readAllLines(meminfo);
    } catch (IOException e) {
      LOGGER.debug("Could not read {}: {}", meminfo, e.getMessage());
      return List.of();
    }
  }

  /** Value in kB of a /proc/meminfo line such as {@code MemAvailable:   8123456 kB}. */
  static OptionalLong meminfoValue(List<String> lines, String key) {
    for (String line : lines) {
      if (line.startsWith(key + ":")) {
        String[] parts = line.substring(key.length() + 1).trim().split("\\s+");
        try {
          return OptionalLong.of(Long.parseLong(parts[0]));
        } catch (NumberFormatException e) {
          LOGGER.debug("Unparseable meminfo line: {}", line);
          return OptionalLong.empty();
        }
      }
    }
    return OptionalLong.empty();
  }

  private static double[] readOperatingSystemBean() {
    OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
    if (bean instanceof com.sun.management.OperatingSystemMXBean os) {
      double total = os.getTotalMemorySize() / BYTES_PER_GB;
      double free = os.getFreeMemorySize() / BYTES_PER_GB;
      if (total > 0) {
        return new double[] {total, free};
      }
    }
    LOGGER.warn(
        "Memory telemetry unavailable, assuming {} GB total / {} GB available",
        FALLBACK_TOTAL_GB,
        FALLBACK_AVAILABLE_GB);
    return new double[] {FALLBACK_TOTAL_GB, FALLBACK_AVAILABLE_GB};
  }
}
