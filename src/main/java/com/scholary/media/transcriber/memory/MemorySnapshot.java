package com.scholary.media.transcriber.memory;

/**
 * Point-in-time view of system and process memory.
 *
 * @param systemTotalGb physical memory of the host
 * @param systemAvailableGb memory available to new work without swapping
 * @param systemUsedPercent share of physical memory in use, 0 to 100
 * @param processUsedMb heap currently used by this JVM
 * @param cpuCount processors available to the JVM
 */
public record MemorySnapshot(
    double systemTotalGb,
    double systemAvailableGb,
    double systemUsedPercent,
    double processUsedMb,
    int cpuCount) {}
