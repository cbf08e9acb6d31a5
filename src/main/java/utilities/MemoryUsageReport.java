package utilities;

/** Human-readable JOL footprint of a suffix tree together with its total size in MiB. */
public record MemoryUsageReport(String report, double totalMiB) {}
