package utilities;

/** Human-readable JOL report for a compiled automaton plus its total size in MiB. */
public record MemoryUsageReport(String report, double totalMiB) {}
