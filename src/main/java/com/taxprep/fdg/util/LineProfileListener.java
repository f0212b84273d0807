package com.taxprep.fdg.util;

import com.taxprep.fdg.api.EvaluationListener;
import com.taxprep.fdg.api.FormTag;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Aggregates evaluation statistics per form line to find slow lines. */
public class LineProfileListener implements EvaluationListener {

    public static class LineStats {
        public final String name;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;

        public LineStats(String name) {
            this.name = name;
        }

        synchronized void update(long duration) {
            count++;
            totalDurationNanos += duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        synchronized void error() {
            errors++;
        }

        public synchronized double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    // Keyed by "tag.line"; copies of a form share one entry
    private final Map<String, LineStats> stats = new ConcurrentHashMap<>();

    @Override
    public void onLineEvaluated(FormTag tag, int copyIndex, String line, Object value, long durationNanos) {
        stats.computeIfAbsent(key(tag, line), LineStats::new).update(durationNanos);
    }

    @Override
    public void onLineError(FormTag tag, int copyIndex, String line, Throwable error) {
        stats.computeIfAbsent(key(tag, line), LineStats::new).error();
    }

    /** Stats for one line, or null if it was never evaluated. */
    public LineStats stats(FormTag tag, String line) {
        return stats.get(key(tag, line));
    }

    public int lineCount() {
        return stats.size();
    }

    public void reset() {
        stats.clear();
    }

    /** Formatted table, slowest lines by total time first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-36s | %8s | %6s | %10s | %10s | %10s%n", "Line", "Count", "Errors",
                "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("-".repeat(96)).append('\n');

        stats.values().stream()
                .filter(s -> s.count > 0)
                .sorted((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos))
                .forEach(s -> sb.append(String.format("%-36s | %8d | %6d | %10.2f | %10.2f | %10.2f%n",
                        truncate(s.name, 36),
                        s.count,
                        s.errors,
                        s.avgMicros(),
                        s.minDurationNanos / 1000.0,
                        s.maxDurationNanos / 1000.0)));
        return sb.toString();
    }

    private static String key(FormTag tag, String line) {
        return tag.id() + "." + line;
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
