package com.questrail.plc.ast;

/**
 * A CASE label: a single value ({@code start == end}) or an inclusive range
 * {@code start..end}. Ranges may be written descending.
 */
public record CaseLabel(long start, long end, boolean range)
{
    public static CaseLabel single(long value) {
        return new CaseLabel(value, value, false);
    }

    public static CaseLabel range(long start, long end) {
        return new CaseLabel(start, end, true);
    }

    public boolean isDescending() {
        return range && start > end;
    }

    public boolean matches(double value) {
        long min = Math.min(start, end);
        long max = Math.max(start, end);
        return value >= min && value <= max;
    }
}
