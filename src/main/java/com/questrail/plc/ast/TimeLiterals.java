package com.questrail.plc.ast;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TimeLiterals
 * -----------------------------------------------------------------------------
 * Converts IEC 61131-3 duration literals to milliseconds.
 *
 * <h2>Accepted forms</h2>
 * <ul>
 *   <li>{@code T#500ms}, {@code TIME#5s}, {@code t#1.5s}</li>
 *   <li>compound forms {@code T#1h30m}, {@code T#1d2h3m4s5ms}, with optional
 *       {@code _} separators</li>
 *   <li>a bare number, taken as milliseconds</li>
 * </ul>
 *
 * Text that matches none of these yields {@code 0}; a malformed literal is a
 * parser concern and never an interpreter failure.
 */
public final class TimeLiterals
{
    private static final Pattern PREFIX = Pattern.compile("^(?i)(T|TIME)#");
    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|d|h|m|s)");

    private TimeLiterals() {
    }

    public static long parseMillis(String text) {
        Objects.requireNonNull(text, "text");
        String body = PREFIX.matcher(text.trim()).replaceFirst("")
                .replace("_", "")
                .toLowerCase(Locale.ROOT);

        boolean negative = body.startsWith("-");
        if (negative) {
            body = body.substring(1);
        }
        if (body.isEmpty()) {
            return 0;
        }

        double total = 0;
        int consumed = 0;
        Matcher m = COMPONENT.matcher(body);
        while (m.find()) {
            if (m.start() != consumed) {
                return fallback(body, negative);
            }
            total += Double.parseDouble(m.group(1)) * unitMillis(m.group(2));
            consumed = m.end();
        }
        if (consumed != body.length()) {
            return fallback(body, negative);
        }

        long millis = (long) total;
        return negative ? -millis : millis;
    }

    private static long fallback(String body, boolean negative) {
        try {
            long millis = (long) Double.parseDouble(body);
            return negative ? -millis : millis;
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static double unitMillis(String unit) {
        return switch (unit) {
            case "d" -> 24d * 60 * 60 * 1000;
            case "h" -> 60d * 60 * 1000;
            case "m" -> 60d * 1000;
            case "s" -> 1000d;
            default -> 1d;
        };
    }
}
