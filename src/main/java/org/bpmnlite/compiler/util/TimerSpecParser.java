package org.bpmnlite.compiler.util;

import org.bpmnlite.compiler.bpmn.models.TimerKind;
import org.bpmnlite.compiler.bpmn.models.TimerSpec;
import org.bpmnlite.compiler.errors.BpmnCompileException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the text of {@code timeDuration}, {@code timeDate} and {@code timeCycle} elements.
 * Only the subset of ISO-8601 the runtime understands is accepted.
 */
public class TimerSpecParser {

    private static final long MS_PER_SECOND = 1_000L;
    private static final long MS_PER_MINUTE = 60 * MS_PER_SECOND;
    private static final long MS_PER_HOUR = 60 * MS_PER_MINUTE;
    private static final long MS_PER_DAY = 24 * MS_PER_HOUR;

    // P[nD][T[nH][nM][nS]]
    private static final Pattern DURATION_PATTERN =
            Pattern.compile("^P(?:(\\d+)D)?(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+)S)?)?$");
    private static final Pattern UNSIGNED_PATTERN = Pattern.compile("^\\d+$");

    /**
     * Dispatches on the timer child element the text came from.
     *
     * @throws BpmnCompileException with kind TIMER_SPEC_ERROR if kind or text is missing or malformed
     */
    public static TimerSpec parse(TimerKind kind, String text) {
        if (text == null || text.isBlank()) {
            throw BpmnCompileException.timerSpec("timer element has no duration/date/cycle text");
        }
        if (kind == null) {
            throw BpmnCompileException.timerSpec("timer has no kind (timeDuration, timeDate or timeCycle)");
        }

        String trimmed = text.trim();
        return switch (kind) {
            case DURATION -> new TimerSpec.Duration(parseDuration(trimmed));
            case DATE -> new TimerSpec.Date(parseDate(trimmed));
            case CYCLE -> parseCycle(trimmed);
        };
    }

    /**
     * Parses {@code P[nD][T[nH][nM][nS]]} into milliseconds, e.g. PT1H30M gives 5_400_000.
     * Text without a leading P is read as a bare millisecond count.
     * A duration adding up to zero is rejected.
     */
    public static long parseDuration(String text) {
        String s = text == null ? "" : text.trim();

        long total;
        if (!s.startsWith("P")) {
            total = parseUnsigned(s, "duration");
        } else {
            Matcher matcher = DURATION_PATTERN.matcher(s);
            if (!matcher.matches()) {
                throw BpmnCompileException.timerSpec("cannot parse duration '" + s
                        + "' (supported form: P[nD][T[nH][nM][nS]])");
            }
            try {
                total = 0;
                total = Math.addExact(total, component(matcher.group(1), MS_PER_DAY));
                total = Math.addExact(total, component(matcher.group(2), MS_PER_HOUR));
                total = Math.addExact(total, component(matcher.group(3), MS_PER_MINUTE));
                total = Math.addExact(total, component(matcher.group(4), MS_PER_SECOND));
            } catch (ArithmeticException | NumberFormatException e) {
                throw BpmnCompileException.timerSpec("duration '" + s + "' is out of range");
            }
        }

        if (total == 0) {
            throw BpmnCompileException.timerSpec("duration '" + s + "' parsed to 0ms");
        }
        return total;
    }

    /**
     * Parses {@code R<count>/<duration>}, e.g. R3/PT1H fires every hour, three times.
     */
    public static TimerSpec.Cycle parseCycle(String text) {
        String s = text == null ? "" : text.trim();
        if (!s.startsWith("R")) {
            throw BpmnCompileException.timerSpec("cycle must start with 'R<count>/', got '" + s + "'");
        }

        String rest = s.substring(1);
        int slash = rest.indexOf('/');
        if (slash < 0) {
            throw BpmnCompileException.timerSpec("cycle is missing the '/' separator: '" + s + "'");
        }

        String countText = rest.substring(0, slash);
        if (!UNSIGNED_PATTERN.matcher(countText).matches()) {
            throw BpmnCompileException.timerSpec("cannot parse cycle count '" + countText + "' in '" + s + "'");
        }
        int maxFires;
        try {
            maxFires = Integer.parseInt(countText);
        } catch (NumberFormatException e) {
            throw BpmnCompileException.timerSpec("cycle count '" + countText + "' is out of range");
        }
        if (maxFires < 1) {
            throw BpmnCompileException.timerSpec("cycle count must be >= 1: '" + s + "'");
        }

        long intervalMs = parseDuration(rest.substring(slash + 1));
        return new TimerSpec.Cycle(intervalMs, maxFires);
    }

    /**
     * A timer date is an unsigned epoch-milliseconds value; calendar notation is not supported.
     */
    public static long parseDate(String text) {
        return parseUnsigned(text == null ? "" : text.trim(), "timer date");
    }

    private static long component(String digits, long unitMs) {
        if (digits == null) {
            return 0;
        }
        return Math.multiplyExact(Long.parseLong(digits), unitMs);
    }

    private static long parseUnsigned(String s, String what) {
        if (!UNSIGNED_PATTERN.matcher(s).matches()) {
            throw BpmnCompileException.timerSpec("cannot parse " + what + " '" + s + "'");
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw BpmnCompileException.timerSpec(what + " '" + s + "' is out of range");
        }
    }
}
