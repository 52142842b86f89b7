package at.sv.boost;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a requested boost duration. Accepted are {@code HH:MM:SS} strings, maps with any of the keys
 * {@code days, hours, minutes, seconds, milliseconds}, and plain numbers interpreted as hours.
 */
public final class DurationParser {

    private static final Pattern HH_MM_SS = Pattern.compile("^(\\d+):(\\d{1,2}):(\\d{1,2})$");

    private DurationParser() {
    }

    /**
     * @param value the raw duration, null if none was requested
     * @return the parsed duration, or null if no value was given
     * @throws BoostValidationException if the value is malformed, out of range, zero or negative
     */
    public static Duration parse(Object value) {
        if (value == null) {
            return null;
        }
        Duration duration;
        try {
            duration = toDuration(value);
        } catch (ArithmeticException | NumberFormatException e) {
            throw new BoostValidationException("time '" + value + "' is out of range.");
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new BoostValidationException("time cannot be 00:00:00.");
        }
        return duration;
    }

    private static Duration toDuration(Object value) {
        if (value instanceof Number hours) {
            return ofHours(hours.doubleValue());
        }
        if (value instanceof Map<?, ?> map) {
            return Duration.ofDays(getLong(map, "days"))
                           .plusHours(getLong(map, "hours"))
                           .plusMinutes(getLong(map, "minutes"))
                           .plusSeconds(getLong(map, "seconds"))
                           .plusMillis(getLong(map, "milliseconds"));
        }
        if (value instanceof String s) {
            return parseTime(s.trim());
        }
        throw new BoostValidationException("time must be a duration value.");
    }

    public static Duration ofHours(double hours) {
        if (!Double.isFinite(hours)) {
            throw new BoostValidationException("Invalid duration '" + hours + "'.");
        }
        return Duration.ofMillis(Math.round(hours * 3_600_000));
    }

    private static Duration parseTime(String s) {
        Matcher matcher = HH_MM_SS.matcher(s);
        if (!matcher.matches()) {
            throw new BoostValidationException("time must be in HH:MM:SS format.");
        }
        int minutes = Integer.parseInt(matcher.group(2));
        int seconds = Integer.parseInt(matcher.group(3));
        if (minutes > 59 || seconds > 59) {
            throw new BoostValidationException("time must be in HH:MM:SS format.");
        }
        return Duration.ofHours(Long.parseLong(matcher.group(1))).plusMinutes(minutes).plusSeconds(seconds);
    }

    private static long getLong(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new BoostValidationException("Invalid value for '" + key + "': '" + value + "'.");
        }
    }
}
