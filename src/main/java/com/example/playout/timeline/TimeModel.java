package com.example.playout.timeline;

import com.example.playout.exception.MalformedTimeException;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion between template time strings and timeline offsets in seconds.
 * <p>
 * Daily strings are {@code HH:MM:SS[.mmm]} or {@code h:mm[:ss][.mmm] am|pm}. Weekly strings
 * require a {@code sun..sat} prefix, monthly strings accept an optional {@code day N} prefix.
 */
public final class TimeModel {

    public static final double SECONDS_PER_DAY = 86_400d;
    public static final double DEFAULT_FRAME_RATE = 29.976d;
    /** Offsets closer than this are the same instant. */
    public static final double TOLERANCE_SECONDS = 0.001d;

    private static final long MILLIS_PER_DAY = 86_400_000L;

    private static final Pattern CLOCK = Pattern.compile(
            "^(\\d{1,2}):(\\d{1,2})(?::(\\d{1,2})(?:\\.(\\d{1,9}))?)?\\s*(am|pm)?$");
    private static final Pattern WEEKLY_PREFIX = Pattern.compile("^([a-z]+)\\s+(.+)$");
    private static final Pattern MONTHLY_PREFIX = Pattern.compile("^day\\s+(\\d{1,2})\\s+(.+)$");
    private static final Pattern MERIDIEM = Pattern.compile("\\b(am|pm)\\b", Pattern.CASE_INSENSITIVE);

    private static final String[] DAY_NAMES = {"sun", "mon", "tue", "wed", "thu", "fri", "sat"};
    private static final Map<String, Integer> DAY_INDEX = Map.of(
            "sun", 0, "mon", 1, "tue", 2, "wed", 3, "thu", 4, "fri", 5, "sat", 6);

    private TimeModel() {
    }

    public static double toOffset(String time, Topology topology) {
        if (time == null || time.isBlank()) {
            throw new MalformedTimeException(String.valueOf(time), "empty time");
        }
        String normalized = time.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        switch (topology) {
            case WEEKLY: {
                Matcher m = WEEKLY_PREFIX.matcher(normalized);
                if (!m.matches()) {
                    throw new MalformedTimeException(time, "weekly time needs a day prefix (sun..sat)");
                }
                Integer day = DAY_INDEX.get(m.group(1));
                if (day == null) {
                    throw new MalformedTimeException(time, "unknown day prefix '" + m.group(1) + "'");
                }
                return day * SECONDS_PER_DAY + timeOfDay(m.group(2), time);
            }
            case MONTHLY: {
                Matcher m = MONTHLY_PREFIX.matcher(normalized);
                if (!m.matches()) {
                    return timeOfDay(normalized, time);
                }
                int day = Integer.parseInt(m.group(1));
                if (day < 1 || day > 31) {
                    throw new MalformedTimeException(time, "day of month out of range");
                }
                return (day - 1) * SECONDS_PER_DAY + timeOfDay(m.group(2), time);
            }
            default:
                return timeOfDay(normalized, time);
        }
    }

    private static double timeOfDay(String clock, String input) {
        Matcher m = CLOCK.matcher(clock.trim());
        if (!m.matches()) {
            throw new MalformedTimeException(input, "expected HH:MM:SS[.mmm] or h:mm[:ss] am/pm");
        }
        int hours = Integer.parseInt(m.group(1));
        int minutes = Integer.parseInt(m.group(2));
        int seconds = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
        double fraction = m.group(4) == null ? 0d : Double.parseDouble("0." + m.group(4));
        String meridiem = m.group(5);

        if (minutes > 59 || seconds > 59) {
            throw new MalformedTimeException(input, "minutes and seconds must be below 60");
        }
        if (meridiem != null) {
            if (hours < 1 || hours > 12) {
                throw new MalformedTimeException(input, "12-hour clock hour must be 1-12");
            }
            if ("am".equals(meridiem) && hours == 12) {
                hours = 0;
            } else if ("pm".equals(meridiem) && hours != 12) {
                hours += 12;
            }
        } else if (hours > 24 || (hours == 24 && (minutes > 0 || seconds > 0 || fraction > 0))) {
            throw new MalformedTimeException(input, "hour out of range");
        }
        return hours * 3600d + minutes * 60d + seconds + fraction;
    }

    /**
     * Start-of-interval string. An offset that rounds up onto the next midnight stays on its own
     * day, one millisecond before it.
     */
    public static String fromOffset(double offset, Topology topology, TimeFormat format) {
        long totalMillis = toMillis(offset);
        if (totalMillis > 0 && totalMillis % MILLIS_PER_DAY == 0 && offset * 1000d < totalMillis) {
            totalMillis--;
        }
        long day = totalMillis / MILLIS_PER_DAY;
        return withDayPrefix(day, clock(totalMillis % MILLIS_PER_DAY, format), topology);
    }

    /**
     * End-of-interval string. An end on midnight belongs to the day it closes: {@code 24:00:00.000}
     * on the 24-hour clock, {@code 11:59:59.999 pm} on the 12-hour clock.
     */
    public static String fromEndOffset(double offset, Topology topology, TimeFormat format) {
        long totalMillis = toMillis(offset);
        if (totalMillis == 0 || totalMillis % MILLIS_PER_DAY != 0) {
            return fromOffset(offset, topology, format);
        }
        long day = totalMillis / MILLIS_PER_DAY - 1;
        String clock = format == TimeFormat.TWENTY_FOUR_HOUR
                ? "24:00:00.000"
                : clock(MILLIS_PER_DAY - 1, format);
        return withDayPrefix(day, clock, topology);
    }

    private static long toMillis(double offset) {
        if (offset < 0 || Double.isNaN(offset) || Double.isInfinite(offset)) {
            throw new IllegalArgumentException("offset must be a non-negative number: " + offset);
        }
        return Math.round(offset * 1000d);
    }

    private static String withDayPrefix(long day, String clock, Topology topology) {
        switch (topology) {
            case WEEKLY:
                return DAY_NAMES[(int) (day % 7)] + " " + clock;
            case MONTHLY:
                return "day " + (day + 1) + " " + clock;
            default:
                return clock;
        }
    }

    private static String clock(long millisOfDay, TimeFormat format) {
        long hours = millisOfDay / 3_600_000L;
        long minutes = (millisOfDay / 60_000L) % 60;
        long seconds = (millisOfDay / 1000L) % 60;
        long millis = millisOfDay % 1000L;
        if (format == TimeFormat.TWENTY_FOUR_HOUR) {
            return String.format(Locale.ROOT, "%02d:%02d:%02d.%03d", hours, minutes, seconds, millis);
        }
        long displayHour = hours % 12 == 0 ? 12 : hours % 12;
        String suffix = hours < 12 ? "am" : "pm";
        return String.format(Locale.ROOT, "%d:%02d:%02d.%03d %s", displayHour, minutes, seconds, millis, suffix);
    }

    /**
     * Picks the clock convention of the strings already in a template. Defaults to 12-hour.
     */
    public static TimeFormat detectFormat(Collection<String> existing) {
        boolean sawAny = false;
        if (existing != null) {
            for (String s : existing) {
                if (s == null || s.isBlank()) continue;
                if (MERIDIEM.matcher(s).find()) {
                    return TimeFormat.TWELVE_HOUR;
                }
                sawAny = true;
            }
        }
        return sawAny ? TimeFormat.TWENTY_FOUR_HOUR : TimeFormat.TWELVE_HOUR;
    }

    public static double addFrameGuard(double offset, double frameRate) {
        return offset + frameDuration(frameRate);
    }

    public static double addFrameGuard(double offset) {
        return addFrameGuard(offset, DEFAULT_FRAME_RATE);
    }

    /**
     * One frame in seconds; zero when the guard is disabled with a non-positive rate.
     */
    public static double frameDuration(double frameRate) {
        return frameRate > 0 ? 1d / frameRate : 0d;
    }
}
