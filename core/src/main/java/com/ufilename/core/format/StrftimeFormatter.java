package com.ufilename.core.format;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Renders strftime-style patterns ("%Y%m%d_%H%M%S") the way the C/POSIX
 * locale does, so timestamp configs stay portable between implementations.
 *
 * Supported: %a %A %b %B %c %d %e %f %H %I %j %m %M %p %S %u %w %x %X %y %Y %z %Z %%.
 * Anything else, including a trailing lone '%', is copied through unchanged.
 */
public final class StrftimeFormatter {

    private static final Locale C_LOCALE = Locale.US;
    private static final DateTimeFormatter ZONE_NAME = DateTimeFormatter.ofPattern("zzz", C_LOCALE);

    private StrftimeFormatter() {}

    public static String format(String pattern, ZonedDateTime time) {
        StringBuilder out = new StringBuilder(pattern.length() + 16);
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c != '%' || i + 1 == pattern.length()) {
                out.append(c);
                i++;
                continue;
            }
            char directive = pattern.charAt(i + 1);
            if (!appendDirective(out, directive, time)) {
                out.append('%').append(directive);
            }
            i += 2;
        }
        return out.toString();
    }

    /** Returns false when {@code directive} is not recognised. */
    private static boolean appendDirective(StringBuilder out, char directive, ZonedDateTime t) {
        switch (directive) {
            case 'a' -> out.append(t.getDayOfWeek().getDisplayName(TextStyle.SHORT, C_LOCALE));
            case 'A' -> out.append(t.getDayOfWeek().getDisplayName(TextStyle.FULL, C_LOCALE));
            case 'b' -> out.append(t.getMonth().getDisplayName(TextStyle.SHORT, C_LOCALE));
            case 'B' -> out.append(t.getMonth().getDisplayName(TextStyle.FULL, C_LOCALE));
            case 'c' -> out.append(format("%a %b %e %H:%M:%S %Y", t));
            case 'd' -> out.append(pad(t.getDayOfMonth(), 2));
            case 'e' -> out.append(String.format("%2d", t.getDayOfMonth()));
            case 'f' -> out.append(pad(t.getNano() / 1_000, 6));
            case 'H' -> out.append(pad(t.getHour(), 2));
            case 'I' -> out.append(pad(t.getHour() % 12 == 0 ? 12 : t.getHour() % 12, 2));
            case 'j' -> out.append(pad(t.getDayOfYear(), 3));
            case 'm' -> out.append(pad(t.getMonthValue(), 2));
            case 'M' -> out.append(pad(t.getMinute(), 2));
            case 'p' -> out.append(t.getHour() < 12 ? "AM" : "PM");
            case 'S' -> out.append(pad(t.getSecond(), 2));
            case 'u' -> out.append(t.getDayOfWeek().getValue());
            case 'w' -> out.append(t.getDayOfWeek().getValue() % 7);
            case 'x' -> out.append(format("%m/%d/%y", t));
            case 'X' -> out.append(format("%H:%M:%S", t));
            case 'y' -> out.append(pad(Math.floorMod(t.getYear(), 100), 2));
            case 'Y' -> out.append(t.getYear());
            case 'z' -> out.append(offset(t.getOffset().getTotalSeconds()));
            case 'Z' -> out.append(ZONE_NAME.format(t));
            case '%' -> out.append('%');
            default  -> { return false; }
        }
        return true;
    }

    private static String pad(int value, int width) {
        String digits = Integer.toString(value);
        return digits.length() >= width ? digits : "0".repeat(width - digits.length()) + digits;
    }

    // +HHMM, as C strftime prints it
    private static String offset(int totalSeconds) {
        int abs = Math.abs(totalSeconds);
        return (totalSeconds < 0 ? "-" : "+") + pad(abs / 3600, 2) + pad((abs / 60) % 60, 2);
    }
}
