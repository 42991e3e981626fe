package chessdoc.records;

import java.time.YearMonth;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date of a game, possibly partial: year only, year and month, or full date.
 *
 * @param year  year, 0 or more
 * @param month 1..12, or {@code null} if unknown
 * @param day   1..length of month, or {@code null} if unknown (must be {@code null} when month is)
 */
public record DateValue(int year, Integer month, Integer day) {

    private static final Pattern PGN_YMD = Pattern.compile("([0-9]{4})\\.([0-9]{2})\\.([0-9]{2})");
    private static final Pattern PGN_YM  = Pattern.compile("([0-9]{4})\\.([0-9]{2})\\.\\?\\?");
    private static final Pattern PGN_Y   = Pattern.compile("([0-9]{4})(?:\\.\\?\\?\\.\\?\\?)?");

    private static final Pattern ISO_YMD = Pattern.compile("([0-9]{4})-([0-9]{2})-([0-9]{2})");
    private static final Pattern ISO_YM  = Pattern.compile("([0-9]{4})-([0-9]{2})-\\*\\*");
    private static final Pattern ISO_Y   = Pattern.compile("([0-9]{4})-\\*\\*-\\*\\*");

    public DateValue {
        if (!isValid(year, month, day)) {
            throw new IllegalArgumentException("Invalid date: " + year + "/" + month + "/" + day);
        }
    }

    public static DateValue of(int year) { return new DateValue(year, null, null); }
    public static DateValue of(int year, int month) { return new DateValue(year, month, null); }
    public static DateValue of(int year, int month, int day) { return new DateValue(year, month, day); }

    public static boolean isValid(int year, Integer month, Integer day) {
        if (year < 0) return false;
        if (month == null) return day == null;
        if (month < 1 || month > 12) return false;
        if (day == null) return true;
        return day >= 1 && day <= YearMonth.of(year, month).lengthOfMonth();
    }

    public boolean hasMonth() { return month != null; }
    public boolean hasDay() { return day != null; }

    /** {@code yyyy.mm.dd}, unknown parts written {@code ??}. */
    public String toPgnString() {
        return format('.', "??");
    }

    /** {@code yyyy-mm-dd}, unknown parts written {@code **}. */
    @Override
    public String toString() {
        return format('-', "**");
    }

    /**
     * Parses a PGN date. Invalid month or day parts degrade to a less precise date.
     *
     * @return {@code null} if the value does not look like a PGN date
     */
    public static DateValue fromPgnString(String value) {
        return parse(value, PGN_YMD, PGN_YM, PGN_Y, true);
    }

    /**
     * Parses the output of {@link #toString()}.
     *
     * @return {@code null} if the value is not a valid date
     */
    public static DateValue fromString(String value) {
        return parse(value, ISO_YMD, ISO_YM, ISO_Y, false);
    }

    private String format(char separator, String unknown) {
        String y = String.format("%04d", year);
        String m = month == null ? unknown : String.format("%02d", month);
        String d = day == null ? unknown : String.format("%02d", day);
        return y + separator + m + separator + d;
    }

    private static DateValue parse(String value, Pattern ymdRe, Pattern ymRe, Pattern yRe, boolean tolerant) {
        Matcher m = ymdRe.matcher(value);
        if (m.matches()) {
            int year = Integer.parseInt(m.group(1));
            int month = Integer.parseInt(m.group(2));
            int day = Integer.parseInt(m.group(3));
            if (isValid(year, month, day)) return of(year, month, day);
            if (!tolerant) return null;
            return isValid(year, month, null) ? of(year, month) : of(year);
        }
        m = ymRe.matcher(value);
        if (m.matches()) {
            int year = Integer.parseInt(m.group(1));
            int month = Integer.parseInt(m.group(2));
            if (isValid(year, month, null)) return of(year, month);
            return tolerant ? of(year) : null;
        }
        m = yRe.matcher(value);
        if (m.matches()) {
            return of(Integer.parseInt(m.group(1)));
        }
        return null;
    }
}
