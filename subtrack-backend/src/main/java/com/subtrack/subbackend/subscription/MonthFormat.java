package com.subtrack.subbackend.subscription;

import com.subtrack.subbackend.error.ValidationException;

import java.time.DateTimeException;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Month-granularity dates in the {@code MM-YYYY} wire format.
 */
public final class MonthFormat {

    private static final Pattern SHAPE = Pattern.compile("(\\d{2})-(\\d{4})");
    private static final DateTimeFormatter OUTPUT = DateTimeFormatter.ofPattern("MM-uuuu");

    private MonthFormat() {
    }

    /**
     * @param field name reported back to the caller when the value is rejected
     * @throws ValidationException for anything that is not exactly two month digits, a dash and four year digits
     */
    public static YearMonth parse(String value, String field) {
        if (value == null) {
            throw new ValidationException("invalid " + field);
        }
        Matcher m = SHAPE.matcher(value);
        if (!m.matches()) {
            throw new ValidationException("invalid " + field);
        }
        try {
            return YearMonth.of(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)));
        } catch (DateTimeException e) {
            throw new ValidationException("invalid " + field, e);
        }
    }

    public static String format(YearMonth month) {
        return month == null ? null : OUTPUT.format(month);
    }
}
