package io.cifxform.core.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reading and writing of CIF numeric values. A number may carry a standard uncertainty in
 * parentheses, {@code 1.234(5)}, which is ignored when reading.
 */
public final class CifNumbers {

    private static final Pattern NUMBER =
            Pattern.compile("([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)(?:\\(\\d+\\))?");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+(?:\\(\\d+\\))?");
    private static final MathContext PRECISION = new MathContext(10);

    private CifNumbers() {
        // utility class
    }

    /** Parses a CIF number, returning empty for placeholders and non-numeric text. */
    public static OptionalDouble parse(String text) {
        Matcher matcher = NUMBER.matcher(text.trim());
        if (!matcher.matches()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(matcher.group(1)));
    }

    public static boolean isNumber(String text) {
        return NUMBER.matcher(text.trim()).matches();
    }

    public static boolean isInteger(String text) {
        return INTEGER.matcher(text.trim()).matches();
    }

    /**
     * Formats a computed value with ten significant digits, trailing zeros removed but at least one
     * decimal place kept: {@code 1.0}, {@code 0.25}, {@code 293.15}.
     *
     * @throws IllegalArgumentException if the value is NaN or infinite
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot format non-finite value " + value);
        }
        BigDecimal decimal = new BigDecimal(value).round(PRECISION).stripTrailingZeros();
        if (decimal.scale() < 1) {
            decimal = decimal.setScale(1);
        }
        return decimal.toPlainString();
    }
}
