package io.github.relcsv.csv;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Renders JSON values as CSV cells.
 *
 * <ul>
 *   <li>strings are always quoted, embedded quotes doubled</li>
 *   <li>numbers use the shortest decimal that reads back as the same value, whole numbers without a fraction</li>
 *   <li>booleans are {@code true} / {@code false}</li>
 *   <li>null, missing, objects and arrays are empty cells</li>
 * </ul>
 */
public class CsvValueFormatter {

    private static final char QUOTE = '"';
    private static final String EMPTY = "";
    private static final double MAX_PLAIN_WHOLE = 1e15;

    /**
     * Formats a field value. {@code value} may be null for an absent field.
     */
    public String format(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode() || value.isContainerNode()) {
            return EMPTY;
        }
        if (value.isTextual()) {
            return quote(value.textValue());
        }
        if (value.isNumber()) {
            return formatNumber(value);
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? "true" : "false";
        }
        // binary and POJO nodes never come out of a parser
        return quote(value.asText());
    }

    /**
     * Formats a row id; null means no id.
     */
    public String formatId(Long id) {
        return id == null ? EMPTY : Long.toString(id);
    }

    /**
     * Formats a column name. Names are written bare unless they contain a delimiter,
     * a quote or a line break.
     */
    public String formatHeader(String columnName) {
        if (needsQuoting(columnName)) {
            return quote(columnName);
        }
        return columnName;
    }

    /**
     * Wraps a string in quotes, doubling any quote inside it.
     */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append(QUOTE);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == QUOTE) {
                sb.append(QUOTE);
            }
            sb.append(c);
        }
        sb.append(QUOTE);
        return sb.toString();
    }

    static String formatNumber(JsonNode number) {
        if (number.isIntegralNumber()) {
            return number.bigIntegerValue().toString();
        }
        if (number.isBigDecimal()) {
            BigDecimal decimal = number.decimalValue();
            if (decimal.signum() == 0) {
                return "0";
            }
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (number.isFloat()) {
            return formatDouble(Double.parseDouble(Float.toString(number.floatValue())));
        }
        return formatDouble(number.doubleValue());
    }

    private static String formatDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return EMPTY;
        }
        if (d == Math.rint(d) && Math.abs(d) < MAX_PLAIN_WHOLE) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    private static boolean needsQuoting(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ',' || c == QUOTE || c == '\n' || c == '\r') {
                return true;
            }
        }
        return false;
    }
}
