package com.phillippitts.voicechat.domain;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single equality predicate of the form {@code <column>=eq.<value>} restricting which rows'
 * changes reach a subscription. Compound filters and other operators are not supported.
 *
 * @param column row column compared
 * @param value  expected value, compared by string form
 */
public record FilterExpression(String column, String value) {

    private static final Pattern WIRE_FORMAT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)=eq\\.(.+)$");
    private static final Pattern COLUMN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public FilterExpression {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(value, "value");
        if (!COLUMN.matcher(column).matches()) {
            throw new IllegalArgumentException("Invalid filter column: '" + column + "'");
        }
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Filter value must not be empty (column " + column + ")");
        }
    }

    public static FilterExpression eq(String column, String value) {
        return new FilterExpression(column, value);
    }

    /**
     * Parses the wire form {@code column=eq.value}.
     *
     * @param expression filter string
     * @return parsed filter
     * @throws IllegalArgumentException if the string is not a single equality filter
     */
    public static FilterExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Filter expression must not be blank");
        }
        Matcher m = WIRE_FORMAT.matcher(expression.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException(
                    "Filter must have the form <column>=eq.<value>, got: '" + expression + "'");
        }
        return new FilterExpression(m.group(1), m.group(2));
    }

    /**
     * Returns true when the row holds this filter's value in its column.
     * A row without the column never matches.
     */
    public boolean matches(Map<String, ?> row) {
        if (row == null) {
            return false;
        }
        Object actual = row.get(column);
        return actual != null && value.equals(String.valueOf(actual));
    }

    /** Wire form, e.g. {@code user_id=eq.u1}. */
    @Override
    public String toString() {
        return column + "=eq." + value;
    }
}
