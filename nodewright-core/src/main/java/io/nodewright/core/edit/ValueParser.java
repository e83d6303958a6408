package io.nodewright.core.edit;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/// Parses literal widget values typed on a command line or in a script.
///
/// `true`/`false` become booleans, `null`/`none` become null, digits become
/// integers (longs or big integers when too large), decimals become doubles,
/// and surrounding single or double quotes are stripped. Anything else stays
/// a string.
public final class ValueParser {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL =
            Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private ValueParser() {}

    public static Object parse(String text) {
        if (text == null) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("true")) {
            return Boolean.TRUE;
        }
        if (lower.equals("false")) {
            return Boolean.FALSE;
        }
        if (lower.equals("null") || lower.equals("none")) {
            return null;
        }
        if (INTEGER.matcher(text).matches()) {
            String digits = text.replaceFirst("^[-+]", "");
            if (digits.length() > 18) {
                return new BigInteger(text);
            }
            long value = Long.parseLong(text);
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return value;
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        if (text.length() >= 2
                && (text.startsWith("\"") && text.endsWith("\"")
                        || text.startsWith("'") && text.endsWith("'"))) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
