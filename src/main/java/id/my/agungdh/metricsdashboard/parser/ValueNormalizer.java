package id.my.agungdh.metricsdashboard.parser;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Token value -> double. Sentinel (case-insensitive): {@code +Inf}/{@code Inf}, {@code -Inf}, {@code NaN}.
 */
public final class ValueNormalizer {

    // Double.parseDouble terlalu longgar ("Infinity", "0x1p3", "1d"), jadi cek bentuknya dulu
    private static final Pattern NUMBER = Pattern.compile(
            "[-+]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][-+]?[0-9]+)?"
    );

    private ValueNormalizer() {
    }

    public static double normalize(String token) {
        if (token == null || token.isEmpty()) throw new MalformedLineException("missing value");
        String lower = token.toLowerCase(Locale.ROOT);
        if (lower.equals("+inf") || lower.equals("inf")) return Double.POSITIVE_INFINITY;
        if (lower.equals("-inf")) return Double.NEGATIVE_INFINITY;
        if (lower.equals("nan")) return Double.NaN;

        if (!NUMBER.matcher(token).matches()) {
            throw new MalformedLineException("invalid value token '" + token + "'");
        }
        return Double.parseDouble(token);
    }
}
