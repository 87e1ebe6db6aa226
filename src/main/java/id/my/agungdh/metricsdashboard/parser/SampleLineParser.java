package id.my.agungdh.metricsdashboard.parser;

import java.util.Map;

/**
 * Grammar: {@code metric_name ['{' label_list '}'] WS value [WS timestamp]}.
 * <p>
 * Contoh: {@code http_requests_total{method="post",code="200"} 1027 1395066363000}
 */
public final class SampleLineParser {

    /** Timestamp (ms) dikonsumsi tapi tidak dipakai di output; null kalau tidak ada. */
    public record ParsedLine(String name, Map<String, String> labels, double value, Long timestampMs) {
    }

    private SampleLineParser() {
    }

    public static ParsedLine parse(String line) {
        int n = line.length();
        int nameEnd = MetricNames.scanName(line, 0);
        if (nameEnd == 0) throw new MalformedLineException("line does not start with a metric name");
        String name = line.substring(0, nameEnd);

        int i = skipWhitespace(line, nameEnd);
        Map<String, String> labels = Map.of();
        if (i < n && line.charAt(i) == '{') {
            LabelBlockParser.Result block = LabelBlockParser.parseBlock(line, i + 1);
            labels = block.labels();
            i = block.end();
        } else if (i == nameEnd && i < n) {
            // nama langsung diikuti karakter lain, mis. "foo-bar 1"
            throw new MalformedLineException("invalid character '" + line.charAt(i) + "' in metric name");
        }

        String[] tokens = line.substring(i).trim().split("\\s+");
        if (tokens.length == 0 || tokens[0].isEmpty()) throw new MalformedLineException("missing value for " + name);
        if (tokens.length > 2) throw new MalformedLineException("unexpected trailing tokens for " + name);

        double value = ValueNormalizer.normalize(tokens[0]);
        Long ts = tokens.length == 2 ? parseTimestamp(tokens[1]) : null;
        return new ParsedLine(name, labels, value, ts);
    }

    private static long parseTimestamp(String token) {
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new MalformedLineException("invalid timestamp '" + token + "'", e);
        }
    }

    private static int skipWhitespace(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return i;
    }
}
