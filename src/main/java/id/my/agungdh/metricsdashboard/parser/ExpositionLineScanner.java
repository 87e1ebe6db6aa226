package id.my.agungdh.metricsdashboard.parser;

import java.util.function.Consumer;

/**
 * Memecah teks exposition menjadi baris logis dan mengklasifikasikan masing-masing.
 * Single-pass, tanpa lookahead.
 */
public final class ExpositionLineScanner {

    public enum LineKind {
        META,
        COMMENT,
        SAMPLE,
        BLANK
    }

    /** {@code number} dimulai dari 1, {@code text} sudah di-trim. */
    public record ScannedLine(int number, LineKind kind, String text) {
    }

    private ExpositionLineScanner() {
    }

    public static void scan(String text, Consumer<ScannedLine> sink) {
        int n = text.length();
        int start = 0;
        int lineNo = 0;
        while (start <= n) {
            int nl = text.indexOf('\n', start);
            int end = nl < 0 ? n : nl;
            lineNo++;
            String line = text.substring(start, end).trim(); // trim juga membuang \r di ujung
            sink.accept(new ScannedLine(lineNo, classify(line), line));
            if (nl < 0) break;
            start = nl + 1;
        }
    }

    public static LineKind classify(String line) {
        if (line.isEmpty()) return LineKind.BLANK;
        if (line.charAt(0) != '#') return LineKind.SAMPLE;
        if (isDirective(line, "# HELP") || isDirective(line, "# TYPE")) return LineKind.META;
        return LineKind.COMMENT;
    }

    // "# HELPER ..." bukan directive
    private static boolean isDirective(String line, String keyword) {
        if (!line.startsWith(keyword)) return false;
        return line.length() == keyword.length() || Character.isWhitespace(line.charAt(keyword.length()));
    }
}
