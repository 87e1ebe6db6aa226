package id.my.agungdh.metricsdashboard.parser;

/**
 * Memproses {@code # HELP <name> <text>} dan {@code # TYPE <name> <type>} ke {@link MetricMetadataTable}.
 * Directive berikutnya untuk root yang sama menimpa yang sebelumnya.
 */
public final class MetaDirectiveProcessor {

    private static final String HELP = "# HELP";
    private static final String TYPE = "# TYPE";

    private MetaDirectiveProcessor() {
    }

    public static void process(String line, MetricMetadataTable table) {
        if (line.startsWith(HELP)) {
            processHelp(line.substring(HELP.length()), table);
        } else if (line.startsWith(TYPE)) {
            processType(line.substring(TYPE.length()), table);
        } else {
            throw new MalformedLineException("not a HELP/TYPE directive");
        }
    }

    private static void processHelp(String rest, MetricMetadataTable table) {
        int start = skipWhitespace(rest, 0);
        int end = readName(rest, start);
        String name = rest.substring(start, end);
        String help = unescapeHelp(rest.substring(end).trim());
        table.putHelp(name, help);
    }

    private static void processType(String rest, MetricMetadataTable table) {
        int start = skipWhitespace(rest, 0);
        int end = readName(rest, start);
        String name = rest.substring(start, end);

        int tStart = skipWhitespace(rest, end);
        int tEnd = tStart;
        while (tEnd < rest.length() && !Character.isWhitespace(rest.charAt(tEnd))) tEnd++;
        if (tStart == tEnd) throw new MalformedLineException("TYPE without type token for " + name);

        // token yang tidak dikenal disimpan apa adanya (rawType), bukan ditolak
        table.putType(name, rest.substring(tStart, tEnd));
    }

    private static int readName(String s, int start) {
        int end = MetricNames.scanName(s, start);
        if (end == start) throw new MalformedLineException("directive without metric name");
        if (end < s.length() && !Character.isWhitespace(s.charAt(end))) {
            throw new MalformedLineException("invalid character '" + s.charAt(end) + "' in metric name");
        }
        return end;
    }

    private static int skipWhitespace(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return i;
    }

    /** {@code \\} -> {@code \}, {@code \n} -> newline; pasangan backslash lain dibiarkan. */
    static String unescapeHelp(String s) {
        if (s.indexOf('\\') < 0) return s;
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(i + 1);
                if (next == '\\') {
                    sb.append('\\');
                    i++;
                    continue;
                }
                if (next == 'n') {
                    sb.append('\n');
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
