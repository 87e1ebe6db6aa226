package id.my.agungdh.metricsdashboard.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sub-grammar {@code {k="v",...}}. Scanner karakter-per-karakter dengan state quote,
 * jadi koma dan kurung kurawal di dalam value tidak memutus pasangan/blok.
 * <p>
 * Label duplikat: kemunculan terakhir yang menang. Trailing comma sebelum {@code }} diterima.
 */
public final class LabelBlockParser {

    private enum State {
        BEFORE_NAME,
        NAME,
        AFTER_NAME,
        BEFORE_VALUE,
        IN_VALUE,
        IN_ESCAPE,
        AFTER_VALUE
    }

    /**
     * @param labels label hasil parse (urutan kemunculan, key unik)
     * @param end    posisi tepat setelah {@code }} penutup
     */
    public record Result(Map<String, String> labels, int end) {
    }

    private LabelBlockParser() {
    }

    /** Parse isi blok saja, tanpa kurung kurawal. */
    public static Map<String, String> parseContents(String contents) {
        Result r = parseBlock(contents + "}", 0);
        if (r.end() != contents.length() + 1) {
            throw new MalformedLineException("unexpected '}' inside label block");
        }
        return r.labels();
    }

    /**
     * Parse mulai dari {@code from} (karakter setelah {@code {}) sampai {@code }} penutup.
     */
    public static Result parseBlock(CharSequence s, int from) {
        Map<String, String> labels = new LinkedHashMap<>();
        StringBuilder name = new StringBuilder();
        StringBuilder value = new StringBuilder();
        State state = State.BEFORE_NAME;

        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (state) {
                case BEFORE_NAME -> {
                    if (Character.isWhitespace(c)) continue;
                    if (c == '}') return new Result(labels, i + 1);
                    if (!MetricNames.isNameStart(c)) throw unexpected(c, i, "label name");
                    name.setLength(0);
                    name.append(c);
                    state = State.NAME;
                }
                case NAME -> {
                    if (MetricNames.isNameChar(c)) {
                        name.append(c);
                    } else if (c == '=') {
                        state = State.BEFORE_VALUE;
                    } else if (Character.isWhitespace(c)) {
                        state = State.AFTER_NAME;
                    } else {
                        throw unexpected(c, i, "label name");
                    }
                }
                case AFTER_NAME -> {
                    if (Character.isWhitespace(c)) continue;
                    if (c != '=') throw unexpected(c, i, "'='");
                    state = State.BEFORE_VALUE;
                }
                case BEFORE_VALUE -> {
                    if (Character.isWhitespace(c)) continue;
                    if (c != '"') throw unexpected(c, i, "'\"'");
                    value.setLength(0);
                    state = State.IN_VALUE;
                }
                case IN_VALUE -> {
                    if (c == '\\') {
                        state = State.IN_ESCAPE;
                    } else if (c == '"') {
                        labels.put(name.toString(), value.toString());
                        state = State.AFTER_VALUE;
                    } else {
                        value.append(c);
                    }
                }
                case IN_ESCAPE -> {
                    switch (c) {
                        case 'n' -> value.append('\n');
                        case '"' -> value.append('"');
                        case '\\' -> value.append('\\');
                        default -> value.append(c);
                    }
                    state = State.IN_VALUE;
                }
                case AFTER_VALUE -> {
                    if (Character.isWhitespace(c)) continue;
                    if (c == ',') {
                        state = State.BEFORE_NAME;
                    } else if (c == '}') {
                        return new Result(labels, i + 1);
                    } else {
                        throw unexpected(c, i, "',' or '}'");
                    }
                }
            }
        }
        throw new MalformedLineException("unterminated label block");
    }

    private static MalformedLineException unexpected(char c, int pos, String expected) {
        return new MalformedLineException("unexpected '" + c + "' at " + pos + ", expected " + expected);
    }
}
