package id.my.agungdh.metricsdashboard.parser;

import id.my.agungdh.metricsdashboard.DTO.metrics.ParsedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Parser Prometheus text exposition format (0.0.4) menjadi {@link ParsedMetrics}.
 * <p>
 * Pure dan reentrant: tabel metadata dan akumulator adalah variabel lokal satu pemanggilan,
 * jadi aman dipanggil paralel dari beberapa thread dengan input masing-masing.
 * Baris rusak dibuang (log DEBUG) dan parse lanjut ke baris berikutnya.
 * <p>
 * Metadata yang dideklarasikan setelah sample-nya tidak menempel mundur (single-pass).
 */
public class PrometheusTextParser {

    private static final Logger log = LoggerFactory.getLogger(PrometheusTextParser.class);
    private static final char BOM = '\uFEFF';

    public ParsedMetrics parse(String text) {
        if (text == null) throw new MetricsParseException("No metrics text to parse");
        if (!text.isEmpty() && text.charAt(0) == BOM) text = text.substring(1);

        MetricMetadataTable table = new MetricMetadataTable();
        ParsedMetricsAssembler assembler = new ParsedMetricsAssembler();
        ParseStats stats = new ParseStats();

        ExpositionLineScanner.scan(text, line -> {
            try {
                switch (line.kind()) {
                    case BLANK -> {
                    }
                    case COMMENT -> stats.comments++;
                    case META -> {
                        MetaDirectiveProcessor.process(line.text(), table);
                        stats.directives++;
                    }
                    case SAMPLE -> {
                        var parsed = SampleLineParser.parse(line.text());
                        assembler.append(MetricClassifier.classify(parsed.name(), parsed.labels(), parsed.value(), table));
                        stats.samples++;
                    }
                }
            } catch (MalformedLineException e) {
                stats.skipped++;
                log.debug("Skipping line {}: {}", line.number(), e.getMessage());
            }
        });

        ParsedMetrics result = assembler.build();
        log.debug("Parsed {} samples ({} directives, {} comments, {} skipped lines, {} families)",
                stats.samples, stats.directives, stats.comments, stats.skipped, table.size());
        return result;
    }

    /**
     * Decode body sebagai UTF-8 ketat lalu parse. Byte yang bukan UTF-8 valid = fatal,
     * bukan diganti diam-diam dengan U+FFFD.
     */
    public ParsedMetrics parse(byte[] body) {
        return parse(decode(body));
    }

    public String decode(byte[] body) {
        if (body == null) throw new MetricsParseException("No metrics body to parse");
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MetricsParseException("Metrics body is not valid UTF-8 text", e);
        }
    }

    private static final class ParseStats {
        int samples;
        int directives;
        int comments;
        int skipped;
    }
}
