package id.my.agungdh.metricsdashboard.parser;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SampleLineParserTest {

    @Test
    void parsesNameLabelsValueAndTimestamp() {
        var line = SampleLineParser.parse("http_requests_total{method=\"post\",code=\"200\"} 1027 1395066363000");

        assertEquals("http_requests_total", line.name());
        assertEquals(Map.of("method", "post", "code", "200"), line.labels());
        assertEquals(1027.0, line.value());
        assertEquals(1395066363000L, line.timestampMs());
    }

    @Test
    void labelsAreOptional() {
        var line = SampleLineParser.parse("process_open_fds 12");

        assertTrue(line.labels().isEmpty());
        assertEquals(12.0, line.value());
        assertNull(line.timestampMs());
    }

    @Test
    void allowsWhitespaceBeforeLabelBlockAndScientificValues() {
        var line = SampleLineParser.parse("go_gc_seconds {quantile=\"0.5\"}   1.5e-3");

        assertEquals("0.5", line.labels().get("quantile"));
        assertEquals(0.0015, line.value(), 1e-12);
    }

    @Test
    void acceptsColonsInNamesAndNegativeTimestamp() {
        var line = SampleLineParser.parse("job:rate5m 3 -1");

        assertEquals("job:rate5m", line.name());
        assertEquals(-1L, line.timestampMs());
    }

    @Test
    void rejectsMalformedLines() {
        assertThrows(MalformedLineException.class, () -> SampleLineParser.parse("1metric 3"));
        assertThrows(MalformedLineException.class, () -> SampleLineParser.parse("metric-name 3"));
        assertThrows(MalformedLineException.class, () -> SampleLineParser.parse("metric"));
        assertThrows(MalformedLineException.class, () -> SampleLineParser.parse("metric{a=\"b\"}"));
        assertThrows(MalformedLineException.class, () -> SampleLineParser.parse("metric{a=\"b\" 3"));
        assertThrows(MalformedLineException.class, () -> SampleLineParser.parse("metric three"));
        assertThrows(MalformedLineException.class, () -> SampleLineParser.parse("metric 3 12.5"));
        assertThrows(MalformedLineException.class, () -> SampleLineParser.parse("metric 3 100 extra"));
    }
}
