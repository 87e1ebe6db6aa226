package id.my.agungdh.metricsdashboard.parser;

import id.my.agungdh.metricsdashboard.parser.ExpositionLineScanner.LineKind;
import id.my.agungdh.metricsdashboard.parser.ExpositionLineScanner.ScannedLine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpositionLineScannerTest {

    @Test
    void classifiesLines() {
        assertEquals(LineKind.META, ExpositionLineScanner.classify("# HELP m text"));
        assertEquals(LineKind.META, ExpositionLineScanner.classify("# TYPE m counter"));
        assertEquals(LineKind.COMMENT, ExpositionLineScanner.classify("# HELPER m"));
        assertEquals(LineKind.COMMENT, ExpositionLineScanner.classify("#TYPE m counter"));
        assertEquals(LineKind.COMMENT, ExpositionLineScanner.classify("# EOF"));
        assertEquals(LineKind.SAMPLE, ExpositionLineScanner.classify("m 1"));
        assertEquals(LineKind.BLANK, ExpositionLineScanner.classify(""));
    }

    @Test
    void trimsAndNumbersLines() {
        List<ScannedLine> lines = new ArrayList<>();
        ExpositionLineScanner.scan("  a 1  \r\n\n\t# TYPE a gauge\r\n", lines::add);

        assertEquals(4, lines.size());
        assertEquals(new ScannedLine(1, LineKind.SAMPLE, "a 1"), lines.get(0));
        assertEquals(LineKind.BLANK, lines.get(1).kind());
        assertEquals(new ScannedLine(3, LineKind.META, "# TYPE a gauge"), lines.get(2));
        assertEquals(LineKind.BLANK, lines.get(3).kind());
    }
}
