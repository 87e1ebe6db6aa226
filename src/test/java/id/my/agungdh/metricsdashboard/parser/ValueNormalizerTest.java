package id.my.agungdh.metricsdashboard.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueNormalizerTest {

    @Test
    void sentinelsAreCaseInsensitive() {
        assertEquals(Double.POSITIVE_INFINITY, ValueNormalizer.normalize("+Inf"));
        assertEquals(Double.POSITIVE_INFINITY, ValueNormalizer.normalize("inf"));
        assertEquals(Double.POSITIVE_INFINITY, ValueNormalizer.normalize("INF"));
        assertEquals(Double.NEGATIVE_INFINITY, ValueNormalizer.normalize("-inf"));
        assertTrue(Double.isNaN(ValueNormalizer.normalize("NaN")));
        assertTrue(Double.isNaN(ValueNormalizer.normalize("nan")));
    }

    @Test
    void decimalAndScientificLiterals() {
        assertEquals(3.5, ValueNormalizer.normalize("3.5"));
        assertEquals(-2.0, ValueNormalizer.normalize("-2"));
        assertEquals(0.5, ValueNormalizer.normalize(".5"));
        assertEquals(7.0, ValueNormalizer.normalize("7."));
        assertEquals(1.2e10, ValueNormalizer.normalize("1.2E10"));
        assertEquals(4e-3, ValueNormalizer.normalize("+4e-3"));
    }

    @Test
    void rejectsNonNumericTokens() {
        for (String bad : new String[]{"", "abc", "Infinity", "0x10", "1d", "1f", "1e", "--1", "1.2.3"}) {
            assertThrows(MalformedLineException.class, () -> ValueNormalizer.normalize(bad), bad);
        }
    }
}
