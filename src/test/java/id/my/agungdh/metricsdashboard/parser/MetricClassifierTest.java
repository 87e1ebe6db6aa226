package id.my.agungdh.metricsdashboard.parser;

import id.my.agungdh.metricsdashboard.DTO.metrics.MetricGroup;
import id.my.agungdh.metricsdashboard.DTO.metrics.MetricType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricClassifierTest {

    @Test
    void stripsSuffixOnlyWhenRootIsDeclared() {
        var table = new MetricMetadataTable();
        table.putType("rpc", "summary");

        assertEquals("rpc", MetricClassifier.familyRoot("rpc_sum", table));
        assertEquals("rpc", MetricClassifier.familyRoot("rpc_count", table));
        assertEquals("rpc", MetricClassifier.familyRoot("rpc_bucket", table));
        assertEquals("other_count", MetricClassifier.familyRoot("other_count", table));
        assertEquals("rpc_total", MetricClassifier.familyRoot("rpc_total", table));
        assertEquals("_sum", MetricClassifier.familyRoot("_sum", table));
    }

    @Test
    void plainMetricWithoutMetadataHasNoHelpOrType() {
        var c = MetricClassifier.classify("mw_user_count", Map.of(), 3, new MetricMetadataTable());

        assertEquals(MetricGroup.CUSTOM, c.group());
        assertNull(c.sample().help());
        assertNull(c.sample().type());
        assertNull(c.sample().rawType());
    }

    @Test
    void attachesMetadataAndGroup() {
        var table = new MetricMetadataTable();
        table.putHelp("process_resident_memory_bytes", "Resident memory size in bytes.");
        table.putType("process_resident_memory_bytes", "gauge");

        var c = MetricClassifier.classify("process_resident_memory_bytes", Map.of(), 1024, table);

        assertEquals(MetricGroup.PROCESS, c.group());
        assertEquals("Resident memory size in bytes.", c.sample().help());
        assertEquals(MetricType.GAUGE, c.sample().type());
        assertEquals("gauge", c.sample().rawType());
    }

    @Test
    void unknownTypeTokenIsCarriedVerbatim() {
        var table = new MetricMetadataTable();
        table.putType("feature_state", "stateset");

        var c = MetricClassifier.classify("feature_state", Map.of("feature_state", "a"), 1, table);

        assertEquals(MetricType.UNKNOWN, c.sample().type());
        assertEquals("stateset", c.sample().rawType());
    }

    @Test
    void groupPrefixes() {
        assertEquals(MetricGroup.PROCESS, MetricGroup.of("process_start_time_seconds"));
        assertEquals(MetricGroup.NODE, MetricGroup.of("nodejs_heap_size_total_bytes"));
        assertEquals(MetricGroup.HTTP, MetricGroup.of("http_request_duration_seconds_bucket"));
        assertEquals(MetricGroup.CUSTOM, MetricGroup.of("node_cpu_seconds_total"));
        assertEquals(MetricGroup.CUSTOM, MetricGroup.of("processes"));
    }
}
