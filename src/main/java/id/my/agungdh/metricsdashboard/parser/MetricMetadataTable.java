package id.my.agungdh.metricsdashboard.parser;

import id.my.agungdh.metricsdashboard.DTO.metrics.MetricFamilyMetadata;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tabel HELP/TYPE per family root. Hidup hanya selama satu pemanggilan parse (bukan shared state).
 */
public final class MetricMetadataTable {

    private final Map<String, MetricFamilyMetadata> byRoot = new HashMap<>();

    public void putHelp(String root, String help) {
        byRoot.merge(root, MetricFamilyMetadata.EMPTY.withHelp(help), (old, fresh) -> old.withHelp(help));
    }

    public void putType(String root, String typeToken) {
        byRoot.merge(root, MetricFamilyMetadata.EMPTY.withType(typeToken), (old, fresh) -> old.withType(typeToken));
    }

    public boolean contains(String root) {
        return byRoot.containsKey(root);
    }

    public Optional<MetricFamilyMetadata> lookup(String root) {
        return Optional.ofNullable(byRoot.get(root));
    }

    public int size() {
        return byRoot.size();
    }
}
