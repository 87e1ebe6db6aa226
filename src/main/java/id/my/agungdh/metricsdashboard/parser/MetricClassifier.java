package id.my.agungdh.metricsdashboard.parser;

import id.my.agungdh.metricsdashboard.DTO.metrics.MetricFamilyMetadata;
import id.my.agungdh.metricsdashboard.DTO.metrics.MetricGroup;
import id.my.agungdh.metricsdashboard.DTO.metrics.MetricSample;

import java.util.List;
import java.util.Map;

/**
 * Menempelkan HELP/TYPE dari tabel metadata lalu menentukan group berdasarkan prefix nama.
 */
public final class MetricClassifier {

    private static final List<String> COMPONENT_SUFFIXES = List.of("_bucket", "_sum", "_count");

    public record Classified(MetricGroup group, MetricSample sample) {
    }

    private MetricClassifier() {
    }

    /**
     * Suffix histogram/summary hanya dibuang kalau root hasil potongannya ada di tabel;
     * selain itu nama lengkap dipakai sebagai key (counter/gauge biasa).
     */
    public static String familyRoot(String name, MetricMetadataTable table) {
        for (String suffix : COMPONENT_SUFFIXES) {
            if (name.length() > suffix.length() && name.endsWith(suffix)) {
                String root = name.substring(0, name.length() - suffix.length());
                if (table.contains(root)) return root;
            }
        }
        return name;
    }

    public static Classified classify(String name, Map<String, String> labels, double value,
                                      MetricMetadataTable table) {
        MetricFamilyMetadata meta = table.lookup(familyRoot(name, table)).orElse(MetricFamilyMetadata.EMPTY);
        MetricSample sample = new MetricSample(name, value, labels, meta.help(), meta.type(), meta.rawType());
        return new Classified(MetricGroup.of(name), sample);
    }
}
