package id.my.agungdh.metricsdashboard.DTO.metrics;

/**
 * HELP/TYPE terakhir yang terlihat untuk satu family root.
 * Semua field nullable: family bisa punya HELP saja atau TYPE saja.
 */
public record MetricFamilyMetadata(
        String help,
        MetricType type,
        String rawType
) {
    public static final MetricFamilyMetadata EMPTY = new MetricFamilyMetadata(null, null, null);

    public MetricFamilyMetadata withHelp(String newHelp) {
        return new MetricFamilyMetadata(newHelp, type, rawType);
    }

    public MetricFamilyMetadata withType(String token) {
        return new MetricFamilyMetadata(help, MetricType.fromToken(token), token);
    }
}
