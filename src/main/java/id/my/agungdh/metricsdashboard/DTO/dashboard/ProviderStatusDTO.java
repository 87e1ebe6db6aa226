package id.my.agungdh.metricsdashboard.DTO.dashboard;

public record ProviderStatusDTO(
        String provider,
        double success,
        double failed,
        double notfound,
        double failureRate          // persen, 1 desimal
) {
}
