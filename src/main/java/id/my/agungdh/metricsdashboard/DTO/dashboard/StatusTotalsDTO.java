package id.my.agungdh.metricsdashboard.DTO.dashboard;

public record StatusTotalsDTO(double success, double failed, double notfound) {
}
