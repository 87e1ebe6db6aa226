package id.my.agungdh.metricsdashboard.DTO.dashboard;

public record HostnameStatDTO(String hostname, double count, double percentage) {
}
