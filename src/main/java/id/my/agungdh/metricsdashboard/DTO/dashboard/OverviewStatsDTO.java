package id.my.agungdh.metricsdashboard.DTO.dashboard;

public record OverviewStatsDTO(
        double totalWatchRequests,
        int uniqueHosts,
        double activeUsers,
        double eventLoopLag
) {
}
