package id.my.agungdh.metricsdashboard.DTO.dashboard;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DashboardSummaryDTO {
    private String source;                                  // URL atau "imported"
    private Instant fetchedAt;
    private OverviewStatsDTO overview;
    private StatusTotalsDTO statusTotals;                   // success/failed/notfound semua provider
    private List<ProviderStatusDTO> providerFailureRates;   // top N, failure rate tertinggi dulu
    private List<LabeledValueDTO> providerToolUsage;
    private List<LabeledValueDTO> httpRequestCounts;
    private List<LabeledValueDTO> routeResponseTimesMs;     // rata-rata ms, paling lambat dulu
}
