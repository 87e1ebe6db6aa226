package id.my.agungdh.metricsdashboard.service;

import id.my.agungdh.metricsdashboard.DTO.dashboard.DashboardSummaryDTO;
import id.my.agungdh.metricsdashboard.DTO.dashboard.HostnameStatDTO;
import id.my.agungdh.metricsdashboard.DTO.dashboard.LabeledValueDTO;
import id.my.agungdh.metricsdashboard.DTO.dashboard.ProviderStatusDTO;
import id.my.agungdh.metricsdashboard.DTO.metrics.MetricsSnapshot;
import id.my.agungdh.metricsdashboard.DTO.metrics.ParsedMetrics;
import id.my.agungdh.metricsdashboard.parser.PrometheusTextParser;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DashboardStatsServiceTest {

    private static final String SAMPLE = """
            # HELP mw_provider_status_count Provider outcomes
            # TYPE mw_provider_status_count gauge
            mw_provider_status_count{provider_id="alpha",status="success"} 90
            mw_provider_status_count{provider_id="alpha",status="failed"} 10
            mw_provider_status_count{provider_id="beta",status="success"} 1
            mw_provider_status_count{provider_id="beta",status="failed"} 3
            mw_provider_status_count_daily{provider_id="beta",status="notfound"} 0
            mw_provider_status_count{provider_id="gamma",status="pending"} 4
            mw_provider_tool_count{tool="scraper"} 7
            mw_provider_tool_count{tool="api"} 2
            mw_provider_hostname_count{hostname="a.example.com"} 30
            mw_provider_hostname_count_weekly{hostname="B.example.org"} 10
            mw_media_watch_count 100
            mw_media_watch_count_daily 20
            mw_media_watch_count_monthly NaN
            mw_user_count_daily 42
            nodejs_eventloop_lag_seconds 0.0123456
            http_request_duration_seconds_sum{method="GET",route="/fast"} 0.5
            http_request_duration_seconds_count{method="GET",route="/fast"} 10
            http_request_duration_seconds_sum{method="POST",route="/slow"} 4
            http_request_duration_seconds_count{method="POST",route="/slow"} 2
            http_request_duration_seconds_count{method="GET",route="/orphan"} 3
            """;

    private final DashboardStatsService stats = new DashboardStatsService();
    private final ParsedMetrics pm = new PrometheusTextParser().parse(SAMPLE);

    @Test
    void overviewStats() {
        var o = stats.overview(pm);

        assertEquals(120.0, o.totalWatchRequests());
        assertEquals(2, o.uniqueHosts());
        assertEquals(42.0, o.activeUsers());
        assertEquals(0.012, o.eventLoopLag());
    }

    @Test
    void failureRatesSortedDescending() {
        List<ProviderStatusDTO> rates = stats.providerFailureRates(pm, 10);

        assertEquals(List.of("beta", "alpha", "gamma"), rates.stream().map(ProviderStatusDTO::provider).toList());
        assertEquals(75.0, rates.get(0).failureRate());
        assertEquals(10.0, rates.get(1).failureRate());
        // status lain diabaikan, total 0 -> rate 0
        assertEquals(0.0, rates.get(2).failureRate());
        assertEquals(1, stats.providerFailureRates(pm, 1).size());
    }

    @Test
    void statusTotals() {
        var t = stats.statusTotals(pm);

        assertEquals(91.0, t.success());
        assertEquals(13.0, t.failed());
        assertEquals(0.0, t.notfound());
    }

    @Test
    void routeResponseTimesSkipIncompleteRoutes() {
        List<LabeledValueDTO> times = stats.routeResponseTimes(pm);

        assertEquals(2, times.size());
        assertEquals("POST /slow", times.get(0).label());
        assertEquals(2000.0, times.get(0).value(), 1e-9);
        assertEquals("GET /fast", times.get(1).label());
        assertEquals(50.0, times.get(1).value(), 1e-9);
    }

    @Test
    void chartSeries() {
        assertEquals(List.of(new LabeledValueDTO("scraper", 7), new LabeledValueDTO("api", 2)),
                stats.providerToolUsage(pm));
        assertEquals(List.of("GET /fast", "POST /slow", "GET /orphan"),
                stats.httpRequestCounts(pm).stream().map(LabeledValueDTO::label).toList());
    }

    @Test
    void hostnameStatsWithPercentageAndSearch() {
        List<HostnameStatDTO> all = stats.hostnameStats(pm, null);

        assertEquals(2, all.size());
        assertEquals("a.example.com", all.get(0).hostname());
        assertEquals(75.0, all.get(0).percentage(), 1e-9);
        assertEquals(25.0, all.get(1).percentage(), 1e-9);

        List<HostnameStatDTO> filtered = stats.hostnameStats(pm, "b.EXAMPLE");
        assertEquals(1, filtered.size());
        assertEquals("B.example.org", filtered.get(0).hostname());
    }

    @Test
    void nonFiniteHostnameCountsAreLeftOutOfTheTable() {
        ParsedMetrics withInf = new PrometheusTextParser().parse("""
                mw_provider_hostname_count{hostname="a.example.com"} 30
                mw_provider_hostname_count{hostname="broken.example.com"} +Inf
                mw_provider_hostname_count_daily{hostname="nan.example.com"} NaN
                mw_provider_hostname_count_weekly{hostname="b.example.org"} 10
                """);

        List<HostnameStatDTO> all = stats.hostnameStats(withInf, null);

        assertEquals(List.of("a.example.com", "b.example.org"), all.stream().map(HostnameStatDTO::hostname).toList());
        assertEquals(75.0, all.get(0).percentage(), 1e-9);
        assertEquals(25.0, all.get(1).percentage(), 1e-9);
    }

    @Test
    void nanActiveUsersFallsBackToZero() {
        ParsedMetrics nanUsers = new PrometheusTextParser().parse("mw_user_count NaN\nmw_user_count_daily 5\n");

        assertEquals(0.0, stats.overview(nanUsers).activeUsers());
    }

    @Test
    void summaryOfEmptyMetrics() {
        DashboardSummaryDTO summary = stats.summarize(
                new MetricsSnapshot("imported", Instant.EPOCH, "", ParsedMetrics.empty()), 10);

        assertEquals("imported", summary.getSource());
        assertEquals(0, summary.getOverview().uniqueHosts());
        assertTrue(summary.getProviderFailureRates().isEmpty());
        assertTrue(summary.getRouteResponseTimesMs().isEmpty());
    }
}
