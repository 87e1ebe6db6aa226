package id.my.agungdh.metricsdashboard.service;

import id.my.agungdh.metricsdashboard.DTO.dashboard.DashboardSummaryDTO;
import id.my.agungdh.metricsdashboard.DTO.dashboard.HostnameStatDTO;
import id.my.agungdh.metricsdashboard.DTO.dashboard.LabeledValueDTO;
import id.my.agungdh.metricsdashboard.DTO.dashboard.OverviewStatsDTO;
import id.my.agungdh.metricsdashboard.DTO.dashboard.ProviderStatusDTO;
import id.my.agungdh.metricsdashboard.DTO.dashboard.StatusTotalsDTO;
import id.my.agungdh.metricsdashboard.DTO.metrics.MetricSample;
import id.my.agungdh.metricsdashboard.DTO.metrics.MetricsSnapshot;
import id.my.agungdh.metricsdashboard.DTO.metrics.ParsedMetrics;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Agregasi untuk tampilan dashboard (chart/tabel). Ini konsumen hasil parser, bukan bagian dari kontraknya.
 */
@Service
public class DashboardStatsService {

    // family yang punya varian _daily/_weekly/_monthly
    private static final List<String> PERIOD_SUFFIXES = List.of("", "_daily", "_weekly", "_monthly");

    private static final String PROVIDER_STATUS = "mw_provider_status_count";
    private static final String PROVIDER_HOSTNAME = "mw_provider_hostname_count";
    private static final String PROVIDER_TOOL = "mw_provider_tool_count";
    private static final String MEDIA_WATCH = "mw_media_watch_count";
    private static final String USER_COUNT = "mw_user_count";
    private static final String EVENT_LOOP_LAG = "nodejs_eventloop_lag_seconds";
    private static final String HTTP_DURATION = "http_request_duration_seconds";

    private static final int CHART_LIMIT = 10;

    public DashboardSummaryDTO summarize(MetricsSnapshot snapshot, int topProviders) {
        ParsedMetrics pm = snapshot.metrics();
        return DashboardSummaryDTO.builder()
                .source(snapshot.source())
                .fetchedAt(snapshot.fetchedAt())
                .overview(overview(pm))
                .statusTotals(statusTotals(pm))
                .providerFailureRates(providerFailureRates(pm, topProviders))
                .providerToolUsage(providerToolUsage(pm))
                .httpRequestCounts(httpRequestCounts(pm))
                .routeResponseTimesMs(routeResponseTimes(pm))
                .build();
    }

    // ========= Overview =========

    public OverviewStatsDTO overview(ParsedMetrics pm) {
        var custom = new Index(pm.customMetrics());
        double watch = sumFinite(custom.withPeriods(MEDIA_WATCH));

        int hosts = (int) custom.withPeriods(PROVIDER_HOSTNAME).stream()
                .map(m -> m.label("hostname"))
                .filter(Objects::nonNull)
                .distinct()
                .count();

        double users = custom.withPeriods(USER_COUNT).stream()
                .findFirst()
                .map(MetricSample::value)
                .filter(Double::isFinite)
                .orElse(0.0);

        double lag = new Index(pm.nodeMetrics()).firstValue(EVENT_LOOP_LAG).orElse(0.0);

        return new OverviewStatsDTO(watch, hosts, users, round(lag, 3));
    }

    // ========= Provider status =========

    /** provider_id -> success/failed/notfound; nilai terakhir yang menang. */
    public Map<String, ProviderCounts> providerStats(ParsedMetrics pm) {
        Map<String, ProviderCounts> out = new LinkedHashMap<>();
        for (MetricSample m : new Index(pm.customMetrics()).withPeriods(PROVIDER_STATUS)) {
            String provider = m.labelOrDefault("provider_id", "unknown");
            String status = m.labelOrDefault("status", "unknown");
            ProviderCounts c = out.computeIfAbsent(provider, k -> new ProviderCounts());
            if ("success".equals(status)) c.success = m.value();
            else if ("failed".equals(status)) c.failed = m.value();
            else if ("notfound".equals(status)) c.notfound = m.value();
        }
        return out;
    }

    public List<ProviderStatusDTO> providerFailureRates(ParsedMetrics pm, int limit) {
        return providerStats(pm).entrySet().stream()
                .map(e -> {
                    ProviderCounts c = e.getValue();
                    double total = c.success + c.failed + c.notfound;
                    // dashboard lama menghasilkan NaN untuk total 0
                    double rate = total == 0 ? 0.0 : (c.failed / total) * 100.0;
                    return new ProviderStatusDTO(e.getKey(), c.success, c.failed, c.notfound, round(rate, 1));
                })
                .sorted(Comparator.comparingDouble(ProviderStatusDTO::failureRate).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    public StatusTotalsDTO statusTotals(ParsedMetrics pm) {
        List<MetricSample> statuses = new Index(pm.customMetrics()).withPeriods(PROVIDER_STATUS);
        return new StatusTotalsDTO(
                sumFinite(withLabel(statuses, "status", "success")),
                sumFinite(withLabel(statuses, "status", "failed")),
                sumFinite(withLabel(statuses, "status", "notfound"))
        );
    }

    // ========= Charts =========

    public List<LabeledValueDTO> providerToolUsage(ParsedMetrics pm) {
        return new Index(pm.customMetrics()).named(PROVIDER_TOOL).stream()
                .limit(CHART_LIMIT)
                .map(m -> new LabeledValueDTO(m.labelOrDefault("tool", "unknown"), m.value()))
                .toList();
    }

    public List<LabeledValueDTO> httpRequestCounts(ParsedMetrics pm) {
        return new Index(pm.httpMetrics()).named(HTTP_DURATION + "_count").stream()
                .limit(CHART_LIMIT)
                .map(m -> new LabeledValueDTO(routeKey(m), m.value()))
                .toList();
    }

    /** Rata-rata response time per "METHOD route" dalam ms = _sum / _count * 1000. */
    public List<LabeledValueDTO> routeResponseTimes(ParsedMetrics pm) {
        Map<String, RouteTiming> timings = new LinkedHashMap<>();
        for (MetricSample m : pm.httpMetrics()) {
            if (!m.name().startsWith(HTTP_DURATION)) continue;
            String route = m.label("route");
            String method = m.label("method");
            if (route == null || route.isEmpty() || method == null || method.isEmpty()) continue;

            RouteTiming t = timings.computeIfAbsent(method + " " + route, k -> new RouteTiming());
            if (m.name().equals(HTTP_DURATION + "_sum")) t.sum = m.value();
            else if (m.name().equals(HTTP_DURATION + "_count")) t.count = m.value();
        }

        // route tanpa _sum atau _count (atau count 0) dibuang
        return timings.entrySet().stream()
                .filter(e -> e.getValue().sum != null && e.getValue().count != null && e.getValue().count > 0)
                .map(e -> new LabeledValueDTO(e.getKey(), e.getValue().sum / e.getValue().count * 1000.0))
                .sorted(Comparator.comparingDouble(LabeledValueDTO::value).reversed())
                .limit(CHART_LIMIT)
                .toList();
    }

    // ========= Hostname table =========

    public List<HostnameStatDTO> hostnameStats(ParsedMetrics pm, String search) {
        // NaN/Inf dibuang dulu, sama seperti di sumFinite
        List<MetricSample> hosts = new Index(pm.customMetrics()).withPeriods(PROVIDER_HOSTNAME).stream()
                .filter(m -> Double.isFinite(m.value()))
                .toList();
        double total = sumFinite(hosts);
        String q = search == null ? "" : search.toLowerCase(Locale.ROOT);

        return hosts.stream()
                .map(m -> {
                    double pct = total == 0 ? 0.0 : m.value() / total * 100.0;
                    return new HostnameStatDTO(m.labelOrDefault("hostname", "unknown"), m.value(), pct);
                })
                .sorted(Comparator.comparingDouble(HostnameStatDTO::count).reversed())
                .filter(h -> h.hostname().toLowerCase(Locale.ROOT).contains(q))
                .collect(Collectors.toList());
    }

    // ========= Utils =========

    private static String routeKey(MetricSample m) {
        return m.labelOrDefault("method", "") + " " + m.labelOrDefault("route", "");
    }

    private static List<MetricSample> withLabel(List<MetricSample> samples, String key, String value) {
        return samples.stream().filter(m -> value.equals(m.label(key))).toList();
    }

    // NaN/Inf dilewati supaya total tidak ikut rusak
    private static double sumFinite(List<MetricSample> list) {
        return list.stream().mapToDouble(MetricSample::value).filter(Double::isFinite).sum();
    }

    private static double round(double v, int decimals) {
        double f = Math.pow(10, decimals);
        return Math.round(v * f) / f;
    }

    public static final class ProviderCounts {
        double success;
        double failed;
        double notfound;

        public double success() { return success; }
        public double failed() { return failed; }
        public double notfound() { return notfound; }
    }

    private static final class RouteTiming {
        Double sum;
        Double count;
    }

    // ========= Index untuk navigasi sample =========

    private static class Index {
        private final List<MetricSample> samples;
        Index(List<MetricSample> samples) { this.samples = samples; }

        List<MetricSample> named(String name) {
            return samples.stream().filter(s -> s.name().equals(name)).toList();
        }

        /** name, name_daily, name_weekly, name_monthly */
        List<MetricSample> withPeriods(String base) {
            Set<String> names = new HashSet<>();
            for (String suffix : PERIOD_SUFFIXES) names.add(base + suffix);
            return samples.stream().filter(s -> names.contains(s.name())).toList();
        }

        Optional<Double> firstValue(String name) {
            return samples.stream()
                    .filter(s -> s.name().equals(name))
                    .map(MetricSample::value)
                    .findFirst();
        }
    }
}
