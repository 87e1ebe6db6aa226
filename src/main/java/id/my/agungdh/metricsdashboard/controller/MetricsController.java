package id.my.agungdh.metricsdashboard.controller;

import id.my.agungdh.metricsdashboard.DTO.api.SourceRequest;
import id.my.agungdh.metricsdashboard.DTO.dashboard.DashboardSummaryDTO;
import id.my.agungdh.metricsdashboard.DTO.dashboard.HostnameStatDTO;
import id.my.agungdh.metricsdashboard.DTO.metrics.MetricsSnapshot;
import id.my.agungdh.metricsdashboard.DTO.metrics.ParsedMetrics;
import id.my.agungdh.metricsdashboard.config.DashboardProps;
import id.my.agungdh.metricsdashboard.scheduler.AutoRefreshScheduler;
import id.my.agungdh.metricsdashboard.service.DashboardStatsService;
import id.my.agungdh.metricsdashboard.service.MetricsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/metrics")
@RequiredArgsConstructor
public class MetricsController {
    private final MetricsService metricsService;
    private final DashboardStatsService statsService;
    private final AutoRefreshScheduler autoRefresh;
    private final DashboardProps props;

    // ========================= Source =========================

    @PostMapping("/source")
    public MetricsSnapshot load(@Valid @RequestBody SourceRequest req) {
        return metricsService.load(req.url().trim());
    }

    @PostMapping("/refresh")
    public MetricsSnapshot refresh() {
        return metricsService.refresh();
    }

    @PostMapping(path = "/import", consumes = MediaType.TEXT_PLAIN_VALUE)
    public MetricsSnapshot importText(@RequestBody byte[] body) {
        return metricsService.importBytes(body);
    }

    @PostMapping(path = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public MetricsSnapshot importFile(@RequestParam("file") MultipartFile file) throws IOException {
        return metricsService.importBytes(file.getBytes());
    }

    // ========================= Read =========================

    @GetMapping
    public ParsedMetrics current() {
        return metricsService.current()
                .map(MetricsSnapshot::metrics)
                .orElse(ParsedMetrics.empty());
    }

    @GetMapping(path = "/raw", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> raw() {
        return metricsService.current()
                .map(s -> ResponseEntity.ok(s.rawText()))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardSummaryDTO> dashboard(@RequestParam(name = "top", required = false) Integer top) {
        int limit = top == null ? props.getTopProviders() : top;
        return metricsService.current()
                .map(s -> ResponseEntity.ok(statsService.summarize(s, limit)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/hostnames")
    public List<HostnameStatDTO> hostnames(@RequestParam(name = "q", required = false) String q) {
        return metricsService.current()
                .map(s -> statsService.hostnameStats(s.metrics(), q))
                .orElse(List.of());
    }

    // ========================= Auto refresh =========================

    @GetMapping("/auto-refresh")
    public Map<String, Object> autoRefreshState() {
        return Map.of(
                "enabled", autoRefresh.isEnabled(),
                "intervalMs", props.getAutoRefreshIntervalMs()
        );
    }

    @PutMapping("/auto-refresh")
    public Map<String, Object> setAutoRefresh(@RequestParam("enabled") boolean enabled) {
        autoRefresh.setEnabled(enabled);
        return autoRefreshState();
    }
}
