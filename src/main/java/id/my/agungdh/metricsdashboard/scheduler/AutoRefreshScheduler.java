package id.my.agungdh.metricsdashboard.scheduler;

import id.my.agungdh.metricsdashboard.config.DashboardProps;
import id.my.agungdh.metricsdashboard.service.MetricsCache;
import id.my.agungdh.metricsdashboard.service.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Re-fetch source aktif secara periodik kalau auto-refresh dinyalakan.
 * Kalau gagal, snapshot lama tetap di cache.
 */
@Component
public class AutoRefreshScheduler {
    private static final Logger log = LoggerFactory.getLogger(AutoRefreshScheduler.class);

    private final MetricsService metricsService;
    private final AtomicBoolean enabled;

    public AutoRefreshScheduler(MetricsService metricsService, DashboardProps props) {
        this.metricsService = metricsService;
        this.enabled = new AtomicBoolean(props.isAutoRefreshEnabled());
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public void setEnabled(boolean on) {
        if (enabled.getAndSet(on) != on) {
            log.info("Auto-refresh {}", on ? "enabled" : "disabled");
        }
    }

    @Scheduled(fixedDelayString = "${dashboard.auto-refresh-interval-ms:30000}",
            initialDelayString = "${dashboard.auto-refresh-interval-ms:30000}")
    public void tick() {
        if (!enabled.get()) return;

        var source = metricsService.currentSource();
        // hanya source URL yang bisa di-fetch ulang
        if (source.isEmpty() || MetricsCache.IMPORTED.equals(source.get())) return;

        try {
            metricsService.refresh();
        } catch (Exception e) {
            log.warn("Auto-refresh of {} failed: {}", source.get(), e.getMessage());
        }
    }
}
