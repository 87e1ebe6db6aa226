package id.my.agungdh.metricsdashboard.bootstrap;

import id.my.agungdh.metricsdashboard.config.DashboardProps;
import id.my.agungdh.metricsdashboard.service.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Load {@code dashboard.default-url} sekali saat aplikasi siap, kalau diisi.
 */
@Component
public class DefaultSourceLoader {
    private static final Logger log = LoggerFactory.getLogger(DefaultSourceLoader.class);

    private final MetricsService metricsService;
    private final DashboardProps props;

    public DefaultSourceLoader(MetricsService metricsService, DashboardProps props) {
        this.metricsService = metricsService;
        this.props = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        String url = props.getDefaultUrl();
        if (url == null || url.isBlank()) return;
        try {
            var snap = metricsService.load(url);
            log.info("Initial metrics load OK: {} samples from {}", snap.metrics().size(), url);
        } catch (Exception e) {
            // source tetap terpilih; auto-refresh / refresh manual bisa mencoba lagi
            log.warn("Initial metrics load from {} failed: {}", url, e.getMessage());
        }
    }
}
