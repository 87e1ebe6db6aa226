package id.my.agungdh.metricsdashboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "dashboard")
public class DashboardProps {

    // URL /metrics yang di-load saat startup (kosong = tunggu user submit)
    private String defaultUrl;

    private boolean autoRefreshEnabled = false;

    // default 30 detik, sama seperti dashboard lama
    private long autoRefreshIntervalMs = 30_000L;

    private long connectTimeoutMs = 5_000L;
    private long readTimeoutMs = 10_000L;

    private int topProviders = 10;

    public String getDefaultUrl() { return defaultUrl; }
    public void setDefaultUrl(String defaultUrl) { this.defaultUrl = defaultUrl; }

    public boolean isAutoRefreshEnabled() { return autoRefreshEnabled; }
    public void setAutoRefreshEnabled(boolean autoRefreshEnabled) { this.autoRefreshEnabled = autoRefreshEnabled; }

    public long getAutoRefreshIntervalMs() { return autoRefreshIntervalMs; }
    public void setAutoRefreshIntervalMs(long autoRefreshIntervalMs) { this.autoRefreshIntervalMs = autoRefreshIntervalMs; }

    public long getConnectTimeoutMs() { return connectTimeoutMs; }
    public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

    public long getReadTimeoutMs() { return readTimeoutMs; }
    public void setReadTimeoutMs(long readTimeoutMs) { this.readTimeoutMs = readTimeoutMs; }

    public int getTopProviders() { return topProviders; }
    public void setTopProviders(int topProviders) { this.topProviders = topProviders; }
}
