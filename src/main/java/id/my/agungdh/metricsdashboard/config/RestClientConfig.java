package id.my.agungdh.metricsdashboard.config;

import id.my.agungdh.metricsdashboard.parser.PrometheusTextParser;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClient metricsRestClient(RestClient.Builder builder, DashboardProps props) {
        var settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .withReadTimeout(Duration.ofMillis(props.getReadTimeoutMs()));
        return builder
                .requestFactory(ClientHttpRequestFactories.get(settings))
                .defaultHeader(HttpHeaders.ACCEPT, "text/plain; version=0.0.4, */*;q=0.1")
                .build();
    }

    // parser tidak punya state, cukup satu instance
    @Bean
    public PrometheusTextParser prometheusTextParser() {
        return new PrometheusTextParser();
    }
}
