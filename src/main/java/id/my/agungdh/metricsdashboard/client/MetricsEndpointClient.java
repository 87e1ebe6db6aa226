package id.my.agungdh.metricsdashboard.client;

import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Ambil raw body dari endpoint /metrics. Tidak ada retry; timeout diatur di {@code RestClientConfig}.
 */
@Component
public class MetricsEndpointClient {

    private static final byte[] EMPTY = new byte[0];

    private final RestClient http;

    public MetricsEndpointClient(RestClient metricsRestClient) {
        this.http = metricsRestClient;
    }

    /**
     * Body dikembalikan sebagai byte supaya decoding UTF-8 (dan error-nya) diurus parser.
     */
    public byte[] fetch(String url) {
        try {
            ResponseEntity<byte[]> resp = http.get().uri(url).retrieve().toEntity(byte[].class);
            byte[] body = resp.getBody();
            return body == null ? EMPTY : body;
        } catch (RestClientResponseException e) {
            String status = e.getStatusText();
            if (status == null || status.isBlank()) status = String.valueOf(e.getStatusCode().value());
            throw new MetricsFetchException("Failed to fetch metrics: " + status, e.getStatusCode().value(), e);
        } catch (RestClientException | IllegalArgumentException e) {
            // IllegalArgumentException: URL tidak absolut / tidak valid
            throw new MetricsFetchException("Failed to fetch metrics: " + e.getMessage(), null, e);
        }
    }
}
