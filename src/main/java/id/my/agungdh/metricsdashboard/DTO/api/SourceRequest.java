package id.my.agungdh.metricsdashboard.DTO.api;

import jakarta.validation.constraints.NotBlank;

public record SourceRequest(
        @NotBlank String url
) {
}
