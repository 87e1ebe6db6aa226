package id.my.agungdh.metricsdashboard.controller;

import id.my.agungdh.metricsdashboard.DTO.api.ApiErrorDTO;
import id.my.agungdh.metricsdashboard.client.MetricsFetchException;
import id.my.agungdh.metricsdashboard.parser.MetricsParseException;
import id.my.agungdh.metricsdashboard.service.NoMetricsSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Error fatal saja yang sampai ke user; baris metrics yang rusak sudah dibuang di parser.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MetricsFetchException.class)
    public ResponseEntity<ApiErrorDTO> fetchFailed(MetricsFetchException e) {
        log.warn("{}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ApiErrorDTO("Error", e.getMessage()));
    }

    @ExceptionHandler(MetricsParseException.class)
    public ResponseEntity<ApiErrorDTO> parseFailed(MetricsParseException e) {
        log.warn("Failed to parse metrics: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ApiErrorDTO("Error parsing file", e.getMessage()));
    }

    @ExceptionHandler(NoMetricsSourceException.class)
    public ResponseEntity<ApiErrorDTO> noSource(NoMetricsSourceException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ApiErrorDTO("Error", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorDTO> invalid(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(new ApiErrorDTO("Error", msg));
    }
}
