package id.my.agungdh.metricsdashboard.DTO.api;

/**
 * Bentuk error untuk UI (title + description), sama seperti toast "destructive" di dashboard lama.
 */
public record ApiErrorDTO(String title, String description) {
}
