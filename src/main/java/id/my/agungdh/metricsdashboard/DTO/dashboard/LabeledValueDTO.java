package id.my.agungdh.metricsdashboard.DTO.dashboard;

public record LabeledValueDTO(String label, double value) {
}
