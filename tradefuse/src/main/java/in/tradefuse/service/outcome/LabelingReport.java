package in.tradefuse.service.outcome;

public record LabelingReport(
    int examined,
    int labeled,
    int skipped,
    int failures
) {
}
