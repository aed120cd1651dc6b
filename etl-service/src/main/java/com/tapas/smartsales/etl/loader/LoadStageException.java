package com.tapas.smartsales.etl.loader;

/**
 * A load stage failed while writing. The load transaction is rolled back, so the
 * warehouse keeps the state it had before the run; the report shows what had
 * been processed up to the failure.
 */
public class LoadStageException extends RuntimeException {

    private final LoadStage stage;
    private final LoadReport report;

    public LoadStageException(LoadStage stage, LoadReport report, Throwable cause) {
        super("Load failed at stage " + stage + " after " + report.totalAccepted() + " accepted and "
                + report.totalRejected() + " rejected records; warehouse rolled back to its prior state", cause);
        this.stage = stage;
        this.report = report;
    }

    public LoadStage getStage() {
        return stage;
    }

    public LoadReport getReport() {
        return report;
    }
}
