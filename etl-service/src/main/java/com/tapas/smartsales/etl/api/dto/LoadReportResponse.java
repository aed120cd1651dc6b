package com.tapas.smartsales.etl.api.dto;

import com.tapas.smartsales.etl.loader.LoadReport;
import com.tapas.smartsales.etl.source.Rejection;

import java.time.Instant;
import java.util.List;

public record LoadReportResponse(
        String status,
        Instant startedAt,
        long elapsedMillis,
        int totalAccepted,
        int totalRejected,
        List<StageResponse> stages,
        List<RejectionResponse> rejections
) {
    public record StageResponse(String stage, int accepted, int rejected) {}

    public record RejectionResponse(String source, String recordKey, String reason) {
        static RejectionResponse from(Rejection rejection) {
            return new RejectionResponse(rejection.source(), rejection.recordKey(), rejection.reason());
        }
    }

    public static LoadReportResponse from(String status, LoadReport report) {
        return new LoadReportResponse(
                status,
                report.startedAt(),
                report.elapsed().toMillis(),
                report.totalAccepted(),
                report.totalRejected(),
                report.stages().stream()
                        .map(s -> new StageResponse(s.stage().name(), s.accepted(), s.rejected()))
                        .toList(),
                report.rejections().stream()
                        .map(RejectionResponse::from)
                        .toList()
        );
    }
}
