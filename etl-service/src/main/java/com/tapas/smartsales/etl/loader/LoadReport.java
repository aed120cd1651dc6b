package com.tapas.smartsales.etl.loader;

import com.tapas.smartsales.etl.source.Rejection;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one loader run: per-stage accepted and rejected counts plus every
 * rejected record with its key and reason.
 */
public record LoadReport(
        Instant startedAt,
        Duration elapsed,
        List<StageResult> stages,
        List<Rejection> rejections) {

    public LoadReport {
        stages = List.copyOf(stages);
        rejections = List.copyOf(rejections);
    }

    public record StageResult(LoadStage stage, int accepted, int rejected) {
    }

    public int accepted(LoadStage stage) {
        return stages.stream().filter(s -> s.stage() == stage).mapToInt(StageResult::accepted).sum();
    }

    public int rejected(LoadStage stage) {
        return stages.stream().filter(s -> s.stage() == stage).mapToInt(StageResult::rejected).sum();
    }

    public int totalAccepted() {
        return stages.stream().mapToInt(StageResult::accepted).sum();
    }

    public int totalRejected() {
        return rejections.size();
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {

        private final Instant startedAt = Instant.now();
        private final Map<LoadStage, Integer> accepted = new EnumMap<>(LoadStage.class);
        private final Map<LoadStage, Integer> rejected = new EnumMap<>(LoadStage.class);
        private final List<Rejection> rejections = new ArrayList<>();

        void accept(LoadStage stage, int count) {
            accepted.merge(stage, count, Integer::sum);
        }

        void reject(LoadStage stage, Rejection rejection) {
            rejected.merge(stage, 1, Integer::sum);
            rejections.add(rejection);
        }

        LoadReport build() {
            List<StageResult> stages = new ArrayList<>();
            for (LoadStage stage : LoadStage.values()) {
                if (accepted.containsKey(stage) || rejected.containsKey(stage)) {
                    stages.add(new StageResult(stage,
                            accepted.getOrDefault(stage, 0),
                            rejected.getOrDefault(stage, 0)));
                }
            }
            return new LoadReport(startedAt, Duration.between(startedAt, Instant.now()), stages, rejections);
        }
    }
}
