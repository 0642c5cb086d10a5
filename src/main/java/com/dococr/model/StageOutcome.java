package com.dococr.model;

import java.util.Objects;

/**
 * Outcome of a best-effort enhancement stage. A stage either returns a corrected value or hands
 * back its input untouched together with the reason, it never fails the request.
 *
 * @param <T> the value flowing through the stage
 */
public record StageOutcome<T>(T value, Status status, String detail) {

    public enum Status {
        CORRECTED,
        UNCHANGED
    }

    public StageOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static <T> StageOutcome<T> corrected(T value, String detail) {
        return new StageOutcome<>(value, Status.CORRECTED, detail);
    }

    public static <T> StageOutcome<T> unchanged(T value, String reason) {
        return new StageOutcome<>(value, Status.UNCHANGED, reason);
    }

    public boolean isCorrected() {
        return status == Status.CORRECTED;
    }
}
