package com.project.foot.measurement.pipeline;

import java.util.Objects;

/**
 * Outcome of one pipeline invocation: either a length in centimeters or a domain failure.
 */
public sealed interface MeasurementResult permits MeasurementResult.Success, MeasurementResult.Failure {

    record Success(double lengthCm, BoundingBox boundingBox) implements MeasurementResult {
        public Success {
            Objects.requireNonNull(boundingBox, "boundingBox");
        }
    }

    record Failure(FailureKind kind, String detail) implements MeasurementResult {
        public Failure {
            Objects.requireNonNull(kind, "kind");
        }
    }

    static MeasurementResult success(double lengthCm, BoundingBox boundingBox) {
        return new Success(lengthCm, boundingBox);
    }

    static MeasurementResult failure(FailureKind kind, String detail) {
        return new Failure(kind, detail);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
