package com.project.foot.measurement.exceptions;

/** Unexpected failure inside the measurement pipeline, distinct from its domain outcomes. */
public class MeasurementException extends RuntimeException {
    public MeasurementException(String message) { super(message); }
    public MeasurementException(String message, Throwable cause) { super(message, cause); }
}
