package com.project.foot.measurement.exceptions;

/** The request's data URI was rejected before reaching the pipeline. */
public class InvalidImagePayloadException extends RuntimeException {
    public InvalidImagePayloadException(String message) { super(message); }
    public InvalidImagePayloadException(String message, Throwable cause) { super(message, cause); }
}
