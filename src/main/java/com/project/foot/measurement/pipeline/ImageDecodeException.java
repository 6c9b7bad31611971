package com.project.foot.measurement.pipeline;

/**
 * Raised by {@link ImageDecoder} when a buffer cannot be parsed as its declared encoding.
 * The pipeline turns it into a {@link FailureKind#DECODE_ERROR} result.
 */
public class ImageDecodeException extends Exception {
    public ImageDecodeException(String message) { super(message); }
    public ImageDecodeException(String message, Throwable cause) { super(message, cause); }
}
