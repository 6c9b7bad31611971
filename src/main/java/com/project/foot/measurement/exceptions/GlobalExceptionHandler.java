package com.project.foot.measurement.exceptions;

import com.project.foot.measurement.DTOs.FootSizeResponse;
import com.project.foot.measurement.controller.FootMeasurementController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures of the measurement API to JSON {@code {message}} bodies. Domain outcomes of the
 * pipeline never reach this class; the controller maps those itself.
 */
@RestControllerAdvice(assignableTypes = FootMeasurementController.class)
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String NO_IMAGE_MESSAGE = "No image provided.";
    static final String STORAGE_ERROR_MESSAGE = "Error saving the image.";
    static final String PROCESSING_ERROR_MESSAGE = "Error processing the image.";

    @ExceptionHandler(InvalidImagePayloadException.class)
    public ResponseEntity<FootSizeResponse> handleInvalidPayload(InvalidImagePayloadException ex) {
        log.warn("Rejected image payload: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<FootSizeResponse> handleMissingImage(Exception ex) {
        log.warn("Request without image data: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, NO_IMAGE_MESSAGE);
    }

    @ExceptionHandler(PayloadTooLargeException.class)
    public ResponseEntity<FootSizeResponse> handlePayloadTooLarge(PayloadTooLargeException ex) {
        log.warn("Image payload too large: {}", ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE,
                "Image is too large. Maximum size: " + ex.getLimitBytes() / (1024 * 1024) + "MB");
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<FootSizeResponse> handleStorage(StorageException ex) {
        log.error("Error saving the image", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, STORAGE_ERROR_MESSAGE);
    }

    @ExceptionHandler(MeasurementException.class)
    public ResponseEntity<FootSizeResponse> handleMeasurement(MeasurementException ex) {
        log.error("Measurement pipeline failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, PROCESSING_ERROR_MESSAGE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<FootSizeResponse> handleUnknownException(Exception ex) {
        log.error("Unhandled error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, PROCESSING_ERROR_MESSAGE);
    }

    private static ResponseEntity<FootSizeResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(FootSizeResponse.error(message));
    }
}
