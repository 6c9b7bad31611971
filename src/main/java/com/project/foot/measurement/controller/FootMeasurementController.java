package com.project.foot.measurement.controller;

import com.project.foot.measurement.DTOs.DecodedUpload;
import com.project.foot.measurement.DTOs.FootImageRequest;
import com.project.foot.measurement.DTOs.FootSizeResponse;
import com.project.foot.measurement.pipeline.FailureKind;
import com.project.foot.measurement.pipeline.MeasurementResult;
import com.project.foot.measurement.service.FootMeasurementService;
import com.project.foot.measurement.service.ImageIngestionService;
import com.project.foot.measurement.service.StorageService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FootMeasurementController {
    private static final Logger log = LoggerFactory.getLogger(FootMeasurementController.class);

    static final String SUCCESS_MESSAGE = "Image processed successfully!";
    static final String NOT_DETECTED_MESSAGE = "Could not detect the foot in the image.";
    static final String DECODE_ERROR_MESSAGE = "Could not decode the image.";

    private final ImageIngestionService ingestionService;
    private final StorageService storageService;
    private final FootMeasurementService measurementService;

    public FootMeasurementController(ImageIngestionService ingestionService,
                                     StorageService storageService,
                                     FootMeasurementService measurementService) {
        this.ingestionService = ingestionService;
        this.storageService = storageService;
        this.measurementService = measurementService;
    }

    @PostMapping(value = "/upload_image",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FootSizeResponse> uploadImage(@Valid @RequestBody FootImageRequest request) {
        DecodedUpload upload = ingestionService.decode(request.image());

        var stored = storageService.store(upload.bytes(), upload.encoding());
        log.debug("Measuring stored image {}", stored.filename());

        MeasurementResult result = measurementService.measureFoot(upload.bytes(), upload.encoding());
        return toResponse(result);
    }

    private ResponseEntity<FootSizeResponse> toResponse(MeasurementResult result) {
        if (result instanceof MeasurementResult.Success success) {
            return ResponseEntity.ok(FootSizeResponse.measured(SUCCESS_MESSAGE, success.lengthCm()));
        }
        MeasurementResult.Failure failure = (MeasurementResult.Failure) result;
        String message = failure.kind() == FailureKind.DECODE_ERROR ? DECODE_ERROR_MESSAGE : NOT_DETECTED_MESSAGE;
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(FootSizeResponse.error(message));
    }
}
