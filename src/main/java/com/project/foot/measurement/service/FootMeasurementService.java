package com.project.foot.measurement.service;

import com.project.foot.measurement.pipeline.BoundingBox;
import com.project.foot.measurement.pipeline.FootMeasurementPipeline;
import com.project.foot.measurement.pipeline.ImageEncoding;
import com.project.foot.measurement.pipeline.MeasurementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Spring-facing entry point of the measurement pipeline. Logs every outcome and leaves the
 * mapping to transport status codes to the controller.
 */
@Service
public class FootMeasurementService {
    private static final Logger log = LoggerFactory.getLogger(FootMeasurementService.class);

    private final FootMeasurementPipeline pipeline;

    public FootMeasurementService(FootMeasurementPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public MeasurementResult measureFoot(byte[] imageBytes, ImageEncoding encoding) {
        log.info("Starting foot measurement for {} image ({} bytes)", encoding, imageBytes.length);

        MeasurementResult result = pipeline.measure(imageBytes, encoding);

        if (result instanceof MeasurementResult.Success success) {
            BoundingBox box = success.boundingBox();
            log.info("Bounding box - width: {} pixels, height: {} pixels", box.width(), box.height());
            log.info("Foot size calculated: {} cm", success.lengthCm());
        } else if (result instanceof MeasurementResult.Failure failure) {
            log.warn("Foot measurement failed ({}): {}", failure.kind(), failure.detail());
        }
        return result;
    }
}
