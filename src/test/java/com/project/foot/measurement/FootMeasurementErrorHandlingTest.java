package com.project.foot.measurement;

import com.project.foot.measurement.exceptions.MeasurementException;
import com.project.foot.measurement.exceptions.StorageException;
import com.project.foot.measurement.pipeline.ImageEncoding;
import com.project.foot.measurement.service.FootMeasurementService;
import com.project.foot.measurement.service.StorageService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {"app.upload.dir=target/test-uploads", "app.upload.max-payload-bytes=64"})
@AutoConfigureMockMvc
class FootMeasurementErrorHandlingTest {

    // "hello" in base64
    private static final String BODY = "{\"image\":\"data:image/png;base64,aGVsbG8=\"}";

    @Autowired MockMvc mvc;
    @MockBean StorageService storageService;
    @MockBean FootMeasurementService measurementService;

    @Test
    void pipeline_failure_maps_to_500() throws Exception {
        when(storageService.store(any(), eq(ImageEncoding.PNG)))
                .thenReturn(new StorageService.StoredFile(Path.of("x.png"), "x.png"));
        when(measurementService.measureFoot(any(), eq(ImageEncoding.PNG)))
                .thenThrow(new MeasurementException("native crash"));

        mvc.perform(post("/upload_image").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Error processing the image."));
    }

    @Test
    void storage_failure_maps_to_500_and_skips_measurement() throws Exception {
        when(storageService.store(any(), any())).thenThrow(new StorageException("disk full"));

        mvc.perform(post("/upload_image").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Error saving the image."));

        verify(measurementService, never()).measureFoot(any(), any());
    }

    @Test
    void unexpected_failure_maps_to_500() throws Exception {
        when(storageService.store(any(), any())).thenThrow(new IllegalStateException("boom"));

        mvc.perform(post("/upload_image").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Error processing the image."));
    }

    @Test
    void oversized_payload_maps_to_413() throws Exception {
        String big = "{\"image\":\"data:image/png;base64," + "A".repeat(200) + "\"}";

        mvc.perform(post("/upload_image").contentType(MediaType.APPLICATION_JSON).content(big))
                .andExpect(status().isPayloadTooLarge());
    }
}
