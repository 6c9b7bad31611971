package com.project.foot.measurement;

import com.project.foot.measurement.DTOs.DecodedUpload;
import com.project.foot.measurement.exceptions.InvalidImagePayloadException;
import com.project.foot.measurement.exceptions.PayloadTooLargeException;
import com.project.foot.measurement.pipeline.ImageEncoding;
import com.project.foot.measurement.service.ImageIngestionService;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

class ImageIngestionServiceTest {
    private final ImageIngestionService service = new ImageIngestionService(1024);

    private static String b64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    @Test
    void png_prefix_is_stripped_and_decoded() {
        DecodedUpload upload = service.decode("data:image/png;base64," + b64(new byte[]{1, 2, 3, 4}));

        assertThat(upload.encoding()).isEqualTo(ImageEncoding.PNG);
        assertThat(upload.bytes()).containsExactly(1, 2, 3, 4);
    }

    @Test
    void jpeg_prefix_declares_jpeg() {
        DecodedUpload upload = service.decode("data:image/jpeg;base64," + b64(new byte[]{9, 8, 7}));

        assertThat(upload.encoding()).isEqualTo(ImageEncoding.JPEG);
        assertThat(upload.bytes()).containsExactly(9, 8, 7);
    }

    @Test
    void line_breaks_inside_payload_are_tolerated() {
        String wrapped = Base64.getMimeEncoder(4, "\r\n".getBytes()).encodeToString(new byte[]{1, 2, 3, 4, 5, 6});

        DecodedUpload upload = service.decode("data:image/png;base64," + wrapped);

        assertThat(upload.bytes()).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void other_types_are_rejected() {
        assertThatThrownBy(() -> service.decode("data:image/gif;base64," + b64(new byte[]{1})))
                .isInstanceOf(InvalidImagePayloadException.class)
                .hasMessageContaining("Only PNG or JPG");
        assertThatThrownBy(() -> service.decode(b64(new byte[]{1, 2, 3})))
                .isInstanceOf(InvalidImagePayloadException.class);
        assertThatThrownBy(() -> service.decode("DATA:IMAGE/PNG;BASE64," + b64(new byte[]{1})))
                .isInstanceOf(InvalidImagePayloadException.class);
    }

    @Test
    void malformed_base64_is_rejected() {
        assertThatThrownBy(() -> service.decode("data:image/png;base64,***not base64***"))
                .isInstanceOf(InvalidImagePayloadException.class)
                .hasMessage("Invalid image format.");
    }

    @Test
    void empty_payload_is_rejected() {
        assertThatThrownBy(() -> service.decode("data:image/jpeg;base64,"))
                .isInstanceOf(InvalidImagePayloadException.class)
                .hasMessage("Invalid image format.");
    }

    @Test
    void blank_input_means_no_image() {
        assertThatThrownBy(() -> service.decode("  "))
                .isInstanceOf(InvalidImagePayloadException.class)
                .hasMessage("No image provided.");
        assertThatThrownBy(() -> service.decode(null))
                .isInstanceOf(InvalidImagePayloadException.class);
    }

    @Test
    void oversized_payload_is_rejected() {
        String big = "data:image/png;base64," + b64(new byte[2048]);

        assertThatThrownBy(() -> service.decode(big))
                .isInstanceOf(PayloadTooLargeException.class)
                .extracting("limitBytes").isEqualTo(1024L);
    }
}
