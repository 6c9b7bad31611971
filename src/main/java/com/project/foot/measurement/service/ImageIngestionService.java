package com.project.foot.measurement.service;

import com.project.foot.measurement.DTOs.DecodedUpload;
import com.project.foot.measurement.exceptions.InvalidImagePayloadException;
import com.project.foot.measurement.exceptions.PayloadTooLargeException;
import com.project.foot.measurement.pipeline.ImageEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates and unpacks {@code data:image/png;base64,...} and {@code data:image/jpeg;base64,...}
 * URIs. The prefix alone decides the declared encoding; the payload is not sniffed here.
 */
@Service
public class ImageIngestionService {
    private static final Logger log = LoggerFactory.getLogger(ImageIngestionService.class);

    static final String UNSUPPORTED_TYPE_MESSAGE = "Image type not allowed. Only PNG or JPG are accepted.";
    static final String INVALID_FORMAT_MESSAGE = "Invalid image format.";

    private static final Map<String, ImageEncoding> ALLOWED_PREFIXES = Map.of(
            dataUriPrefix(ImageEncoding.PNG), ImageEncoding.PNG,
            dataUriPrefix(ImageEncoding.JPEG), ImageEncoding.JPEG
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final long maxPayloadBytes;

    public ImageIngestionService(@Value("${app.upload.max-payload-bytes:10485760}") long maxPayloadBytes) {
        this.maxPayloadBytes = maxPayloadBytes;
    }

    public DecodedUpload decode(String dataUri) {
        if (dataUri == null || dataUri.isBlank()) {
            throw new InvalidImagePayloadException("No image provided.");
        }
        if (dataUri.length() > maxPayloadBytes) {
            throw new PayloadTooLargeException(maxPayloadBytes);
        }

        for (Map.Entry<String, ImageEncoding> allowed : ALLOWED_PREFIXES.entrySet()) {
            String prefix = allowed.getKey();
            if (dataUri.startsWith(prefix)) {
                byte[] bytes = decodeBase64(dataUri.substring(prefix.length()));
                log.info("Image decoded successfully ({} bytes, {})", bytes.length, allowed.getValue());
                return new DecodedUpload(bytes, allowed.getValue());
            }
        }

        log.warn("Rejected image with unsupported prefix: {}", abbreviate(dataUri));
        throw new InvalidImagePayloadException(UNSUPPORTED_TYPE_MESSAGE);
    }

    private static String dataUriPrefix(ImageEncoding encoding) {
        return "data:" + encoding.mimeType() + ";base64,";
    }

    private static byte[] decodeBase64(String payload) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(WHITESPACE.matcher(payload).replaceAll(""));
        } catch (IllegalArgumentException e) {
            throw new InvalidImagePayloadException(INVALID_FORMAT_MESSAGE, e);
        }
        if (bytes.length == 0) {
            throw new InvalidImagePayloadException(INVALID_FORMAT_MESSAGE);
        }
        return bytes;
    }

    private static String abbreviate(String value) {
        int comma = value.indexOf(',');
        String head = comma >= 0 ? value.substring(0, comma) : value;
        return head.length() > 40 ? head.substring(0, 40) + "..." : head;
    }
}
