package com.project.foot.measurement.pipeline;

/**
 * Encodings accepted by the pipeline. The caller labels the payload; the decoder
 * parses the bytes strictly as the labelled format.
 */
public enum ImageEncoding {
    PNG("png", "png", "image/png"),
    JPEG("jpeg", "jpg", "image/jpeg");

    private final String formatName;
    private final String fileExtension;
    private final String mimeType;

    ImageEncoding(String formatName, String fileExtension, String mimeType) {
        this.formatName = formatName;
        this.fileExtension = fileExtension;
        this.mimeType = mimeType;
    }

    /** ImageIO format name used to look up a reader. */
    public String formatName() {
        return formatName;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public String mimeType() {
        return mimeType;
    }
}
