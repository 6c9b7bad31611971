package com.project.foot.measurement.DTOs;

import com.project.foot.measurement.pipeline.ImageEncoding;

/** Raw image bytes recovered from a data URI, with the encoding its prefix declared. */
public record DecodedUpload(byte[] bytes, ImageEncoding encoding) {}
