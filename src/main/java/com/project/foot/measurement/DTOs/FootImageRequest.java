package com.project.foot.measurement.DTOs;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /upload_image}: a {@code data:image/...;base64,} URI. */
public record FootImageRequest(
        @NotBlank(message = "No image provided.") String image
) {}
