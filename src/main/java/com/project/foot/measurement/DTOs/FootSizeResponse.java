package com.project.foot.measurement.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FootSizeResponse(
        String message,
        @JsonProperty("foot_size_cm") Double footSizeCm
) {
    public static FootSizeResponse measured(String message, double footSizeCm) {
        return new FootSizeResponse(message, footSizeCm);
    }

    public static FootSizeResponse error(String message) {
        return new FootSizeResponse(message, null);
    }
}
