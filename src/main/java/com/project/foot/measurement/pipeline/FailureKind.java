package com.project.foot.measurement.pipeline;

public enum FailureKind {
    /** The bytes could not be parsed as the declared encoding. */
    DECODE_ERROR,
    /** Processing succeeded but no outer contour was found. */
    NO_CONTOUR_FOUND
}
