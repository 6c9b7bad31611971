package com.project.foot.measurement.pipeline;

/**
 * Axis-aligned rectangle enclosing a contour. Coordinates follow the image pixel grid
 * with the origin in the top-left corner; width and height count pixels inclusively.
 */
public record BoundingBox(int x, int y, int width, int height) {

    public BoundingBox {
        if (width <= 0) {
            throw new IllegalArgumentException("Bounding box width must be positive");
        }
        if (height <= 0) {
            throw new IllegalArgumentException("Bounding box height must be positive");
        }
    }
}
