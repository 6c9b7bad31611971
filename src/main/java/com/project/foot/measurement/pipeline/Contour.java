package com.project.foot.measurement.pipeline;

import java.awt.Point;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Closed boundary traced from an edge map. Only the points needed to describe each
 * straight segment are kept; the last point connects back to the first.
 */
public final class Contour {

    /** Raster-scan order of the top-most, left-most point of each contour. */
    public static final Comparator<Contour> RASTER_ORDER =
            Comparator.comparingInt(Contour::anchorY).thenComparingInt(Contour::anchorX);

    private final int[] xs;
    private final int[] ys;
    private final int anchorX;
    private final int anchorY;

    Contour(int[] xs, int[] ys) {
        if (xs.length == 0 || xs.length != ys.length) {
            throw new IllegalArgumentException("A contour needs at least one point and matching coordinates");
        }
        this.xs = Arrays.copyOf(xs, xs.length);
        this.ys = Arrays.copyOf(ys, ys.length);

        int ax = this.xs[0], ay = this.ys[0];
        for (int i = 1; i < this.xs.length; i++) {
            if (this.ys[i] < ay || (this.ys[i] == ay && this.xs[i] < ax)) {
                ax = this.xs[i];
                ay = this.ys[i];
            }
        }
        this.anchorX = ax;
        this.anchorY = ay;
    }

    public static Contour of(Point... points) {
        int[] xs = new int[points.length];
        int[] ys = new int[points.length];
        for (int i = 0; i < points.length; i++) {
            xs[i] = points[i].x;
            ys[i] = points[i].y;
        }
        return new Contour(xs, ys);
    }

    static Contour of(org.opencv.core.Point[] points) {
        int[] xs = new int[points.length];
        int[] ys = new int[points.length];
        for (int i = 0; i < points.length; i++) {
            xs[i] = (int) Math.round(points[i].x);
            ys[i] = (int) Math.round(points[i].y);
        }
        return new Contour(xs, ys);
    }

    public int size() {
        return xs.length;
    }

    public Point point(int index) {
        return new Point(xs[index], ys[index]);
    }

    int anchorX() {
        return anchorX;
    }

    int anchorY() {
        return anchorY;
    }

    /** Absolute polygon area (shoelace formula); a degenerate line or point encloses nothing. */
    public double area() {
        long twiceArea = 0;
        for (int i = 0, j = xs.length - 1; i < xs.length; j = i++) {
            twiceArea += (long) xs[j] * ys[i] - (long) xs[i] * ys[j];
        }
        return Math.abs(twiceArea) / 2.0;
    }

    public BoundingBox boundingBox() {
        int minX = xs[0], maxX = xs[0], minY = ys[0], maxY = ys[0];
        for (int i = 1; i < xs.length; i++) {
            minX = Math.min(minX, xs[i]);
            maxX = Math.max(maxX, xs[i]);
            minY = Math.min(minY, ys[i]);
            maxY = Math.max(maxY, ys[i]);
        }
        return new BoundingBox(minX, minY, maxX - minX + 1, maxY - minY + 1);
    }

    @Override
    public String toString() {
        return "Contour{points=" + xs.length + ", anchor=(" + anchorX + "," + anchorY + ")}";
    }
}
