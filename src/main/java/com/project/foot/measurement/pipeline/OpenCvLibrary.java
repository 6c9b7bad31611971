package com.project.foot.measurement.pipeline;

import com.project.foot.measurement.exceptions.MeasurementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact, once per JVM.
 */
public final class OpenCvLibrary {
    private static final Logger log = LoggerFactory.getLogger(OpenCvLibrary.class);

    private static boolean loaded;

    private OpenCvLibrary() {
    }

    public static synchronized void load() {
        if (loaded) {
            return;
        }
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV loaded successfully");
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            log.error("Failed to load OpenCV", e);
            throw new MeasurementException("OpenCV native library could not be loaded", e);
        }
    }
}
