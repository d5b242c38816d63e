package com.ttennebkram.stickersplit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the bundled OpenCV native library exactly once per JVM.
 * Every entry point that creates a Mat calls {@link #load()} first.
 */
public final class OpenCvLoader {

    private static final Logger LOG = LoggerFactory.getLogger(OpenCvLoader.class);

    private static volatile boolean loaded = false;

    private OpenCvLoader() {
    }

    /**
     * Load the native library if it is not loaded yet. Safe to call repeatedly.
     */
    public static void load() {
        if (loaded) {
            return;
        }
        synchronized (OpenCvLoader.class) {
            if (loaded) {
                return;
            }
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            LOG.debug("OpenCV native library loaded ({})", org.opencv.core.Core.VERSION);
        }
    }

    public static boolean isLoaded() {
        return loaded;
    }
}
