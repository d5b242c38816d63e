package com.ttennebkram.stickersplit.model;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * File-level limits: which extensions are accepted, how many images a batch may hold,
 * and the size under which split results are usually poor.
 */
public final class ImageFormats {

    public static final List<String> SUPPORTED_EXTENSIONS =
            Collections.unmodifiableList(Arrays.asList("jpg", "jpeg", "png", "bmp", "webp"));

    public static final int MAX_BATCH_SIZE = 10;

    /** Below this edge length (px) a split is allowed but logged as likely poor. */
    public static final int MIN_RECOMMENDED_SIZE = 100;

    private ImageFormats() {
    }

    public static String extensionOf(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String baseNameOf(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    public static boolean isSupported(Path file) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(file));
    }

    public static void requireSupported(Path file) {
        if (!isSupported(file)) {
            throw new InputException("Unsupported file format: ." + extensionOf(file)
                    + " (supported: " + String.join("/", SUPPORTED_EXTENSIONS) + ")");
        }
    }

    public static void requireBatchSize(int count) {
        if (count < 1) {
            throw new ParameterException("At least one image is required");
        }
        if (count > MAX_BATCH_SIZE) {
            throw new ParameterException("Too many images: " + count + " (limit " + MAX_BATCH_SIZE + ")");
        }
    }

    public static boolean isSmall(int width, int height) {
        return width < MIN_RECOMMENDED_SIZE || height < MIN_RECOMMENDED_SIZE;
    }
}
