package com.ttennebkram.stickersplit.io;

import com.ttennebkram.stickersplit.model.ImageFormats;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks one output folder per image: {@code <name>_split} beside the image (or in a common
 * output directory), with {@code _2}, {@code _3}, ... appended when the name is taken on disk
 * or by an earlier image of the same batch.
 */
public final class OutputFolders {

    public static final String SUFFIX = "_split";

    private OutputFolders() {
    }

    /**
     * @param outputDirectory common parent for all folders, or null to use each image's directory
     * @return folders in input order
     */
    public static List<Path> resolve(List<Path> images, Path outputDirectory) {
        Set<Path> taken = new HashSet<>();
        List<Path> folders = new ArrayList<>(images.size());
        for (Path image : images) {
            Path parent = outputDirectory != null
                    ? outputDirectory.toAbsolutePath()
                    : image.toAbsolutePath().getParent();
            String base = ImageFormats.baseNameOf(image) + SUFFIX;
            Path candidate = parent.resolve(base);
            int n = 2;
            while (taken.contains(candidate) || Files.exists(candidate)) {
                candidate = parent.resolve(base + "_" + n);
                n++;
            }
            taken.add(candidate);
            folders.add(candidate);
        }
        return folders;
    }
}
