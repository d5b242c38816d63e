package com.ttennebkram.stickersplit.io;

import com.ttennebkram.stickersplit.model.OutputFormat;
import com.ttennebkram.stickersplit.model.Tile;
import com.ttennebkram.stickersplit.processing.CancellationToken;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.stream.Stream;

/**
 * Writes tiles with OpenCV's encoders. Files go to a hidden staging folder next to the
 * final one and are moved into place only once every tile has been attempted, so a
 * cancelled image leaves nothing behind.
 */
public class FileTileWriter implements TileWriter {

    private static final Logger LOG = LoggerFactory.getLogger(FileTileWriter.class);

    @Override
    public SaveReport write(List<Tile> tiles, Path folder, String baseName, NamingTemplate template,
                            OutputFormat format, CancellationToken token) {
        List<SaveReport.FileFailure> failures = new ArrayList<>();
        List<String> staged = new ArrayList<>();
        Set<String> used = new HashSet<>();
        Path staging = stagingFolder(folder);
        try {
            deleteRecursively(staging);
            Files.createDirectories(staging);
        } catch (IOException e) {
            throw new UncheckedOutputException("Cannot create staging folder " + staging, e);
        }

        try {
            for (int i = 0; i < tiles.size(); i++) {
                token.throwIfCancelled();
                Tile tile = tiles.get(i);
                String fileName = template.fileName(i, tile.rowIndex(), tile.colIndex(), baseName, format);
                if (!used.add(fileName)) {
                    LOG.warn("Not writing tile {}: {} is already taken by an earlier tile", i + 1, fileName);
                    failures.add(new SaveReport.FileFailure(fileName, "duplicate file name for tile " + (i + 1)));
                    continue;
                }
                try {
                    encode(tile.image().view(), staging.resolve(fileName), format);
                    staged.add(fileName);
                } catch (IOException | CvException e) {
                    LOG.warn("Failed to write {}: {}", fileName, e.getMessage());
                    failures.add(new SaveReport.FileFailure(fileName, e.getMessage()));
                }
            }
            token.throwIfCancelled();
        } catch (CancellationException e) {
            discard(staging);
            throw e;
        }

        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(folder);
        } catch (IOException e) {
            discard(staging);
            throw new UncheckedOutputException("Cannot create output folder " + folder, e);
        }
        for (String fileName : staged) {
            Path target = folder.resolve(fileName);
            try {
                Files.move(staging.resolve(fileName), target, StandardCopyOption.REPLACE_EXISTING);
                written.add(target);
            } catch (IOException e) {
                LOG.warn("Failed to move {} into {}: {}", fileName, folder, e.getMessage());
                failures.add(new SaveReport.FileFailure(fileName, e.getMessage()));
            }
        }
        discard(staging);
        LOG.debug("Wrote {} of {} tiles to {}", written.size(), tiles.size(), folder);
        return new SaveReport(folder, written, failures);
    }

    /**
     * Encode one tile. JPG is written at quality {@value OutputFormat#JPEG_QUALITY}.
     *
     * @throws IOException if the encoder reports failure
     */
    protected void encode(Mat image, Path file, OutputFormat format) throws IOException {
        boolean ok;
        if (format == OutputFormat.JPG) {
            MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, OutputFormat.JPEG_QUALITY);
            try {
                ok = Imgcodecs.imwrite(file.toString(), image, params);
            } finally {
                params.release();
            }
        } else {
            ok = Imgcodecs.imwrite(file.toString(), image);
        }
        if (!ok) {
            throw new IOException("Encoder refused " + file.getFileName());
        }
    }

    static Path stagingFolder(Path folder) {
        Path parent = folder.toAbsolutePath().getParent();
        return parent.resolve("." + folder.getFileName() + ".partial");
    }

    private static void discard(Path staging) {
        try {
            deleteRecursively(staging);
        } catch (IOException e) {
            LOG.warn("Could not remove staging folder {}: {}", staging, e.getMessage());
        }
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = new ArrayList<>();
            walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
        }
        for (Path p : paths) {
            Files.deleteIfExists(p);
        }
    }
}
