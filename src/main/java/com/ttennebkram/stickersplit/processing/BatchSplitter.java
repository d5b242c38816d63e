package com.ttennebkram.stickersplit.processing;

import com.google.gson.JsonObject;
import com.ttennebkram.stickersplit.extract.ImageRotator;
import com.ttennebkram.stickersplit.extract.PreviewRenderer;
import com.ttennebkram.stickersplit.io.ManifestSerializer;
import com.ttennebkram.stickersplit.io.OutputFolders;
import com.ttennebkram.stickersplit.io.SaveReport;
import com.ttennebkram.stickersplit.io.TileWriter;
import com.ttennebkram.stickersplit.model.ImageFormats;
import com.ttennebkram.stickersplit.model.SheetImage;
import com.ttennebkram.stickersplit.model.StickerSplitException;
import org.opencv.core.CvException;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Splits up to {@value ImageFormats#MAX_BATCH_SIZE} images on a fixed worker pool.
 * One image failing never affects the others; every failure ends up in the {@link BatchReport}.
 */
public class BatchSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(BatchSplitter.class);

    public static final String PREVIEW_FILE_NAME = "preview.png";

    private final SheetPipeline pipeline;
    private final TileWriter writer;

    public BatchSplitter(SheetPipeline pipeline, TileWriter writer) {
        this.pipeline = pipeline;
        this.writer = writer;
    }

    /**
     * @throws com.ttennebkram.stickersplit.model.ParameterException if the batch is empty or too large;
     *         raised before any image is read
     */
    public BatchReport run(List<Path> images, SplitRequest request, OutputOptions options,
                           ProgressListener listener, CancellationToken token) {
        ImageFormats.requireBatchSize(images.size());
        List<Path> folders = OutputFolders.resolve(images, options.outputDirectory);

        int workers = Math.min(Runtime.getRuntime().availableProcessors(), images.size());
        LOG.info("Splitting {} image(s) on {} worker(s): {}", images.size(), workers, request);

        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "split-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        List<ImageReport> reports = new ArrayList<>(images.size());
        try {
            List<Future<ImageReport>> futures = new ArrayList<>(images.size());
            for (int i = 0; i < images.size(); i++) {
                Path image = images.get(i);
                Path folder = folders.get(i);
                futures.add(pool.submit(() -> splitOne(image, folder, request, options, listener, token)));
            }
            for (int i = 0; i < futures.size(); i++) {
                reports.add(await(futures.get(i), images.get(i), folders.get(i), token));
            }
        } finally {
            pool.shutdownNow();
        }

        BatchReport report = new BatchReport(reports);
        LOG.info("Batch done: {} ok, {} failed, {} cancelled, {} tiles written",
                report.count(ImageReport.Status.OK), report.count(ImageReport.Status.FAILED),
                report.count(ImageReport.Status.CANCELLED), report.tilesWritten());
        return report;
    }

    private static ImageReport await(Future<ImageReport> future, Path image, Path folder, CancellationToken token) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            return ImageReport.cancelled(image, folder);
        } catch (ExecutionException e) {
            // splitOne catches everything it expects; anything else is a bug worth a stack trace
            LOG.error("Unexpected failure splitting {}", image, e.getCause());
            return ImageReport.failed(image, folder, String.valueOf(e.getCause()));
        }
    }

    private ImageReport splitOne(Path image, Path folder, SplitRequest request, OutputOptions options,
                                 ProgressListener listener, CancellationToken token) {
        String name = image.getFileName().toString();
        String baseName = ImageFormats.baseNameOf(image);
        try {
            token.throwIfCancelled();
            try (SheetImage sheet = SheetImage.load(image);
                 SplitOutcome outcome = pipeline.split(name, sheet, request, listener, token)) {

                SaveReport save = writer.write(outcome.tiles, folder, baseName, options.template,
                        request.outputFormat(), token);

                List<String> warnings = new ArrayList<>();
                if (outcome.result.isFallback()) {
                    warnings.add("no separator lines found; used a uniform "
                            + outcome.result.rowCount() + "x" + outcome.result.colCount() + " grid");
                }
                if (options.writeManifest) {
                    JsonObject manifest = ManifestSerializer.toJson(name, outcome, options.template,
                            request.outputFormat(), save);
                    try {
                        ManifestSerializer.write(folder.resolve(ManifestSerializer.FILE_NAME), manifest);
                    } catch (IOException e) {
                        LOG.warn("Cannot write manifest for {}: {}", name, e.getMessage());
                        warnings.add("manifest not written: " + e.getMessage());
                    }
                }
                if (options.writePreview) {
                    writePreview(sheet, outcome, request, folder, warnings);
                }
                return ImageReport.ok(image, folder, outcome.result, save, warnings);
            }
        } catch (CancellationException e) {
            LOG.info("{} cancelled", name);
            return ImageReport.cancelled(image, folder);
        } catch (StickerSplitException e) {
            LOG.warn("{} failed: {}", name, e.getMessage());
            return ImageReport.failed(image, folder, e.getMessage());
        }
    }

    private static void writePreview(SheetImage sheet, SplitOutcome outcome, SplitRequest request,
                                     Path folder, List<String> warnings) {
        try (SheetImage rotated = ImageRotator.rotate(sheet, request.rotationAngle());
             SheetImage preview = PreviewRenderer.render(rotated, outcome.result)) {
            Path file = folder.resolve(PREVIEW_FILE_NAME);
            if (!Imgcodecs.imwrite(file.toString(), preview.view())) {
                warnings.add("preview not written");
            }
        } catch (CvException e) {
            LOG.warn("Cannot write preview into {}: {}", folder, e.getMessage());
            warnings.add("preview not written: " + e.getMessage());
        }
    }
}
