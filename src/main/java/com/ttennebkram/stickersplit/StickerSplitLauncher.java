package com.ttennebkram.stickersplit;

import com.ttennebkram.stickersplit.edges.EdgeDetectorRegistry;
import com.ttennebkram.stickersplit.io.FileTileWriter;
import com.ttennebkram.stickersplit.io.SettingsStore;
import com.ttennebkram.stickersplit.io.SplitSettings;
import com.ttennebkram.stickersplit.model.GridSpec;
import com.ttennebkram.stickersplit.model.StickerSplitException;
import com.ttennebkram.stickersplit.processing.BatchReport;
import com.ttennebkram.stickersplit.processing.BatchSplitter;
import com.ttennebkram.stickersplit.processing.CancellationToken;
import com.ttennebkram.stickersplit.processing.ImageReport;
import com.ttennebkram.stickersplit.processing.OutputOptions;
import com.ttennebkram.stickersplit.processing.ProgressListener;
import com.ttennebkram.stickersplit.processing.SheetPipeline;
import com.ttennebkram.stickersplit.processing.SplitRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point: splits one or more sticker sheets into tiles.
 */
public class StickerSplitLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(StickerSplitLauncher.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Parse arguments, run the batch and print a summary.
     *
     * @return {@link #EXIT_OK}, {@link #EXIT_FAILURES} if any image or file failed,
     *         or {@link #EXIT_USAGE} for bad arguments
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        List<Path> images = new ArrayList<>();
        Integer rows = null;
        Integer cols = null;
        String mode = null;
        String format = null;
        Double angle = null;
        String outDir = null;
        String template = null;
        String trim = null;
        String settingsFile = null;
        boolean preview = false;

        // Parse command line arguments
        for (int i = 0; i < args.length; i++) {
            String param = args[i];
            if ("-h".equals(param) || "--help".equals(param)) {
                printHelp(out);
                return EXIT_OK;
            } else if ("--preview".equals(param)) {
                preview = true;
            } else if (param.startsWith("--")) {
                if (i + 1 >= args.length) {
                    err.println("Error: " + param + " requires a value");
                    return EXIT_USAGE;
                }
                String value = args[++i];
                switch (param) {
                    case "--rows":
                    case "--cols": {
                        int n;
                        try {
                            n = Integer.parseInt(value);
                        } catch (NumberFormatException e) {
                            err.println("Error: " + param + " requires a whole number, got " + value);
                            return EXIT_USAGE;
                        }
                        if ("--rows".equals(param)) {
                            rows = n;
                        } else {
                            cols = n;
                        }
                        break;
                    }
                    case "--mode":
                        mode = value;
                        break;
                    case "--format":
                        format = value;
                        break;
                    case "--angle":
                        try {
                            angle = Double.parseDouble(value);
                        } catch (NumberFormatException e) {
                            err.println("Error: --angle requires a number of degrees, got " + value);
                            return EXIT_USAGE;
                        }
                        break;
                    case "--out":
                        outDir = value;
                        break;
                    case "--template":
                        template = value;
                        break;
                    case "--trim":
                        trim = value;
                        break;
                    case "--settings":
                        settingsFile = value;
                        break;
                    default:
                        err.println("Error: unknown option " + param);
                        return EXIT_USAGE;
                }
            } else {
                images.add(Paths.get(param));
            }
        }

        if (images.isEmpty()) {
            err.println("Error: no input images given (see --help)");
            return EXIT_USAGE;
        }

        SplitRequest request;
        OutputOptions options;
        try {
            SplitSettings settings = settingsFile != null
                    ? new SettingsStore(Paths.get(settingsFile)).load()
                    : new SplitSettings();
            boolean gridGiven = rows != null || cols != null;
            if (rows != null) settings.setRows(rows);
            if (cols != null) settings.setCols(cols);
            if (mode != null) {
                if (SplitSettings.GRID_MANUAL.equalsIgnoreCase(mode.trim())) {
                    settings.setGridMode(SplitSettings.GRID_MANUAL);
                } else {
                    settings.setEdgeMode(mode);
                    settings.setGridMode(SplitSettings.GRID_AUTO);
                }
            } else if (gridGiven) {
                settings.setGridMode(SplitSettings.GRID_MANUAL);
            }
            if (format != null) settings.setOutputFormat(format);
            if (angle != null) settings.setRotationAngle(angle);
            if (outDir != null) settings.setOutputDirectory(outDir);
            if (template != null) settings.setNamingTemplate(template);
            if (trim != null) {
                settings.setBorderTrimEnabled(!"none".equalsIgnoreCase(trim.trim()));
                settings.setBorderTrimMode(trim);
            }
            if (preview) settings.setWritePreview(true);

            request = settings.toRequest();
            // Counts given together with a detector become the fallback grid
            if (gridGiven && !request.gridSpec().isManual()) {
                request = request.toBuilder()
                        .gridSpec(GridSpec.auto(settings.getRows(), settings.getCols()))
                        .build();
            }
            options = settings.toOutputOptions();
        } catch (StickerSplitException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        OpenCvLoader.load();
        BatchSplitter splitter = new BatchSplitter(new SheetPipeline(), new FileTileWriter());
        ProgressListener progress = event -> LOG.debug("{}", event);
        BatchReport report;
        try {
            report = splitter.run(images, request, options, progress, new CancellationToken());
        } catch (StickerSplitException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        for (ImageReport image : report.images) {
            out.println(image);
        }
        List<String> problems = report.problems();
        if (!problems.isEmpty()) {
            err.println();
            err.println("Problems:");
            for (String line : problems) {
                err.println("  " + line);
            }
        }
        boolean failed = report.count(ImageReport.Status.FAILED) > 0 || report.images.stream().anyMatch(ImageReport::hasWriteFailures);
        return failed ? EXIT_FAILURES : EXIT_OK;
    }

    private static void printHelp(PrintStream out) {
        out.println("Sticker Sheet Splitter");
        out.println();
        out.println("Usage: java -jar sticker-split.jar [options] IMAGE [IMAGE...]   (up to 10 images)");
        out.println();
        out.println("Options:");
        out.println("  -h, --help              Show this help message and exit");
        out.println("  --rows N, --cols N      Grid size, 1-18 each. Without --mode this is a fixed grid;");
        out.println("                          with a detection mode it is the fallback grid");
        out.println("  --mode MODE             manual, or a detection mode (default adaptive):");
        for (Map.Entry<String, String> entry : EdgeDetectorRegistry.withDefaults().descriptions().entrySet()) {
            out.println(String.format("                            %-16s %s", entry.getKey(), entry.getValue()));
        }
        out.println("  --format FMT            png (default, keeps transparency) or jpg");
        out.println("  --angle DEG             Rotate clockwise before splitting");
        out.println("  --out DIR               Write <name>_split folders into DIR instead of beside each image");
        out.println("  --template T            Tile name template, tokens {seq} {row} {col} {name} (default {seq}_{name})");
        out.println("  --trim MODE             Trim separator remnants: none, auto, aggressive, conservative, gradient");
        out.println("  --preview               Also write preview.png with the detected lines");
        out.println("  --settings FILE         Load defaults from a JSON settings file");
        out.println();
        out.println("Examples:");
        out.println("  java -jar sticker-split.jar sheet.png");
        out.println("  java -jar sticker-split.jar --rows 3 --cols 3 --format jpg sheet.png");
        out.println("  java -jar sticker-split.jar --mode basic --angle 90 --trim auto a.png b.png");
    }
}
