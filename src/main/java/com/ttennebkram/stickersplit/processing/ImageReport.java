package com.ttennebkram.stickersplit.processing;

import com.ttennebkram.stickersplit.io.SaveReport;
import com.ttennebkram.stickersplit.model.DetectionResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What happened to one image of a batch.
 */
public class ImageReport {

    public enum Status {
        OK,
        FAILED,
        CANCELLED
    }

    public final Path source;
    public final Path outputFolder;
    public final Status status;
    public final DetectionResult result;   // null unless lines were located
    public final SaveReport save;          // null unless tiles were written
    public final String error;             // null when OK
    public final List<String> warnings;    // e.g. manifest or preview not written

    private ImageReport(Path source, Path outputFolder, Status status, DetectionResult result,
                        SaveReport save, String error, List<String> warnings) {
        this.source = source;
        this.outputFolder = outputFolder;
        this.status = status;
        this.result = result;
        this.save = save;
        this.error = error;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public static ImageReport ok(Path source, Path folder, DetectionResult result, SaveReport save,
                                 List<String> warnings) {
        return new ImageReport(source, folder, Status.OK, result, save, null, warnings);
    }

    public static ImageReport failed(Path source, Path folder, String error) {
        return new ImageReport(source, folder, Status.FAILED, null, null, error, Collections.emptyList());
    }

    public static ImageReport cancelled(Path source, Path folder) {
        return new ImageReport(source, folder, Status.CANCELLED, null, null, "Cancelled", Collections.emptyList());
    }

    /** OK, but some tile files could not be written. */
    public boolean hasWriteFailures() {
        return save != null && !save.isComplete();
    }

    @Override
    public String toString() {
        String name = source.getFileName().toString();
        switch (status) {
            case OK:
                return name + ": " + save.written.size() + " tiles -> " + outputFolder
                        + (hasWriteFailures() ? " (" + save.failures.size() + " failed)" : "");
            case FAILED:
                return name + ": failed: " + error;
            default:
                return name + ": cancelled";
        }
    }
}
