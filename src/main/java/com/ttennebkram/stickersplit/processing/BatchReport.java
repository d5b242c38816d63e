package com.ttennebkram.stickersplit.processing;

import com.ttennebkram.stickersplit.io.SaveReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-image reports of a batch, in input order, plus aggregate views.
 */
public class BatchReport {

    public final List<ImageReport> images;

    public BatchReport(List<ImageReport> images) {
        this.images = Collections.unmodifiableList(new ArrayList<>(images));
    }

    public int count(ImageReport.Status status) {
        int n = 0;
        for (ImageReport report : images) {
            if (report.status == status) n++;
        }
        return n;
    }

    public int tilesWritten() {
        int n = 0;
        for (ImageReport report : images) {
            if (report.save != null) {
                n += report.save.written.size();
            }
        }
        return n;
    }

    /**
     * Every problem in the batch, one line each: failed images, unwritten files, warnings.
     */
    public List<String> problems() {
        List<String> lines = new ArrayList<>();
        for (ImageReport report : images) {
            String name = report.source.getFileName().toString();
            if (report.status == ImageReport.Status.FAILED) {
                lines.add(name + ": " + report.error);
            }
            if (report.save != null) {
                for (SaveReport.FileFailure failure : report.save.failures) {
                    lines.add(name + ": " + failure);
                }
            }
            for (String warning : report.warnings) {
                lines.add(name + ": " + warning);
            }
        }
        return lines;
    }

    public boolean isClean() {
        return problems().isEmpty() && count(ImageReport.Status.CANCELLED) == 0;
    }
}
