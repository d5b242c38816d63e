package com.ttennebkram.stickersplit.processing;

import com.ttennebkram.stickersplit.io.NamingTemplate;

import java.nio.file.Path;

/**
 * Where and how a batch writes its results.
 */
public class OutputOptions {
    public final Path outputDirectory;      // null = beside each image
    public final NamingTemplate template;
    public final boolean writeManifest;
    public final boolean writePreview;

    public OutputOptions(Path outputDirectory, NamingTemplate template, boolean writeManifest, boolean writePreview) {
        this.outputDirectory = outputDirectory;
        this.template = template;
        this.writeManifest = writeManifest;
        this.writePreview = writePreview;
    }

    public static OutputOptions defaults() {
        return new OutputOptions(null, NamingTemplate.defaults(), true, false);
    }
}
