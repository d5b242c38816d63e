package com.ttennebkram.stickersplit.io;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of writing one image's tiles: the files that made it and the ones that did not.
 */
public class SaveReport {

    /**
     * A file that could not be written.
     */
    public static class FileFailure {
        public final String fileName;
        public final String message;

        public FileFailure(String fileName, String message) {
            this.fileName = fileName;
            this.message = message;
        }

        @Override
        public String toString() {
            return fileName + ": " + message;
        }
    }

    public final Path folder;
    public final List<Path> written;
    public final List<FileFailure> failures;

    public SaveReport(Path folder, List<Path> written, List<FileFailure> failures) {
        this.folder = folder;
        this.written = Collections.unmodifiableList(new ArrayList<>(written));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
