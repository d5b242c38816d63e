package com.ttennebkram.stickersplit.io;

import com.ttennebkram.stickersplit.model.OutputFormat;
import com.ttennebkram.stickersplit.model.Tile;
import com.ttennebkram.stickersplit.processing.CancellationToken;

import java.nio.file.Path;
import java.util.List;

/**
 * Persists the tiles of one image. A failure on one file is recorded in the report
 * and never stops the rest.
 */
public interface TileWriter {

    /**
     * @param tiles    row-major tiles
     * @param folder   final output folder; it receives files only if the write is not cancelled
     * @param baseName source image base name, for the {@code {name}} token
     * @throws java.util.concurrent.CancellationException if cancelled between files
     */
    SaveReport write(List<Tile> tiles, Path folder, String baseName, NamingTemplate template,
                     OutputFormat format, CancellationToken token);
}
