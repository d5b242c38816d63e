package com.ttennebkram.stickersplit.io;

import com.ttennebkram.stickersplit.OpenCvLoader;
import com.ttennebkram.stickersplit.SyntheticSheets;
import com.ttennebkram.stickersplit.model.OutputFormat;
import com.ttennebkram.stickersplit.model.SheetImage;
import com.ttennebkram.stickersplit.model.Tile;
import com.ttennebkram.stickersplit.processing.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Rect;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

public class FileTileWriterTest {

    @TempDir
    Path tempDir;

    private List<Tile> tiles;

    @BeforeAll
    public static void loadOpenCv() {
        OpenCvLoader.load();
    }

    @BeforeEach
    public void createTiles() {
        tiles = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            SheetImage image = SyntheticSheets.gray(SyntheticSheets.flat(20, 10, 40 * i), 20, 10);
            tiles.add(new Tile(0, i, new Rect(20 * i, 0, 20, 10), image));
        }
    }

    @AfterEach
    public void closeTiles() {
        for (Tile tile : tiles) {
            tile.close();
        }
    }

    @Test
    public void testWritesAllTilesAndRemovesStaging() {
        Path folder = tempDir.resolve("sheet_split");
        SaveReport report = new FileTileWriter().write(tiles, folder, "sheet", NamingTemplate.defaults(),
                OutputFormat.JPG, new CancellationToken());

        assertTrue(report.isComplete());
        assertEquals(3, report.written.size());
        assertTrue(Files.exists(folder.resolve("001_sheet.jpg")));
        assertTrue(Files.exists(folder.resolve("003_sheet.jpg")));
        assertFalse(Files.exists(FileTileWriter.stagingFolder(folder)));
    }

    @Test
    public void testCancelledWriteLeavesNothing() {
        Path folder = tempDir.resolve("sheet_split");
        CancellationToken token = new CancellationToken();
        FileTileWriter cancelling = new FileTileWriter() {
            @Override
            protected void encode(org.opencv.core.Mat image, Path file, OutputFormat format) throws IOException {
                super.encode(image, file, format);
                token.cancel();
            }
        };
        assertThrows(CancellationException.class, () -> cancelling.write(tiles, folder, "sheet",
                NamingTemplate.defaults(), OutputFormat.PNG, token));
        assertFalse(Files.exists(folder));
        assertFalse(Files.exists(FileTileWriter.stagingFolder(folder)));
    }

    @Test
    public void testStaleStagingReplaced() throws IOException {
        Path folder = tempDir.resolve("sheet_split");
        Path staging = FileTileWriter.stagingFolder(folder);
        Files.createDirectories(staging);
        Files.write(staging.resolve("leftover.png"), new byte[]{1});

        SaveReport report = new FileTileWriter().write(tiles, folder, "sheet", NamingTemplate.defaults(),
                OutputFormat.PNG, new CancellationToken());

        assertEquals(3, report.written.size());
        assertFalse(Files.exists(folder.resolve("leftover.png")));
        assertFalse(Files.exists(staging));
    }

    @Test
    public void testDuplicateNameFailsInsteadOfOverwriting() {
        Path folder = tempDir.resolve("sheet_split");
        List<Tile> clashing = new ArrayList<>();
        clashing.add(new Tile(0, 0, new Rect(0, 0, 20, 10), tiles.get(0).image().copy()));
        clashing.add(new Tile(0, 0, new Rect(20, 0, 20, 10), tiles.get(2).image().copy()));
        try {
            SaveReport report = new FileTileWriter().write(clashing, folder, "sheet",
                    NamingTemplate.parse("{row}_{col}"), OutputFormat.PNG, new CancellationToken());

            assertEquals(1, report.written.size());
            assertEquals(1, report.failures.size());
            assertEquals("01_01.png", report.failures.get(0).fileName);
            // The first tile (all zeros) is the one on disk
            try (SheetImage onDisk = SheetImage.load(folder.resolve("01_01.png"))) {
                assertEquals(0, onDisk.toBytes()[0]);
            }
        } finally {
            for (Tile tile : clashing) {
                tile.close();
            }
        }
    }

    @Test
    public void testStagingFolderIsHiddenSibling() {
        Path folder = tempDir.resolve("cats_split");
        assertEquals(tempDir.toAbsolutePath().resolve(".cats_split.partial"), FileTileWriter.stagingFolder(folder));
    }
}
