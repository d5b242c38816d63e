package com.ttennebkram.stickersplit.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.DetectionResult;
import com.ttennebkram.stickersplit.model.FeatureScores;
import com.ttennebkram.stickersplit.model.OutputFormat;
import com.ttennebkram.stickersplit.model.Tile;
import com.ttennebkram.stickersplit.processing.SplitOutcome;
import org.opencv.core.Rect;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes {@code manifest.json} into each output folder: where the lines were found,
 * how confident the detection was, and which file holds which tile.
 */
public class ManifestSerializer {

    public static final String FILE_NAME = "manifest.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static JsonObject toJson(String sourceName, SplitOutcome outcome, NamingTemplate template,
                                    OutputFormat format, SaveReport save) {
        DetectionResult result = outcome.result;
        JsonObject root = new JsonObject();
        root.addProperty("source", sourceName);
        root.addProperty("width", result.width());
        root.addProperty("height", result.height());
        root.addProperty("mode", result.mode().displayName());
        root.addProperty("confidence", result.confidence());
        root.addProperty("fallback", result.isFallback());
        root.add("rowLines", toArray(result.rowLines()));
        root.add("colLines", toArray(result.colLines()));

        if (outcome.parameters != null) {
            root.add("parameters", SplitSettings.serializeParameters(outcome.parameters));
        }
        FeatureScores features = outcome.features;
        if (features != null) {
            JsonObject f = new JsonObject();
            f.addProperty("blur", features.getBlurScore());
            f.addProperty("texture", features.getTextureScore());
            f.addProperty("contrast", features.getContrastScore());
            root.add("features", f);
        }

        Set<String> written = new HashSet<>();
        for (Path p : save.written) {
            written.add(p.getFileName().toString());
        }
        JsonArray tiles = new JsonArray();
        List<Tile> list = outcome.tiles;
        String baseName = baseNameOf(sourceName);
        for (int i = 0; i < list.size(); i++) {
            Tile tile = list.get(i);
            Rect r = tile.bounds();
            String fileName = template.fileName(i, tile.rowIndex(), tile.colIndex(), baseName, format);
            JsonObject t = new JsonObject();
            t.addProperty("file", fileName);
            t.addProperty("row", tile.rowIndex());
            t.addProperty("col", tile.colIndex());
            t.addProperty("x", r.x);
            t.addProperty("y", r.y);
            t.addProperty("width", r.width);
            t.addProperty("height", r.height);
            // A name is credited to the first tile that claimed it
            t.addProperty("written", written.remove(fileName));
            tiles.add(t);
        }
        root.add("tiles", tiles);
        return root;
    }

    public static void write(Path file, JsonObject manifest) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(manifest, writer);
        }
    }

    public static JsonObject read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return JsonParser.parseReader(reader).getAsJsonObject();
        }
    }

    private static JsonArray toArray(List<Integer> values) {
        JsonArray array = new JsonArray();
        for (Integer v : values) {
            array.add(v);
        }
        return array;
    }

    private static String baseNameOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }
}
