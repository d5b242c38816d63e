package com.ttennebkram.stickersplit.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.stickersplit.model.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads and saves {@link SplitSettings} as pretty-printed JSON. Missing keys take their
 * defaults; a missing or malformed file yields all defaults.
 */
public class SettingsStore {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsStore.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static final String DEFAULT_FILE_NAME = "stickersplit-settings.json";

    private final Path file;

    public SettingsStore(Path file) {
        this.file = file;
    }

    /**
     * Store in the user's home directory.
     */
    public static SettingsStore inHomeDirectory() {
        return new SettingsStore(Paths.get(System.getProperty("user.home"), DEFAULT_FILE_NAME));
    }

    public Path file() {
        return file;
    }

    public SplitSettings load() {
        SplitSettings settings = new SplitSettings();
        if (!Files.exists(file)) {
            return settings;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                LOG.warn("Settings file {} is not a JSON object; using defaults", file);
                return new SplitSettings();
            }
            settings.deserializeProperties(root.getAsJsonObject());
            return settings;
        } catch (IOException e) {
            LOG.warn("Cannot read settings file {}: {}; using defaults", file, e.getMessage());
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                 | NumberFormatException | ParameterException e) {
            LOG.warn("Malformed settings file {}: {}; using defaults", file, e.getMessage());
        }
        return new SplitSettings();
    }

    public void save(SplitSettings settings) throws IOException {
        JsonObject root = new JsonObject();
        settings.serializeProperties(root);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(root, writer);
        }
    }
}
