package com.ttennebkram.stickersplit.io;

import com.google.gson.JsonObject;
import com.ttennebkram.stickersplit.extract.TrimMode;
import com.ttennebkram.stickersplit.model.DetectionMode;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.GridSpec;
import com.ttennebkram.stickersplit.model.OutputFormat;
import com.ttennebkram.stickersplit.processing.OutputOptions;
import com.ttennebkram.stickersplit.processing.SplitRequest;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * User settings as stored in the JSON settings file. Every field has a default, so a
 * partial file is filled in from defaults. Values are checked only when converted into a
 * {@link SplitRequest} or {@link OutputOptions}.
 */
public class SplitSettings {

    public static final String GRID_AUTO = "auto";
    public static final String GRID_MANUAL = "manual";

    // Properties with defaults
    private String outputFormat = "png";
    private String edgeMode = "adaptive";
    private String gridMode = GRID_AUTO;
    private int rows = 3;
    private int cols = 3;
    private double rotationAngle = 0;
    private String namingTemplate = NamingTemplate.DEFAULT;
    private String outputDirectory = "";
    private boolean borderTrimEnabled = false;
    private String borderTrimMode = "auto";
    private boolean writeManifest = true;
    private boolean writePreview = false;
    private DetectionParameters detection = DetectionParameters.defaults();

    public void serializeProperties(JsonObject json) {
        json.addProperty("outputFormat", outputFormat);
        json.addProperty("edgeMode", edgeMode);
        json.addProperty("gridMode", gridMode);
        json.addProperty("rows", rows);
        json.addProperty("cols", cols);
        json.addProperty("rotationAngle", rotationAngle);
        json.addProperty("namingTemplate", namingTemplate);
        json.addProperty("outputDirectory", outputDirectory);
        json.addProperty("borderTrimEnabled", borderTrimEnabled);
        json.addProperty("borderTrimMode", borderTrimMode);
        json.addProperty("writeManifest", writeManifest);
        json.addProperty("writePreview", writePreview);
        json.add("detection", serializeParameters(detection));
    }

    public void deserializeProperties(JsonObject json) {
        outputFormat = getJsonString(json, "outputFormat", "png");
        edgeMode = getJsonString(json, "edgeMode", "adaptive");
        gridMode = getJsonString(json, "gridMode", GRID_AUTO);
        rows = getJsonInt(json, "rows", 3);
        cols = getJsonInt(json, "cols", 3);
        rotationAngle = getJsonDouble(json, "rotationAngle", 0);
        namingTemplate = getJsonString(json, "namingTemplate", NamingTemplate.DEFAULT);
        outputDirectory = getJsonString(json, "outputDirectory", "");
        borderTrimEnabled = getJsonBoolean(json, "borderTrimEnabled", false);
        borderTrimMode = getJsonString(json, "borderTrimMode", "auto");
        writeManifest = getJsonBoolean(json, "writeManifest", true);
        writePreview = getJsonBoolean(json, "writePreview", false);
        if (json.has("detection") && json.get("detection").isJsonObject()) {
            detection = deserializeParameters(json.getAsJsonObject("detection"));
        } else {
            detection = DetectionParameters.defaults();
        }
    }

    static JsonObject serializeParameters(DetectionParameters p) {
        JsonObject json = new JsonObject();
        json.addProperty("cannyLow", p.getCannyLow());
        json.addProperty("cannyHigh", p.getCannyHigh());
        json.addProperty("sobelThreshold", p.getSobelThreshold());
        json.addProperty("laplacianThreshold", p.getLaplacianThreshold());
        json.addProperty("morphKernelSize", p.getMorphKernelSize());
        json.addProperty("minAreaRatio", p.getMinAreaRatio());
        json.addProperty("blurThreshold", p.getBlurThreshold());
        json.addProperty("textureThreshold", p.getTextureThreshold());
        json.addProperty("contrastThreshold", p.getContrastThreshold());
        return json;
    }

    static DetectionParameters deserializeParameters(JsonObject json) {
        return DetectionParameters.builder()
                .cannyLow(getJsonDouble(json, "cannyLow", DetectionParameters.DEFAULT_CANNY_LOW))
                .cannyHigh(getJsonDouble(json, "cannyHigh", DetectionParameters.DEFAULT_CANNY_HIGH))
                .sobelThreshold(getJsonDouble(json, "sobelThreshold", DetectionParameters.DEFAULT_SOBEL_THRESHOLD))
                .laplacianThreshold(getJsonDouble(json, "laplacianThreshold", DetectionParameters.DEFAULT_LAPLACIAN_THRESHOLD))
                .morphKernelSize(getJsonInt(json, "morphKernelSize", DetectionParameters.DEFAULT_MORPH_KERNEL_SIZE))
                .minAreaRatio(getJsonDouble(json, "minAreaRatio", DetectionParameters.DEFAULT_MIN_AREA_RATIO))
                .blurThreshold(getJsonDouble(json, "blurThreshold", DetectionParameters.DEFAULT_BLUR_THRESHOLD))
                .textureThreshold(getJsonDouble(json, "textureThreshold", DetectionParameters.DEFAULT_TEXTURE_THRESHOLD))
                .contrastThreshold(getJsonDouble(json, "contrastThreshold", DetectionParameters.DEFAULT_CONTRAST_THRESHOLD))
                .build();
    }

    /**
     * @throws com.ttennebkram.stickersplit.model.ParameterException if a value is out of range
     */
    public SplitRequest toRequest() {
        boolean manual = GRID_MANUAL.equalsIgnoreCase(gridMode.trim());
        GridSpec grid = manual ? GridSpec.manual(rows, cols) : GridSpec.auto();
        return SplitRequest.builder()
                .gridSpec(grid)
                .mode(manual ? DetectionMode.MANUAL : DetectionMode.fromName(edgeMode))
                .parameters(detection)
                .rotationAngle(rotationAngle)
                .outputFormat(OutputFormat.fromName(outputFormat))
                .trimMode(borderTrimEnabled ? TrimMode.fromName(borderTrimMode) : TrimMode.NONE)
                .build();
    }

    public OutputOptions toOutputOptions() {
        Path dir = outputDirectory == null || outputDirectory.trim().isEmpty() ? null : Paths.get(outputDirectory);
        return new OutputOptions(dir, NamingTemplate.parse(namingTemplate), writeManifest, writePreview);
    }

    // Helpers to safely read JSON values

    private static int getJsonInt(JsonObject json, String key, int defaultValue) {
        if (json.has(key)) {
            return json.get(key).getAsInt();
        }
        return defaultValue;
    }

    private static double getJsonDouble(JsonObject json, String key, double defaultValue) {
        if (json.has(key)) {
            return json.get(key).getAsDouble();
        }
        return defaultValue;
    }

    private static boolean getJsonBoolean(JsonObject json, String key, boolean defaultValue) {
        if (json.has(key)) {
            return json.get(key).getAsBoolean();
        }
        return defaultValue;
    }

    private static String getJsonString(JsonObject json, String key, String defaultValue) {
        if (json.has(key)) {
            return json.get(key).getAsString();
        }
        return defaultValue;
    }

    // Getters/setters
    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public String getEdgeMode() {
        return edgeMode;
    }

    public void setEdgeMode(String edgeMode) {
        this.edgeMode = edgeMode;
    }

    public String getGridMode() {
        return gridMode;
    }

    public void setGridMode(String gridMode) {
        this.gridMode = gridMode;
    }

    public int getRows() {
        return rows;
    }

    public void setRows(int rows) {
        this.rows = rows;
    }

    public int getCols() {
        return cols;
    }

    public void setCols(int cols) {
        this.cols = cols;
    }

    public double getRotationAngle() {
        return rotationAngle;
    }

    public void setRotationAngle(double rotationAngle) {
        this.rotationAngle = rotationAngle;
    }

    public String getNamingTemplate() {
        return namingTemplate;
    }

    public void setNamingTemplate(String namingTemplate) {
        this.namingTemplate = namingTemplate;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public boolean isBorderTrimEnabled() {
        return borderTrimEnabled;
    }

    public void setBorderTrimEnabled(boolean borderTrimEnabled) {
        this.borderTrimEnabled = borderTrimEnabled;
    }

    public String getBorderTrimMode() {
        return borderTrimMode;
    }

    public void setBorderTrimMode(String borderTrimMode) {
        this.borderTrimMode = borderTrimMode;
    }

    public boolean isWriteManifest() {
        return writeManifest;
    }

    public void setWriteManifest(boolean writeManifest) {
        this.writeManifest = writeManifest;
    }

    public boolean isWritePreview() {
        return writePreview;
    }

    public void setWritePreview(boolean writePreview) {
        this.writePreview = writePreview;
    }

    public DetectionParameters getDetection() {
        return detection;
    }

    public void setDetection(DetectionParameters detection) {
        this.detection = detection;
    }
}
