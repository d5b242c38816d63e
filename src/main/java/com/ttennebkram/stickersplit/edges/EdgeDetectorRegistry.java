package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.model.DetectionMode;
import com.ttennebkram.stickersplit.model.ParameterException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps each {@link DetectionMode} to its detector. Detectors declare their mode with
 * {@link EdgeDetectorInfo}; MANUAL has no detector because it never looks at pixels.
 *
 * Usage:
 *   EdgeDetector detector = EdgeDetectorRegistry.withDefaults(config).get(DetectionMode.ADAPTIVE);
 *   EdgeMap edges = detector.detect(image, params);
 */
public class EdgeDetectorRegistry {

    private final Map<DetectionMode, EdgeDetector> detectors = new EnumMap<>(DetectionMode.class);
    private final Map<DetectionMode, EdgeDetectorInfo> infos = new EnumMap<>(DetectionMode.class);

    /**
     * Registry with the three built-in detectors.
     */
    public static EdgeDetectorRegistry withDefaults(AdaptationConfig config) {
        EdgeDetectorRegistry registry = new EdgeDetectorRegistry();
        registry.register(new BasicEdgeDetector());
        registry.register(new MultiAlgorithmEdgeDetector());
        registry.register(new AdaptiveEdgeDetector(config));
        return registry;
    }

    public static EdgeDetectorRegistry withDefaults() {
        return withDefaults(AdaptationConfig.defaults());
    }

    /**
     * Register a detector under the mode named by its annotation, replacing any previous one.
     */
    public void register(EdgeDetector detector) {
        EdgeDetectorInfo info = detector.getClass().getAnnotation(EdgeDetectorInfo.class);
        if (info == null) {
            throw new IllegalArgumentException(detector.getClass().getName() + " is missing @EdgeDetectorInfo");
        }
        if (info.mode() == DetectionMode.MANUAL) {
            throw new IllegalArgumentException("MANUAL mode does not take a detector");
        }
        detectors.put(info.mode(), detector);
        infos.put(info.mode(), info);
    }

    public boolean hasDetector(DetectionMode mode) {
        return detectors.containsKey(mode);
    }

    public EdgeDetector get(DetectionMode mode) {
        EdgeDetector detector = detectors.get(mode);
        if (detector == null) {
            throw new ParameterException("No edge detector for mode " + mode.displayName());
        }
        return detector;
    }

    /**
     * Mode name (as accepted on the command line) to "Display name: description", in mode order.
     */
    public Map<String, String> descriptions() {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<DetectionMode, EdgeDetectorInfo> entry : infos.entrySet()) {
            EdgeDetectorInfo info = entry.getValue();
            String name = info.displayName().isEmpty() ? entry.getKey().displayName() : info.displayName();
            result.put(entry.getKey().displayName(), name + ": " + info.description());
        }
        return Collections.unmodifiableMap(result);
    }
}
