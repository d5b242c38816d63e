package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.model.DetectionMode;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares which {@link DetectionMode} an {@link EdgeDetector} implements.
 * The {@link EdgeDetectorRegistry} keys detectors by this annotation.
 *
 * Example usage:
 * <pre>
 * {@literal @}EdgeDetectorInfo(
 *     mode = DetectionMode.BASIC,
 *     displayName = "Basic",
 *     description = "Sobel gradient magnitude above sobelThreshold"
 * )
 * public class BasicEdgeDetector implements EdgeDetector { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EdgeDetectorInfo {

    DetectionMode mode();

    /**
     * Name shown in help output. If empty, defaults to the mode's display name.
     */
    String displayName() default "";

    /**
     * One-line summary of the operators involved.
     */
    String description() default "";
}
