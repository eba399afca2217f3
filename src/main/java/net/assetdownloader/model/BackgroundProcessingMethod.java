package net.assetdownloader.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Background handling strategies accepted in run configurations.
 *
 * <p>Only transparency flattening is implemented. The remaining tags are reserved and
 * currently normalize exactly like {@link #SMART_DETECT}.</p>
 */
public enum BackgroundProcessingMethod {
    SMART_DETECT("smart_detect", true),
    AI_REMOVAL("ai_removal", false),
    COLOR_REPLACE("color_replace", false),
    EDGE_DETECTION("edge_detection", false);

    private final String value;
    private final boolean implemented;

    BackgroundProcessingMethod(String value, boolean implemented) {
        this.value = value;
        this.implemented = implemented;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isImplemented() {
        return implemented;
    }

    @JsonCreator
    public static BackgroundProcessingMethod fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return SMART_DETECT;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (BackgroundProcessingMethod method : values()) {
            if (method.value.equals(normalized) || method.name().equalsIgnoreCase(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown background processing method: '" + raw
            + "'. Supported values: smart_detect, ai_removal, color_replace, edge_detection");
    }
}
