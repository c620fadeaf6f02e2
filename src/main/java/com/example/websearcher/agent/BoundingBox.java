package com.example.websearcher.agent;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * An interactive element labelled on the page by the mark-page script. The
 * coordinates are the element's center in viewport pixels.
 */
@Value
@Builder
public class BoundingBox {
    double x;
    double y;
    String text;
    String type;
    String ariaLabel;

    /** Label shown to the model, the aria label when there is one. */
    public String label() {
        if (ariaLabel != null && !ariaLabel.isBlank()) {
            return ariaLabel;
        }
        return text == null ? "" : text;
    }

    static BoundingBox fromScript(Map<?, ?> raw) {
        return BoundingBox.builder()
                .x(toDouble(raw.get("x")))
                .y(toDouble(raw.get("y")))
                .text(raw.get("text") == null ? null : raw.get("text").toString())
                .type(raw.get("type") == null ? null : raw.get("type").toString())
                .ariaLabel(raw.get("ariaLabel") == null ? null : raw.get("ariaLabel").toString())
                .build();
    }

    private static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException("Bounding box coordinate is not a number: " + value);
    }
}
