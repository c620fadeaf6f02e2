package com.example.websearcher.agent;

import lombok.Value;

import java.util.List;

@Value
public class PageAnnotation {
    byte[] screenshot;
    List<BoundingBox> boxes;

    /** Bounding box list in the format the prompt expects. */
    public String describe() {
        StringBuilder labels = new StringBuilder("\nValid Bounding Boxes:\n");
        for (int i = 0; i < boxes.size(); i++) {
            BoundingBox box = boxes.get(i);
            if (i > 0) {
                labels.append('\n');
            }
            labels.append(i).append(" (<").append(box.getType()).append("/>): \"")
                    .append(box.label()).append('"');
        }
        return labels.toString();
    }
}
