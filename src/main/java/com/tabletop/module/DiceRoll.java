package com.tabletop.module;

import java.util.Collections;
import java.util.List;

/**
 * Faces of one throw of the configured dice.
 */
public record DiceRoll(List<Integer> faces) {

    public DiceRoll {
        faces = List.copyOf(faces);
    }

    public int total() {
        return faces.stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * @return true when at least {@code required} dice show the same face
     */
    public boolean hasDuplicates(int required) {
        return faces.stream()
                .mapToInt(face -> Collections.frequency(faces, face))
                .max()
                .orElse(0) >= required;
    }
}
