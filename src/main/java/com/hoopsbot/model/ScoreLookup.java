package com.hoopsbot.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pre-resolved score rows for one run, in source order. Implementations must not perform I/O
 * on lookup.
 */
public interface ScoreLookup {

    List<ScoreRecord> records();

    default boolean isEmpty() {
        return records().isEmpty();
    }

    static ScoreLookup of(List<ScoreRecord> records) {
        List<ScoreRecord> copy = records == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(records));
        return () -> copy;
    }
}
