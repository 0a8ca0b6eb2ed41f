package com.conveyal.roofarea.pipeline;

import java.nio.file.Path;

/**
 * How a roof mask is produced. Selecting a learned model is distinct from not configuring one: the learned path
 * exists as a choice but reports that it is unsupported instead of silently falling back to the heuristic.
 */
public enum InferenceMode {

    /** Image gradients constrained to building footprints. Requires footprints. */
    HEURISTIC_BASELINE,

    /** Segmentation by a trained model. Not implemented. */
    LEARNED_MODEL;

    /** A model path selects the learned model, its absence the heuristic baseline. */
    public static InferenceMode forModelPath (Path modelPath) {
        return modelPath == null || modelPath.toString().isBlank() ? HEURISTIC_BASELINE : LEARNED_MODEL;
    }

}
