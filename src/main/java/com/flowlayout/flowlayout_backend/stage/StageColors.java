package com.flowlayout.flowlayout_backend.stage;

import java.util.Map;

/** Accent color per whole stage, for renderers that tint by pipeline position. */
public final class StageColors {

    public static final String NEUTRAL = "#29B5E8";

    private static final Map<Integer, String> COLORS = Map.of(
            0, "#6366F1",   // source
            1, "#8B5CF6",   // ingest
            2, "#CD7F32",   // raw / bronze
            3, "#C0C0C0",   // transform / silver
            4, "#FFD700",   // curated / gold
            5, "#10B981",   // serve
            6, "#F59E0B"    // consume
    );

    private StageColors() {
    }

    public static String forStage(Double stage) {
        if (stage == null || !Double.isFinite(stage)) return NEUTRAL;
        return COLORS.getOrDefault((int) Math.floor(stage), NEUTRAL);
    }
}
