package com.flowlayout.flowlayout_backend.config;

import lombok.Builder;
import lombok.Data;

/**
 * Spacing and sizing constants for every layout pass, in pixels.
 * Built from application properties by {@link LayoutConfig}; tests use {@link #defaults()}.
 */
@Data
@Builder(toBuilder = true)
public class LayoutSettings {

    /** Standard component size; every non-boundary node gets it so handles line up. */
    @Builder.Default private double nodeWidth = 150;
    @Builder.Default private double nodeHeight = 130;

    /** Horizontal gap between stage columns. */
    @Builder.Default private double columnGap = 200;
    /** Vertical gap between nodes stacked in one column. */
    @Builder.Default private double rowGap = 60;

    /** Pitch of one lane band (node height plus the gap below it). */
    @Builder.Default private double laneHeight = 190;
    /** Horizontal gap between consecutive nodes of one lane. */
    @Builder.Default private double laneNodeGap = 80;
    /** Width of one section column. */
    @Builder.Default private double sectionWidth = 230;
    /** Gap between the lane area and the first section, and before the overflow column. */
    @Builder.Default private double sectionGap = 60;

    @Builder.Default private double badgeSize = 36;
    @Builder.Default private double badgeGap = 24;

    /** Inner padding of a fitted boundary. */
    @Builder.Default private double boundaryPadding = 40;
    /** Title band reserved at the top of a fitted boundary. */
    @Builder.Default private double boundaryTitleHeight = 50;
    /** Row pitch of members stacked inside an external boundary. */
    @Builder.Default private double boundaryRowHeight = 170;
    @Builder.Default private double boundaryMinWidth = 200;
    @Builder.Default private double boundaryMinHeight = 200;
    /** Extra height on top of the minimum so the label never touches a child. */
    @Builder.Default private double boundaryLabelPadding = 30;
    /** Gap between adjacent boundaries. */
    @Builder.Default private double boundaryGap = 40;

    @Builder.Default private int propagationMaxPasses = 10;
    @Builder.Default private double propagationStep = 0.5;

    public static LayoutSettings defaults() {
        return LayoutSettings.builder().build();
    }
}
