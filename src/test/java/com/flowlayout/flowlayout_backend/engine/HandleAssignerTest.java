package com.flowlayout.flowlayout_backend.engine;

import com.flowlayout.flowlayout_backend.engine.HandleAssigner.HandlePair;
import com.flowlayout.flowlayout_backend.model.domain.DiagramEdge;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.GridCell;
import com.flowlayout.flowlayout_backend.model.domain.Handle;
import com.flowlayout.flowlayout_backend.model.domain.LayoutMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HandleAssignerTest {

    private static DiagramNode placed(String id, double x, double y) {
        DiagramNode node = DiagramNode.builder().id(id).build();
        node.place(x, y, 150, 130);
        return node;
    }

    // -- grid cells --------------------------------------------------------

    @Test
    void whenAssigning_givenSameRow_shouldUseHorizontalPairByDirection() {
        assertThat(HandleAssigner.forCells(new GridCell(0, 0), new GridCell(2, 0), LayoutMode.LANE_SECTION))
                .isEqualTo(new HandlePair(Handle.RIGHT_SOURCE, Handle.LEFT_TARGET));
        assertThat(HandleAssigner.forCells(new GridCell(2, 0), new GridCell(0, 0), LayoutMode.LANE_SECTION))
                .isEqualTo(new HandlePair(Handle.LEFT_SOURCE, Handle.RIGHT_TARGET));
    }

    @Test
    void whenAssigning_givenSameColumn_shouldUseVerticalPairByRow() {
        assertThat(HandleAssigner.forCells(new GridCell(1, 0), new GridCell(1, 3), LayoutMode.LANE_SECTION))
                .isEqualTo(new HandlePair(Handle.BOTTOM_SOURCE, Handle.TOP_TARGET));
        assertThat(HandleAssigner.forCells(new GridCell(1, 3), new GridCell(1, 0), LayoutMode.LANE_SECTION))
                .isEqualTo(new HandlePair(Handle.TOP_SOURCE, Handle.BOTTOM_TARGET));
    }

    @Test
    void whenAssigning_givenLaneWrap_shouldLeaveVerticallyTowardTargetRow() {
        assertThat(HandleAssigner.forCells(new GridCell(3, 0), new GridCell(0, 1), LayoutMode.LANE_SECTION))
                .isEqualTo(new HandlePair(Handle.BOTTOM_SOURCE, Handle.TOP_TARGET));
        assertThat(HandleAssigner.forCells(new GridCell(0, 1), new GridCell(3, 0), LayoutMode.LANE_SECTION))
                .isEqualTo(new HandlePair(Handle.TOP_SOURCE, Handle.BOTTOM_TARGET));
    }

    @Test
    void whenAssigning_givenColumnModeAcrossColumns_shouldUseHorizontalPairWhateverTheRows() {
        assertThat(HandleAssigner.forCells(new GridCell(0, 1), new GridCell(1, 0), LayoutMode.COLUMN))
                .isEqualTo(new HandlePair(Handle.RIGHT_SOURCE, Handle.LEFT_TARGET));
        assertThat(HandleAssigner.forCells(new GridCell(0, 0), new GridCell(2, 3), LayoutMode.COLUMN))
                .isEqualTo(new HandlePair(Handle.RIGHT_SOURCE, Handle.LEFT_TARGET));
        assertThat(HandleAssigner.forCells(new GridCell(2, 0), new GridCell(0, 1), LayoutMode.COLUMN))
                .isEqualTo(new HandlePair(Handle.LEFT_SOURCE, Handle.RIGHT_TARGET));
        // Same column still runs vertically
        assertThat(HandleAssigner.forCells(new GridCell(0, 0), new GridCell(0, 1), LayoutMode.COLUMN))
                .isEqualTo(new HandlePair(Handle.BOTTOM_SOURCE, Handle.TOP_TARGET));
    }

    @Test
    void whenAssigning_givenIdenticalCells_shouldFallBackToRightward() {
        assertThat(HandleAssigner.forCells(new GridCell(2, 2), new GridCell(2, 2), LayoutMode.LANE_SECTION))
                .isEqualTo(new HandlePair(Handle.RIGHT_SOURCE, Handle.LEFT_TARGET));
    }

    // -- pixel centers -----------------------------------------------------

    @Test
    void whenAssigning_givenNoCells_shouldCompareCenters() {
        assertThat(HandleAssigner.forCenters(placed("a", 0, 0), placed("b", 400, 100)))
                .isEqualTo(new HandlePair(Handle.RIGHT_SOURCE, Handle.LEFT_TARGET));
        assertThat(HandleAssigner.forCenters(placed("a", 0, 0), placed("b", 50, 400)))
                .isEqualTo(new HandlePair(Handle.BOTTOM_SOURCE, Handle.TOP_TARGET));
        assertThat(HandleAssigner.forCenters(placed("a", 400, 0), placed("b", 0, 0)))
                .isEqualTo(new HandlePair(Handle.LEFT_SOURCE, Handle.RIGHT_TARGET));
    }

    @Test
    void whenAssigning_givenUnpositionedEndpoint_shouldFallBackToRightward() {
        DiagramNode unplaced = DiagramNode.builder().id("b").build();

        assertThat(HandleAssigner.forCenters(placed("a", 0, 0), unplaced))
                .isEqualTo(new HandlePair(Handle.RIGHT_SOURCE, Handle.LEFT_TARGET));
        assertThat(HandleAssigner.forCenters(null, unplaced))
                .isEqualTo(new HandlePair(Handle.RIGHT_SOURCE, Handle.LEFT_TARGET));
    }

    @Test
    void whenAssigning_givenEdgesInAnyOrder_shouldDependOnlyOnEndpoints() {
        DiagramNode a = placed("a", 0, 0);
        DiagramNode b = placed("b", 350, 0);
        DiagramNode c = placed("c", 0, 600);
        Map<String, DiagramNode> nodes = Map.of("a", a, "b", b, "c", c);
        Map<String, GridCell> cells = Map.of("a", new GridCell(0, 0), "b", new GridCell(1, 0));
        DiagramEdge ab = DiagramEdge.builder().source("a").target("b").build();
        DiagramEdge ac = DiagramEdge.builder().source("a").target("c").build();
        DiagramEdge ab2 = DiagramEdge.builder().source("a").target("b").build();
        DiagramEdge ac2 = DiagramEdge.builder().source("a").target("c").build();

        HandleAssigner assigner = new HandleAssigner();
        assigner.assign(List.of(ab, ac), nodes, cells, LayoutMode.COLUMN);
        assigner.assign(List.of(ac2, ab2), nodes, cells, LayoutMode.COLUMN);

        assertThat(ab.getSourceHandle()).isEqualTo(ab2.getSourceHandle()).isEqualTo(Handle.RIGHT_SOURCE);
        assertThat(ac.getTargetHandle()).isEqualTo(ac2.getTargetHandle()).isEqualTo(Handle.TOP_TARGET);
    }
}
