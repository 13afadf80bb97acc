package com.flowlayout.flowlayout_backend.engine;

import com.flowlayout.flowlayout_backend.model.domain.DiagramEdge;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.GridCell;
import com.flowlayout.flowlayout_backend.model.domain.Handle;
import com.flowlayout.flowlayout_backend.model.domain.LayoutMode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Picks connector anchors from grid cells, so the choice depends on where the
 * endpoints ended up and never on the order edges arrived in. Columns read left
 * to right, so in column mode an edge between two columns always leaves sideways.
 * Lanes wrap into rows, so in lane mode it leaves vertically toward the target row.
 */
@Component
public class HandleAssigner {

    public void assign(List<DiagramEdge> edges, Map<String, DiagramNode> nodes,
                       Map<String, GridCell> cells, LayoutMode mode) {
        for (DiagramEdge edge : edges) {
            GridCell from = cells.get(edge.getSource());
            GridCell to = cells.get(edge.getTarget());
            HandlePair pair = from != null && to != null
                    ? forCells(from, to, mode)
                    : forCenters(nodes.get(edge.getSource()), nodes.get(edge.getTarget()));
            edge.setSourceHandle(pair.source());
            edge.setTargetHandle(pair.target());
        }
    }

    public static HandlePair forCells(GridCell from, GridCell to, LayoutMode mode) {
        if (from.column() == to.column() && from.row() == to.row()) {
            return HandlePair.RIGHTWARD;
        }
        if (from.column() == to.column()) {
            return to.row() > from.row() ? HandlePair.DOWNWARD : HandlePair.UPWARD;
        }
        if (from.row() == to.row() || mode == LayoutMode.COLUMN) {
            return to.column() > from.column() ? HandlePair.RIGHTWARD : HandlePair.LEFTWARD;
        }
        // Lane wrap: different row and column
        return to.row() > from.row() ? HandlePair.DOWNWARD : HandlePair.UPWARD;
    }

    /** Boundary-fitted endpoints have no cell; fall back to their pixel centers. */
    public static HandlePair forCenters(DiagramNode from, DiagramNode to) {
        if (from == null || to == null || !from.isPositioned() || !to.isPositioned()) {
            return HandlePair.RIGHTWARD;
        }
        double dx = centerX(to) - centerX(from);
        double dy = centerY(to) - centerY(from);
        if (Math.abs(dx) >= Math.abs(dy)) {
            return dx >= 0 ? HandlePair.RIGHTWARD : HandlePair.LEFTWARD;
        }
        return dy > 0 ? HandlePair.DOWNWARD : HandlePair.UPWARD;
    }

    private static double centerX(DiagramNode n) {
        return n.getX() + (n.getWidth() != null ? n.getWidth() : 0) / 2;
    }

    private static double centerY(DiagramNode n) {
        return n.getY() + (n.getHeight() != null ? n.getHeight() : 0) / 2;
    }

    public record HandlePair(Handle source, Handle target) {
        static final HandlePair RIGHTWARD = new HandlePair(Handle.RIGHT_SOURCE, Handle.LEFT_TARGET);
        static final HandlePair LEFTWARD = new HandlePair(Handle.LEFT_SOURCE, Handle.RIGHT_TARGET);
        static final HandlePair DOWNWARD = new HandlePair(Handle.BOTTOM_SOURCE, Handle.TOP_TARGET);
        static final HandlePair UPWARD = new HandlePair(Handle.TOP_SOURCE, Handle.BOTTOM_TARGET);
    }
}
