package com.flowlayout.flowlayout_backend.engine;

import com.flowlayout.flowlayout_backend.config.LayoutSettings;
import com.flowlayout.flowlayout_backend.model.domain.DiagramGraph;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.GridCell;
import com.flowlayout.flowlayout_backend.model.domain.NodeKind;
import com.flowlayout.flowlayout_backend.model.domain.Subgraph;
import com.flowlayout.flowlayout_backend.model.domain.SubgraphKind;
import com.flowlayout.flowlayout_backend.stage.PropagationOutcome;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Working state of one layout call: the normalized graph, lookups over it and
 * what the strategies produce (grid cells, badge nodes, propagation outcome).
 * Created per call and never shared.
 */
@Getter
public class LayoutContext {

    private final DiagramGraph graph;
    private final LayoutSettings settings;
    private final Map<String, DiagramNode> nodesById = new LinkedHashMap<>();
    private final Map<String, Subgraph> subgraphsById = new LinkedHashMap<>();

    // Members of external boundaries; placed by the boundary fitter only
    private final Set<String> bypassIds;

    private final Map<String, GridCell> cells = new HashMap<>();
    private final List<DiagramNode> badges = new ArrayList<>();

    @Setter
    private PropagationOutcome propagation = new PropagationOutcome(0, true);

    public LayoutContext(DiagramGraph graph, LayoutSettings settings, Set<String> bypassIds) {
        this.graph = graph;
        this.settings = settings;
        this.bypassIds = new HashSet<>(bypassIds);
        graph.getNodes().forEach(n -> nodesById.put(n.getId(), n));
        graph.getSubgraphs().forEach(s -> subgraphsById.put(s.getId(), s));
    }

    /** Nodes a strategy is responsible for: everything except boundaries and bypassed members. */
    public List<DiagramNode> layoutNodes() {
        List<DiagramNode> result = new ArrayList<>();
        for (DiagramNode node : graph.getNodes()) {
            if (node.getKind() != NodeKind.BOUNDARY && !bypassIds.contains(node.getId())) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Closest enclosing subgraph that drives lane/section placement: a lane, a
     * section, or an outside-the-grid boundary (index -1).
     */
    public Optional<Subgraph> regionOf(DiagramNode node) {
        Set<String> visited = new HashSet<>();
        String current = node.getSubgraph();
        while (current != null && visited.add(current)) {
            Subgraph sg = subgraphsById.get(current);
            if (sg == null) {
                return Optional.empty();
            }
            if (sg.getKind() == SubgraphKind.LANE || sg.getKind() == SubgraphKind.SECTION) {
                return Optional.of(sg);
            }
            if (sg.getKind() == SubgraphKind.BOUNDARY && sg.getIndex() != null && sg.getIndex() < 0) {
                return Optional.of(sg);
            }
            current = sg.getParent();
        }
        return Optional.empty();
    }

    public void recordCell(DiagramNode node, int column, int row) {
        cells.put(node.getId(), new GridCell(column, row));
    }
}
