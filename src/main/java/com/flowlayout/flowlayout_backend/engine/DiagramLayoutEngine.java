package com.flowlayout.flowlayout_backend.engine;

import com.flowlayout.flowlayout_backend.config.LayoutSettings;
import com.flowlayout.flowlayout_backend.model.domain.DiagramGraph;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.LayoutMode;
import com.flowlayout.flowlayout_backend.model.domain.LayoutResult;
import com.flowlayout.flowlayout_backend.model.domain.NodeKind;
import com.flowlayout.flowlayout_backend.model.domain.Provider;
import com.flowlayout.flowlayout_backend.model.domain.Subgraph;
import com.flowlayout.flowlayout_backend.model.domain.SubgraphKind;
import com.flowlayout.flowlayout_backend.normalize.GraphNormalizer;
import com.flowlayout.flowlayout_backend.stage.MedallionDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one full layout: normalize, classify subgraphs, pick a strategy, fit
 * boundaries, assign handles. Every call starts from a copy of the input, so
 * feeding a result back in gives the same positions again.
 */
@Slf4j
@Service
public class DiagramLayoutEngine {

    private final GraphNormalizer        normalizer;
    private final SubgraphDetector       detector;
    private final LayoutStrategyRegistry strategyRegistry;
    private final BoundaryFitter         boundaryFitter;
    private final HandleAssigner         handleAssigner;
    private final LayoutSettings         settings;

    public DiagramLayoutEngine(GraphNormalizer normalizer,
                               SubgraphDetector detector,
                               LayoutStrategyRegistry strategyRegistry,
                               BoundaryFitter boundaryFitter,
                               HandleAssigner handleAssigner,
                               LayoutSettings settings) {
        this.normalizer = normalizer;
        this.detector = detector;
        this.strategyRegistry = strategyRegistry;
        this.boundaryFitter = boundaryFitter;
        this.handleAssigner = handleAssigner;
        this.settings = settings;
    }

    public LayoutResult layout(DiagramGraph input) {
        DiagramGraph graph = normalizer.normalize(withoutBadges(input));
        graph.getNodes().forEach(DiagramNode::clearLayout);

        detector.classify(graph.getSubgraphs());

        Map<Provider, List<DiagramNode>> claims = boundaryFitter.claimMembers(graph);
        Set<String> bypass = boundaryFitter.bypassIds(claims);
        LayoutContext context = new LayoutContext(graph, settings, bypass);

        LayoutMode mode = selectMode(context);
        if (!strategyRegistry.isSupported(mode)) {
            log.warn("[Layout] No strategy registered for mode {}, laying out in {} instead",
                    mode, LayoutMode.COLUMN);
            mode = LayoutMode.COLUMN;
        }
        log.debug("[Layout] {} nodes, {} edges, mode {}, {} boundary member(s) bypass the strategy",
                graph.getNodes().size(), graph.getEdges().size(), mode, bypass.size());

        strategyRegistry.get(mode).layout(context);
        boundaryFitter.fit(context, claims);
        appendUnpositioned(context);

        List<DiagramNode> nodes = new ArrayList<>(graph.getNodes());
        nodes.addAll(context.getBadges());
        context.getBadges().forEach(b -> context.getNodesById().put(b.getId(), b));
        handleAssigner.assign(graph.getEdges(), context.getNodesById(), context.getCells(), mode);

        List<String> warnings = graph.getWarnings();
        if (!context.getPropagation().converged()) {
            warnings.add("Stage propagation stopped after " + context.getPropagation().passes()
                    + " passes without converging (cycle?)");
        }

        return LayoutResult.builder()
                .mode(mode)
                .nodes(nodes)
                .edges(graph.getEdges())
                .subgraphs(graph.getSubgraphs())
                .classStyles(graph.getClassStyles())
                .medallion(MedallionDetector.isMedallion(graph.getNodes()))
                .propagationPasses(context.getPropagation().passes())
                .propagationConverged(context.getPropagation().converged())
                .warnings(warnings)
                .build();
    }

    /** Lane/section mode as soon as one laid-out node sits in a lane or a section. */
    static LayoutMode selectMode(LayoutContext context) {
        for (DiagramNode node : context.layoutNodes()) {
            boolean gridRegion = context.regionOf(node)
                    .map(Subgraph::getKind)
                    .filter(kind -> kind == SubgraphKind.LANE || kind == SubgraphKind.SECTION)
                    .isPresent();
            if (gridRegion) {
                return LayoutMode.LANE_SECTION;
            }
        }
        return LayoutMode.COLUMN;
    }

    /** Badge nodes from an earlier result are regenerated, never laid out as input. */
    private static DiagramGraph withoutBadges(DiagramGraph input) {
        DiagramGraph graph = input.copy();
        Set<String> badgeIds = new HashSet<>();
        graph.getNodes().removeIf(n -> {
            if (n.getKind() == NodeKind.BADGE) {
                badgeIds.add(n.getId());
                return true;
            }
            return false;
        });
        if (!badgeIds.isEmpty()) {
            graph.getEdges().removeIf(e -> badgeIds.contains(e.getSource()) || badgeIds.contains(e.getTarget()));
            graph.getSubgraphs().forEach(sg -> sg.getMembers().removeIf(badgeIds::contains));
        }
        return graph;
    }

    /** Last resort for anything no pass placed: a row below the content. */
    private void appendUnpositioned(LayoutContext context) {
        double bottom = 0;
        List<DiagramNode> missing = new ArrayList<>();
        for (DiagramNode node : context.getGraph().getNodes()) {
            if (node.isPositioned()) {
                bottom = Math.max(bottom, node.getY() + node.getHeight());
            } else {
                missing.add(node);
            }
        }
        for (int i = 0; i < missing.size(); i++) {
            DiagramNode node = missing.get(i);
            node.place(i * (settings.getNodeWidth() + settings.getColumnGap()), bottom + settings.getRowGap(),
                    settings.getNodeWidth(), settings.getNodeHeight());
            log.warn("[Layout] Node '{}' was not placed by any pass, appended below the diagram", node.getId());
        }
    }
}
