package com.flowlayout.flowlayout_backend;

import com.flowlayout.flowlayout_backend.config.LayoutSettings;
import com.flowlayout.flowlayout_backend.engine.BoundaryFitter;
import com.flowlayout.flowlayout_backend.engine.ColumnLayoutEngine;
import com.flowlayout.flowlayout_backend.engine.DiagramLayoutEngine;
import com.flowlayout.flowlayout_backend.engine.HandleAssigner;
import com.flowlayout.flowlayout_backend.engine.LaneSectionLayoutEngine;
import com.flowlayout.flowlayout_backend.engine.LayoutStrategyRegistry;
import com.flowlayout.flowlayout_backend.engine.SubgraphDetector;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.LayoutResult;
import com.flowlayout.flowlayout_backend.normalize.GraphNormalizer;
import com.flowlayout.flowlayout_backend.parser.DiagramParser;
import com.flowlayout.flowlayout_backend.service.DiagramLayoutService;
import com.flowlayout.flowlayout_backend.stage.StageClassifier;
import com.flowlayout.flowlayout_backend.stage.StagePropagator;

import java.util.List;

/** Wires the layout pipeline by hand with default settings, no Spring context. */
public final class LayoutFixtures {

    private LayoutFixtures() {
    }

    public static DiagramLayoutEngine engine() {
        LayoutSettings settings = LayoutSettings.defaults();
        ColumnLayoutEngine column = new ColumnLayoutEngine(new StageClassifier(), new StagePropagator(settings));
        LayoutStrategyRegistry registry = new LayoutStrategyRegistry(List.of(column, new LaneSectionLayoutEngine()));
        registry.init();
        return new DiagramLayoutEngine(new GraphNormalizer(), new SubgraphDetector(), registry,
                new BoundaryFitter(), new HandleAssigner(), settings);
    }

    public static DiagramLayoutService service() {
        return new DiagramLayoutService(new DiagramParser(), new GraphNormalizer(), engine(), new SubgraphDetector());
    }

    public static DiagramNode node(LayoutResult result, String id) {
        return result.getNodes().stream()
                .filter(n -> n.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No node '" + id + "' in result"));
    }
}
