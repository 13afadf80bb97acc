package com.flowlayout.flowlayout_backend.engine;

import com.flowlayout.flowlayout_backend.config.LayoutSettings;
import com.flowlayout.flowlayout_backend.model.domain.DiagramEdge;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.LayoutMode;
import com.flowlayout.flowlayout_backend.stage.PropagationOutcome;
import com.flowlayout.flowlayout_backend.stage.StageClassifier;
import com.flowlayout.flowlayout_backend.stage.StageColors;
import com.flowlayout.flowlayout_backend.stage.StagePropagator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Default strategy: stage → column bucket → row.
 *
 * Adjacent stages share a bucket (ingestion sits with its sources, change
 * capture with transforms). Empty buckets take no horizontal space: x comes
 * from the ordinal of the occupied bucket while {@code column} keeps the bucket.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColumnLayoutEngine implements LayoutStrategy {

    private static final double[] COLUMN_LIMITS = {1.5, 2, 3, 3.5, 4.5, 5, 5.5};

    private final StageClassifier classifier;
    private final StagePropagator propagator;

    @Override
    public LayoutMode supportedMode() {
        return LayoutMode.COLUMN;
    }

    /** ≤1.5 → 0, ≤2 → 1, ≤3 → 2, ≤3.5 → 3, ≤4.5 → 4, ≤5 → 5, ≤5.5 → 6, else 7. */
    public static int columnFor(double stage) {
        for (int i = 0; i < COLUMN_LIMITS.length; i++) {
            if (stage <= COLUMN_LIMITS[i]) return i;
        }
        return COLUMN_LIMITS.length;
    }

    @Override
    public void layout(LayoutContext context) {
        List<DiagramNode> nodes = context.layoutNodes();
        if (nodes.isEmpty()) {
            return;
        }
        LayoutSettings settings = context.getSettings();

        Map<String, Double> stages = new LinkedHashMap<>();
        Set<String> utilityIds = new HashSet<>();
        for (DiagramNode node : nodes) {
            stages.put(node.getId(), classifier.classify(node));
            if (classifier.isUtility(node)) {
                utilityIds.add(node.getId());
            }
        }
        PropagationOutcome outcome = propagator.propagate(stages, context.getGraph().getEdges(), utilityIds);
        context.setPropagation(outcome);

        TreeMap<Integer, List<DiagramNode>> buckets = new TreeMap<>();
        for (DiagramNode node : nodes) {
            double stage = stages.get(node.getId());
            node.setStage(stage);
            node.setStageColor(StageColors.forStage(stage));
            node.setColumn(columnFor(stage));
            buckets.computeIfAbsent(node.getColumn(), k -> new ArrayList<>()).add(node);
        }
        // List.sort is stable: equal stages keep declaration order
        buckets.values().forEach(column -> column.sort(Comparator.comparingDouble(DiagramNode::getStage)));

        Map<String, Integer> rowOf = new HashMap<>();
        List<DiagramNode> previous = null;
        for (List<DiagramNode> column : buckets.values()) {
            if (previous != null) {
                orderByBarycenter(column, previous, rowOf, context.getGraph().getEdges());
            }
            for (int r = 0; r < column.size(); r++) {
                rowOf.put(column.get(r).getId(), r);
            }
            previous = column;
        }

        double pitch = settings.getNodeHeight() + settings.getRowGap();
        int tallest = buckets.values().stream().mapToInt(List::size).max().orElse(0);
        double tallestHeight = tallest * pitch - settings.getRowGap();

        int ordinal = 0;
        for (List<DiagramNode> column : buckets.values()) {
            double columnHeight = column.size() * pitch - settings.getRowGap();
            double offsetY = (tallestHeight - columnHeight) / 2;
            double x = ordinal * (settings.getNodeWidth() + settings.getColumnGap());
            for (int r = 0; r < column.size(); r++) {
                DiagramNode node = column.get(r);
                node.setRow(r);
                node.place(x, offsetY + r * pitch, settings.getNodeWidth(), settings.getNodeHeight());
                context.recordCell(node, ordinal, r);
            }
            ordinal++;
        }

        log.debug("[ColumnLayout] {} nodes in {} occupied columns, propagation {} pass(es), converged={}",
                nodes.size(), buckets.size(), outcome.passes(), outcome.converged());
    }

    /**
     * Stable re-sort by the mean row of upstream neighbours in the previous
     * occupied column. Nodes with no such neighbour go last.
     */
    private static void orderByBarycenter(List<DiagramNode> column, List<DiagramNode> previous,
                                          Map<String, Integer> rowOf, List<DiagramEdge> edges) {
        Set<String> previousIds = new HashSet<>();
        previous.forEach(n -> previousIds.add(n.getId()));

        Map<String, Double> barycenter = new HashMap<>();
        for (DiagramNode node : column) {
            double sum = 0;
            int count = 0;
            for (DiagramEdge edge : edges) {
                if (edge.getTarget().equals(node.getId()) && previousIds.contains(edge.getSource())) {
                    sum += rowOf.get(edge.getSource());
                    count++;
                }
            }
            barycenter.put(node.getId(), count > 0 ? sum / count : Double.POSITIVE_INFINITY);
        }
        column.sort(Comparator.comparingDouble(n -> barycenter.get(n.getId())));
    }
}
