package com.flowlayout.flowlayout_backend.engine;

import com.flowlayout.flowlayout_backend.config.LayoutSettings;
import com.flowlayout.flowlayout_backend.model.domain.DiagramEdge;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.LayoutMode;
import com.flowlayout.flowlayout_backend.model.domain.NodeKind;
import com.flowlayout.flowlayout_backend.model.domain.Subgraph;
import com.flowlayout.flowlayout_backend.model.domain.SubgraphKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Grid layout driven by group naming.
 *
 * <pre>
 *  [outside]  [1A] n1 → n2 → n3      [2]   [3]
 *             [1B] n4 → n5           n6    n8
 *                                    n7
 *                                                 [unplaced]
 * </pre>
 *
 * Lanes are horizontal bands in index order, sections are fixed-width columns
 * right of the widest lane, outside boundaries (index -1) sit left of the lanes.
 * Section rows use the lane pitch so they line up with the bands.
 */
@Slf4j
@Component
public class LaneSectionLayoutEngine implements LayoutStrategy {

    @Override
    public LayoutMode supportedMode() {
        return LayoutMode.LANE_SECTION;
    }

    @Override
    public void layout(LayoutContext context) {
        LayoutSettings s = context.getSettings();
        List<Subgraph> declared = context.getGraph().getSubgraphs();

        Map<Subgraph, List<DiagramNode>> lanes = new LinkedHashMap<>();
        Map<Subgraph, List<DiagramNode>> sections = new LinkedHashMap<>();
        List<DiagramNode> outside = new ArrayList<>();
        List<DiagramNode> unplaced = new ArrayList<>();

        // Every classified lane and section gets its band and badge, members or not
        for (Subgraph sg : declared) {
            if (sg.getKind() == SubgraphKind.LANE) {
                lanes.put(sg, new ArrayList<>());
            } else if (sg.getKind() == SubgraphKind.SECTION) {
                sections.put(sg, new ArrayList<>());
            }
        }

        for (DiagramNode node : context.layoutNodes()) {
            Optional<Subgraph> region = context.regionOf(node);
            if (region.isEmpty()) {
                unplaced.add(node);
                continue;
            }
            Subgraph sg = region.get();
            tag(node, sg);
            if (sg.getKind() == SubgraphKind.LANE) {
                lanes.computeIfAbsent(sg, k -> new ArrayList<>()).add(node);
            } else if (sg.getKind() == SubgraphKind.SECTION) {
                sections.computeIfAbsent(sg, k -> new ArrayList<>()).add(node);
            } else {
                outside.add(node);
            }
        }

        Comparator<Subgraph> byIndexThenDeclaration = Comparator
                .comparingInt((Subgraph sg) -> sg.getIndex() != null ? sg.getIndex() : 0)
                .thenComparingInt(declared::indexOf);
        List<Subgraph> laneOrder = new ArrayList<>(lanes.keySet());
        laneOrder.sort(byIndexThenDeclaration);
        List<Subgraph> sectionOrder = new ArrayList<>(sections.keySet());
        sectionOrder.sort(byIndexThenDeclaration);

        double laneTop = sectionOrder.isEmpty() ? 0 : s.getBadgeSize() + s.getBadgeGap();
        double laneStartX = outside.isEmpty() ? 0 : s.getNodeWidth() + s.getSectionGap();
        Set<String> badgeIds = new HashSet<>();

        // Lanes
        double laneContentRight = laneStartX;
        int maxLaneLength = 0;
        for (int rank = 0; rank < laneOrder.size(); rank++) {
            Subgraph lane = laneOrder.get(rank);
            List<DiagramNode> members = new ArrayList<>(lanes.get(lane));
            double bandY = laneTop + rank * s.getLaneHeight();
            double badgeX = laneStartX;
            double badgeY = bandY + (s.getNodeHeight() - s.getBadgeSize()) / 2;
            placeBadge(context, lane, members, "lane_label_", badgeX, badgeY, badgeIds);

            List<DiagramNode> ordered = topologicalOrder(members, context.getGraph().getEdges());
            double firstX = laneStartX + s.getBadgeSize() + s.getBadgeGap();
            for (int k = 0; k < ordered.size(); k++) {
                DiagramNode node = ordered.get(k);
                double x = firstX + k * (s.getNodeWidth() + s.getLaneNodeGap());
                node.place(x, bandY, s.getNodeWidth(), s.getNodeHeight());
                node.setColumn(k);
                node.setRow(rank);
                context.recordCell(node, k, rank);
                laneContentRight = Math.max(laneContentRight, x + s.getNodeWidth());
            }
            maxLaneLength = Math.max(maxLaneLength, ordered.size());
        }

        // Sections
        int maxSectionLength = 0;
        for (int i = 0; i < sectionOrder.size(); i++) {
            Subgraph section = sectionOrder.get(i);
            List<DiagramNode> members = new ArrayList<>(sections.get(section));
            double sectionX = laneContentRight + s.getSectionGap() + i * s.getSectionWidth();
            double badgeX = sectionX + (s.getSectionWidth() - s.getBadgeSize()) / 2;
            double badgeY = laneTop - s.getBadgeSize() - s.getBadgeGap();
            placeBadge(context, section, members, "section_label_", badgeX, badgeY, badgeIds);

            double nodeX = sectionX + (s.getSectionWidth() - s.getNodeWidth()) / 2;
            int column = maxLaneLength + i;
            for (int j = 0; j < members.size(); j++) {
                DiagramNode node = members.get(j);
                node.place(nodeX, laneTop + j * s.getLaneHeight(), s.getNodeWidth(), s.getNodeHeight());
                node.setColumn(column);
                node.setRow(j);
                context.recordCell(node, column, j);
            }
            maxSectionLength = Math.max(maxSectionLength, members.size());
        }

        // Outside-the-grid producers/consumers, centered on the lane stack
        if (!outside.isEmpty()) {
            int stackRows = Math.max(1, Math.max(laneOrder.size(), maxSectionLength));
            double gridHeight = stackHeight(stackRows, s);
            double outsideHeight = stackHeight(outside.size(), s);
            double top = laneTop + (gridHeight - outsideHeight) / 2;
            for (int j = 0; j < outside.size(); j++) {
                DiagramNode node = outside.get(j);
                node.place(0, top + j * s.getLaneHeight(), s.getNodeWidth(), s.getNodeHeight());
                node.setColumn(-1);
                node.setRow(j);
                context.recordCell(node, -1, j);
            }
        }

        // Everything else goes to a final column on the right
        if (!unplaced.isEmpty()) {
            double right = sectionOrder.isEmpty()
                    ? laneContentRight
                    : laneContentRight + s.getSectionGap() + sectionOrder.size() * s.getSectionWidth();
            double x = right + s.getSectionGap();
            int column = maxLaneLength + sectionOrder.size();
            for (int j = 0; j < unplaced.size(); j++) {
                DiagramNode node = unplaced.get(j);
                node.place(x, laneTop + j * s.getLaneHeight(), s.getNodeWidth(), s.getNodeHeight());
                node.setColumn(column);
                node.setRow(j);
                context.recordCell(node, column, j);
            }
            log.debug("[LaneLayout] {} node(s) outside any lane or section appended at x={}", unplaced.size(), x);
        }

        log.debug("[LaneLayout] {} lanes, {} sections, {} outside, {} badges",
                laneOrder.size(), sectionOrder.size(), outside.size(), context.getBadges().size());
    }

    private static double stackHeight(int rows, LayoutSettings s) {
        return rows * s.getLaneHeight() - (s.getLaneHeight() - s.getNodeHeight());
    }

    private static void tag(DiagramNode node, Subgraph sg) {
        node.setLayoutKind(sg.getKind());
        node.setLayoutIndex(sg.getIndex());
        node.setBadgeLabel(sg.getBadgeLabel());
        node.setLayoutColor(sg.getColor());
    }

    /**
     * A user-declared annotation in the region takes the badge slot; otherwise a
     * badge node is synthesized. The annotation is removed from {@code members}.
     */
    private static void placeBadge(LayoutContext context, Subgraph sg, List<DiagramNode> members,
                                   String idPrefix, double x, double y, Set<String> badgeIds) {
        double size = context.getSettings().getBadgeSize();
        Optional<DiagramNode> annotation = members.stream()
                .filter(n -> n.getKind() == NodeKind.ANNOTATION)
                .findFirst();
        if (annotation.isPresent()) {
            members.remove(annotation.get());
            annotation.get().place(x, y, size, size);
            return;
        }

        String badge = sg.getBadgeLabel() != null && !sg.getBadgeLabel().isEmpty() ? sg.getBadgeLabel() : sg.getId();
        String id = idPrefix + badge.toLowerCase(Locale.ROOT);
        if (!badgeIds.add(id)) {
            id = idPrefix + sg.getId().toLowerCase(Locale.ROOT);
            badgeIds.add(id);
        }
        DiagramNode node = DiagramNode.builder()
                .id(id)
                .label(badge)
                .componentType("badge")
                .kind(NodeKind.BADGE)
                .layoutKind(sg.getKind())
                .layoutIndex(sg.getIndex())
                .badgeLabel(badge)
                .layoutColor(sg.getColor())
                .build();
        node.place(x, y, size, size);
        context.getBadges().add(node);
    }

    /** Kahn's algorithm over edges inside the lane; unreached members keep arrival order at the end. */
    static List<DiagramNode> topologicalOrder(List<DiagramNode> members, List<DiagramEdge> edges) {
        Map<String, DiagramNode> byId = new LinkedHashMap<>();
        members.forEach(n -> byId.put(n.getId(), n));
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> outgoing = new HashMap<>();
        members.forEach(n -> inDegree.put(n.getId(), 0));

        for (DiagramEdge edge : edges) {
            if (byId.containsKey(edge.getSource()) && byId.containsKey(edge.getTarget())) {
                outgoing.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge.getTarget());
                inDegree.merge(edge.getTarget(), 1, Integer::sum);
            }
        }

        ArrayDeque<String> queue = new ArrayDeque<>();
        byId.keySet().forEach(id -> { if (inDegree.get(id) == 0) queue.add(id); });

        Set<String> ordered = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!ordered.add(id)) continue;
            for (String next : outgoing.getOrDefault(id, List.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    queue.add(next);
                }
            }
        }
        ordered.addAll(byId.keySet());

        List<DiagramNode> result = new ArrayList<>();
        ordered.forEach(id -> result.add(byId.get(id)));
        return result;
    }
}
