package com.flowlayout.flowlayout_backend.service;

import com.flowlayout.flowlayout_backend.engine.DiagramLayoutEngine;
import com.flowlayout.flowlayout_backend.engine.SubgraphDetector;
import com.flowlayout.flowlayout_backend.model.domain.DiagramEdge;
import com.flowlayout.flowlayout_backend.model.domain.DiagramGraph;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.LayoutResult;
import com.flowlayout.flowlayout_backend.model.domain.NodeKind;
import com.flowlayout.flowlayout_backend.model.domain.Subgraph;
import com.flowlayout.flowlayout_backend.model.dto.DiagramEdgeDto;
import com.flowlayout.flowlayout_backend.model.dto.DiagramNodeDto;
import com.flowlayout.flowlayout_backend.model.dto.LayoutRequestDto;
import com.flowlayout.flowlayout_backend.model.dto.SubgraphDto;
import com.flowlayout.flowlayout_backend.normalize.GraphNormalizer;
import com.flowlayout.flowlayout_backend.parser.DiagramParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point for callers: diagram text or a pre-parsed graph in, positioned
 * graph out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagramLayoutService {

    private final DiagramParser parser;
    private final GraphNormalizer normalizer;
    private final DiagramLayoutEngine engine;
    private final SubgraphDetector detector;

    public LayoutResult layout(String source) {
        return engine.layout(parser.parse(source));
    }

    public LayoutResult layout(DiagramGraph graph) {
        return engine.layout(graph);
    }

    public LayoutResult layout(LayoutRequestDto request) {
        return engine.layout(toGraph(request));
    }

    /** Normalized graph without positions. */
    public DiagramGraph parse(LayoutRequestDto request) {
        return normalizer.normalize(toGraph(request));
    }

    public SubgraphDetector.Detection detect(String id, String label, String parent) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Subgraph id is required");
        }
        return detector.detect(id, label, parent);
    }

    DiagramGraph toGraph(LayoutRequestDto request) {
        if (request == null || (!request.hasSource() && request.nodes().isEmpty())) {
            throw new IllegalArgumentException("Request needs either 'source' text or a 'nodes' list");
        }
        if (request.hasSource()) {
            if (!request.nodes().isEmpty()) {
                log.debug("Request carries both source text and {} nodes, using the source", request.nodes().size());
            }
            return parser.parse(request.source());
        }

        // Membership listed on the subgraph fills in nodes that do not name one
        Map<String, String> memberOf = new HashMap<>();
        List<Subgraph> subgraphs = new ArrayList<>();
        for (SubgraphDto dto : request.subgraphs()) {
            if (dto.id() == null || dto.id().isBlank()) continue;
            dto.nodes().forEach(member -> memberOf.putIfAbsent(member, dto.id()));
            subgraphs.add(Subgraph.builder()
                    .id(dto.id())
                    .label(dto.label() != null ? dto.label() : dto.id())
                    .parent(dto.parent())
                    .members(new ArrayList<>(dto.nodes()))
                    .build());
        }

        List<DiagramNode> nodes = new ArrayList<>();
        for (DiagramNodeDto dto : request.nodes()) {
            nodes.add(DiagramNode.builder()
                    .id(dto.id())
                    .label(dto.label() != null ? dto.label() : dto.id())
                    .componentType(dto.componentType())
                    .kind(parseKind(dto.kind()))
                    .subgraph(dto.subgraph() != null ? dto.subgraph() : memberOf.get(dto.id()))
                    .stageHint(dto.flowStageOrder())
                    .stageName(dto.flowStage())
                    .boundary(dto.boundary())
                    .build());
        }

        List<DiagramEdge> edges = new ArrayList<>();
        for (DiagramEdgeDto dto : request.edges()) {
            edges.add(DiagramEdge.builder()
                    .id(dto.id())
                    .source(dto.source())
                    .target(dto.target())
                    .label(dto.label())
                    .build());
        }

        return DiagramGraph.builder()
                .nodes(nodes)
                .edges(edges)
                .subgraphs(subgraphs)
                .build();
    }

    private static NodeKind parseKind(String kind) {
        if (kind == null || kind.isBlank()) return NodeKind.COMPONENT;
        try {
            return NodeKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown node kind '{}', treating as component", kind);
            return NodeKind.COMPONENT;
        }
    }
}
