package com.flowlayout.flowlayout_backend.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Nodes, edges and group blocks of one diagram, as produced by the parser or
 * handed in pre-parsed by a caller. Lists keep declaration order.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DiagramGraph {

    @Builder.Default
    private List<DiagramNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<DiagramEdge> edges = new ArrayList<>();

    @Builder.Default
    private List<Subgraph> subgraphs = new ArrayList<>();

    @Builder.Default
    private Map<String, ClassStyle> classStyles = new LinkedHashMap<>();

    // Skipped lines, dropped nodes/edges: never fatal, reported to the caller
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public Optional<DiagramNode> findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    public Optional<Subgraph> findSubgraph(String id) {
        return subgraphs.stream().filter(s -> s.getId().equals(id)).findFirst();
    }

    /** Deep enough copy that the layout can write derived fields without touching the input. */
    public DiagramGraph copy() {
        List<DiagramNode> nodeCopies = new ArrayList<>();
        nodes.forEach(n -> nodeCopies.add(n.toBuilder().build()));
        List<DiagramEdge> edgeCopies = new ArrayList<>();
        edges.forEach(e -> edgeCopies.add(e.toBuilder().build()));
        List<Subgraph> subgraphCopies = new ArrayList<>();
        subgraphs.forEach(s -> subgraphCopies.add(s.toBuilder().members(new ArrayList<>(s.getMembers())).build()));
        return DiagramGraph.builder()
                .nodes(nodeCopies)
                .edges(edgeCopies)
                .subgraphs(subgraphCopies)
                .classStyles(new LinkedHashMap<>(classStyles))
                .warnings(new ArrayList<>(warnings))
                .build();
    }
}
