package com.flowlayout.flowlayout_backend.normalize;

import com.flowlayout.flowlayout_backend.model.domain.DiagramEdge;
import com.flowlayout.flowlayout_backend.model.domain.DiagramGraph;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.NodeKind;
import com.flowlayout.flowlayout_backend.model.domain.Provider;
import com.flowlayout.flowlayout_backend.model.domain.Subgraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dedups nodes, canonicalizes component types and drops edges that cannot be
 * drawn. Works on a copy; the input graph is never modified.
 *
 * Dedup keeps the FIRST occurrence of an id. Later declarations are dropped
 * even when they carry more information.
 */
@Slf4j
@Component
public class GraphNormalizer {

    public DiagramGraph normalize(DiagramGraph input) {
        DiagramGraph graph = input.copy();
        List<String> warnings = graph.getWarnings();

        Map<String, String> aliases = new HashMap<>();
        Map<String, DiagramNode> survivors = new LinkedHashMap<>();

        for (DiagramNode node : graph.getNodes()) {
            if (node.getId() == null || node.getId().isBlank()) {
                warnings.add("Dropped node without id");
                continue;
            }
            String originalId = node.getId();
            if (looksLikeBoundary(node)) {
                Optional<Provider> provider = Provider.fromBoundaryText(
                        node.getComponentType() + " " + node.getId() + " " + node.getLabel());
                if (provider.isPresent()) {
                    node.setKind(NodeKind.BOUNDARY);
                    node.setId(provider.get().canonicalId());
                    node.setComponentType(provider.get().canonicalId());
                    node.setBoundary(null);
                } else {
                    log.warn("[Normalizer] Boundary '{}' names no known provider, treating it as a component",
                            originalId);
                    warnings.add("Boundary '" + originalId + "' names no known provider");
                    node.setKind(NodeKind.COMPONENT);
                }
            }
            if (!originalId.equals(node.getId())) {
                aliases.put(originalId, node.getId());
            }

            DiagramNode first = survivors.get(node.getId());
            if (first != null) {
                log.debug("[Normalizer] Duplicate node '{}' dropped, first declaration kept", node.getId());
                if (!first.isBoundaryNode()) {
                    warnings.add("Duplicate node '" + node.getId() + "' dropped");
                }
                continue;
            }
            survivors.put(node.getId(), node);
        }

        for (DiagramNode node : survivors.values()) {
            if (!node.isBoundaryNode()) {
                node.setComponentType(node.getComponentType() != null
                        ? ComponentTypeCanonicalizer.canonicalize(node.getComponentType())
                        : ComponentTypeCanonicalizer.canonicalize(ComponentTypeCanonicalizer.fromLabel(node.getLabel())));
            }
            if (node.getBoundary() != null) {
                // "account_boundary_aws" and "AWS" both mean aws
                node.setBoundary(Provider.fromKey(node.getBoundary())
                        .or(() -> Provider.fromBoundaryText(node.getBoundary()))
                        .map(Provider::key)
                        .orElse(null));
            }
        }

        graph.setNodes(new ArrayList<>(survivors.values()));
        graph.setSubgraphs(normalizeSubgraphs(graph.getSubgraphs(), survivors, aliases));
        graph.setEdges(normalizeEdges(graph.getEdges(), survivors.keySet(), aliases, warnings));

        log.debug("[Normalizer] {} nodes, {} edges, {} subgraphs after normalization",
                graph.getNodes().size(), graph.getEdges().size(), graph.getSubgraphs().size());
        return graph;
    }

    private static boolean looksLikeBoundary(DiagramNode node) {
        if (node.getKind() == NodeKind.BOUNDARY) return true;
        String type = node.getComponentType() != null ? node.getComponentType().toLowerCase() : "";
        return type.startsWith("account_boundary") || node.getId().toLowerCase().startsWith(Provider.BOUNDARY_PREFIX);
    }

    /** Members are rewritten through aliases and kept only when the node really sits in that subgraph. */
    private static List<Subgraph> normalizeSubgraphs(List<Subgraph> subgraphs,
                                                     Map<String, DiagramNode> nodes,
                                                     Map<String, String> aliases) {
        List<Subgraph> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Subgraph sg : subgraphs) {
            if (sg.getId() == null || !seen.add(sg.getId())) {
                log.debug("[Normalizer] Duplicate subgraph '{}' dropped", sg.getId());
                continue;
            }
            Set<String> members = new LinkedHashSet<>();
            for (String member : sg.getMembers()) {
                String id = aliases.getOrDefault(member, member);
                DiagramNode node = nodes.get(id);
                if (node != null && sg.getId().equals(node.getSubgraph())) {
                    members.add(id);
                }
            }
            // Nodes that name the subgraph but were not listed (pre-parsed input)
            for (DiagramNode node : nodes.values()) {
                if (sg.getId().equals(node.getSubgraph())) {
                    members.add(node.getId());
                }
            }
            sg.setMembers(new ArrayList<>(members));
            result.add(sg);
        }
        return result;
    }

    private static List<DiagramEdge> normalizeEdges(List<DiagramEdge> edges,
                                                    Set<String> nodeIds,
                                                    Map<String, String> aliases,
                                                    List<String> warnings) {
        List<DiagramEdge> result = new ArrayList<>();
        Set<String> pairs = new HashSet<>();
        for (DiagramEdge edge : edges) {
            String source = aliases.getOrDefault(edge.getSource(), edge.getSource());
            String target = aliases.getOrDefault(edge.getTarget(), edge.getTarget());
            if (source == null || target == null || !nodeIds.contains(source) || !nodeIds.contains(target)) {
                log.warn("[Normalizer] Edge {} -> {} references a missing node, dropped", source, target);
                warnings.add("Edge " + source + " -> " + target + " references a missing node");
                continue;
            }
            if (source.equals(target)) {
                log.debug("[Normalizer] Self-loop on '{}' dropped", source);
                warnings.add("Self-loop on '" + source + "' dropped");
                continue;
            }
            if (!pairs.add(source + "\u0000" + target)) {
                log.debug("[Normalizer] Duplicate edge {} -> {} dropped", source, target);
                continue;
            }
            edge.setSource(source);
            edge.setTarget(target);
            if (edge.getId() == null || edge.getId().isBlank()) {
                edge.setId(source + "-" + target + "-" + result.size());
            }
            result.add(edge);
        }
        return result;
    }
}
