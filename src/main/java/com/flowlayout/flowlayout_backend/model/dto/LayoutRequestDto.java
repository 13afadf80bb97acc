package com.flowlayout.flowlayout_backend.model.dto;

import java.util.List;

/**
 * Request body for POST /api/layout and /api/layout/parse: either diagram
 * {@code source} text or a pre-parsed graph. Source wins when both are sent.
 * Null-safe: null lists are treated as empty.
 */
public record LayoutRequestDto(
    String source,
    List<DiagramNodeDto> nodes,
    List<DiagramEdgeDto> edges,
    List<SubgraphDto> subgraphs
) {
    public List<DiagramNodeDto> nodes() {
        return nodes != null ? nodes : java.util.Collections.emptyList();
    }

    public List<DiagramEdgeDto> edges() {
        return edges != null ? edges : java.util.Collections.emptyList();
    }

    public List<SubgraphDto> subgraphs() {
        return subgraphs != null ? subgraphs : java.util.Collections.emptyList();
    }

    public boolean hasSource() {
        return source != null && !source.isBlank();
    }
}
