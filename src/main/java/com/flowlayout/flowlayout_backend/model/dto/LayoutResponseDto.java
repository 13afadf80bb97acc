package com.flowlayout.flowlayout_backend.model.dto;

import com.flowlayout.flowlayout_backend.model.domain.ClassStyle;
import com.flowlayout.flowlayout_backend.model.domain.DiagramEdge;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.LayoutMode;
import com.flowlayout.flowlayout_backend.model.domain.LayoutResult;
import com.flowlayout.flowlayout_backend.model.domain.Subgraph;

import java.util.List;
import java.util.Map;

/** Response body for POST /api/layout. */
public record LayoutResponseDto(
    LayoutMode mode,
    List<DiagramNode> nodes,
    List<DiagramEdge> edges,
    List<Subgraph> subgraphs,
    Map<String, ClassStyle> classStyles,
    Metadata metadata,
    List<String> warnings
) {

    public record Metadata(boolean medallion, int propagationPasses, boolean propagationConverged) {}

    public static LayoutResponseDto from(LayoutResult result) {
        return new LayoutResponseDto(
                result.getMode(),
                result.getNodes(),
                result.getEdges(),
                result.getSubgraphs(),
                result.getClassStyles(),
                new Metadata(result.isMedallion(), result.getPropagationPasses(), result.isPropagationConverged()),
                result.getWarnings());
    }
}
