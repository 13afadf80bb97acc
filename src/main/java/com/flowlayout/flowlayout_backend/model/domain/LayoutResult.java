package com.flowlayout.flowlayout_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LayoutResult {

    private LayoutMode mode;

    // Input nodes with positions and sizes; badge nodes appended in lane/section mode
    private List<DiagramNode> nodes;
    private List<DiagramEdge> edges;
    private List<Subgraph> subgraphs;
    private Map<String, ClassStyle> classStyles;

    // Bronze/silver/gold naming somewhere in the diagram
    private boolean medallion;

    // Stage repair outcome; both zero/true in lane/section mode
    private int propagationPasses;
    private boolean propagationConverged;

    private List<String> warnings;
}
