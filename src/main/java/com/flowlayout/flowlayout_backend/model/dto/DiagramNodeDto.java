package com.flowlayout.flowlayout_backend.model.dto;

/**
 * Pre-parsed node as an upstream generator sends it. {@code flowStageOrder} and
 * {@code flowStage} are hints only; keyword classification comes first.
 */
public record DiagramNodeDto(
    String id,
    String label,
    String componentType,
    String subgraph,
    Double flowStageOrder,
    String flowStage,
    String boundary,
    String kind
) {}
