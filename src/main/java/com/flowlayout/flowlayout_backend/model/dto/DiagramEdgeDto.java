package com.flowlayout.flowlayout_backend.model.dto;

public record DiagramEdgeDto(
    String id,
    String source,
    String target,
    String label
) {}
