package com.flowlayout.flowlayout_backend.model.dto;

import java.util.List;

public record SubgraphDto(
    String id,
    String label,
    String parent,
    List<String> nodes
) {
    public List<String> nodes() {
        return nodes != null ? nodes : java.util.Collections.emptyList();
    }
}
