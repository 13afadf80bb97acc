package com.flowlayout.flowlayout_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Subgraph {

    private String id;
    private String label;
    private String parent;

    @Builder.Default
    private List<String> members = new ArrayList<>();

    // Filled in by SubgraphDetector
    private SubgraphKind kind;
    private Integer index;
    private String badgeLabel;
    private String color;
}
