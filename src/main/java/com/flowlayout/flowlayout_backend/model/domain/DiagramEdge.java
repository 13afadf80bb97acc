package com.flowlayout.flowlayout_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagramEdge {

    private String id;
    private String source;
    private String target;

    // Inline "|label|" or "-- label -->" text
    private String label;

    private Handle sourceHandle;
    private Handle targetHandle;
}
