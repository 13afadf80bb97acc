package com.flowlayout.flowlayout_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
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
public class DiagramNode {

    private String id;
    private String label;
    private String componentType;

    @Builder.Default
    private NodeKind kind = NodeKind.COMPONENT;

    // Innermost group block the node was declared in
    private String subgraph;

    // Caller-supplied hints, used only when keyword classification finds nothing
    private Double stageHint;
    private String stageName;

    // Explicit provider assignment ("aws", "snowflake", ...); beats keyword matching
    private String boundary;

    private String styleClass;

    // ── Derived by the layout ────────────────────────────────────────────────

    private Double stage;
    private String stageColor;
    private Integer column;
    private Integer row;

    private SubgraphKind layoutKind;
    private Integer layoutIndex;
    private String badgeLabel;
    private String layoutColor;

    private Double x;
    private Double y;
    private Double width;
    private Double height;

    @JsonIgnore
    public boolean isBoundaryNode() {
        return kind == NodeKind.BOUNDARY;
    }

    @JsonIgnore
    public boolean isBadgeNode() {
        return kind == NodeKind.BADGE;
    }

    /** Lower-cased "id label componentType", the text every keyword rule scans. */
    @JsonIgnore
    public String searchText() {
        return (id + " " + (label != null ? label : "") + " " + (componentType != null ? componentType : ""))
                .toLowerCase();
    }

    @JsonIgnore
    public boolean isPositioned() {
        return x != null && y != null;
    }

    public void place(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /** Forget everything an earlier layout run derived. */
    public void clearLayout() {
        stage = null;
        stageColor = null;
        column = null;
        row = null;
        layoutKind = null;
        layoutIndex = null;
        badgeLabel = null;
        layoutColor = null;
        x = null;
        y = null;
        width = null;
        height = null;
    }
}
