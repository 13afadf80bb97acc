package com.flowlayout.flowlayout_backend.service;

import com.flowlayout.flowlayout_backend.LayoutFixtures;
import com.flowlayout.flowlayout_backend.engine.SubgraphDetector;
import com.flowlayout.flowlayout_backend.model.domain.DiagramGraph;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.LayoutMode;
import com.flowlayout.flowlayout_backend.model.domain.LayoutResult;
import com.flowlayout.flowlayout_backend.model.domain.NodeKind;
import com.flowlayout.flowlayout_backend.model.domain.SubgraphKind;
import com.flowlayout.flowlayout_backend.model.dto.DiagramEdgeDto;
import com.flowlayout.flowlayout_backend.model.dto.DiagramNodeDto;
import com.flowlayout.flowlayout_backend.model.dto.LayoutRequestDto;
import com.flowlayout.flowlayout_backend.model.dto.SubgraphDto;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flowlayout.flowlayout_backend.LayoutFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagramLayoutServiceTest {

    private final DiagramLayoutService service = LayoutFixtures.service();

    private static DiagramNodeDto nodeDto(String id, String label) {
        return new DiagramNodeDto(id, label, null, null, null, null, null, null);
    }

    // -- request mapping ---------------------------------------------------

    @Test
    void whenMapping_givenNeitherSourceNorNodes_shouldReject() {
        assertThatThrownBy(() -> service.toGraph(new LayoutRequestDto(null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'source'");
        assertThatThrownBy(() -> service.toGraph(new LayoutRequestDto("   ", List.of(), null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.toGraph(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void whenMapping_givenSourceAndNodes_shouldUseSource() {
        DiagramGraph graph = service.toGraph(new LayoutRequestDto(
                "a[Kafka] --> b[Snowpipe]", List.of(nodeDto("z", "Ignored")), null, null));

        assertThat(graph.getNodes()).extracting(DiagramNode::getId).containsExactly("a", "b");
    }

    @Test
    void whenMapping_givenPreParsedGraph_shouldCarryHintsAndMembership() {
        LayoutRequestDto request = new LayoutRequestDto(
                null,
                List.of(
                        new DiagramNodeDto("a", "Orders Feed", "ext_kafka_topic", null, null, null, null, null),
                        new DiagramNodeDto("b", null, null, null, 4.0, null, "snowflake", "component"),
                        new DiagramNodeDto("n", "1a", null, "path_1a", null, null, null, "annotation"),
                        new DiagramNodeDto("c", "Odd", null, null, null, "serve", null, "mystery")),
                List.of(new DiagramEdgeDto(null, "a", "b", "load")),
                List.of(new SubgraphDto("path_1a", null, null, List.of("a", "b"))));

        DiagramGraph graph = service.toGraph(request);

        DiagramNode a = graph.findNode("a").orElseThrow();
        DiagramNode b = graph.findNode("b").orElseThrow();
        assertThat(a.getSubgraph()).isEqualTo("path_1a");
        assertThat(a.getComponentType()).isEqualTo("ext_kafka_topic");
        assertThat(b.getLabel()).isEqualTo("b");
        assertThat(b.getStageHint()).isEqualTo(4.0);
        assertThat(b.getBoundary()).isEqualTo("snowflake");
        assertThat(graph.findNode("n").orElseThrow().getKind()).isEqualTo(NodeKind.ANNOTATION);
        assertThat(graph.findNode("c").orElseThrow().getKind()).isEqualTo(NodeKind.COMPONENT);
        assertThat(graph.findNode("c").orElseThrow().getStageName()).isEqualTo("serve");
        assertThat(graph.findSubgraph("path_1a").orElseThrow().getLabel()).isEqualTo("path_1a");
        assertThat(graph.getEdges().get(0).getLabel()).isEqualTo("load");
    }

    // -- layout ------------------------------------------------------------

    @Test
    void whenLayingOut_givenPreParsedLanes_shouldMatchTextLayout() {
        LayoutRequestDto request = new LayoutRequestDto(
                null,
                List.of(nodeDto("k", "Kafka"), nodeDto("p", "Snowpipe")),
                List.of(new DiagramEdgeDto(null, "k", "p", null)),
                List.of(new SubgraphDto("path_1a", "Path 1a", null, List.of("k", "p"))));

        LayoutResult fromDto = service.layout(request);
        LayoutResult fromText = service.layout("group path_1a[Path 1a]\nk[Kafka] --> p[Snowpipe]\nend");

        assertThat(fromDto.getMode()).isEqualTo(LayoutMode.LANE_SECTION);
        assertThat(node(fromDto, "p").getX()).isEqualTo(node(fromText, "p").getX());
        assertThat(node(fromDto, "p").getY()).isEqualTo(node(fromText, "p").getY());
    }

    @Test
    void whenLayingOut_givenStageHintOnUnknownNode_shouldUseHint() {
        LayoutRequestDto request = new LayoutRequestDto(
                null,
                List.of(new DiagramNodeDto("x", "Mystery Box", null, null, 4.0, null, null, null),
                        new DiagramNodeDto("y", "Other Box", null, null, null, "serve", null, null)),
                null,
                null);

        LayoutResult result = service.layout(request);

        assertThat(node(result, "x").getStage()).isEqualTo(4.0);
        assertThat(node(result, "y").getStage()).isEqualTo(5.0);
    }

    @Test
    void whenParsing_givenDuplicates_shouldReturnNormalizedGraphWithoutPositions() {
        DiagramGraph graph = service.parse(new LayoutRequestDto("a[First]\na[Second]\na --> a", null, null, null));

        assertThat(graph.getNodes()).hasSize(1);
        assertThat(graph.getNodes().get(0).getX()).isNull();
        assertThat(graph.getEdges()).isEmpty();
        assertThat(graph.getWarnings()).hasSize(2);
    }

    // -- detection ---------------------------------------------------------

    @Test
    void whenDetecting_givenLaneId_shouldReturnLaneWithBadge() {
        SubgraphDetector.Detection detection = service.detect("path_2b", null, null);

        assertThat(detection.kind()).isEqualTo(SubgraphKind.LANE);
        assertThat(detection.index()).isEqualTo(1);
        assertThat(detection.badgeLabel()).isEqualTo("2B");
    }

    @Test
    void whenDetecting_givenBlankId_shouldReject() {
        assertThatThrownBy(() -> service.detect(" ", "Label", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
