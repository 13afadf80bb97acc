package com.flowlayout.flowlayout_backend.parser;

import com.flowlayout.flowlayout_backend.model.domain.DiagramEdge;
import com.flowlayout.flowlayout_backend.model.domain.DiagramGraph;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.NodeKind;
import com.flowlayout.flowlayout_backend.model.domain.Subgraph;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DiagramParserTest {

    private final DiagramParser parser = new DiagramParser();

    // -- edges -------------------------------------------------------------

    @Test
    void whenParsing_givenEdgeChainWithInlineDeclarations_shouldCreateNodesAndEdges() {
        DiagramGraph graph = parser.parse("flowchart LR\na[Kafka] --> b[Snowpipe] --> c[Table]");

        assertThat(graph.getNodes()).extracting(DiagramNode::getId).containsExactly("a", "b", "c");
        assertThat(graph.getNodes()).extracting(DiagramNode::getLabel).containsExactly("Kafka", "Snowpipe", "Table");
        assertThat(graph.getEdges()).extracting(DiagramEdge::getSource).containsExactly("a", "b");
        assertThat(graph.getEdges()).extracting(DiagramEdge::getTarget).containsExactly("b", "c");
        assertThat(graph.getWarnings()).isEmpty();
    }

    @Test
    void whenParsing_givenArrowVariantsAndLabels_shouldReadEveryEdge() {
        DiagramGraph graph = parser.parse(String.join("\n",
                "a -->|load| b",
                "b -- merge --> c",
                "c -.-> d",
                "d ==> e",
                "e --- f"));

        assertThat(graph.getEdges()).hasSize(5);
        assertThat(graph.getEdges().get(0).getLabel()).isEqualTo("load");
        assertThat(graph.getEdges().get(1).getLabel()).isEqualTo("merge");
        assertThat(graph.getEdges().get(2).getLabel()).isNull();
    }

    @Test
    void whenParsing_givenArrowInsideLabel_shouldNotSplitOnIt() {
        DiagramGraph graph = parser.parse("a[\"A --- B\"] --> b[Sink]");

        assertThat(graph.getEdges()).hasSize(1);
        assertThat(graph.findNode("a")).get().extracting(DiagramNode::getLabel).isEqualTo("A --- B");
    }

    @Test
    void whenParsing_givenShapeVariants_shouldStripDelimiters() {
        DiagramGraph graph = parser.parse(String.join("\n",
                "a[(Raw Table)]",
                "b([\"Stadium\"])",
                "c((Circle))",
                "d{Decision}",
                "e(Round)"));

        assertThat(graph.getNodes()).extracting(DiagramNode::getLabel)
                .containsExactly("Raw Table", "Stadium", "Circle", "Decision", "Round");
    }

    @Test
    void whenParsing_givenPunctuationOnlyId_shouldSkipEdgeWithWarning() {
        DiagramGraph graph = parser.parse("!!! --> a");

        assertThat(graph.getEdges()).isEmpty();
        assertThat(graph.getNodes()).extracting(DiagramNode::getId).containsExactly("a");
        assertThat(graph.getWarnings()).anyMatch(w -> w.contains("invalid endpoint"));
    }

    @Test
    void whenParsing_givenEscapedSource_shouldUnescapeBeforeTokenizing() {
        DiagramGraph graph = parser.parse("flowchart LR\\na[\\\"Orders\\\"] --> b[Sink]");

        assertThat(graph.getEdges()).hasSize(1);
        assertThat(graph.findNode("a")).get().extracting(DiagramNode::getLabel).isEqualTo("Orders");
    }

    @Test
    void whenParsing_givenUnrecognizedLine_shouldWarnAndContinue() {
        DiagramGraph graph = parser.parse("a --> b\nthis is not a diagram line\nb --> c");

        assertThat(graph.getEdges()).hasSize(2);
        assertThat(graph.getWarnings()).hasSize(1);
        assertThat(graph.getWarnings().get(0)).contains("line 2");
    }

    // -- groups ------------------------------------------------------------

    @Test
    void whenParsing_givenNestedGroups_shouldRecordParentAndMembers() {
        DiagramGraph graph = parser.parse(String.join("\n",
                "group ingestion_paths[Ingestion]",
                "  subgraph path_1[\"Path 1\"]",
                "    a[Kafka] --> b[Snowpipe]",
                "  end",
                "  c[Loose]",
                "end"));

        Subgraph outer = graph.findSubgraph("ingestion_paths").orElseThrow();
        Subgraph inner = graph.findSubgraph("path_1").orElseThrow();
        assertThat(inner.getParent()).isEqualTo("ingestion_paths");
        assertThat(inner.getLabel()).isEqualTo("Path 1");
        assertThat(inner.getMembers()).containsExactly("a", "b");
        assertThat(outer.getMembers()).containsExactly("c");
        assertThat(graph.findNode("a")).get().extracting(DiagramNode::getSubgraph).isEqualTo("path_1");
    }

    @Test
    void whenParsing_givenUnbalancedEnds_shouldTolerateThem() {
        DiagramGraph graph = parser.parse("end\ngroup g1[Open]\na[Thing]");

        assertThat(graph.getWarnings()).isEmpty();
        assertThat(graph.findNode("a")).get().extracting(DiagramNode::getSubgraph).isEqualTo("g1");
    }

    @Test
    void whenParsing_givenPerimeterGroup_shouldCreateBoundaryAndAssignMembers() {
        DiagramGraph graph = parser.parse(String.join("\n",
                "group aws_acct[AWS Account]",
                "  s3[S3 Bucket]",
                "end"));

        DiagramNode boundary = graph.findNode("account_boundary_aws").orElseThrow();
        assertThat(boundary.getKind()).isEqualTo(NodeKind.BOUNDARY);
        assertThat(boundary.getLabel()).isEqualTo("AWS Account");
        assertThat(graph.findNode("s3")).get().extracting(DiagramNode::getBoundary).isEqualTo("aws");
    }

    @Test
    void whenParsing_givenPerimeterGroupWithEmptyLabel_shouldLabelBoundaryWithGroupId() {
        DiagramGraph graph = parser.parse(String.join("\n",
                "group gcp_boundary[\"\"]",
                "  bq[BigQuery]",
                "end"));

        DiagramNode boundary = graph.findNode("account_boundary_gcp").orElseThrow();
        assertThat(boundary.getLabel()).isEqualTo("gcp_boundary");
        assertThat(graph.findSubgraph("gcp_boundary")).get().extracting(Subgraph::getLabel).isEqualTo("gcp_boundary");
        assertThat(graph.findNode("bq")).get().extracting(DiagramNode::getBoundary).isEqualTo("gcp");
    }

    @Test
    void whenParsing_givenPerimeterNodeDeclaredLaterThanItsEdge_shouldUseCanonicalIdEverywhere() {
        DiagramGraph graph = parser.parse("sf --> x\nsf[Snowflake Account]");

        assertThat(graph.getNodes()).extracting(DiagramNode::getId).contains("account_boundary_snowflake");
        assertThat(graph.getEdges().get(0).getSource()).isEqualTo("account_boundary_snowflake");
    }

    @Test
    void whenParsing_givenAzureServiceNode_shouldNotTreatItAsPerimeter() {
        DiagramGraph graph = parser.parse("blob[Azure Blob Storage]");

        assertThat(graph.findNode("blob")).get().extracting(DiagramNode::getKind).isEqualTo(NodeKind.COMPONENT);
    }

    // -- styles and annotations --------------------------------------------

    @Test
    void whenParsing_givenClassDefs_shouldBuildStyleTable() {
        DiagramGraph graph = parser.parse(String.join("\n",
                "classDef laneBadge fill:#7C3AED,stroke:#5B21B6,color:#fff",
                "classDef sectionBadge",
                "fill:#0EA5E9,stroke:#0369A1"));

        assertThat(graph.getClassStyles()).containsOnlyKeys("laneBadge", "sectionBadge");
        assertThat(graph.getClassStyles().get("laneBadge").fill()).isEqualTo("#7C3AED");
        assertThat(graph.getClassStyles().get("laneBadge").color()).isEqualTo("#fff");
        assertThat(graph.getClassStyles().get("sectionBadge").stroke()).isEqualTo("#0369A1");
        assertThat(graph.getClassStyles().get("sectionBadge").color()).isNull();
    }

    @Test
    void whenParsing_givenBadgeClassAndInvisibleLink_shouldMoveAnnotationIntoGroup() {
        DiagramGraph graph = parser.parse(String.join("\n",
                "group path_1a[Path 1a]",
                "  k[Kafka]",
                "end",
                "badge_1a([\"1a\"]):::laneBadge",
                "badge_1a ~~~ path_1a"));

        DiagramNode badge = graph.findNode("badge_1a").orElseThrow();
        assertThat(badge.getKind()).isEqualTo(NodeKind.ANNOTATION);
        assertThat(badge.getSubgraph()).isEqualTo("path_1a");
        assertThat(graph.findSubgraph("path_1a").orElseThrow().getMembers()).containsExactly("k", "badge_1a");
        assertThat(graph.getEdges()).isEmpty();
    }

    @Test
    void whenParsing_givenInvisibleLinkToUnknownTarget_shouldWarn() {
        DiagramGraph graph = parser.parse("note[Note]\nnote ~~~ nowhere");

        assertThat(graph.getWarnings()).anyMatch(w -> w.contains("nowhere"));
    }

    // -- declarations ------------------------------------------------------

    @Test
    void whenParsing_givenRepeatedDeclaration_shouldKeepBothForNormalizer() {
        DiagramGraph graph = parser.parse("a[First]\na[Second]");

        assertThat(graph.getNodes()).extracting(DiagramNode::getLabel).containsExactly("First", "Second");
    }

    @Test
    void whenParsing_givenReferenceBeforeDeclaration_shouldUseDeclaredLabel() {
        DiagramGraph graph = parser.parse("a --> b\nb[Gold Mart]");

        assertThat(graph.getNodes()).hasSize(2);
        assertThat(graph.findNode("b")).get().extracting(DiagramNode::getLabel).isEqualTo("Gold Mart");
    }

    @Test
    void whenParsing_givenSameSourceTwice_shouldReturnIndependentGraphs() {
        String source = "group g[G]\na --> b\nend";

        DiagramGraph first = parser.parse(source);
        DiagramGraph second = parser.parse(source);

        assertThat(second.getSubgraphs().get(0).getMembers()).containsExactly("a", "b");
        assertThat(first.getNodes()).isNotSameAs(second.getNodes());
    }
}
