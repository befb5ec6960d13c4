package com.gentoro.flowscript.query;

import static com.gentoro.flowscript.ir.IrTestBuilder.ir;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowscript.exception.FlowScriptErrorCode;
import com.gentoro.flowscript.exception.FlowScriptException;
import com.gentoro.flowscript.exception.NotFoundException;
import com.gentoro.flowscript.exception.ValidationException;
import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.NodeType;
import com.gentoro.flowscript.ir.RelationshipType;
import com.gentoro.flowscript.ir.StateType;
import com.gentoro.flowscript.query.result.AlternativesComparison;
import com.gentoro.flowscript.query.result.AlternativesComparison.AlternativeDetail;
import com.gentoro.flowscript.query.result.AlternativesSimple;
import com.gentoro.flowscript.query.result.AlternativesTree;
import com.gentoro.flowscript.query.result.AlternativesTree.TreeAlternative;
import com.gentoro.flowscript.query.result.BlockedResult;
import com.gentoro.flowscript.query.result.BlockedResult.BlockerDetail;
import com.gentoro.flowscript.query.result.ImpactAnalysis;
import com.gentoro.flowscript.query.result.ImpactAnalysis.Consequence;
import com.gentoro.flowscript.query.result.ImpactSummary;
import com.gentoro.flowscript.query.result.NodeRef;
import com.gentoro.flowscript.query.result.TensionsResult;
import com.gentoro.flowscript.query.result.WhyChainResult;
import com.gentoro.flowscript.query.result.WhyChainResult.CausalStep;
import com.gentoro.flowscript.query.result.WhyMinimalResult;
import com.gentoro.flowscript.utility.JacksonUtility;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QueryEngineTest {
  private static final Instant NOW = Instant.parse("2024-03-11T00:00:00Z");

  private QueryEngine engine;

  @BeforeEach
  void setUp() {
    engine = new QueryEngine(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  @DisplayName("Queries before load fail with a precondition error")
  void notLoaded() {
    FlowScriptException ex = assertThrows(FlowScriptException.class, () -> engine.why("a"));
    assertEquals(FlowScriptErrorCode.FAILED_PRECONDITION, ex.getCode());
  }

  @Test
  @DisplayName("Loading null is rejected")
  void loadNull() {
    assertThrows(ValidationException.class, () -> engine.load(null));
  }

  @Test
  @DisplayName("Unknown node ids raise NotFoundException")
  void unknownNode() {
    engine.load(ir().node("a", "A").build());

    NotFoundException ex = assertThrows(NotFoundException.class, () -> engine.why("nope"));
    assertEquals("Node not found: nope", ex.getMessage());
    assertThrows(NotFoundException.class, () -> engine.whatIf("nope"));
    assertThrows(NotFoundException.class, () -> engine.alternatives("nope"));
  }

  @Test
  @DisplayName("Negative depth limits are rejected")
  void negativeDepth() {
    assertThrows(ValidationException.class, () -> WhyOptions.defaults().withMaxDepth(-1));
    assertThrows(ValidationException.class, () -> WhatIfOptions.defaults().withMaxDepth(-1));
  }

  @Test
  @DisplayName("Days blocked are whole days and unreadable dates count as zero")
  void daysSince() {
    Instant noon = Instant.parse("2024-03-11T12:00:00Z");
    assertEquals(10, QueryEngine.daysSince("2024-03-01", noon));
    assertEquals(1, QueryEngine.daysSince("2024-03-10T00:00:00Z", noon));
    assertEquals(0, QueryEngine.daysSince("someday", noon));
    assertEquals(0, QueryEngine.daysSince("", noon));
  }

  @Nested
  @DisplayName("why")
  class Why {

    @Test
    @DisplayName("Derivations are followed back to the deepest source")
    void derivationChain() {
      // A <- B <- C
      engine.load(
          ir().node("a", "Outage")
              .node("b", "Bad deploy")
              .node("c", "Missing review")
              .derivesFrom("a", "b")
              .derivesFrom("b", "c")
              .build());

      WhyChainResult result = (WhyChainResult) engine.why("a");

      assertEquals(new NodeRef("a", "Outage"), result.target());
      assertEquals("c", result.rootCause().id());
      assertTrue(result.rootCause().isRoot());
      assertEquals(
          List.of(
              new CausalStep(2, "c", "Missing review", "derives_from"),
              new CausalStep(1, "b", "Bad deploy", "derives_from")),
          result.causalChain());
      assertEquals(2, result.metadata().totalAncestors());
      assertEquals(2, result.metadata().maxDepth());
      assertFalse(result.metadata().hasMultiplePaths());
    }

    @Test
    @DisplayName("Causes edges lead to the same chain as derivations")
    void causesChain() {
      engine.load(
          ir().node("c", "Missing review")
              .node("b", "Bad deploy")
              .node("a", "Outage")
              .causes("c", "b")
              .causes("b", "a")
              .build());

      WhyChainResult result = (WhyChainResult) engine.why("a");

      assertThat(result.causalChain()).extracting(CausalStep::id).containsExactly("c", "b");
      assertEquals("causes", result.causalChain().get(0).relationshipType());
    }

    @Test
    @DisplayName("Two direct causes mark multiple paths")
    void multiplePaths() {
      engine.load(
          ir().node("x", "Traffic spike")
              .node("y", "Memory leak")
              .node("t", "Crash")
              .causes("x", "t")
              .causes("y", "t")
              .build());

      WhyChainResult result = (WhyChainResult) engine.why("t");

      assertTrue(result.metadata().hasMultiplePaths());
      assertEquals(2, result.metadata().totalAncestors());
      assertEquals("x", result.rootCause().id());
    }

    @Test
    @DisplayName("A node without causes is its own root")
    void noAncestors() {
      engine.load(ir().node("a", "Idea").build());

      WhyChainResult result = (WhyChainResult) engine.why("a");

      assertTrue(result.causalChain().isEmpty());
      assertEquals("a", result.rootCause().id());
      assertEquals(0, result.metadata().totalAncestors());
    }

    @Test
    @DisplayName("Depth limit cuts the walk short")
    void depthLimit() {
      engine.load(
          ir().node("a", "A")
              .node("b", "B")
              .node("c", "C")
              .derivesFrom("a", "b")
              .derivesFrom("b", "c")
              .build());

      WhyChainResult result =
          (WhyChainResult) engine.why("a", WhyOptions.defaults().withMaxDepth(1));

      assertEquals("b", result.rootCause().id());
      assertEquals(1, result.metadata().totalAncestors());
    }

    @Test
    @DisplayName("Minimal format lists contents only")
    void minimal() {
      engine.load(
          ir().node("c", "Root").node("a", "Leaf").causes("c", "a").build());

      WhyMinimalResult result =
          (WhyMinimalResult)
              engine.why("a", WhyOptions.defaults().withFormat(WhyOptions.Format.MINIMAL));

      assertEquals("Root", result.rootCause());
      assertEquals(List.of("Root"), result.chain());
    }

    @Test
    @DisplayName("Correlations are only followed when requested")
    void correlations() {
      engine.load(
          ir().node("a", "A")
              .node("b", "B")
              .rel(RelationshipType.EQUIVALENT, "a", "b", null)
              .build());

      assertEquals(0, ((WhyChainResult) engine.why("a")).metadata().totalAncestors());
      WhyChainResult withCorrelations =
          (WhyChainResult) engine.why("a", WhyOptions.defaults().withCorrelations(true));
      assertEquals(1, withCorrelations.metadata().totalAncestors());
    }

    @Test
    @DisplayName("Cycles terminate")
    void cycle() {
      engine.load(
          ir().node("a", "A").node("b", "B").causes("a", "b").causes("b", "a").build());

      assertNotNull(engine.why("a"));
    }
  }

  @Nested
  @DisplayName("whatIf")
  class WhatIf {

    @BeforeEach
    void load() {
      engine.load(
          ir().node("s", "Add cache")
              .node("a", "Faster reads")
              .node("b", "Cache invalidation issue")
              .node("t", "Team retraining")
              .causes("s", "a")
              .causes("a", "b")
              .rel(RelationshipType.TEMPORAL, "s", "t", null)
              .tension("a", "b", "cost")
              .build());
    }

    @Test
    @DisplayName("Direct and indirect consequences are split by depth")
    void tree() {
      ImpactAnalysis result = (ImpactAnalysis) engine.whatIf("s");

      assertEquals(new NodeRef("s", "Add cache"), result.source());
      assertEquals(
          List.of(
              new Consequence("a", "Faster reads", "causes", 1, true, null),
              new Consequence("t", "Team retraining", "temporal", 1, false, null)),
          result.impactTree().directConsequences());
      assertEquals(
          List.of(new Consequence("b", "Cache invalidation issue", "causes", 2, null, "cost")),
          result.impactTree().indirectConsequences());
      assertEquals(1, result.tensionsInImpactZone().size());
      assertEquals("cost", result.tensionsInImpactZone().get(0).axis());

      ImpactAnalysis.Metadata metadata = result.metadata();
      assertEquals(3, metadata.totalDescendants());
      assertEquals(2, metadata.maxDepth());
      assertEquals(1, metadata.tensionCount());
      assertTrue(metadata.hasTemporalConsequences());
    }

    @Test
    @DisplayName("Temporal consequences can be left out")
    void withoutTemporal() {
      ImpactAnalysis result =
          (ImpactAnalysis)
              engine.whatIf("s", WhatIfOptions.defaults().withTemporalConsequences(false));

      assertEquals(2, result.metadata().totalDescendants());
      assertFalse(result.metadata().hasTemporalConsequences());
    }

    @Test
    @DisplayName("Summary sorts consequences into benefits and risks")
    void summary() {
      ImpactSummary result =
          (ImpactSummary)
              engine.whatIf("s", WhatIfOptions.defaults().withFormat(WhatIfOptions.Format.SUMMARY));

      assertEquals("Add cache affects 3 downstream considerations", result.impactSummary());
      assertEquals(List.of("Faster reads", "Team retraining"), result.benefits());
      assertEquals(List.of("Cache invalidation issue"), result.risks());
      assertEquals("cost (Faster reads vs Cache invalidation issue)", result.keyTradeoff());
    }

    @Test
    @DisplayName("A leaf node has no impact")
    void leaf() {
      ImpactSummary result =
          (ImpactSummary)
              engine.whatIf("b", WhatIfOptions.defaults().withFormat(WhatIfOptions.Format.SUMMARY));

      assertEquals(
          "Cache invalidation issue affects 0 downstream considerations", result.impactSummary());
      assertNull(result.keyTradeoff());
    }

    @Test
    @DisplayName("A node reached twice is reported once at its shortest depth")
    void diamond() {
      engine.load(
          ir().node("s", "S")
              .node("x", "X")
              .node("y", "Y")
              .node("z", "Z")
              .causes("s", "x")
              .causes("x", "z")
              .causes("s", "y")
              .causes("y", "z")
              .causes("s", "z")
              .build());

      ImpactAnalysis result = (ImpactAnalysis) engine.whatIf("s");

      assertEquals(3, result.metadata().totalDescendants());
      assertThat(result.impactTree().directConsequences())
          .extracting(Consequence::id)
          .containsExactly("x", "z", "y");
      assertTrue(result.impactTree().indirectConsequences().isEmpty());
    }
  }

  @Nested
  @DisplayName("tensions")
  class Tensions {

    @BeforeEach
    void load() {
      engine.load(
          ir().node("root", "Rewrite")
              .node("s", "Speed")
              .node("q", "Quality")
              .node("c", "Cost")
              .node("t", "Time")
              .causes("root", "s")
              .causes("root", "q")
              .tension("s", "q", "performance")
              .tension("c", "t", "budget")
              .tension("s", "c", "performance")
              .tension("q", "t", null)
              .build());
    }

    @Test
    @DisplayName("Grouped by axis by default, unlabeled ones included")
    void byAxis() {
      TensionsResult result = engine.tensions();

      assertEquals(
          List.of("performance", "budget", "unlabeled"),
          List.copyOf(result.tensionsByAxis().keySet()));
      assertEquals(2, result.tensionsByAxis().get("performance").size());
      assertNull(result.tensionsByNode());
      assertNull(result.tensions());
      assertEquals(4, result.metadata().totalTensions());
      assertEquals("performance", result.metadata().mostCommonAxis());
    }

    @Test
    @DisplayName("Axis filter keeps only the listed axes")
    void filter() {
      TensionsResult result =
          engine.tensions(TensionOptions.defaults().withAxes(List.of("budget")));

      assertEquals(1, result.metadata().totalTensions());
      assertEquals(List.of("budget"), result.metadata().uniqueAxes());
      assertEquals("budget", result.metadata().mostCommonAxis());
    }

    @Test
    @DisplayName("Grouping by node keys on the tension source")
    void byNode() {
      TensionsResult result =
          engine.tensions(TensionOptions.defaults().withGroupBy(TensionOptions.GroupBy.NODE));

      assertEquals(List.of("s", "c", "q"), List.copyOf(result.tensionsByNode().keySet()));
      assertEquals(2, result.tensionsByNode().get("s").size());
    }

    @Test
    @DisplayName("Flat listing keeps document order")
    void flat() {
      TensionsResult result =
          engine.tensions(TensionOptions.defaults().withGroupBy(TensionOptions.GroupBy.NONE));

      assertThat(result.tensions())
          .extracting(d -> d.source().id() + ">" + d.target().id())
          .containsExactly("s>q", "c>t", "s>c", "q>t");
    }

    @Test
    @DisplayName("Scope keeps tensions whose ends both follow from the scope node")
    void scope() {
      TensionsResult result = engine.tensions(TensionOptions.defaults().withScope("root"));

      assertEquals(1, result.metadata().totalTensions());
      assertEquals("s", result.tensionsByAxis().get("performance").get(0).source().id());
    }

    @Test
    @DisplayName("Unknown scope is an error")
    void unknownScope() {
      assertThrows(
          NotFoundException.class,
          () -> engine.tensions(TensionOptions.defaults().withScope("missing")));
    }

    @Test
    @DisplayName("Context lists what leads into the tension source")
    void context() {
      TensionsResult result =
          engine.tensions(
              TensionOptions.defaults()
                  .withGroupBy(TensionOptions.GroupBy.NONE)
                  .withContext(true));

      assertEquals(List.of(new NodeRef("root", "Rewrite")), result.tensions().get(0).context());
      assertNull(result.tensions().get(1).context());
    }

    @Test
    @DisplayName("No tensions gives an empty result with a null most common axis")
    void none() {
      engine.load(ir().node("a", "A").build());

      TensionsResult result = engine.tensions();

      assertEquals(0, result.metadata().totalTensions());
      assertNull(result.metadata().mostCommonAxis());
      JsonNode json = JacksonUtility.getJsonMapper().valueToTree(result);
      assertTrue(json.get("metadata").get("most_common_axis").isNull());
    }
  }

  @Nested
  @DisplayName("blocked")
  class Blocked {

    @BeforeEach
    void load() {
      engine.load(
          ir().node("x", "Schema drift")
              .node("d", "Data migration")
              .node("l", "Launch")
              .node("r", "Marketing push")
              .node("v", "Vendor contract")
              .node("o", "Old ticket")
              .causes("x", "d")
              .causes("d", "l")
              .causes("l", "r")
              .state(StateType.BLOCKED, "v", "reason", "Legal review", "since", "2024-03-08")
              .state(StateType.BLOCKED, "d", "reason", "Schema freeze", "since", "2024-03-01")
              .state(StateType.BLOCKED, "o", "reason", "Unclear owner")
              .build());
    }

    @Test
    @DisplayName("Blockers are ordered by impact, then by days blocked")
    void detailed() {
      BlockedResult result = engine.blocked();

      assertThat(result.blockers())
          .extracting(b -> b.node().id())
          .containsExactly("d", "v", "o");

      BlockerDetail top = result.blockers().get(0);
      assertEquals(2, top.impactScore());
      assertEquals(10, top.blockedState().daysBlocked());
      assertEquals("Schema freeze", top.blockedState().reason());
      assertEquals(List.of(new NodeRef("x", "Schema drift")), top.transitiveCauses());
      assertEquals(
          List.of(new NodeRef("l", "Launch"), new NodeRef("r", "Marketing push")),
          top.transitiveEffects());

      assertEquals(3, result.blockers().get(1).blockedState().daysBlocked());
      assertEquals(0, result.blockers().get(2).blockedState().daysBlocked());
      assertEquals("", result.blockers().get(2).blockedState().since());

      BlockedResult.Metadata metadata = result.metadata();
      assertEquals(3, metadata.totalBlockers());
      assertEquals(1, metadata.highPriorityCount());
      assertEquals(4.3, metadata.averageDaysBlocked());
      assertEquals("d", metadata.oldestBlocker().id());
      assertEquals(10, metadata.oldestBlocker().days());
    }

    @Test
    @DisplayName("Summary drops the transitive lists but keeps the impact score")
    void summary() {
      BlockedResult result =
          engine.blocked(BlockedOptions.defaults().withFormat(BlockedOptions.Format.SUMMARY));

      BlockerDetail top = result.blockers().get(0);
      assertNull(top.transitiveCauses());
      assertNull(top.transitiveEffects());
      assertEquals(2, top.impactScore());
    }

    @Test
    @DisplayName("Transitive lists can be switched off one at a time")
    void withoutCauses() {
      BlockedResult result =
          engine.blocked(BlockedOptions.defaults().withTransitiveCauses(false));

      assertNull(result.blockers().get(0).transitiveCauses());
      assertNotNull(result.blockers().get(0).transitiveEffects());
    }

    @Test
    @DisplayName("Since filter keeps blockers from that date on")
    void since() {
      BlockedResult result = engine.blocked(BlockedOptions.defaults().withSince("2024-03-05"));

      assertThat(result.blockers()).extracting(b -> b.node().id()).containsExactly("v");
    }

    @Test
    @DisplayName("No blockers gives zero metadata")
    void none() {
      engine.load(ir().node("a", "A").build());

      BlockedResult result = engine.blocked();

      assertTrue(result.blockers().isEmpty());
      assertEquals(0.0, result.metadata().averageDaysBlocked());
      assertNull(result.metadata().oldestBlocker());
    }
  }

  @Nested
  @DisplayName("alternatives")
  class Alternatives {

    private IR decisionGraph() {
      return ir().node("q", NodeType.QUESTION, "Which database")
          .node("p", NodeType.ALTERNATIVE, "Postgres")
          .node("m", NodeType.ALTERNATIVE, "Mongo")
          .node("pc", "Strong consistency")
          .node("mt", NodeType.THOUGHT, "Schema flexibility not needed")
          .node("oc", "Ops cost")
          .rel(RelationshipType.ALTERNATIVE, "q", "p", null)
          .rel(RelationshipType.ALTERNATIVE, "q", "m", null)
          .causes("p", "pc")
          .causes("m", "mt")
          .tension("p", "oc", "cost")
          .state(StateType.DECIDED, "p", "rationale", "Mature tooling", "on", "2024-01-01")
          .build();
    }

    @BeforeEach
    void load() {
      engine.load(decisionGraph());
    }

    @Test
    @DisplayName("Simple format names the chosen option and its rationale")
    void simple() {
      AlternativesSimple result =
          (AlternativesSimple)
              engine.alternatives(
                  "q",
                  AlternativesOptions.defaults().withFormat(AlternativesOptions.Format.SIMPLE));

      assertEquals("simple", result.format());
      assertEquals("Which database", result.question());
      assertEquals(List.of("Postgres", "Mongo"), result.optionsConsidered());
      assertEquals("Postgres", result.chosen());
      assertEquals("Mature tooling", result.reason());
    }

    @Test
    @DisplayName("Rationale can be left out")
    void simpleWithoutRationale() {
      AlternativesSimple result =
          (AlternativesSimple)
              engine.alternatives(
                  "q",
                  AlternativesOptions.defaults()
                      .withFormat(AlternativesOptions.Format.SIMPLE)
                      .withRationale(false));

      assertEquals("Postgres", result.chosen());
      assertNull(result.reason());
    }

    @Test
    @DisplayName("Comparison is the default format")
    void comparison() {
      AlternativesComparison result = (AlternativesComparison) engine.alternatives("q");

      assertEquals("comparison", result.format());
      AlternativeDetail postgres = result.alternatives().get(0);
      assertTrue(postgres.chosen());
      assertEquals("Mature tooling", postgres.rationale());
      assertEquals("2024-01-01", postgres.decidedOn());
      assertNull(postgres.consequences());
      assertEquals("cost", postgres.tensions().get(0).axis());

      AlternativeDetail mongo = result.alternatives().get(1);
      assertFalse(mongo.chosen());
      assertNull(mongo.rationale());
      assertNull(mongo.rejectionReasons());

      assertEquals("Postgres", result.decisionSummary().chosen());
      assertEquals(List.of("Mongo"), result.decisionSummary().rejected());
      assertEquals(List.of("cost"), result.decisionSummary().keyFactors());
    }

    @Test
    @DisplayName("Consequences and rejection reasons are opt-in")
    void comparisonExtras() {
      AlternativesComparison result =
          (AlternativesComparison)
              engine.alternatives(
                  "q",
                  AlternativesOptions.defaults().withConsequences(true).withRejectedReasons(true));

      assertEquals(
          List.of(new NodeRef("pc", "Strong consistency")),
          result.alternatives().get(0).consequences());
      assertEquals(
          List.of("Schema flexibility not needed"),
          result.alternatives().get(1).rejectionReasons());
    }

    @Test
    @DisplayName("Tree format nests what each alternative causes")
    void tree() {
      AlternativesTree result =
          (AlternativesTree)
              engine.alternatives(
                  "q",
                  AlternativesOptions.defaults()
                      .withFormat(AlternativesOptions.Format.TREE)
                      .withRejectedReasons(true));

      assertEquals(new NodeRef("q", "Which database"), result.question());
      TreeAlternative postgres = result.alternatives().get(0);
      assertTrue(postgres.chosen());
      assertNull(postgres.rejectionReasons());
      assertEquals("pc", postgres.children().get(0).id());

      TreeAlternative mongo = result.alternatives().get(1);
      assertFalse(mongo.chosen());
      assertEquals(List.of("Schema flexibility not needed"), mongo.rejectionReasons());
    }

    @Test
    @DisplayName("Tree format marks cycles instead of recursing forever")
    void treeCycle() {
      engine.load(
          ir().node("q", NodeType.QUESTION, "Q")
              .node("p", NodeType.ALTERNATIVE, "P")
              .node("x", "X")
              .rel(RelationshipType.ALTERNATIVE, "q", "p", null)
              .causes("p", "x")
              .causes("x", "p")
              .build());

      AlternativesTree result =
          (AlternativesTree)
              engine.alternatives(
                  "q", AlternativesOptions.defaults().withFormat(AlternativesOptions.Format.TREE));

      TreeAlternative back = result.alternatives().get(0).children().get(0).children().get(0);
      assertEquals("P [cycle detected]", back.content());
      assertTrue(back.children().isEmpty());
    }

    @Test
    @DisplayName("A decision on a node with the same text counts when no alternative has one")
    void contentFallback() {
      engine.load(
          ir().node("q", NodeType.QUESTION, "Which database")
              .node("p", NodeType.ALTERNATIVE, "Postgres")
              .node("m", NodeType.ALTERNATIVE, "Mongo")
              .node("p2", "Postgres")
              .rel(RelationshipType.ALTERNATIVE, "q", "p", null)
              .rel(RelationshipType.ALTERNATIVE, "q", "m", null)
              .state(StateType.DECIDED, "p2", "rationale", "Team knows it", "on", "2024-02-01")
              .build());

      AlternativesComparison result = (AlternativesComparison) engine.alternatives("q");

      assertTrue(result.alternatives().get(0).chosen());
      assertEquals("Team knows it", result.decisionSummary().rationale());
    }

    @Test
    @DisplayName("Undecided questions have no chosen option")
    void undecided() {
      engine.load(
          ir().node("q", NodeType.QUESTION, "Q")
              .node("a", NodeType.ALTERNATIVE, "A")
              .rel(RelationshipType.ALTERNATIVE, "q", "a", null)
              .build());

      AlternativesComparison result = (AlternativesComparison) engine.alternatives("q");

      assertNull(result.decisionSummary().chosen());
      assertEquals(List.of("A"), result.decisionSummary().rejected());
      assertTrue(result.decisionSummary().keyFactors().isEmpty());
    }

    @Test
    @DisplayName("Only questions have alternatives")
    void notAQuestion() {
      ValidationException ex =
          assertThrows(ValidationException.class, () -> engine.alternatives("p"));
      assertEquals("Node p is not a question (type: alternative)", ex.getMessage());
    }
  }
}
