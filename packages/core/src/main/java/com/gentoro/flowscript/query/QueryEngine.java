package com.gentoro.flowscript.query;

import com.gentoro.flowscript.exception.FlowScriptErrorCode;
import com.gentoro.flowscript.exception.FlowScriptException;
import com.gentoro.flowscript.exception.ValidationException;
import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.NodeType;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.RelationshipType;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.ir.StateType;
import com.gentoro.flowscript.logging.LoggingService;
import com.gentoro.flowscript.query.GraphIndex.Reached;
import com.gentoro.flowscript.query.GraphIndex.Step;
import com.gentoro.flowscript.query.result.AlternativesComparison;
import com.gentoro.flowscript.query.result.AlternativesComparison.AlternativeDetail;
import com.gentoro.flowscript.query.result.AlternativesComparison.DecisionSummary;
import com.gentoro.flowscript.query.result.AlternativesResult;
import com.gentoro.flowscript.query.result.AlternativesSimple;
import com.gentoro.flowscript.query.result.AlternativesTree;
import com.gentoro.flowscript.query.result.AlternativesTree.TreeAlternative;
import com.gentoro.flowscript.query.result.BlockedResult;
import com.gentoro.flowscript.query.result.BlockedResult.BlockedState;
import com.gentoro.flowscript.query.result.BlockedResult.BlockerDetail;
import com.gentoro.flowscript.query.result.BlockedResult.OldestBlocker;
import com.gentoro.flowscript.query.result.ImpactAnalysis;
import com.gentoro.flowscript.query.result.ImpactAnalysis.Consequence;
import com.gentoro.flowscript.query.result.ImpactSummary;
import com.gentoro.flowscript.query.result.NodeRef;
import com.gentoro.flowscript.query.result.TensionInfo;
import com.gentoro.flowscript.query.result.TensionsResult;
import com.gentoro.flowscript.query.result.TensionsResult.TensionDetail;
import com.gentoro.flowscript.query.result.WhatIfResult;
import com.gentoro.flowscript.query.result.WhyChainResult;
import com.gentoro.flowscript.query.result.WhyChainResult.CausalStep;
import com.gentoro.flowscript.query.result.WhyMinimalResult;
import com.gentoro.flowscript.query.result.WhyResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;

/**
 * Structural queries over a loaded IR.
 *
 * <p>{@link #load(IR)} builds the indexes once; every query after that reads them and keeps its
 * traversal state local, so one loaded engine can serve concurrent callers. Load a separate engine
 * per document.
 */
public class QueryEngine {
  private static final Logger log = LoggingService.getLogger(QueryEngine.class);
  private static final Pattern RISK_WORDS = Pattern.compile("risk|problem|issue|error|fail");
  private static final String UNLABELED = "unlabeled";

  private final Clock clock;
  private volatile GraphIndex index;

  public QueryEngine() {
    this(Clock.systemUTC());
  }

  /** @param clock source of "today" for days-blocked arithmetic */
  public QueryEngine(Clock clock) {
    this.clock = clock;
  }

  public QueryEngine load(IR ir) {
    if (ir == null) {
      throw new ValidationException("IR must not be null");
    }
    this.index = new GraphIndex(ir);
    log.debug(
        "Loaded IR: {} nodes, {} relationships, {} states",
        ir.nodes().size(),
        ir.relationships().size(),
        ir.states().size());
    return this;
  }

  static void checkDepth(Integer maxDepth) {
    if (maxDepth != null && maxDepth < 0) {
      throw new ValidationException("maxDepth must not be negative: " + maxDepth);
    }
  }

  private GraphIndex index() {
    GraphIndex current = index;
    if (current == null) {
      throw new FlowScriptException(
          FlowScriptErrorCode.FAILED_PRECONDITION, "No IR loaded; call load() first");
    }
    return current;
  }

  // ------------------------------------------------------------------ why

  public WhyResult why(String nodeId) {
    return why(nodeId, WhyOptions.defaults());
  }

  /**
   * Causal ancestry of a node. The root cause is the deepest ancestor (first found on ties); the
   * chain is rebuilt by walking forward from it through ancestors only.
   */
  public WhyResult why(String nodeId, WhyOptions options) {
    GraphIndex idx = index();
    Node target = idx.require(nodeId);
    Set<RelationshipType> types =
        EnumSet.of(RelationshipType.DERIVES_FROM, RelationshipType.CAUSES);
    if (options.includeCorrelations()) types.add(RelationshipType.EQUIVALENT);

    List<Reached> ancestors = idx.ancestors(nodeId, types, options.maxDepth());
    List<Reached> chain = causalChain(idx, target, ancestors, types);
    Node root = chain.isEmpty() ? target : chain.get(0).node();

    if (options.format() == WhyOptions.Format.MINIMAL) {
      return new WhyMinimalResult(
          root.content(), chain.stream().map(r -> r.node().content()).toList());
    }

    List<CausalStep> steps = new ArrayList<>(chain.size());
    for (int i = 0; i < chain.size(); i++) {
      Reached r = chain.get(i);
      steps.add(
          new CausalStep(chain.size() - i, r.node().id(), r.node().content(), r.via().value()));
    }
    return new WhyChainResult(
        NodeRef.of(target),
        steps,
        new WhyChainResult.RootCause(root.id(), root.content(), true),
        new WhyChainResult.Metadata(
            GraphIndex.distinct(ancestors).size(),
            chain.size(),
            idx.parents(nodeId, types).size() > 1));
  }

  private List<Reached> causalChain(
      GraphIndex idx, Node target, List<Reached> ancestors, Set<RelationshipType> types) {
    if (ancestors.isEmpty()) return List.of();
    Reached root = ancestors.get(0);
    for (Reached r : ancestors) {
      if (r.depth() > root.depth()) root = r;
    }

    Set<String> allowed = new HashSet<>();
    ancestors.forEach(r -> allowed.add(r.node().id()));
    allowed.add(target.id());

    List<Reached> chain = new ArrayList<>();
    chain.add(root);
    Set<String> onChain = new HashSet<>();
    onChain.add(root.node().id());
    String current = root.node().id();
    while (!current.equals(target.id())) {
      Step next =
          idx.children(current, types).stream()
              .filter(s -> allowed.contains(s.nodeId()))
              .findFirst()
              .orElse(null);
      if (next == null || next.nodeId().equals(target.id()) || !onChain.add(next.nodeId())) {
        break;
      }
      chain.add(
          new Reached(idx.node(next.nodeId()), 0, next.relationship().type()));
      current = next.nodeId();
    }
    return chain;
  }

  // ------------------------------------------------------------------ whatIf

  public WhatIfResult whatIf(String nodeId) {
    return whatIf(nodeId, WhatIfOptions.defaults());
  }

  /** Forward impact of a node: direct and indirect consequences and the tensions among them. */
  public WhatIfResult whatIf(String nodeId, WhatIfOptions options) {
    GraphIndex idx = index();
    Node source = idx.require(nodeId);
    Set<RelationshipType> types = EnumSet.of(RelationshipType.CAUSES);
    if (options.includeTemporalConsequences()) types.add(RelationshipType.TEMPORAL);
    if (options.includeCorrelations()) types.add(RelationshipType.EQUIVALENT);

    List<Reached> raw = idx.descendants(nodeId, types, options.maxDepth());
    List<Reached> descendants = GraphIndex.distinct(raw);

    Set<String> zone = new LinkedHashSet<>();
    zone.add(nodeId);
    descendants.forEach(d -> zone.add(d.node().id()));
    List<TensionInfo> tensions = tensionsWithin(idx, zone);

    if (options.format() == WhatIfOptions.Format.SUMMARY) {
      return impactSummary(source, descendants, tensions);
    }

    Set<String> inTension = new HashSet<>();
    for (Relationship rel : idx.ir().relationships()) {
      if (rel.type() == RelationshipType.TENSION) {
        inTension.add(rel.source());
        inTension.add(rel.target());
      }
    }

    List<Consequence> direct = new ArrayList<>();
    List<Consequence> indirect = new ArrayList<>();
    for (Reached d : descendants) {
      Node n = d.node();
      if (d.depth() == 1) {
        direct.add(
            new Consequence(
                n.id(), n.content(), d.via().value(), 1, inTension.contains(n.id()), null));
      } else {
        indirect.add(
            new Consequence(
                n.id(), n.content(), d.via().value(), d.depth(), null, tensionAxisOf(idx, n)));
      }
    }

    int maxDepth = raw.stream().mapToInt(Reached::depth).max().orElse(0);
    boolean temporal = raw.stream().anyMatch(r -> r.via() == RelationshipType.TEMPORAL);
    return new ImpactAnalysis(
        NodeRef.of(source),
        new ImpactAnalysis.ImpactTree(direct, indirect),
        tensions,
        new ImpactAnalysis.Metadata(descendants.size(), maxDepth, tensions.size(), temporal));
  }

  private static String tensionAxisOf(GraphIndex idx, Node node) {
    for (Relationship rel : idx.ir().relationships()) {
      if (rel.type() == RelationshipType.TENSION
          && (rel.source().equals(node.id()) || rel.target().equals(node.id()))) {
        return rel.axisLabel();
      }
    }
    return null;
  }

  private static List<TensionInfo> tensionsWithin(GraphIndex idx, Set<String> nodeIds) {
    List<TensionInfo> out = new ArrayList<>();
    for (Relationship rel : idx.ir().relationships()) {
      if (rel.type() != RelationshipType.TENSION) continue;
      if (!nodeIds.contains(rel.source()) || !nodeIds.contains(rel.target())) continue;
      Node s = idx.node(rel.source());
      Node t = idx.node(rel.target());
      if (s != null && t != null) {
        out.add(new TensionInfo(axisOf(rel), NodeRef.of(s), NodeRef.of(t)));
      }
    }
    return out;
  }

  private static ImpactSummary impactSummary(
      Node source, List<Reached> descendants, List<TensionInfo> tensions) {
    List<String> benefits = new ArrayList<>();
    List<String> risks = new ArrayList<>();
    for (Reached d : descendants) {
      String content = d.node().content();
      if (RISK_WORDS.matcher(content.toLowerCase(Locale.ROOT)).find()) {
        risks.add(content);
      } else {
        benefits.add(content);
      }
    }
    String tradeoff = null;
    if (!tensions.isEmpty()) {
      TensionInfo t = tensions.get(0);
      tradeoff =
          "%s (%s vs %s)".formatted(t.axis(), t.source().content(), t.target().content());
    }
    int n = descendants.size();
    return new ImpactSummary(
        "%s affects %d downstream consideration%s"
            .formatted(source.content(), n, n == 1 ? "" : "s"),
        benefits,
        risks,
        tradeoff);
  }

  // ------------------------------------------------------------------ tensions

  public TensionsResult tensions() {
    return tensions(TensionOptions.defaults());
  }

  /** All tradeoffs in the graph, optionally bounded to what a scope node leads to. */
  public TensionsResult tensions(TensionOptions options) {
    GraphIndex idx = index();
    Set<String> scope = null;
    if (options.scope() != null) {
      idx.require(options.scope());
      scope = new HashSet<>();
      scope.add(options.scope());
      Set<RelationshipType> types =
          EnumSet.of(
              RelationshipType.CAUSES, RelationshipType.TEMPORAL, RelationshipType.DERIVES_FROM);
      for (Reached r : idx.descendants(options.scope(), types, null)) {
        scope.add(r.node().id());
      }
    }

    Map<String, List<TensionDetail>> byAxis = new LinkedHashMap<>();
    Map<String, List<TensionDetail>> byNode = new LinkedHashMap<>();
    List<TensionDetail> flat = new ArrayList<>();
    Map<String, Integer> axisCounts = new LinkedHashMap<>();

    for (Relationship rel : idx.ir().relationships()) {
      if (rel.type() != RelationshipType.TENSION) continue;
      if (scope != null && (!scope.contains(rel.source()) || !scope.contains(rel.target()))) {
        continue;
      }
      if (!options.filterByAxis().isEmpty()
          && (rel.axisLabel() == null || !options.filterByAxis().contains(rel.axisLabel()))) {
        continue;
      }
      Node s = idx.node(rel.source());
      Node t = idx.node(rel.target());
      if (s == null || t == null) continue;

      List<NodeRef> context = null;
      if (options.includeContext()) {
        context = new ArrayList<>();
        for (Relationship parent : idx.incoming(s.id())) {
          if (parent.type() == RelationshipType.TENSION) continue;
          Node p = idx.node(parent.source());
          if (p != null) context.add(NodeRef.of(p));
        }
        if (context.isEmpty()) context = null;
      }

      TensionDetail detail = new TensionDetail(NodeRef.of(s), NodeRef.of(t), context);
      String axis = axisOf(rel);
      axisCounts.merge(axis, 1, Integer::sum);
      byAxis.computeIfAbsent(axis, k -> new ArrayList<>()).add(detail);
      byNode.computeIfAbsent(s.id(), k -> new ArrayList<>()).add(detail);
      flat.add(detail);
    }

    String mostCommon = null;
    int best = 0;
    for (Map.Entry<String, Integer> e : axisCounts.entrySet()) {
      if (e.getValue() > best) {
        mostCommon = e.getKey();
        best = e.getValue();
      }
    }
    TensionsResult.Metadata metadata =
        new TensionsResult.Metadata(flat.size(), List.copyOf(axisCounts.keySet()), mostCommon);

    return switch (options.groupBy()) {
      case AXIS -> new TensionsResult(byAxis, null, null, metadata);
      case NODE -> new TensionsResult(null, byNode, null, metadata);
      case NONE -> new TensionsResult(null, null, flat, metadata);
    };
  }

  private static String axisOf(Relationship rel) {
    return rel.axisLabel() == null || rel.axisLabel().isBlank() ? UNLABELED : rel.axisLabel();
  }

  // ------------------------------------------------------------------ blocked

  public BlockedResult blocked() {
    return blocked(BlockedOptions.defaults());
  }

  /**
   * Blocked nodes by priority. {@code impact_score} is the number of distinct nodes the blocker
   * holds up, counted whether or not the effects are listed.
   */
  public BlockedResult blocked(BlockedOptions options) {
    GraphIndex idx = index();
    Instant now = clock.instant();
    Set<RelationshipType> causeTypes =
        EnumSet.of(RelationshipType.DERIVES_FROM, RelationshipType.CAUSES);
    Set<RelationshipType> effectTypes =
        EnumSet.of(RelationshipType.CAUSES, RelationshipType.TEMPORAL);
    boolean detailed = options.format() == BlockedOptions.Format.DETAILED;

    List<BlockerDetail> blockers = new ArrayList<>();
    for (State state : idx.ir().states()) {
      if (state.type() != StateType.BLOCKED) continue;
      String since = state.field("since");
      if (options.since() != null && (since == null || since.compareTo(options.since()) < 0)) {
        continue;
      }
      Node node = idx.node(state.nodeId());
      if (node == null) continue;

      String reason = state.field("reason") == null ? "unknown" : state.field("reason");
      String sinceValue = since == null ? "" : since;
      long days = daysSince(sinceValue, now);

      List<NodeRef> effects =
          refs(GraphIndex.distinct(idx.descendants(node.id(), effectTypes, null)));
      List<NodeRef> causes = null;
      if (detailed && options.includeTransitiveCauses()) {
        causes = refs(GraphIndex.distinct(idx.ancestors(node.id(), causeTypes, null)));
      }
      blockers.add(
          new BlockerDetail(
              NodeRef.of(node),
              new BlockedState(reason, sinceValue, days),
              causes,
              detailed && options.includeTransitiveEffects() ? effects : null,
              effects.size()));
    }

    blockers.sort(
        Comparator.comparingInt(BlockerDetail::impactScore)
            .reversed()
            .thenComparing(
                Comparator.comparingLong((BlockerDetail b) -> b.blockedState().daysBlocked())
                    .reversed()));

    int high = 0;
    long total = 0;
    BlockerDetail oldest = null;
    for (BlockerDetail b : blockers) {
      long days = b.blockedState().daysBlocked();
      if (b.impactScore() > 0 || days > 7) high++;
      total += days;
      if (oldest == null || days > oldest.blockedState().daysBlocked()) oldest = b;
    }
    double average =
        blockers.isEmpty() ? 0.0 : Math.round((double) total / blockers.size() * 10) / 10.0;
    return new BlockedResult(
        blockers,
        new BlockedResult.Metadata(
            blockers.size(),
            high,
            average,
            oldest == null
                ? null
                : new OldestBlocker(oldest.node().id(), oldest.blockedState().daysBlocked())));
  }

  private static List<NodeRef> refs(List<Reached> reached) {
    return reached.stream().map(r -> NodeRef.of(r.node())).toList();
  }

  /** Whole days from {@code since} to {@code now}; 0 when the date cannot be read. */
  static long daysSince(String since, Instant now) {
    if (since == null || since.isBlank()) return 0;
    Instant start;
    try {
      start = LocalDate.parse(since).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeParseException notADate) {
      try {
        start = OffsetDateTime.parse(since).toInstant();
      } catch (DateTimeParseException notADateTime) {
        log.debug("Unreadable blocked since value '{}'; counting 0 days", since);
        return 0;
      }
    }
    return Math.floorDiv(Duration.between(start, now).toMillis(), Duration.ofDays(1).toMillis());
  }

  // ------------------------------------------------------------------ alternatives

  public AlternativesResult alternatives(String questionId) {
    return alternatives(questionId, AlternativesOptions.defaults());
  }

  /**
   * Reconstructs the decision taken on a question.
   *
   * <p>An alternative is chosen when a decided state is attached to it. If no alternative of the
   * question matches that way, a decided state attached to a node with the same content counts.
   *
   * @throws ValidationException if the node is not a question
   */
  public AlternativesResult alternatives(String questionId, AlternativesOptions options) {
    GraphIndex idx = index();
    Node question = idx.require(questionId);
    if (question.type() != NodeType.QUESTION) {
      throw new ValidationException(
          "Node " + questionId + " is not a question (type: " + question.type().value() + ")");
    }

    List<Node> alternatives = new ArrayList<>();
    for (Relationship rel : idx.outgoing(questionId)) {
      if (rel.type() != RelationshipType.ALTERNATIVE) continue;
      Node alt = idx.node(rel.target());
      if (alt != null) alternatives.add(alt);
    }
    Map<String, State> decisions = decisions(idx, alternatives);

    return switch (options.format()) {
      case SIMPLE -> simple(question, alternatives, decisions, options);
      case TREE -> tree(idx, question, alternatives, decisions, options);
      case COMPARISON -> comparison(idx, question, alternatives, decisions, options);
    };
  }

  private static Map<String, State> decisions(GraphIndex idx, List<Node> alternatives) {
    List<State> decided =
        idx.ir().states().stream().filter(s -> s.type() == StateType.DECIDED).toList();
    Map<String, State> byId = new LinkedHashMap<>();
    for (Node alt : alternatives) {
      for (State s : decided) {
        if (s.nodeId().equals(alt.id())) byId.putIfAbsent(alt.id(), s);
      }
    }
    if (!byId.isEmpty()) return byId;

    for (Node alt : alternatives) {
      for (State s : decided) {
        Node attached = idx.node(s.nodeId());
        if (attached != null && attached.content().equals(alt.content())) {
          byId.putIfAbsent(alt.id(), s);
        }
      }
    }
    return byId;
  }

  private static AlternativesSimple simple(
      Node question,
      List<Node> alternatives,
      Map<String, State> decisions,
      AlternativesOptions options) {
    String chosen = null;
    String reason = null;
    for (Node alt : alternatives) {
      State s = decisions.get(alt.id());
      if (s != null && chosen == null) {
        chosen = alt.content();
        reason = options.includeRationale() ? s.field("rationale") : null;
      }
    }
    return new AlternativesSimple(
        AlternativesOptions.Format.SIMPLE.value(),
        question.content(),
        alternatives.stream().map(Node::content).toList(),
        chosen,
        reason);
  }

  private static AlternativesTree tree(
      GraphIndex idx,
      Node question,
      List<Node> alternatives,
      Map<String, State> decisions,
      AlternativesOptions options) {
    List<TreeAlternative> trees = new ArrayList<>();
    for (Node alt : alternatives) {
      trees.add(
          treeNode(idx, alt, decisions.keySet(), new HashSet<>(), options.showRejectedReasons()));
    }
    return new AlternativesTree(
        AlternativesOptions.Format.TREE.value(), NodeRef.of(question), trees);
  }

  private static TreeAlternative treeNode(
      GraphIndex idx, Node node, Set<String> chosenIds, Set<String> visited, boolean reasons) {
    if (visited.contains(node.id())) {
      return new TreeAlternative(
          node.id(), node.content() + " [cycle detected]", false, null, List.of());
    }
    Set<String> path = new HashSet<>(visited);
    path.add(node.id());

    boolean chosen = chosenIds.contains(node.id()) || decidedOn(idx, node.id());
    List<String> rejection = null;
    if (reasons && !chosen) {
      List<String> found = rejectionReasons(idx, node.id());
      rejection = found.isEmpty() ? null : found;
    }
    List<TreeAlternative> children = new ArrayList<>();
    for (Relationship rel : idx.outgoing(node.id())) {
      if (rel.type() != RelationshipType.CAUSES) continue;
      Node child = idx.node(rel.target());
      if (child != null) children.add(treeNode(idx, child, chosenIds, path, reasons));
    }
    return new TreeAlternative(node.id(), node.content(), chosen, rejection, children);
  }

  private static boolean decidedOn(GraphIndex idx, String nodeId) {
    return idx.ir().states().stream()
        .anyMatch(s -> s.type() == StateType.DECIDED && s.nodeId().equals(nodeId));
  }

  private static AlternativesComparison comparison(
      GraphIndex idx,
      Node question,
      List<Node> alternatives,
      Map<String, State> decisions,
      AlternativesOptions options) {
    List<AlternativeDetail> details = new ArrayList<>();
    AlternativeDetail chosenDetail = null;
    for (Node alt : alternatives) {
      State decision = decisions.get(alt.id());
      boolean chosen = decision != null;

      String rationale = null;
      String decidedOn = null;
      if (chosen && options.includeRationale()) {
        rationale = decision.field("rationale");
        decidedOn = rationale == null ? null : decision.field("on");
      }

      List<String> rejection = null;
      if (options.showRejectedReasons() && !chosen) {
        List<String> found = rejectionReasons(idx, alt.id());
        rejection = found.isEmpty() ? null : found;
      }

      List<NodeRef> consequences = null;
      if (options.includeConsequences()) {
        List<NodeRef> found = new ArrayList<>();
        for (Relationship rel : idx.outgoing(alt.id())) {
          if (rel.type() != RelationshipType.CAUSES) continue;
          Node child = idx.node(rel.target());
          if (child != null) found.add(NodeRef.of(child));
        }
        consequences = found.isEmpty() ? null : found;
      }

      List<TensionInfo> tensions = new ArrayList<>();
      for (Relationship rel : idx.outgoing(alt.id())) {
        if (rel.type() != RelationshipType.TENSION) continue;
        Node other = idx.node(rel.target());
        if (other != null) {
          tensions.add(new TensionInfo(axisOf(rel), NodeRef.of(alt), NodeRef.of(other)));
        }
      }

      AlternativeDetail detail =
          new AlternativeDetail(
              alt.id(),
              alt.content(),
              chosen,
              rationale,
              decidedOn,
              rejection,
              consequences,
              tensions.isEmpty() ? null : tensions);
      details.add(detail);
      if (chosen && chosenDetail == null) chosenDetail = detail;
    }

    List<String> rejected =
        details.stream().filter(d -> !d.chosen()).map(AlternativeDetail::content).toList();
    List<String> keyFactors = List.of();
    if (chosenDetail != null && chosenDetail.tensions() != null) {
      keyFactors = chosenDetail.tensions().stream().map(TensionInfo::axis).distinct().toList();
    }
    return new AlternativesComparison(
        AlternativesOptions.Format.COMPARISON.value(),
        NodeRef.of(question),
        details,
        new DecisionSummary(
            chosenDetail == null ? null : chosenDetail.content(),
            chosenDetail == null ? null : chosenDetail.rationale(),
            rejected,
            keyFactors));
  }

  /** Thoughts an alternative causes are read as the reasons it was turned down. */
  private static List<String> rejectionReasons(GraphIndex idx, String nodeId) {
    List<String> reasons = new ArrayList<>();
    for (Relationship rel : idx.outgoing(nodeId)) {
      if (rel.type() != RelationshipType.CAUSES) continue;
      Node target = idx.node(rel.target());
      if (target != null && target.type() == NodeType.THOUGHT) reasons.add(target.content());
    }
    return reasons;
  }
}
