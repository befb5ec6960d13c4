package com.gentoro.flowscript.parser;

import com.gentoro.flowscript.ir.ContentHash;
import com.gentoro.flowscript.ir.Modifier;
import com.gentoro.flowscript.ir.Node;
import com.gentoro.flowscript.ir.NodeType;
import com.gentoro.flowscript.ir.Provenance;
import com.gentoro.flowscript.ir.Relationship;
import com.gentoro.flowscript.ir.RelationshipType;
import com.gentoro.flowscript.ir.State;
import com.gentoro.flowscript.ir.StateType;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.ActionContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.AlternativeContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.BlockChainContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.BlockContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.BlockLineContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.CompletionContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.ContentContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.ContinuationContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.DocumentContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.ElementContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.ExpressionContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.FieldContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.LineContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.QuestionContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.RelNodeContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.RelOpContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.RelPairContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.StateMarkerContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.StatementContext;
import com.gentoro.flowscript.parser.FlowScriptGrammarParser.ThoughtContext;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Turns a parse tree into nodes, relationships and states.
 *
 * <p>Every node an element produces is "touched": it becomes the most recent node and a member of
 * each open block. A block's direct children are its members minus the ids already claimed as
 * direct children by nested blocks. Content visits return the element's primary node, or null
 * for a state marker that stands alone.
 */
final class IrBuilder extends FlowScriptGrammarBaseVisitor<Node> {

  /** An open block: its anchor candidate and the ids created or reused inside it. */
  private static final class BlockScope {
    private final Node preceding;
    private final Set<String> members = new LinkedHashSet<>();
    private String first;

    BlockScope(Node preceding) {
      this.preceding = preceding;
    }

    String anchor() {
      return preceding != null ? preceding.id() : first;
    }
  }

  private final BuildContext ctx;
  private final Deque<BlockScope> scopes = new ArrayDeque<>();
  private List<Modifier> modifiers = List.of();
  private Node last;

  IrBuilder(BuildContext ctx) {
    this.ctx = ctx;
  }

  void build(DocumentContext document) {
    for (LineContext line : document.line()) {
      for (ElementContext element : line.element()) {
        element(element, List.of());
      }
    }
  }

  private Node element(ElementContext element, List<Modifier> inherited) {
    List<Modifier> collected = new ArrayList<>(inherited);
    for (TerminalNode marker : element.MODIFIER()) {
      Modifier m = Modifier.fromMarker(marker.getText().trim());
      if (!collected.contains(m)) collected.add(m);
    }
    List<Modifier> saved = modifiers;
    modifiers = List.copyOf(collected);
    try {
      return visit(element.content());
    } finally {
      modifiers = saved;
    }
  }

  @Override
  public Node visitContent(ContentContext content) {
    return visit(content.getChild(0));
  }

  @Override
  public Node visitQuestion(QuestionContext n) {
    return marked(n, NodeType.QUESTION, text(n.text()), n.block(), List.of());
  }

  @Override
  public Node visitAlternative(AlternativeContext n) {
    return marked(n, NodeType.ALTERNATIVE, text(n.text()), n.block(), List.of());
  }

  @Override
  public Node visitCompletion(CompletionContext n) {
    return marked(n, NodeType.COMPLETION, text(n.text()), n.block(), List.of());
  }

  @Override
  public Node visitThought(ThoughtContext n) {
    return marked(n, NodeType.THOUGHT, text(n.nodeText()), n.block(), n.relPair());
  }

  @Override
  public Node visitAction(ActionContext n) {
    return marked(n, NodeType.ACTION, text(n.nodeText()), n.block(), n.relPair());
  }

  private Node marked(
      ParserRuleContext n,
      NodeType type,
      String text,
      BlockContext body,
      List<RelPairContext> pairs) {
    Node node;
    if (body == null) {
      node = add(new Node(ContentHash.node(type, text, modifiers), type, text, provenance(n),
          modifiers));
    } else {
      Node block = visitBlock(body);
      node = block.retag(type, text);
      ctx.replace(node);
      last = node;
    }
    chain(node, pairs);
    return node;
  }

  @Override
  public Node visitContinuation(ContinuationContext n) {
    BlockScope scope = scopes.peek();
    String anchor = scope == null ? null : scope.anchor();
    Node target = visitRelNode(n.relNode());
    if (anchor != null) {
      relate(n.relOp(), anchor, target.id());
    }
    chain(target, n.relPair());
    return target;
  }

  @Override
  public Node visitExpression(ExpressionContext n) {
    Node head = statement(n.nodeText());
    chain(head, n.relPair());
    return head;
  }

  @Override
  public Node visitBlockChain(BlockChainContext n) {
    Node head = visitBlock(n.block());
    chain(head, n.relPair());
    return head;
  }

  @Override
  public Node visitStatement(StatementContext n) {
    return statement(n.text());
  }

  @Override
  public Node visitRelNode(RelNodeContext n) {
    return n.block() != null ? visitBlock(n.block()) : statement(n.nodeText());
  }

  /** Links each pair to the node before it; {@code A -> B -> C} never yields {@code A -> C}. */
  private void chain(Node head, List<RelPairContext> pairs) {
    Node previous = head;
    for (RelPairContext pair : pairs) {
      Node target = visitRelNode(pair.relNode());
      relate(pair.relOp(), previous.id(), target.id());
      previous = target;
    }
  }

  private Node statement(ParserRuleContext textContext) {
    String text = text(textContext);
    return add(new Node(ContentHash.node(NodeType.STATEMENT, text, modifiers), NodeType.STATEMENT,
        text, provenance(textContext), modifiers));
  }

  @Override
  public Node visitBlock(BlockContext n) {
    List<Modifier> own = modifiers;
    BlockScope scope = new BlockScope(last);
    scopes.push(scope);
    try {
      for (BlockLineContext line : n.blockLine()) {
        for (ElementContext element : line.element()) {
          element(element, List.of());
        }
      }
    } finally {
      scopes.pop();
      modifiers = own;
    }

    Set<String> claimed = new HashSet<>();
    for (String id : scope.members) {
      Node member = ctx.node(id);
      if (member != null) claimed.addAll(member.blockChildren());
    }
    List<String> direct = scope.members.stream().filter(id -> !claimed.contains(id)).toList();

    return add(new Node(ContentHash.block(direct, own), NodeType.BLOCK, "", provenance(n),
        List.of(), own, direct));
  }

  @Override
  public Node visitStateMarker(StateMarkerContext n) {
    StateType type = StateType.fromValue(n.stateName().getText());
    Map<String, String> fields = new LinkedHashMap<>();
    if (n.fieldList() != null) {
      for (FieldContext field : n.fieldList().field()) {
        fields.put(field.WORD().getText(), fieldValue(field));
      }
    }
    Provenance provenance = provenance(n);
    ctx.addState(new State(ContentHash.state(type, fields, provenance.lineNumber()), type, "",
        fields, provenance));

    return n.element() == null ? null : element(n.element(), modifiers);
  }

  private static String fieldValue(FieldContext field) {
    TerminalNode quoted = field.fieldValue().STRING();
    if (quoted != null) {
      String raw = quoted.getText();
      return raw.substring(1, raw.length() - 1);
    }
    return text(field.fieldValue().bareValue());
  }

  private void relate(RelOpContext op, String source, String target) {
    RelationshipType type = relationshipType(op.getStart().getText().trim());
    String axis = null;
    if (type == RelationshipType.TENSION && op.axis() != null) {
      String bracketed = text(op.axis());
      String label = bracketed.substring(1, bracketed.length() - 1).trim();
      axis = label.isEmpty() ? null : label;
    }
    ctx.addRelationship(new Relationship(ContentHash.relationship(type, source, target, axis),
        type, source, target, axis, provenance(op)));
  }

  static RelationshipType relationshipType(String operator) {
    return switch (operator) {
      case "->" -> RelationshipType.CAUSES;
      case "<-" -> RelationshipType.DERIVES_FROM;
      case "<->" -> RelationshipType.BIDIRECTIONAL;
      case "=>" -> RelationshipType.TEMPORAL;
      case "><" -> RelationshipType.TENSION;
      case "=" -> RelationshipType.EQUIVALENT;
      case "!=" -> RelationshipType.DIFFERENT;
      default -> throw new IllegalStateException("Unknown operator: " + operator);
    };
  }

  private Node add(Node node) {
    Node kept = ctx.addNode(node);
    last = kept;
    for (BlockScope scope : scopes) {
      scope.members.add(kept.id());
      if (scope.first == null) scope.first = kept.id();
    }
    return kept;
  }

  private Provenance provenance(ParserRuleContext n) {
    return ctx.provenance(n.getStart().getLine());
  }

  /** Source text from the first to the last token of {@code n}, trimmed; "" when absent. */
  private static String text(ParserRuleContext n) {
    if (n == null) return "";
    Token start = n.getStart();
    Token stop = n.getStop();
    if (stop == null || stop.getStopIndex() < start.getStartIndex()) return "";
    return start
        .getInputStream()
        .getText(Interval.of(start.getStartIndex(), stop.getStopIndex()))
        .trim();
  }
}
