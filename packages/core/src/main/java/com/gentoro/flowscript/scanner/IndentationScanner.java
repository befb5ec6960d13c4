package com.gentoro.flowscript.scanner;

import com.gentoro.flowscript.exception.IndentationException;
import com.gentoro.flowscript.logging.LoggingService;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.slf4j.Logger;

/**
 * Rewrites indentation-scoped source into source with explicit {@code { }} blocks.
 *
 * <pre>
 *   INPUT:          OUTPUT:
 *   A               A
 *     B               {B
 *     C               C
 *                     }
 * </pre>
 *
 * <p>Lines that already carry braces keep them. Inside an explicit block indentation is tracked
 * relative to the block's first content line, and the enclosing block's levels come back when a
 * nested one closes. Every output line is mapped back to the original line it came from.
 *
 * <p>Instances keep per-call state and are not thread safe; use one per thread.
 */
public class IndentationScanner {
  private static final Logger log = LoggingService.getLogger(IndentationScanner.class);

  private final int indentSize;

  private Deque<Integer> indentStack;
  private Deque<Frame> savedFrames;
  private int explicitDepth;
  private Integer blockBaseIndent;
  private boolean seenContent;

  public IndentationScanner() {
    this(2);
  }

  /**
   * @param indentSize indentation width quoted in the tab diagnostic; any consistent width is
   *     accepted
   */
  public IndentationScanner(int indentSize) {
    this.indentSize = indentSize;
  }

  private record OutLine(String text, int originalLine) {}

  /** Indentation state of an enclosing explicit block, restored when the inner one closes. */
  private record Frame(Deque<Integer> stack, Integer baseIndent) {}

  public ScanResult process(String source) {
    if (source == null || source.isEmpty()) {
      return new ScanResult("", Map.of());
    }
    reset();

    String[] lines = source.split("\n", -1);
    List<OutLine> out = new ArrayList<>(lines.length);
    int lastContentLine = lines.length;

    for (int i = 0; i < lines.length; i++) {
      int lineNum = i + 1;
      String line = stripCarriageReturn(lines[i]);
      if (!line.isBlank()) {
        lastContentLine = lineNum;
      }
      processLine(line, lineNum, out);
    }

    while (indentStack.size() > 1) {
      int closing = indentStack.pop();
      out.add(new OutLine(" ".repeat(closing) + "}", lastContentLine));
    }

    Map<Integer, Integer> lineMap = new HashMap<>();
    StringJoiner joiner = new StringJoiner("\n");
    for (int i = 0; i < out.size(); i++) {
      lineMap.put(i + 1, out.get(i).originalLine());
      joiner.add(out.get(i).text());
    }
    log.trace("Rewrote {} source lines into {} lines", lines.length, out.size());
    return new ScanResult(joiner.toString(), lineMap);
  }

  private void reset() {
    indentStack = new ArrayDeque<>();
    indentStack.push(0);
    savedFrames = new ArrayDeque<>();
    explicitDepth = 0;
    blockBaseIndent = null;
    seenContent = false;
  }

  private void processLine(String line, int lineNum, List<OutLine> out) {
    if (line.isBlank()) {
      out.add(new OutLine(line, lineNum));
      return;
    }
    if (line.indexOf('\t') >= 0) {
      throw new IndentationException(
          "Tabs not allowed. Use %d spaces for indentation.".formatted(indentSize), lineNum);
    }
    int indent = leadingSpaces(line);
    if (!seenContent) {
      seenContent = true;
      if (indent > 0) {
        throw new IndentationException("First line cannot be indented.", lineNum);
      }
    }

    int opens = count(line, '{');
    int closes = count(line, '}');
    int depthBefore = explicitDepth;
    explicitDepth += opens - closes;

    if (opens > 0 || closes > 0) {
      processBraceLine(line, lineNum, indent, opens, closes, depthBefore, out);
      return;
    }

    if (explicitDepth > 0 && blockBaseIndent == null) {
      blockBaseIndent = indent;
      indentStack = new ArrayDeque<>();
      indentStack.push(indent);
      out.add(new OutLine(line, lineNum));
      return;
    }

    int current = indentStack.peek();
    if (indent > current) {
      indentStack.push(indent);
      out.add(new OutLine(openImplicit(line, indent), lineNum));
    } else if (indent < current) {
      dedent(indent, lineNum, out);
      out.add(new OutLine(line, lineNum));
    } else {
      out.add(new OutLine(line, lineNum));
    }
  }

  private void processBraceLine(
      String line,
      int lineNum,
      int indent,
      int opens,
      int closes,
      int depthBefore,
      List<OutLine> out) {
    if (depthBefore == 0 || (blockBaseIndent != null && closes <= opens)) {
      int current = indentStack.peek();
      if (indent > current) {
        indentStack.push(indent);
        out.add(new OutLine(openImplicit(line, indent), lineNum));
        if (opens > closes) enterExplicitBlock();
        return;
      }
      if (indent < current) {
        dedent(indent, lineNum, out);
        out.add(new OutLine(line, lineNum));
        if (opens > closes) enterExplicitBlock();
        return;
      }
    }

    if (closes > opens) {
      if (blockBaseIndent != null) {
        while (indentStack.size() > 1 && indentStack.peek() > blockBaseIndent) {
          int closing = indentStack.pop();
          out.add(new OutLine(" ".repeat(closing) + "}", lineNum));
        }
      }
      Frame outer = savedFrames.isEmpty() ? new Frame(freshStack(), null) : savedFrames.pop();
      indentStack = outer.stack();
      blockBaseIndent = outer.baseIndent();
    }
    if (opens > closes) {
      enterExplicitBlock();
    }
    out.add(new OutLine(line, lineNum));
  }

  private void enterExplicitBlock() {
    savedFrames.push(new Frame(new ArrayDeque<>(indentStack), blockBaseIndent));
    indentStack = freshStack();
    blockBaseIndent = null;
  }

  private void dedent(int indent, int lineNum, List<OutLine> out) {
    while (indentStack.size() > 1 && indentStack.peek() > indent) {
      int closing = indentStack.pop();
      out.add(new OutLine(" ".repeat(closing) + "}", lineNum));
    }
    if (indentStack.peek() != indent) {
      throw new IndentationException(
          "Invalid dedent to level %d. Expected one of: [%s].".formatted(indent, levels()),
          lineNum);
    }
  }

  private String levels() {
    // Deque iterates top first; report bottom to top.
    List<String> values = new ArrayList<>();
    Iterator<Integer> it = indentStack.descendingIterator();
    while (it.hasNext()) {
      values.add(String.valueOf(it.next()));
    }
    return String.join(", ", values);
  }

  private static Deque<Integer> freshStack() {
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(0);
    return stack;
  }

  private static String openImplicit(String line, int indent) {
    return " ".repeat(indent) + "{" + line.substring(indent);
  }

  private static int leadingSpaces(String line) {
    int count = 0;
    while (count < line.length() && line.charAt(count) == ' ') {
      count++;
    }
    return count;
  }

  private static int count(String line, char c) {
    int n = 0;
    for (int i = 0; i < line.length(); i++) {
      if (line.charAt(i) == c) n++;
    }
    return n;
  }

  private static String stripCarriageReturn(String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }
}
