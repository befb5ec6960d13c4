package com.gentoro.flowscript.parser;

import com.gentoro.flowscript.config.FlowScriptSettings;
import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.ir.Invariants;
import com.gentoro.flowscript.ir.IrMetadata;
import com.gentoro.flowscript.linker.IrLinker;
import com.gentoro.flowscript.logging.LoggingService;
import com.gentoro.flowscript.logging.SourceLogContext;
import com.gentoro.flowscript.scanner.IndentationScanner;
import com.gentoro.flowscript.scanner.ScanResult;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;

/**
 * Compiles FlowScript text into a linked {@link IR}.
 *
 * <p>Stages: indentation rewrite, grammar match with the generated {@code FlowScriptGrammar}
 * parser, IR construction, linking. Any stage failure is fatal and no partial IR is returned.
 */
public class FlowScriptParser {
  private static final Logger log = LoggingService.getLogger(FlowScriptParser.class);
  static final String DEFAULT_SOURCE_FILE = "editor.fs";

  private final FlowScriptSettings settings;
  private final Clock clock;
  private final IrLinker linker = new IrLinker();

  public FlowScriptParser() {
    this(FlowScriptSettings.defaults(), Clock.systemUTC());
  }

  public FlowScriptParser(FlowScriptSettings settings, Clock clock) {
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * @param source document text; null is treated as empty
   * @param sourceFile name recorded in provenance; defaults to {@code editor.fs}
   * @throws com.gentoro.flowscript.exception.IndentationException on inconsistent indentation
   * @throws com.gentoro.flowscript.exception.ParseException when the text does not match the
   *     grammar
   */
  public IR parse(String source, String sourceFile) {
    String file = sourceFile == null || sourceFile.isBlank() ? DEFAULT_SOURCE_FILE : sourceFile;
    String text = source == null ? "" : source;

    try (SourceLogContext ignored = LoggingService.forSource(file)) {
      ScanResult scan = new IndentationScanner(settings.indentSize()).process(text);
      FlowScriptGrammarParser.DocumentContext document = match(scan);

      String timestamp = Instant.now(clock).toString();
      BuildContext ctx = new BuildContext(file, timestamp, scan);
      new IrBuilder(ctx).build(document);

      IR ir =
          new IR(
              IR.VERSION,
              ctx.nodes(),
              ctx.relationships(),
              ctx.states(),
              Invariants.advertised(),
              new IrMetadata(List.of(file), timestamp, settings.parserName()));
      IR linked = linker.link(ir, ctx.occurrences());
      log.debug(
          "Parsed {} nodes, {} relationships, {} states",
          linked.nodes().size(),
          linked.relationships().size(),
          linked.states().size());
      return linked;
    }
  }

  private static FlowScriptGrammarParser.DocumentContext match(ScanResult scan) {
    SyntaxErrorListener errors = new SyntaxErrorListener(scan::originalLine);
    FlowScriptGrammarLexer lexer =
        new FlowScriptGrammarLexer(CharStreams.fromString(scan.transformed()));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errors);
    FlowScriptGrammarParser grammar = new FlowScriptGrammarParser(new CommonTokenStream(lexer));
    grammar.removeErrorListeners();
    grammar.addErrorListener(errors);
    return grammar.document();
  }
}
