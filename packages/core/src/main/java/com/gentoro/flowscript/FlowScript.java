package com.gentoro.flowscript;

import com.gentoro.flowscript.config.ConfigurationProvider;
import com.gentoro.flowscript.config.FlowScriptSettings;
import com.gentoro.flowscript.exception.ErrorDetails;
import com.gentoro.flowscript.exception.ExceptionUtil;
import com.gentoro.flowscript.exception.FlowScriptException;
import com.gentoro.flowscript.exception.FlowScriptErrorCode;
import com.gentoro.flowscript.graph.GraphData;
import com.gentoro.flowscript.graph.GraphProjector;
import com.gentoro.flowscript.ir.IR;
import com.gentoro.flowscript.linter.LintResult;
import com.gentoro.flowscript.linter.Linter;
import com.gentoro.flowscript.logging.LoggingService;
import com.gentoro.flowscript.parser.FlowScriptParser;
import com.gentoro.flowscript.query.QueryEngine;
import com.gentoro.flowscript.validation.IrValidator;
import com.gentoro.flowscript.validation.SchemaIrValidator;
import com.gentoro.flowscript.validation.ValidationResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;

/**
 * Entry point wiring the compiler pipeline, linter, query engine and graph projection together
 * with one set of {@link FlowScriptSettings}.
 */
public class FlowScript {
  private static final Logger log = LoggingService.getLogger(FlowScript.class);

  private final FlowScriptSettings settings;
  private final Clock clock;
  private final FlowScriptParser parser;
  private final Linter linter;
  private final GraphProjector projector = new GraphProjector();
  private final IrValidator validator = new SchemaIrValidator();

  /** Settings from {@code classpath:application.yaml}, with built-in defaults when absent. */
  public FlowScript() {
    this(new ConfigurationProvider());
  }

  public FlowScript(ConfigurationProvider configurationProvider) {
    this(configure(configurationProvider), Clock.systemUTC());
  }

  public FlowScript(FlowScriptSettings settings, Clock clock) {
    this.settings = settings;
    this.clock = clock;
    this.parser = new FlowScriptParser(settings, clock);
    this.linter = new Linter(settings);
  }

  private static FlowScriptSettings configure(ConfigurationProvider provider) {
    LoggingService.applyConfiguration(provider.config());
    return FlowScriptSettings.from(provider.config());
  }

  public FlowScriptSettings settings() {
    return settings;
  }

  /**
   * Scan, parse and link {@code source}.
   *
   * @throws com.gentoro.flowscript.exception.IndentationException on bad indentation
   * @throws com.gentoro.flowscript.exception.ParseException on a grammar mismatch
   */
  public IR compile(String source, String sourceFile) {
    return parser.parse(source, sourceFile);
  }

  public IR compileFile(Path path) {
    String source;
    try {
      source = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new FlowScriptException(
          FlowScriptErrorCode.IO_ERROR, "Failed to read FlowScript source: " + path, e);
    }
    return compile(source, path.getFileName().toString());
  }

  /** Like {@link #compile} but reports failures as {@link CompileResult#error()}. */
  public CompileResult tryCompile(String source, String sourceFile) {
    try {
      return CompileResult.success(compile(source, sourceFile));
    } catch (FlowScriptException e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e, sourceFile);
      log.debug("Compilation failed: {}", ExceptionUtil.summarize(details));
      return CompileResult.failure(details);
    }
  }

  public List<LintResult> lint(IR ir) {
    return linter.lint(ir);
  }

  public String formatLint(List<LintResult> results) {
    return linter.formatResults(results);
  }

  public ValidationResult validate(IR ir) {
    return validator.validate(ir);
  }

  /** A fresh engine loaded with {@code ir}; engines are not shared between documents. */
  public QueryEngine query(IR ir) {
    return new QueryEngine(clock).load(ir);
  }

  public GraphData project(IR ir) {
    return projector.project(ir);
  }
}
