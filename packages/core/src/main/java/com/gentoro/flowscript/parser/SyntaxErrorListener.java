package com.gentoro.flowscript.parser;

import com.gentoro.flowscript.exception.ParseException;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.IntUnaryOperator;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.IntervalSet;

/**
 * Fails the parse on the first syntax error with a {@link ParseException} positioned in the
 * original source: {@code "Line L, col C: expected <tokens>"}.
 */
final class SyntaxErrorListener extends BaseErrorListener {
  private final IntUnaryOperator lineMapper;

  /**
   * @param lineMapper maps a rewritten line to the original line
   */
  SyntaxErrorListener(IntUnaryOperator lineMapper) {
    this.lineMapper = lineMapper;
  }

  @Override
  public void syntaxError(
      Recognizer<?, ?> recognizer,
      Object offendingSymbol,
      int line,
      int charPositionInLine,
      String msg,
      RecognitionException e) {
    int originalLine = lineMapper.applyAsInt(line);
    int column = charPositionInLine + 1;
    String what =
        recognizer instanceof Parser parser ? expected(parser, e) : "valid FlowScript";
    throw new ParseException(
        "Line %d, col %d: expected %s".formatted(originalLine, column, what),
        originalLine,
        column);
  }

  private static String expected(Parser parser, RecognitionException e) {
    IntervalSet tokens =
        e != null && e.getExpectedTokens() != null
            ? e.getExpectedTokens()
            : parser.getExpectedTokens();
    Vocabulary vocabulary = parser.getVocabulary();
    Set<String> names = new LinkedHashSet<>();
    for (int type : tokens.toList()) {
      names.add(describe(type, vocabulary));
    }
    return names.isEmpty() ? "valid FlowScript" : String.join(", ", names);
  }

  private static String describe(int type, Vocabulary vocabulary) {
    if (type == Token.EOF) return "end of input";
    switch (type) {
      case FlowScriptGrammarLexer.NL:
        return "newline";
      case FlowScriptGrammarLexer.EQUALS:
        return "\" = \"";
      case FlowScriptGrammarLexer.NOT_EQUALS:
        return "\" != \"";
      case FlowScriptGrammarLexer.MODIFIER:
        return "modifier";
      case FlowScriptGrammarLexer.STRING:
        return "quoted text";
      case FlowScriptGrammarLexer.WORD:
      case FlowScriptGrammarLexer.OTHER:
        return "text";
      default:
        break;
    }
    String literal = vocabulary.getLiteralName(type);
    if (literal != null && literal.length() >= 2) {
      return "\"" + literal.substring(1, literal.length() - 1) + "\"";
    }
    return vocabulary.getDisplayName(type);
  }
}
