package com.gentoro.flowscript.query;

import java.util.Locale;

/**
 * Options for {@link QueryEngine#alternatives}.
 *
 * @param format output shape
 * @param includeRationale report the decided state's rationale and date
 * @param includeConsequences list the nodes each alternative causes (comparison only)
 * @param showRejectedReasons list thoughts caused by alternatives that were not chosen
 */
public record AlternativesOptions(
    Format format,
    boolean includeRationale,
    boolean includeConsequences,
    boolean showRejectedReasons) {

  public enum Format {
    COMPARISON,
    TREE,
    SIMPLE;

    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public AlternativesOptions {
    format = format == null ? Format.COMPARISON : format;
  }

  public static AlternativesOptions defaults() {
    return new AlternativesOptions(Format.COMPARISON, true, false, false);
  }

  public AlternativesOptions withFormat(Format newFormat) {
    return new AlternativesOptions(
        newFormat, includeRationale, includeConsequences, showRejectedReasons);
  }

  public AlternativesOptions withRationale(boolean include) {
    return new AlternativesOptions(format, include, includeConsequences, showRejectedReasons);
  }

  public AlternativesOptions withConsequences(boolean include) {
    return new AlternativesOptions(format, includeRationale, include, showRejectedReasons);
  }

  public AlternativesOptions withRejectedReasons(boolean show) {
    return new AlternativesOptions(format, includeRationale, includeConsequences, show);
  }
}
