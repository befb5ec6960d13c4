package com.gentoro.flowscript.query;

/**
 * Options for {@link QueryEngine#why}.
 *
 * @param maxDepth traversal depth limit; null means unbounded
 * @param includeCorrelations also follow {@code =} edges
 * @param format output shape
 */
public record WhyOptions(Integer maxDepth, boolean includeCorrelations, Format format) {

  public enum Format {
    CHAIN,
    MINIMAL
  }

  public WhyOptions {
    QueryEngine.checkDepth(maxDepth);
    format = format == null ? Format.CHAIN : format;
  }

  public static WhyOptions defaults() {
    return new WhyOptions(null, false, Format.CHAIN);
  }

  public WhyOptions withMaxDepth(Integer depth) {
    return new WhyOptions(depth, includeCorrelations, format);
  }

  public WhyOptions withCorrelations(boolean include) {
    return new WhyOptions(maxDepth, include, format);
  }

  public WhyOptions withFormat(Format newFormat) {
    return new WhyOptions(maxDepth, includeCorrelations, newFormat);
  }
}
