package com.gentoro.flowscript.query;

/**
 * Options for {@link QueryEngine#whatIf}.
 *
 * @param maxDepth traversal depth limit; null means unbounded
 * @param includeCorrelations also follow {@code =} edges
 * @param includeTemporalConsequences also follow {@code =>} edges
 * @param format output shape
 */
public record WhatIfOptions(
    Integer maxDepth,
    boolean includeCorrelations,
    boolean includeTemporalConsequences,
    Format format) {

  public enum Format {
    TREE,
    SUMMARY
  }

  public WhatIfOptions {
    QueryEngine.checkDepth(maxDepth);
    format = format == null ? Format.TREE : format;
  }

  public static WhatIfOptions defaults() {
    return new WhatIfOptions(null, false, true, Format.TREE);
  }

  public WhatIfOptions withMaxDepth(Integer depth) {
    return new WhatIfOptions(depth, includeCorrelations, includeTemporalConsequences, format);
  }

  public WhatIfOptions withCorrelations(boolean include) {
    return new WhatIfOptions(maxDepth, include, includeTemporalConsequences, format);
  }

  public WhatIfOptions withTemporalConsequences(boolean include) {
    return new WhatIfOptions(maxDepth, includeCorrelations, include, format);
  }

  public WhatIfOptions withFormat(Format newFormat) {
    return new WhatIfOptions(maxDepth, includeCorrelations, includeTemporalConsequences, newFormat);
  }
}
