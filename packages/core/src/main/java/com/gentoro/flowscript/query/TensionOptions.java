package com.gentoro.flowscript.query;

import java.util.List;

/**
 * Options for {@link QueryEngine#tensions}.
 *
 * @param groupBy grouping of the result
 * @param filterByAxis axes to keep; empty keeps all
 * @param includeContext attach the non-tension parents of each tension's source
 * @param scope node id whose downstream subgraph bounds the search; null searches everything
 */
public record TensionOptions(
    GroupBy groupBy, List<String> filterByAxis, boolean includeContext, String scope) {

  public enum GroupBy {
    AXIS,
    NODE,
    NONE
  }

  public TensionOptions {
    groupBy = groupBy == null ? GroupBy.AXIS : groupBy;
    filterByAxis = filterByAxis == null ? List.of() : List.copyOf(filterByAxis);
  }

  public static TensionOptions defaults() {
    return new TensionOptions(GroupBy.AXIS, List.of(), false, null);
  }

  public TensionOptions withGroupBy(GroupBy grouping) {
    return new TensionOptions(grouping, filterByAxis, includeContext, scope);
  }

  public TensionOptions withAxes(List<String> axes) {
    return new TensionOptions(groupBy, axes, includeContext, scope);
  }

  public TensionOptions withContext(boolean include) {
    return new TensionOptions(groupBy, filterByAxis, include, scope);
  }

  public TensionOptions withScope(String nodeId) {
    return new TensionOptions(groupBy, filterByAxis, includeContext, nodeId);
  }
}
