package com.gentoro.flowscript.query;

/**
 * Options for {@link QueryEngine#blocked}.
 *
 * @param since keep blockers whose {@code since} field is on or after this ISO date; null keeps
 *     all
 * @param includeTransitiveCauses list what leads to each blocker
 * @param includeTransitiveEffects list what each blocker holds up
 * @param format {@code DETAILED} lists every blocker with its reason and dates; {@code SUMMARY}
 *     keeps only the node, the state and the impact score
 */
public record BlockedOptions(
    String since,
    boolean includeTransitiveCauses,
    boolean includeTransitiveEffects,
    Format format) {

  public enum Format {
    DETAILED,
    SUMMARY
  }

  public BlockedOptions {
    format = format == null ? Format.DETAILED : format;
  }

  public static BlockedOptions defaults() {
    return new BlockedOptions(null, true, true, Format.DETAILED);
  }

  public BlockedOptions withSince(String date) {
    return new BlockedOptions(date, includeTransitiveCauses, includeTransitiveEffects, format);
  }

  public BlockedOptions withTransitiveCauses(boolean include) {
    return new BlockedOptions(since, include, includeTransitiveEffects, format);
  }

  public BlockedOptions withTransitiveEffects(boolean include) {
    return new BlockedOptions(since, includeTransitiveCauses, include, format);
  }

  public BlockedOptions withFormat(Format newFormat) {
    return new BlockedOptions(since, includeTransitiveCauses, includeTransitiveEffects, newFormat);
  }
}
