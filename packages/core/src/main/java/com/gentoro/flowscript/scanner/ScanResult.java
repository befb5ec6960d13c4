package com.gentoro.flowscript.scanner;

import java.util.Map;

/**
 * Output of {@link IndentationScanner#process(String)}.
 *
 * @param transformed source with implicit blocks made explicit
 * @param lineMap 1-indexed transformed line to 1-indexed original line
 */
public record ScanResult(String transformed, Map<Integer, Integer> lineMap) {
  public ScanResult {
    lineMap = Map.copyOf(lineMap);
  }

  /** Maps a transformed line back to the source; unmapped lines map to themselves. */
  public int originalLine(int transformedLine) {
    return lineMap.getOrDefault(transformedLine, transformedLine);
  }
}
