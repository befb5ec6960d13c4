package com.gentoro.flowscript.logging;

import org.slf4j.MDC;

/** MDC scope naming the document being compiled; logback prints it as {@code %X{source_file}}. */
public final class SourceLogContext implements AutoCloseable {
  public static final String MDC_SOURCE_FILE = "source_file";

  private final String previous;

  public SourceLogContext(String sourceFile) {
    previous = MDC.get(MDC_SOURCE_FILE);
    if (sourceFile != null) MDC.put(MDC_SOURCE_FILE, sourceFile);
  }

  @Override
  public void close() {
    if (previous == null) {
      MDC.remove(MDC_SOURCE_FILE);
    } else {
      MDC.put(MDC_SOURCE_FILE, previous);
    }
  }
}
