package com.gentoro.flowscript.linker;

/**
 * One place where a node was written. Repeated content shares a node id but every occurrence keeps
 * its own line, so position-based linking sees the document as written.
 *
 * @param nodeId content-hash id of the node
 * @param line 1-indexed line of the original source
 */
public record Occurrence(String nodeId, int line) {}
