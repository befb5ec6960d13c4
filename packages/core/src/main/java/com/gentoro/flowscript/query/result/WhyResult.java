package com.gentoro.flowscript.query.result;

/** Result of a causal ancestry query; the concrete type follows the requested format. */
public interface WhyResult {}
