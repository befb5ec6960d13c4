package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Keyword-bucketed impact overview.
 *
 * <p>Risks are consequences whose text mentions risk, problem, issue, error or fail; everything
 * else is listed as a benefit. This is a text heuristic, not a classification.
 */
public record ImpactSummary(
    @JsonProperty("impact_summary") String impactSummary,
    @JsonProperty("benefits") List<String> benefits,
    @JsonProperty("risks") List<String> risks,
    @JsonProperty("key_tradeoff") String keyTradeoff)
    implements WhatIfResult {}
