package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A tension edge; {@code axis} is {@code "unlabeled"} when none was written. */
public record TensionInfo(
    @JsonProperty("axis") String axis,
    @JsonProperty("source") NodeRef source,
    @JsonProperty("target") NodeRef target) {}
