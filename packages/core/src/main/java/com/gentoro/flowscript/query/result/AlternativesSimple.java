package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record AlternativesSimple(
    @JsonProperty("format") String format,
    @JsonProperty("question") String question,
    @JsonProperty("options_considered") List<String> optionsConsidered,
    @JsonProperty("chosen") String chosen,
    @JsonProperty("reason") String reason)
    implements AlternativesResult {}
