package com.gentoro.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record WhyMinimalResult(
    @JsonProperty("root_cause") String rootCause, @JsonProperty("chain") List<String> chain)
    implements WhyResult {}
