package com.advisoryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PeerProbability(
    @JsonProperty("core_name")   String coreName,
    @JsonProperty("probability") double probability
) {}
