package com.zerarate.rate.source.validator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AceTokensResponse(List<AceToken> tokens) {}
