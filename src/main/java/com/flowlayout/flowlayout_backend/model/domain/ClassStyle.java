package com.flowlayout.flowlayout_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/** One parsed {@code classDef} entry. Any field may be null. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassStyle(String fill, String stroke, String color) {}
