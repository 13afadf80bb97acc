package com.flowlayout.flowlayout_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SubgraphKind {
    LANE,      // horizontal band, one parallel data path
    SECTION,   // vertical column, one processing phase
    BOUNDARY,  // cloud/account or producer/consumer perimeter
    GROUP;     // anything else

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
