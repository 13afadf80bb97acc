package com.flowlayout.flowlayout_backend.model.domain;

public enum LayoutMode {
    COLUMN,        // stage columns + barycenter ordering
    LANE_SECTION   // lane bands + section columns from subgraph naming
}
