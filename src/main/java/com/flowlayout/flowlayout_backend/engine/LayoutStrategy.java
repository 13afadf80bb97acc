package com.flowlayout.flowlayout_backend.engine;

import com.flowlayout.flowlayout_backend.model.domain.LayoutMode;

public interface LayoutStrategy {

    LayoutMode supportedMode();

    // Positions every node of context.layoutNodes() and records its grid cell
    void layout(LayoutContext context);
}
