package com.flowlayout.flowlayout_backend.model.domain;

public enum NodeKind {
    COMPONENT,   // regular pipeline component, laid out by a strategy
    BOUNDARY,    // account/cloud perimeter, sized by the boundary fitter
    BADGE,       // synthesized lane/section label
    ANNOTATION   // user-declared label node (":::laneBadge" style), bound with ~~~
}
