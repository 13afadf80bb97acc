package com.flowlayout.flowlayout_backend.stage;

/** Passes the propagator ran and whether the last one changed nothing. */
public record PropagationOutcome(int passes, boolean converged) {}
