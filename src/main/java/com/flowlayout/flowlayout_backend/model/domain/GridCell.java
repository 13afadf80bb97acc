package com.flowlayout.flowlayout_backend.model.domain;

/** Discrete (column, row) slot a strategy placed a node in. */
public record GridCell(int column, int row) {}
