package com.tabletop.model;

public enum BoardShape {
    LINEAR_LOOP,
    SQUARE_GRID
}
