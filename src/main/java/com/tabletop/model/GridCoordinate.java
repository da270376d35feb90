package com.tabletop.model;

/**
 * Column/row pair on a square grid board.
 */
public record GridCoordinate(int x, int y) {}
