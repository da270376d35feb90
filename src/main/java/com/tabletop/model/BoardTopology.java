package com.tabletop.model;

/**
 * Size and shape of the board a match is played on.
 *
 * @param size  number of addressable positions
 * @param shape loop or grid
 */
public record BoardTopology(int size, BoardShape shape) {

    public boolean isGrid() {
        return shape == BoardShape.SQUARE_GRID;
    }
}
