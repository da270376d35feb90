package com.tabletop.module;

import com.tabletop.model.BoardShape;
import com.tabletop.model.BoardTopology;
import com.tabletop.model.GridCoordinate;
import com.tabletop.model.RuleConfiguration;
import com.tabletop.model.SpaceType;
import lombok.extern.slf4j.Slf4j;

/**
 * Board topology and position semantics.
 * <p>
 * This is the only place the board size is computed; every other module asks the board.
 */
@Slf4j
public class BoardModel {

    /** Loop size used whenever currency and purchasable properties are both enabled. */
    public static final int STANDARD_LOOP_SIZE = 40;

    private final BoardShape shape;
    private final int tilesPerSide;
    private final int size;

    public BoardModel(RuleConfiguration rules) {
        this.tilesPerSide = rules.getTilesPerSide();
        if (rules.isSeparateBoards()) {
            this.shape = BoardShape.SQUARE_GRID;
            this.size = tilesPerSide * tilesPerSide;
        } else {
            this.shape = BoardShape.LINEAR_LOOP;
            this.size = rules.isCurrencyEnabled() && rules.isPurchasableProperties()
                    ? STANDARD_LOOP_SIZE
                    : tilesPerSide;
        }
        if (size <= 0) {
            throw new IllegalArgumentException("Board must have at least one position");
        }
        log.debug("Board initialized: {} with {} positions", shape, size);
    }

    public int size() {
        return size;
    }

    public BoardShape shape() {
        return shape;
    }

    public boolean isGrid() {
        return shape == BoardShape.SQUARE_GRID;
    }

    public BoardTopology topology() {
        return new BoardTopology(size, shape);
    }

    public int goalPosition() {
        return size - 1;
    }

    public boolean isValidPosition(int position) {
        return position >= 0 && position < size;
    }

    /**
     * Convert a linear position to grid coordinates.
     *
     * @throws IllegalStateException on loop boards
     */
    public GridCoordinate toCoordinates(int position) {
        requireGrid();
        requireValid(position);
        return new GridCoordinate(position % tilesPerSide, position / tilesPerSide);
    }

    /**
     * Convert grid coordinates to a linear position.
     *
     * @throws IllegalStateException on loop boards
     */
    public int toPosition(GridCoordinate coordinate) {
        requireGrid();
        if (coordinate.x() < 0 || coordinate.x() >= tilesPerSide
                || coordinate.y() < 0 || coordinate.y() >= tilesPerSide) {
            throw new IllegalArgumentException("Coordinate outside the grid: " + coordinate);
        }
        return coordinate.y() * tilesPerSide + coordinate.x();
    }

    public boolean isSpecial(int position) {
        requireValid(position);
        if (isGrid()) {
            GridCoordinate c = toCoordinates(position);
            int last = tilesPerSide - 1;
            return (c.x() == 0 || c.x() == last) && (c.y() == 0 || c.y() == last);
        }
        return position == 0
                || position == size / 4
                || position == size / 2
                || position == (size * 3) / 4;
    }

    public SpaceType spaceType(int position) {
        requireValid(position);
        if (position == 0) {
            return SpaceType.START;
        } else if (position == goalPosition()) {
            return SpaceType.GOAL;
        } else if (isSpecial(position)) {
            return SpaceType.SPECIAL;
        }
        return SpaceType.NORMAL;
    }

    private void requireGrid() {
        if (!isGrid()) {
            throw new IllegalStateException("Grid coordinates are undefined on a loop board");
        }
    }

    private void requireValid(int position) {
        if (!isValidPosition(position)) {
            throw new IllegalArgumentException("Position " + position + " is off the board (size " + size + ")");
        }
    }
}
