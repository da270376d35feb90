package com.tabletop.module;

import com.tabletop.model.BoardShape;
import com.tabletop.model.BoardTopology;
import com.tabletop.model.GridCoordinate;
import com.tabletop.model.RuleConfiguration;
import com.tabletop.model.SpaceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BoardModel sizing and position geometry.
 */
class BoardModelTest {

    private static BoardModel loop(int tiles) {
        return new BoardModel(RuleConfiguration.builder()
                .currencyEnabled(false)
                .tilesPerSide(tiles)
                .build());
    }

    private static BoardModel grid(int tiles) {
        return new BoardModel(RuleConfiguration.builder()
                .currencyEnabled(false)
                .separateBoards(true)
                .tilesPerSide(tiles)
                .build());
    }

    @Nested
    @DisplayName("size()")
    class SizeTests {

        @Test
        @DisplayName("shared board without properties should be a loop of tilesPerSide")
        void plainLoopUsesTilesPerSide() {
            BoardModel board = loop(20);

            assertEquals(20, board.size());
            assertEquals(BoardShape.LINEAR_LOOP, board.shape());
            assertFalse(board.isGrid());
        }

        @Test
        @DisplayName("property trading board should use the standard 40-space loop")
        void tradingLoopIsStandardSize() {
            BoardModel board = new BoardModel(RuleConfiguration.builder()
                    .currencyEnabled(true)
                    .purchasableProperties(true)
                    .tilesPerSide(10)
                    .build());

            assertEquals(BoardModel.STANDARD_LOOP_SIZE, board.size());
        }

        @Test
        @DisplayName("separate boards should be a square grid of tilesPerSide squared")
        void separateBoardsAreGrids() {
            BoardModel board = grid(10);

            assertEquals(100, board.size());
            assertEquals(BoardShape.SQUARE_GRID, board.shape());
            assertEquals(new BoardTopology(100, BoardShape.SQUARE_GRID), board.topology());
        }

        @Test
        @DisplayName("goal should be the last position")
        void goalIsLastPosition() {
            assertEquals(19, loop(20).goalPosition());
            assertEquals(99, grid(10).goalPosition());
        }
    }

    @Nested
    @DisplayName("coordinates")
    class CoordinateTests {

        @Test
        @DisplayName("should convert positions to grid coordinates and back")
        void shouldConvertBothWays() {
            BoardModel board = grid(10);

            GridCoordinate c = board.toCoordinates(37);

            assertEquals(new GridCoordinate(7, 3), c);
            assertEquals(37, board.toPosition(c));
        }

        @Test
        @DisplayName("loop boards should reject coordinate conversion")
        void loopRejectsCoordinates() {
            BoardModel board = loop(20);

            assertThrows(IllegalStateException.class, () -> board.toCoordinates(3));
            assertThrows(IllegalStateException.class, () -> board.toPosition(new GridCoordinate(1, 1)));
        }

        @Test
        @DisplayName("should reject coordinates outside the grid")
        void shouldRejectOutsideGrid() {
            BoardModel board = grid(4);

            assertThrows(IllegalArgumentException.class, () -> board.toPosition(new GridCoordinate(4, 0)));
            assertThrows(IllegalArgumentException.class, () -> board.toCoordinates(16));
        }
    }

    @Nested
    @DisplayName("spaceType()")
    class SpaceTypeTests {

        @Test
        @DisplayName("loop specials should sit at the quarter marks")
        void loopQuarterMarks() {
            BoardModel board = loop(20);

            assertEquals(SpaceType.START, board.spaceType(0));
            assertEquals(SpaceType.SPECIAL, board.spaceType(5));
            assertEquals(SpaceType.SPECIAL, board.spaceType(10));
            assertEquals(SpaceType.SPECIAL, board.spaceType(15));
            assertEquals(SpaceType.GOAL, board.spaceType(19));
            assertEquals(SpaceType.NORMAL, board.spaceType(7));
        }

        @Test
        @DisplayName("grid specials should be the corners")
        void gridCorners() {
            BoardModel board = grid(5);

            assertEquals(SpaceType.START, board.spaceType(0));
            assertEquals(SpaceType.SPECIAL, board.spaceType(4));
            assertEquals(SpaceType.SPECIAL, board.spaceType(20));
            assertEquals(SpaceType.GOAL, board.spaceType(24));
            assertEquals(SpaceType.NORMAL, board.spaceType(12));
        }

        @Test
        @DisplayName("should reject positions off the board")
        void offBoard() {
            BoardModel board = loop(20);

            assertFalse(board.isValidPosition(20));
            assertFalse(board.isValidPosition(-1));
            assertThrows(IllegalArgumentException.class, () -> board.spaceType(20));
        }
    }
}
