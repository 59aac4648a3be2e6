package com.tictactoehub.gameservice.games.tictactoe.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoardTest {

    @Test
    void shouldStartEmpty() {
        Board board = new Board();

        assertEquals(3, board.getSize());
        assertEquals(9, board.emptyCount());
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                assertEquals(Mark.EMPTY, board.get(r, c));
    }

    @Test
    void shouldParseRows() {
        Board board = Board.parse("XO.", ".X.", "..O");

        assertEquals(Mark.X, board.get(0, 0));
        assertEquals(Mark.O, board.get(0, 1));
        assertEquals(Mark.O, board.get(2, 2));
        assertEquals(2, board.count(Mark.X));
        assertEquals(5, board.emptyCount());
        assertEquals("XO./.X./..O", board.toString());
    }

    @Test
    void shouldRejectRaggedRows() {
        assertThrows(IllegalArgumentException.class, () -> Board.parse("XO", "..."));
    }

    @Test
    void shouldCopyIndependently() {
        Board board = Board.parse("X..", "...", "...");
        Board copy = board.copy();

        copy.place(1, 1, Mark.O);

        assertEquals(Mark.EMPTY, board.get(1, 1));
        assertEquals(board, Board.parse("X..", "...", "..."));
        assertNotSame(board, copy);
    }

    @Test
    void shouldCheckBoundsAndEmptiness() {
        Board board = Board.parse("X..", "...", "...");

        assertFalse(board.isEmpty(0, 0));
        assertTrue(board.isEmpty(0, 1));
        assertFalse(board.isEmpty(3, 0));
        assertFalse(board.inBounds(-1, 0));
    }

    @Test
    void shouldClearWithoutChangingSize() {
        Board board = Board.parse("XOX", "OXO", "OXO");
        assertTrue(board.isFull());

        board.clear();

        assertEquals(9, board.emptyCount());
        assertArrayEquals(new char[]{'.', '.', '.'}, board.view()[1]);
    }
}
