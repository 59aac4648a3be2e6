package com.tictactoehub.gameservice.games.tictactoe.domain.ai;

import com.tictactoehub.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.WinningLines;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EvaluatorTest {

    private static final WinningLines LINES_3 = WinningLines.of(3);

    @Test
    void shouldScoreZeroOnEmptyBoard() {
        assertEquals(0, Evaluator.score(new Board(), LINES_3, Mark.O));
    }

    @Test
    void shouldCountOpenLinesThroughCenter() {
        Board board = Board.parse("...", ".O.", "...");

        assertEquals(4, Evaluator.score(board, LINES_3, Mark.O));
        assertEquals(-4, Evaluator.score(board, LINES_3, Mark.X));
    }

    @Test
    void shouldIgnoreContestedLines() {
        // X: row 0 and col 0 open; O: row 1, col 1, anti-diagonal open; main diagonal contested
        Board board = Board.parse("X..", ".O.", "...");

        assertEquals(1, Evaluator.score(board, LINES_3, Mark.O));
        assertEquals(-1, Evaluator.score(board, LINES_3, Mark.X));
    }
}
