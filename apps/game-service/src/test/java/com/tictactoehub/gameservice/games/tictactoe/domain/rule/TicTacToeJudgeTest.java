package com.tictactoehub.gameservice.games.tictactoe.domain.rule;

import com.tictactoehub.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Cell;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.WinningLines;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TicTacToeJudgeTest {

    private static final WinningLines LINES_3 = WinningLines.of(3);

    @Test
    void shouldDetectColumnWinForO() {
        Board board = Board.parse("XO.", "XO.", ".OX");

        Outcome o = TicTacToeJudge.outcome(board, LINES_3);

        assertEquals(OutcomeType.O_WIN, o.type());
        assertEquals(Mark.O, o.winner());
        assertEquals(List.of(new Cell(0, 1), new Cell(1, 1), new Cell(2, 1)), o.winningCells());
    }

    @Test
    void shouldDetectAntiDiagonal() {
        Board board = Board.parse("OOX", ".X.", "X..");

        Outcome o = TicTacToeJudge.outcome(board, LINES_3);

        assertEquals(OutcomeType.X_WIN, o.type());
        assertEquals(List.of(new Cell(0, 2), new Cell(1, 1), new Cell(2, 0)), o.winningCells());
    }

    @Test
    void shouldPreferWinOverFullBoard() {
        Board board = Board.parse("XXX", "OOX", "XOO");

        assertEquals(OutcomeType.X_WIN, TicTacToeJudge.outcome(board, LINES_3).type());
    }

    @Test
    void shouldStayInProgressWithFreeCellsAndNoLine() {
        Board board = Board.parse("XO.", "...", "...");

        assertEquals(Outcome.IN_PROGRESS, TicTacToeJudge.outcome(board, LINES_3));
        assertEquals(Mark.EMPTY, TicTacToeJudge.winner(board, LINES_3));
    }

    @Test
    void shouldJudgeLegality() {
        Board board = Board.parse("X..", "...", "...");

        assertFalse(TicTacToeJudge.isLegal(board, 0, 0));
        assertTrue(TicTacToeJudge.isLegal(board, 2, 2));
        assertFalse(TicTacToeJudge.isLegal(board, 0, 3));
    }

    @Test
    void shouldWorkOnLargerBoards() {
        Board board = Board.parse("O...", ".O..", "..O.", "...O");

        Outcome o = TicTacToeJudge.outcome(board, WinningLines.of(4));

        assertEquals(OutcomeType.O_WIN, o.type());
        assertEquals(4, o.winningCells().size());
    }
}
