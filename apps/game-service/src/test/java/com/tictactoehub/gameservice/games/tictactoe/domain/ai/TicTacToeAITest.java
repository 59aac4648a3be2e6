package com.tictactoehub.gameservice.games.tictactoe.domain.ai;

import com.tictactoehub.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.WinningLines;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.NoLegalMoveAvailableException;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.OutcomeType;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TicTacToeAITest {

    private static final WinningLines LINES_3 = WinningLines.of(3);

    private static ExecutorService pool;

    @BeforeAll
    static void startPool() {
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterAll
    static void stopPool() {
        pool.shutdownNow();
    }

    private static Move best(TicTacToeAI ai, Board board, Mark me) {
        return ai.bestMove(board, LINES_3, me, board.emptyCount());
    }

    @Test
    void shouldTakeImmediateWin() {
        Board board = Board.parse("XX.", "OO.", "X..");

        assertEquals(new Move(1, 2, Mark.O), best(new TicTacToeAI(), board, Mark.O));
    }

    @Test
    void shouldBlockOpponentLine() {
        Board board = Board.parse("XX.", ".O.", "...");

        assertEquals(new Move(0, 2, Mark.O), best(new TicTacToeAI(), board, Mark.O));
    }

    @Test
    void shouldScoreLeavesWithEvaluatorAtDepthLimit() {
        // two plies, no game can end: centre keeps 3 open lines against any reply,
        // a corner or an edge gives the centre away to O
        TicTacToeAI ai = new TicTacToeAI(new SearchSettings(1, 0));
        Board board = new Board();

        assertEquals(new Move(1, 1, Mark.X), ai.bestMove(board, LINES_3, Mark.X, 9));
        assertEquals(new Board(), board);
    }

    @Test
    void shouldPickCentreAgainstCornerAtDepthLimit() {
        // O to reply to a corner: centre scores -1 at the cutoff, every other cell -2 or worse
        TicTacToeAI ai = new TicTacToeAI(new SearchSettings(1, 0));

        assertEquals(new Move(1, 1, Mark.O), ai.bestMove(Board.parse("X..", "...", "..."), LINES_3, Mark.O, 8));
    }

    @Test
    void shouldKeepFirstCellInRowMajorOrderOnEqualScores() {
        // (0,2) completes row 0 and (2,2) the main diagonal: both score the same
        Board board = Board.parse("OO.", "XOX", "XX.");

        assertEquals(new Move(0, 2, Mark.O), best(new TicTacToeAI(), board, Mark.O));
    }

    @Test
    void shouldLeaveBoardUntouched() {
        Board board = Board.parse("X..", ".O.", "..X");
        Board before = board.copy();

        best(new TicTacToeAI(), board, Mark.O);
        best(new TicTacToeAI(SearchSettings.exhaustive(3)), board, Mark.O);

        assertEquals(before, board);
    }

    @Test
    void shouldBeDeterministic() {
        TicTacToeAI ai = new TicTacToeAI();
        Board board = Board.parse("X..", "...", "...");

        Move first = best(ai, board, Mark.O);
        for (int i = 0; i < 5; i++) {
            assertEquals(first, best(ai, board, Mark.O));
        }
    }

    @Test
    void shouldFailOnFullBoard() {
        Board board = Board.parse("XOX", "XOO", "OXX");

        assertThrows(NoLegalMoveAvailableException.class, () -> best(new TicTacToeAI(), board, Mark.O));
    }

    @Test
    void shouldPreferFasterWin() {
        // O wins now at (0,2); other cells only delay or lose the win
        Board board = Board.parse("OO.", "XX.", "X..");

        Move m = best(new TicTacToeAI(SearchSettings.exhaustive(3)), board, Mark.O);

        assertEquals(new Move(0, 2, Mark.O), m);
    }

    @Test
    void shouldMatchSequentialSearchWhenParallel() {
        String[][] positions = {
                {"...", "...", "..."},
                {"X..", "...", "..."},
                {"X..", ".O.", "..X"},
                {"XX.", ".O.", "..."},
                {"OO.", "XOX", "XX."},
        };
        for (SearchSettings settings : new SearchSettings[]{SearchSettings.DEFAULT, SearchSettings.exhaustive(3)}) {
            TicTacToeAI sequential = new TicTacToeAI(settings);
            TicTacToeAI parallel = new TicTacToeAI(settings, pool);
            for (String[] rows : positions) {
                Board board = Board.parse(rows);
                Mark me = board.count(Mark.X) > board.count(Mark.O) ? Mark.O : Mark.X;
                Board before = board.copy();

                assertEquals(best(sequential, board, me), best(parallel, board, me));
                assertEquals(before, board);
            }
        }
    }

    @Test
    void shouldSuggestForSideToMoveWithoutTouchingState() {
        TicTacToeState state = TicTacToeState.of(Board.parse("XX.", ".O.", "..."), TicTacToeState.DEFAULT_PLAYERS);
        Board before = state.board().copy();

        Move m = new TicTacToeAI().suggest(state);

        assertEquals(new Move(0, 2, Mark.O), m);
        assertEquals(before, state.board());
    }

    /**
     * Exhaustive AI playing O against every possible sequence of X moves never loses.
     */
    @Test
    void shouldNeverLoseAsOWithExhaustiveSearch() {
        TicTacToeAI ai = new TicTacToeAI(SearchSettings.exhaustive(3));
        int[] finished = new int[1];

        exploreXMoves(ai, new Board(), finished);

        assertNotEquals(0, finished[0]);
    }

    private static void exploreXMoves(TicTacToeAI ai, Board board, int[] finished) {
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                if (board.get(r, c) != Mark.EMPTY) continue;
                Board next = board.copy();
                next.place(r, c, Mark.X);
                OutcomeType afterX = TicTacToeJudge.outcome(next, LINES_3).type();
                assertNotEquals(OutcomeType.X_WIN, afterX, "X won on " + next);
                if (afterX != OutcomeType.IN_PROGRESS) {
                    finished[0]++;
                    continue;
                }
                Move reply = ai.bestMove(next, LINES_3, Mark.O, next.emptyCount());
                next.place(reply.row(), reply.col(), Mark.O);
                if (TicTacToeJudge.outcome(next, LINES_3).isTerminal()) {
                    finished[0]++;
                    continue;
                }
                exploreXMoves(ai, next, finished);
            }
        }
    }

    /**
     * Exhaustive AI against itself from the empty board always ties.
     */
    @Test
    void shouldTieInExhaustiveSelfPlay() {
        TicTacToeAI ai = new TicTacToeAI(SearchSettings.exhaustive(3));
        TicTacToeState state = new TicTacToeState();

        while (!state.outcome().isTerminal()) {
            state.apply(ai.suggest(state));
            if (!state.outcome().isTerminal()) state.toggleTurn();
        }

        assertEquals(OutcomeType.TIE, state.outcome().type());
    }
}
