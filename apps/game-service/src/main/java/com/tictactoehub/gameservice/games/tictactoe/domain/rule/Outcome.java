package com.tictactoehub.gameservice.games.tictactoe.domain.rule;

import com.tictactoehub.gameservice.games.tictactoe.domain.model.Cell;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.WinningLine;

import java.util.List;

/**
 * 局面结果。获胜时携带胜方与连成的格子（展示层用于高亮）；
 * 其余结果 winner 为 EMPTY、格子为空。
 */
public record Outcome(OutcomeType type, Mark winner, List<Cell> winningCells) {

    public static final Outcome IN_PROGRESS = new Outcome(OutcomeType.IN_PROGRESS, Mark.EMPTY, List.of());
    public static final Outcome TIE = new Outcome(OutcomeType.TIE, Mark.EMPTY, List.of());

    public Outcome {
        winningCells = List.copyOf(winningCells);
    }

    /** 某方连成一线 */
    public static Outcome win(Mark mark, WinningLine line) {
        return new Outcome(OutcomeType.winOf(mark), mark, line.cells());
    }

    /** 是否终局（胜或平） */
    public boolean isTerminal() {
        return type != OutcomeType.IN_PROGRESS;
    }

    public boolean isWin() {
        return type == OutcomeType.X_WIN || type == OutcomeType.O_WIN;
    }

    public boolean isTie() {
        return type == OutcomeType.TIE;
    }
}
