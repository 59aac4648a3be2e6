package com.tictactoehub.gameservice.games.tictactoe.domain.rule;

import com.tictactoehub.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Cell;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.WinningLine;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.WinningLines;

/**
 * 井字棋规则：只依赖棋盘的纯函数（合法性、胜负、平局）。
 */
public class TicTacToeJudge {

    private TicTacToeJudge() {
    }

    /** 目标格在棋盘内且为空 */
    public static boolean isLegal(Board b, int row, int col) {
        return b.inBounds(row, col) && b.isEmpty(row, col);
    }

    /**
     * 整条线都是同一标记时返回该标记，否则返回 EMPTY。
     */
    public static Mark owner(Board b, WinningLine line) {
        Mark first = null;
        for (Cell cell : line.cells()) {
            Mark m = b.get(cell);
            if (m == Mark.EMPTY) return Mark.EMPTY;
            if (first == null) first = m;
            else if (m != first) return Mark.EMPTY;
        }
        return first == null ? Mark.EMPTY : first;
    }

    /**
     * 按顺序扫描胜利线，返回第一条连成的线；否则满盘为 TIE，未满为 IN_PROGRESS。
     * 轮流落子下只有一方能连成，扫描顺序只决定同一胜方有多条线时报告哪一条。
     */
    public static Outcome outcome(Board b, WinningLines lines) {
        for (WinningLine line : lines.all()) {
            Mark m = owner(b, line);
            if (m != Mark.EMPTY) return Outcome.win(m, line);
        }
        return b.isFull() ? Outcome.TIE : Outcome.IN_PROGRESS;
    }

    /** 局面胜方；无人连成时为 EMPTY */
    public static Mark winner(Board b, WinningLines lines) {
        for (WinningLine line : lines.all()) {
            Mark m = owner(b, line);
            if (m != Mark.EMPTY) return m;
        }
        return Mark.EMPTY;
    }
}
