package com.tictactoehub.gameservice.games.tictactoe.domain.ai;

import com.tictactoehub.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Cell;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.WinningLine;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.WinningLines;

/**
 * 静态局面评估（对 me 越大越好）。
 * 只在搜索到达深度上限且胜负未分时使用。
 */
public class Evaluator {

    private Evaluator() {
    }

    /**
     * 开放线差值：含我方子且无对方子的线 +1，反之 -1；
     * 双方都有子或全空的线记 0。
     */
    public static int score(Board b, WinningLines lines, Mark me) {
        Mark opp = me.opponent();
        int meOpen = 0, oppOpen = 0;
        for (WinningLine line : lines.all()) {
            boolean mine = false, theirs = false;
            for (Cell cell : line.cells()) {
                Mark m = b.get(cell);
                if (m == me) mine = true;
                else if (m == opp) theirs = true;
            }
            if (mine && !theirs) meOpen++;
            else if (theirs && !mine) oppOpen++;
        }
        return meOpen - oppOpen;
    }
}
