package com.tictactoehub.gameservice.games.tictactoe.domain.model;

import java.util.List;

/**
 * 一条胜利线：N 个格子，全部为同一标记即获胜。
 */
public record WinningLine(List<Cell> cells) {

    public WinningLine {
        cells = List.copyOf(cells);
    }

    /** 格子数 */
    public int length() {
        return cells.size();
    }
}
