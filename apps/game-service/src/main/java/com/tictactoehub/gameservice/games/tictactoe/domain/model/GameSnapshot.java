package com.tictactoehub.gameservice.games.tictactoe.domain.model;

import java.util.List;

/**
 * 对局只读快照，供展示层渲染。
 */
public final class GameSnapshot {

    /** 对局 ID */
    public final String gameId;
    /** 棋盘边长 */
    public final int boardSize;
    /** 每格的显示符号（副本） */
    public final char[][] cells;
    /** 当前行棋方；终局为 null */
    public final Character sideToMove;
    /** 当前行棋方颜色；终局为 null */
    public final String sideToMoveColor;
    /** 人类执子 */
    public final Character humanSide;
    /** AI 执子 */
    public final Character aiSide;
    /** 结果类型名（IN_PROGRESS / X_WIN / O_WIN / TIE） */
    public final String outcome;
    /** 胜方符号；无人获胜时为 null */
    public final Character winner;
    /** 获胜线上的格子（用于高亮），否则为空 */
    public final List<Cell> winningCells;
    /** 剩余空格数 */
    public final int cellsLeft;

    public GameSnapshot(String gameId,
                        int boardSize,
                        char[][] cells,
                        Character sideToMove,
                        String sideToMoveColor,
                        Character humanSide,
                        Character aiSide,
                        String outcome,
                        Character winner,
                        List<Cell> winningCells,
                        int cellsLeft) {
        this.gameId = gameId;
        this.boardSize = boardSize;
        this.cells = cells;
        this.sideToMove = sideToMove;
        this.sideToMoveColor = sideToMoveColor;
        this.humanSide = humanSide;
        this.aiSide = aiSide;
        this.outcome = outcome;
        this.winner = winner;
        this.winningCells = winningCells == null ? List.of() : List.copyOf(winningCells);
        this.cellsLeft = cellsLeft;
    }
}
