package com.tictactoehub.gameservice.games.tictactoe.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * N x N 棋盘的全部胜利线：N 行、N 列、两条对角线，共 2N+2 条。
 * 只由几何决定，同尺寸的对局可共用一个实例。
 * 顺序固定：行（自上而下）、列（自左而右）、主对角线、副对角线。
 */
public final class WinningLines {

    private final int boardSize;
    private final List<WinningLine> lines;

    private WinningLines(int boardSize, List<WinningLine> lines) {
        this.boardSize = boardSize;
        this.lines = Collections.unmodifiableList(lines);
    }

    /** 生成指定尺寸的胜利线集合 */
    public static WinningLines of(int boardSize) {
        if (boardSize < 1) {
            throw new IllegalArgumentException("board size must be >= 1, got " + boardSize);
        }
        List<WinningLine> all = new ArrayList<>(2 * boardSize + 2);
        for (int r = 0; r < boardSize; r++) {
            List<Cell> row = new ArrayList<>(boardSize);
            for (int c = 0; c < boardSize; c++) row.add(new Cell(r, c));
            all.add(new WinningLine(row));
        }
        for (int c = 0; c < boardSize; c++) {
            List<Cell> col = new ArrayList<>(boardSize);
            for (int r = 0; r < boardSize; r++) col.add(new Cell(r, c));
            all.add(new WinningLine(col));
        }
        List<Cell> main = new ArrayList<>(boardSize);
        List<Cell> anti = new ArrayList<>(boardSize);
        for (int i = 0; i < boardSize; i++) {
            main.add(new Cell(i, i));
            anti.add(new Cell(i, boardSize - 1 - i));
        }
        all.add(new WinningLine(main));
        all.add(new WinningLine(anti));
        return new WinningLines(boardSize, all);
    }

    /** 对应的棋盘尺寸 */
    public int boardSize() { return boardSize; }

    /** 按生成顺序的不可变列表 */
    public List<WinningLine> all() { return lines; }

    public int count() { return lines.size(); }
}
