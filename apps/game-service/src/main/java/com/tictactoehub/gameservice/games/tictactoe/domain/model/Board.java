package com.tictactoehub.gameservice.games.tictactoe.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;

/**
 * 井字棋棋盘：N x N 的 {@link Mark} 网格（默认 3x3）。
 * 只负责存储；越界、占用等规则由规则层判定。
 */
@EqualsAndHashCode
public class Board {

    /** 默认棋盘尺寸 */
    public static final int DEFAULT_SIZE = 3;

    /** 棋盘边长 */
    @Getter
    private final int size;

    /** 棋盘二维数组，存放当前局面 */
    private final Mark[][] grid;

    public Board() {
        this(DEFAULT_SIZE);
    }

    /** 构造全空棋盘 */
    public Board(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("board size must be >= 1, got " + size);
        }
        this.size = size;
        this.grid = new Mark[size][size];
        clear();
    }

    /**
     * 按行字符串摆局，例如 {@code "XO.", ".X.", "..O"}。
     */
    public static Board parse(String... rows) {
        Board b = new Board(rows.length);
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length() != rows.length) {
                throw new IllegalArgumentException("row " + r + " must have " + rows.length + " cells: " + rows[r]);
            }
            for (int c = 0; c < rows.length; c++) b.grid[r][c] = Mark.fromSymbol(rows[r].charAt(c));
        }
        return b;
    }

    /** 是否在棋盘内 */
    public boolean inBounds(int row, int col) {
        return row >= 0 && row < size && col >= 0 && col < size;
    }

    /** 读取该格的标记 */
    public Mark get(int row, int col) { return grid[row][col]; }

    public Mark get(Cell cell) { return grid[cell.row()][cell.col()]; }

    /** 该格是否在棋盘内且为空 */
    public boolean isEmpty(int row, int col) {
        return inBounds(row, col) && grid[row][col] == Mark.EMPTY;
    }

    /** 写入标记（不做合法性校验，由上层规则判定）；写 EMPTY 即撤子 */
    public void place(int row, int col, Mark mark) { grid[row][col] = mark; }

    /** 清空所有格子 */
    public void clear() {
        for (Mark[] row : grid) Arrays.fill(row, Mark.EMPTY);
    }

    /** 总格数 */
    public int totalCells() { return size * size; }

    /** 空格数 */
    public int emptyCount() {
        int n = 0;
        for (Mark[] row : grid)
            for (Mark m : row)
                if (m == Mark.EMPTY) n++;
        return n;
    }

    /** 某种标记的数量 */
    public int count(Mark mark) {
        int n = 0;
        for (Mark[] row : grid)
            for (Mark m : row)
                if (m == mark) n++;
        return n;
    }

    /** 是否已下满 */
    public boolean isFull() { return emptyCount() == 0; }

    /** 深拷贝棋盘（供状态复制 / AI 模拟使用） */
    public Board copy() {
        Board b = new Board(size);
        for (int i = 0; i < size; i++) b.grid[i] = grid[i].clone();
        return b;
    }

    /** 返回一个只读视图副本（用于渲染 / 日志） */
    public char[][] view() {
        char[][] v = new char[size][size];
        for (int r = 0; r < size; r++)
            for (int c = 0; c < size; c++)
                v[r][c] = grid[r][c].symbol();
        return v;
    }

    /** 形如 {@code XO./.X./..O}，用于日志 */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < size; r++) {
            if (r > 0) sb.append('/');
            for (int c = 0; c < size; c++) sb.append(grid[r][c].symbol());
        }
        return sb.toString();
    }
}
