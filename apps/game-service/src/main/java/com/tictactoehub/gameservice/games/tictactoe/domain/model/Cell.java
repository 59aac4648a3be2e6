package com.tictactoehub.gameservice.games.tictactoe.domain.model;

/**
 * 棋盘坐标 (row, col)，从 0 开始。
 */
public record Cell(int row, int col) {

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
