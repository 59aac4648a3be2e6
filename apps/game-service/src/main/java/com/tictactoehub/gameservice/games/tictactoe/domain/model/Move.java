package com.tictactoehub.gameservice.games.tictactoe.domain.model;

import java.util.Objects;

/**
 * 一步棋：在 (row, col) 落下 {@code mark}。
 * 不可变；是否合法由规则层判定。
 */
public record Move(int row, int col, Mark mark) {

    public Move {
        Objects.requireNonNull(mark, "mark");
        if (mark == Mark.EMPTY) {
            throw new IllegalArgumentException("a move must place X or O");
        }
    }

    /** 落点坐标 */
    public Cell cell() {
        return new Cell(row, col);
    }
}
