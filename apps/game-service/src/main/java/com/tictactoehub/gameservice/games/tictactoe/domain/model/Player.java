package com.tictactoehub.gameservice.games.tictactoe.domain.model;

import java.util.Objects;

/**
 * 玩家：执子标记 + 显示颜色。
 * 颜色只用于渲染，引擎只读标记。
 */
public record Player(Mark mark, String color) {

    public Player {
        Objects.requireNonNull(mark, "mark");
        if (mark == Mark.EMPTY) {
            throw new IllegalArgumentException("a player cannot play EMPTY");
        }
    }

    /** 显示用标签，即标记符号 */
    public String label() {
        return String.valueOf(mark.symbol());
    }
}
