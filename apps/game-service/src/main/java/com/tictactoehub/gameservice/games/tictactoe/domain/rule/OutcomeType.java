package com.tictactoehub.gameservice.games.tictactoe.domain.rule;

import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;

/** 对局结果类型 */
public enum OutcomeType {
    /** 进行中 */
    IN_PROGRESS,
    /** X 连成一线 */
    X_WIN,
    /** O 连成一线 */
    O_WIN,
    /** 满盘且无人连成 */
    TIE;

    /**
     * 某方获胜对应的结果类型。
     *
     * @param mark X 或 O
     * @return X 返回 {@link #X_WIN}，O 返回 {@link #O_WIN}
     */
    public static OutcomeType winOf(Mark mark) {
        switch (mark) {
            case X: return X_WIN;
            case O: return O_WIN;
            default: throw new IllegalArgumentException("EMPTY cannot win");
        }
    }
}
