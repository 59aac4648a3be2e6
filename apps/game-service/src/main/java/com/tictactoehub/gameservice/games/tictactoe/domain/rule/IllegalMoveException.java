package com.tictactoehub.gameservice.games.tictactoe.domain.rule;

import com.tictactoehub.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Move;
import lombok.Getter;

/**
 * 非法落子。抛出时棋盘保持不变。
 */
@Getter
public class IllegalMoveException extends IllegalStateException {

    /** 拒绝原因 */
    public enum Reason {
        /** 行或列越界 */
        OUT_OF_RANGE,
        /** 目标格已有子 */
        OCCUPIED,
        /** 对局已分胜负或平局 */
        GAME_OVER,
        /** 未轮到该标记行棋 */
        NOT_YOUR_TURN
    }

    private final Reason reason;
    private final transient Move move;

    public IllegalMoveException(Reason reason, Move move) {
        super(GameMessages.formatIllegalMove(reason.name(), move));
        this.reason = reason;
        this.move = move;
    }
}
