package com.tictactoehub.gameservice.games.tictactoe.domain.rule;

import com.tictactoehub.gameservice.games.tictactoe.domain.constants.GameMessages;

/**
 * 在没有空格的棋盘上请求搜索。
 * 调用方应先检查对局结果再请求 AI 落子。
 */
public class NoLegalMoveAvailableException extends IllegalStateException {

    public NoLegalMoveAvailableException(String board) {
        super(GameMessages.NO_LEGAL_MOVE + ": " + board);
    }
}
