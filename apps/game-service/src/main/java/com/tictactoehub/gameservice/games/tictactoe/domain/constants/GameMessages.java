package com.tictactoehub.gameservice.games.tictactoe.domain.constants;

import com.tictactoehub.gameservice.games.tictactoe.domain.model.Move;

/**
 * 井字棋消息常量
 * 统一管理错误码与用户可见的状态文案，避免硬编码
 *
 * 使用示例：
 *   throw new IllegalArgumentException(GameMessages.GAME_NOT_FOUND + ": " + gameId);
 *   out.println(GameMessages.formatTurn("X"));
 */
public final class GameMessages {

    private GameMessages() {
    }

    // ========== 错误码 ==========

    /** 非法落子前缀 */
    public static final String ILLEGAL_MOVE = "ILLEGAL_MOVE";

    /** 在满盘上调用搜索 */
    public static final String NO_LEGAL_MOVE = "NO_LEGAL_MOVE";

    /** 对局不存在 */
    public static final String GAME_NOT_FOUND = "GAME_NOT_FOUND";

    /** 未轮到 AI 时请求 AI 落子 */
    public static final String NOT_AI_TURN = "NOT_AI_TURN";

    /** 格式化非法落子消息：ILLEGAL_MOVE[原因]: 着法 */
    public static String formatIllegalMove(String reason, Move move) {
        return String.format("%s[%s]: %s", ILLEGAL_MOVE, reason, move);
    }

    // ========== 状态文案 ==========

    /** 开局提示 */
    public static final String READY = "Ready?";

    /** 轮到某方（用标记格式化） */
    public static final String TURN = "%s's turn";

    /** 某方获胜（用标记格式化） */
    public static final String WON = "Player \"%s\" won!";

    /** 平局 */
    public static final String TIED = "Tied game!";

    public static String formatTurn(String mark) {
        return String.format(TURN, mark);
    }

    public static String formatWon(String mark) {
        return String.format(WON, mark);
    }
}
