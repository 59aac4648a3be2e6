package com.tictactoehub.gameservice.games.tictactoe.domain.model;

import com.tictactoehub.gameservice.games.tictactoe.domain.ai.TicTacToeAI;
import lombok.Data;

/**
 * 一局人机对局（服务层持有）。
 */
@Data
public class Game {
    /** 对局 ID */
    private final String gameId;
    /** 人类执子 */
    private final Mark humanMark;
    /** AI 执子（人类的对方） */
    private final Mark aiMark;
    /** 对局状态 */
    private final TicTacToeState state;
    /** 本局使用的 AI */
    private final TicTacToeAI ai;

    public Game(String gameId, Mark humanMark, TicTacToeState state, TicTacToeAI ai) {
        this.gameId = gameId;
        this.humanMark = humanMark;
        this.aiMark = humanMark.opponent();
        this.state = state;
        this.ai = ai;
    }

    /** 对局未结束且轮到 AI */
    public boolean aiToMove() {
        return !state.outcome().isTerminal() && state.currentMark() == aiMark;
    }
}
