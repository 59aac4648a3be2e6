package com.tictactoehub.gameservice.engine.core;

/**
 * 游戏状态快照。
 * - 必须可复制：AI 搜索、回放、存档都基于副本。
 * - 具体游戏（如 TicTacToeState）实现该接口。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝。
     */
    GameState copy();
}
