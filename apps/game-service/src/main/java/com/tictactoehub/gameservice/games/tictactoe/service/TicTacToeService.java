package com.tictactoehub.gameservice.games.tictactoe.service;

import com.tictactoehub.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.Outcome;

/**
 * 井字棋对局服务（引擎边界）：人机对局的创建、落子、AI 应手、重开与快照。
 */
public interface TicTacToeService {

    /** 新建人机对局；humanMark 为 null 时取配置的默认值。AI 执 X 时立即先手。 */
    String newGame(Mark humanMark);

    /**
     * 为 {@code mark} 落一子，对局未结束则交换轮次。
     *
     * @throws com.tictactoehub.gameservice.games.tictactoe.domain.rule.IllegalMoveException
     *         越界 / 已占 / 已终局 / 未轮到该方，状态不变
     */
    Outcome attemptMove(String gameId, int row, int col, Mark mark);

    /**
     * 让 AI 计算一步，只返回不落子。
     *
     * @param cellsRemaining AI 落子前的空格数，决定搜索深度
     * @throws com.tictactoehub.gameservice.games.tictactoe.domain.rule.NoLegalMoveAvailableException 棋盘已满
     */
    Move requestAiMove(String gameId, int cellsRemaining);

    /**
     * 一站式人类回合：
     *   - 落人类的子；
     *   - 对局未结束且轮到 AI，则 AI 应手并落子；
     *   - 返回最新结果。
     */
    Outcome playAndRespond(String gameId, int row, int col);

    /** 给当前行棋方的提示（不落子）。 */
    Move suggest(String gameId);

    /** 重开：清空棋盘，X 重新先手。 */
    void reset(String gameId);

    /** 对局的实时状态。 */
    TicTacToeState getState(String gameId);

    /** 只读快照，供渲染使用。 */
    GameSnapshot snapshot(String gameId);

    /** 关闭并移除对局。 */
    void closeGame(String gameId);
}
