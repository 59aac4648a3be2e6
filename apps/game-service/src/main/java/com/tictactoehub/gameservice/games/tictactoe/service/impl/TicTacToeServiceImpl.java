package com.tictactoehub.gameservice.games.tictactoe.service.impl;

import com.tictactoehub.gameservice.games.tictactoe.config.TicTacToeProperties;
import com.tictactoehub.gameservice.games.tictactoe.domain.ai.TicTacToeAI;
import com.tictactoehub.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Game;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.IllegalMoveException;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.NoLegalMoveAvailableException;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.Outcome;
import com.tictactoehub.gameservice.games.tictactoe.service.TicTacToeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * 井字棋服务实现：内存中维护对局，串行化同一对局上的操作（synchronized(game)）。
 */
@Slf4j
@Service
public class TicTacToeServiceImpl implements TicTacToeService {

    // ====== 内存对局表 ======
    private final Map<String, Game> games = new ConcurrentHashMap<>();

    private final TicTacToeProperties props;
    private final ExecutorService aiSearchExecutor;

    public TicTacToeServiceImpl(TicTacToeProperties props,
                                @Qualifier("aiSearchExecutor") ExecutorService aiSearchExecutor) {
        this.props = props;
        this.aiSearchExecutor = aiSearchExecutor;
    }

    /**
     * 创建新对局
     */
    @Override
    public String newGame(Mark humanMark) {
        // 1) 缺省执子
        Mark human = (humanMark == null ? props.getHumanMark() : humanMark);
        if (human == Mark.EMPTY) {
            throw new IllegalArgumentException("human mark must be X or O");
        }

        // 2) 状态与 AI，整局固定
        TicTacToeState state = new TicTacToeState(props.getBoardSize(), props.playerList());
        TicTacToeAI ai = new TicTacToeAI(props.searchSettings(),
                props.getAi().isParallel() ? aiSearchExecutor : null);

        String gameId = UUID.randomUUID().toString();
        Game game = new Game(gameId, human, state, ai);
        games.put(gameId, game);
        log.info("新建对局: gameId={}, size={}, human={}, ai={}, settings={}",
                gameId, props.getBoardSize(), human, game.getAiMark(), ai.getSettings());

        // 3) AI 执 X 时先手落子
        synchronized (game) {
            if (game.aiToMove()) playAi(game);
        }
        return gameId;
    }

    /** 取对局，不存在则抛 GAME_NOT_FOUND */
    private Game game(String gameId) {
        Game g = games.get(gameId);
        if (g == null) throw new IllegalArgumentException(GameMessages.GAME_NOT_FOUND + ": " + gameId);
        return g;
    }

    @Override
    public Outcome attemptMove(String gameId, int row, int col, Mark mark) {
        Game g = game(gameId);
        synchronized (g) {
            TicTacToeState s = g.getState();
            Move m = new Move(row, col, mark);
            try {
                s.apply(m);
            } catch (IllegalMoveException e) {
                log.warn("落子被拒绝: gameId={}, reason={}, move={}", gameId, e.getReason(), m);
                throw e;
            }
            log.debug("落子成功: gameId={}, move={}, board={}", gameId, m, s.board());
            return afterMove(g);
        }
    }

    /** 终局则记录结果，否则交换轮次。 */
    private Outcome afterMove(Game g) {
        TicTacToeState s = g.getState();
        Outcome o = s.outcome();
        if (o.isTerminal()) {
            log.info("对局结束: gameId={}, outcome={}, line={}", g.getGameId(), o.type(), o.winningCells());
        } else {
            s.toggleTurn();
        }
        return o;
    }

    @Override
    public Move requestAiMove(String gameId, int cellsRemaining) {
        Game g = game(gameId);
        synchronized (g) {
            TicTacToeState s = g.getState();
            if (s.cellsLeft() == 0) {
                log.warn("满盘时请求 AI 落子: gameId={}", gameId);
                throw new NoLegalMoveAvailableException(s.board().toString());
            }
            if (!g.aiToMove()) {
                throw new IllegalStateException(GameMessages.NOT_AI_TURN + ": gameId=" + gameId
                        + ", outcome=" + s.outcome().type() + ", toMove=" + s.currentMark());
            }
            return g.getAi().bestMove(s.board(), s.winningLines(), g.getAiMark(), cellsRemaining);
        }
    }

    @Override
    public Outcome playAndRespond(String gameId, int row, int col) {
        Game g = game(gameId);
        synchronized (g) {
            Outcome o = attemptMove(gameId, row, col, g.getHumanMark());
            if (g.aiToMove()) o = playAi(g);
            return o;
        }
    }

    /** AI 计算并落子；调用方已持有对局锁。 */
    private Outcome playAi(Game g) {
        TicTacToeState s = g.getState();
        Move m = requestAiMove(g.getGameId(), s.cellsLeft());
        return attemptMove(g.getGameId(), m.row(), m.col(), m.mark());
    }

    @Override
    public Move suggest(String gameId) {
        Game g = game(gameId);
        synchronized (g) {
            return g.getAi().suggest(g.getState());
        }
    }

    @Override
    public void reset(String gameId) {
        Game g = game(gameId);
        synchronized (g) {
            g.getState().reset();
            log.info("对局重开: gameId={}", gameId);
            if (g.aiToMove()) playAi(g);
        }
    }

    @Override
    public TicTacToeState getState(String gameId) {
        return game(gameId).getState();
    }

    @Override
    public GameSnapshot snapshot(String gameId) {
        Game g = game(gameId);
        synchronized (g) {
            TicTacToeState s = g.getState();
            Outcome o = s.outcome();
            boolean over = o.isTerminal();
            return new GameSnapshot(
                    g.getGameId(),
                    s.board().getSize(),
                    s.board().view(),
                    over ? null : s.currentMark().symbol(),
                    over ? null : s.currentPlayer().color(),
                    g.getHumanMark().symbol(),
                    g.getAiMark().symbol(),
                    o.type().name(),
                    o.isWin() ? o.winner().symbol() : null,
                    o.winningCells(),
                    s.cellsLeft());
        }
    }

    @Override
    public void closeGame(String gameId) {
        if (games.remove(gameId) != null) log.info("对局关闭: gameId={}", gameId);
    }
}
