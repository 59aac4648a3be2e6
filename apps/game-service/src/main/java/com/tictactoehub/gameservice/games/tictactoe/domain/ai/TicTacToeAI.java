package com.tictactoehub.gameservice.games.tictactoe.domain.ai;

import com.tictactoehub.gameservice.engine.core.AiAdvisor;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.WinningLines;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.NoLegalMoveAvailableException;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * TicTacToeAI：
 * 1) 每个空格都是根候选，按行优先顺序扫描
 * 2) 每个候选用 minimax + α-β剪枝打分，深度随对局进度加深
 * 3) 到达深度上限且胜负未分时，用 {@link Evaluator} 评估
 * 4) 取最高分；同分保留最先扫到的格子
 *
 * 搜索直接在传入的棋盘上落子 / 撤子，每次落子都在 finally 中撤销，
 * 因此 {@link #bestMove} 返回或抛异常后棋盘不变。
 * 提供线程池时，根候选在各自的棋盘副本上并行打分，再按扫描顺序归并，结果与串行一致。
 */
@Slf4j
public class TicTacToeAI implements AiAdvisor<TicTacToeState, Move> {

    /** 根着法后立即获胜的分值；每多一层少 1 分 */
    static final int WIN_SCORE = 10;

    @Getter
    private final SearchSettings settings;
    private final ExecutorService executor; // null = 串行

    /** 默认深度表、串行搜索 */
    public TicTacToeAI() {
        this(SearchSettings.DEFAULT);
    }

    public TicTacToeAI(SearchSettings settings) {
        this(settings, null);
    }

    public TicTacToeAI(SearchSettings settings, ExecutorService executor) {
        this.settings = settings;
        this.executor = executor;
    }

    /** 为当前行棋方给出一步；在棋盘副本上搜索，不改动状态。 */
    @Override
    public Move suggest(TicTacToeState state) {
        return bestMove(state.board().copy(), state.winningLines(), state.currentMark(), state.cellsLeft());
    }

    /**
     * 计算对 {@code me} 的最佳一步。
     *
     * @param remainingEmptyCells 本步之前的空格数，决定搜索深度
     * @throws NoLegalMoveAvailableException 棋盘没有空格
     */
    public Move bestMove(Board board, WinningLines lines, Mark me, int remainingEmptyCells) {
        if (lines.boardSize() != board.getSize()) {
            throw new IllegalArgumentException("winning lines for size " + lines.boardSize()
                    + " do not match board size " + board.getSize());
        }
        List<int[]> cands = candidates(board);
        if (cands.isEmpty()) throw new NoLegalMoveAvailableException(board.toString());

        int maxDepth = settings.maxDepth(remainingEmptyCells, board.totalCells());
        int[] scores = new int[cands.size()];
        long nodes = (executor == null)
                ? scoreSequential(board, lines, me, maxDepth, cands, scores)
                : scoreParallel(board, lines, me, maxDepth, cands, scores);

        int bestIdx = 0;
        for (int i = 1; i < scores.length; i++) {
            if (scores[i] > scores[bestIdx]) bestIdx = i;
        }
        int[] p = cands.get(bestIdx);
        Move best = new Move(p[0], p[1], me);
        log.debug("AI 落子 {} -> ({},{}) score={} maxDepth={} candidates={} nodes={}",
                me, p[0], p[1], scores[bestIdx], maxDepth, cands.size(), nodes);
        return best;
    }

    private long scoreSequential(Board board, WinningLines lines, Mark me, int maxDepth,
                                 List<int[]> cands, int[] scores) {
        Search search = new Search(board, lines, me, maxDepth);
        for (int i = 0; i < cands.size(); i++) {
            scores[i] = search.scoreRoot(cands.get(i)[0], cands.get(i)[1]);
        }
        return search.nodes;
    }

    private long scoreParallel(Board board, WinningLines lines, Mark me, int maxDepth,
                               List<int[]> cands, int[] scores) {
        List<Search> searches = new ArrayList<>(cands.size());
        List<Future<Integer>> futures = new ArrayList<>(cands.size());
        for (int[] p : cands) {
            Search s = new Search(board.copy(), lines, me, maxDepth);
            searches.add(s);
            futures.add(executor.submit(() -> s.scoreRoot(p[0], p[1])));
        }
        long nodes = 0;
        try {
            for (int i = 0; i < futures.size(); i++) {
                scores[i] = futures.get(i).get();
                nodes += searches.get(i).nodes;
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("AI search interrupted", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("AI search failed", cause);
        }
        return nodes;
    }

    /** 行优先顺序的全部空格 */
    private static List<int[]> candidates(Board b) {
        List<int[]> list = new ArrayList<>();
        for (int r = 0; r < b.getSize(); r++) {
            for (int c = 0; c < b.getSize(); c++) {
                if (b.get(r, c) == Mark.EMPTY) list.add(new int[]{r, c});
            }
        }
        return list;
    }

    /**
     * 一次搜索，绑定一块棋盘。非线程安全；并行时每个副本一个实例。
     */
    private static final class Search {
        private final Board board;
        private final WinningLines lines;
        private final Mark me;
        private final Mark opp;
        private final int maxDepth;
        private long nodes;

        Search(Board board, WinningLines lines, Mark me, int maxDepth) {
            this.board = board;
            this.lines = lines;
            this.me = me;
            this.opp = me.opponent();
            this.maxDepth = maxDepth;
        }

        /** 根候选打分：落子、搜索、撤子 */
        int scoreRoot(int row, int col) {
            board.place(row, col, me);
            try {
                return minimax(false, Integer.MIN_VALUE, Integer.MAX_VALUE, 0);
            } finally {
                board.place(row, col, Mark.EMPTY);
            }
        }

        /**
         * Minimax + α-β剪枝（maximizing = 轮到 AI）。
         * 胜局记 {@code WIN_SCORE - depth}：赢得越快分越高，输得越慢分越高。
         */
        int minimax(boolean maximizing, int alpha, int beta, int depth) {
            nodes++;
            Mark winner = TicTacToeJudge.winner(board, lines);
            boolean full = board.isFull();
            if (depth == maxDepth || winner != Mark.EMPTY || full) {
                if (winner == me) return WIN_SCORE - depth;
                if (winner == opp) return -WIN_SCORE + depth;
                if (full) return 0;
                return Evaluator.score(board, lines, me);
            }

            Mark mover = maximizing ? me : opp;
            int best = maximizing ? Integer.MIN_VALUE : Integer.MAX_VALUE;
            int n = board.getSize();
            for (int r = 0; r < n; r++) {
                for (int c = 0; c < n; c++) {
                    if (board.get(r, c) != Mark.EMPTY) continue;
                    board.place(r, c, mover);
                    int score;
                    try {
                        score = minimax(!maximizing, alpha, beta, depth + 1);
                    } finally {
                        board.place(r, c, Mark.EMPTY);
                    }
                    if (maximizing) {
                        best = Math.max(best, score);
                        alpha = Math.max(alpha, best);
                    } else {
                        best = Math.min(best, score);
                        beta = Math.min(beta, best);
                    }
                    if (beta <= alpha) return best; // 剪掉剩余兄弟节点
                }
            }
            return best;
        }
    }
}
