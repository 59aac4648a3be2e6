package com.tictactoehub.gameservice.games.tictactoe.domain.model;

import com.tictactoehub.gameservice.engine.core.GameState;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.IllegalMoveException;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.IllegalMoveException.Reason;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.Outcome;
import com.tictactoehub.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 井字棋对局状态（唯一事实来源）：棋盘、胜利线、轮到谁、最后一步。
 * <ul>
 *   <li>{@link #apply(Move)}：校验越界 / 终局 / 轮次 / 占用，通过后落子；</li>
 *   <li>{@link #evaluateOutcome()}：每次都从棋盘重新计算结果，不做缓存，不修改状态；</li>
 *   <li>轮次是固定玩家列表上的下标，只由 {@link #toggleTurn()} 推进；</li>
 *   <li>{@link #reset()}：清空棋盘，轮次回到第一个玩家（X），胜利线保留。</li>
 * </ul>
 */
public class TicTacToeState implements GameState {

    /** 默认玩家：X 先手（蓝），O 后手（绿）。 */
    public static final List<Player> DEFAULT_PLAYERS = List.of(
            new Player(Mark.X, "blue"),
            new Player(Mark.O, "green"));

    /** 棋盘 */
    private final Board board;
    /** 胜利线（按尺寸生成一次，不可变） */
    private final WinningLines winningLines;
    /** 玩家顺序，下标 0 先手 */
    private final List<Player> players;

    /** 当前行棋方在 players 中的下标 */
    private int turnIndex;
    /** 最近一步（reset 后为 null） */
    private Move lastMove;

    /** 3x3、默认玩家的新局。 */
    public TicTacToeState() {
        this(Board.DEFAULT_SIZE, DEFAULT_PLAYERS);
    }

    /** 指定尺寸与玩家顺序的新局。 */
    public TicTacToeState(int boardSize, List<Player> players) {
        this(new Board(boardSize), WinningLines.of(boardSize), players);
    }

    private TicTacToeState(Board board, WinningLines winningLines, List<Player> players) {
        Objects.requireNonNull(players, "players");
        if (players.isEmpty()) {
            throw new IllegalArgumentException("at least one player is required");
        }
        Set<Mark> seen = EnumSet.noneOf(Mark.class);
        for (Player p : players) {
            if (!seen.add(p.mark())) {
                throw new IllegalArgumentException("duplicate player mark: " + p.mark());
            }
        }
        this.board = board;
        this.winningLines = winningLines;
        this.players = List.copyOf(players);
    }

    /**
     * 由局面构造状态（恢复对局 / 测试摆局）。
     * 各玩家的子数必须符合轮流落子的结果：先手方比后手方多 0 或 1 子；
     * 轮次落在按子数应当行棋的玩家上。
     *
     * @throws IllegalArgumentException 子数不可能由合法对局产生，或出现了不属于任何玩家的标记
     */
    public static TicTacToeState of(Board position, List<Player> players) {
        TicTacToeState s = new TicTacToeState(position.copy(), WinningLines.of(position.getSize()), players);
        int placed = position.totalCells() - position.emptyCount();
        int n = s.players.size();
        for (int i = 0; i < n; i++) {
            Mark m = s.players.get(i).mark();
            int expected = placed / n + (i < placed % n ? 1 : 0);
            if (position.count(m) != expected) {
                throw new IllegalArgumentException("unreachable position " + position + ": "
                        + m + " has " + position.count(m) + " marks, expected " + expected);
            }
        }
        s.turnIndex = placed % n;
        return s;
    }

    // --------- 读取 ----------
    /** 棋盘本体（可变，供搜索与渲染读取） */
    public Board board() { return board; }
    public WinningLines winningLines() { return winningLines; }
    public List<Player> players() { return players; }
    /** 当前行棋方 */
    public Player currentPlayer() { return players.get(turnIndex); }
    public Mark currentMark() { return currentPlayer().mark(); }
    /** 当前结果，等同于 {@link #evaluateOutcome()} */
    public Outcome outcome() { return evaluateOutcome(); }
    public Move lastMove() { return lastMove; }
    /** 剩余空格数 */
    public int cellsLeft() { return board.emptyCount(); }

    // --------- 规则 ----------
    /** 越界 / 已占 / 终局 / 非当前行棋方，任一成立即为非法。 */
    public boolean isLegal(Move m) {
        return m.mark() == currentMark()
                && TicTacToeJudge.isLegal(board, m.row(), m.col())
                && !evaluateOutcome().isTerminal();
    }

    /**
     * 落子。校验顺序：越界 → 终局 → 轮次 → 占用；任一失败则棋盘不变。
     * 落子后不切换轮次，由调用方在对局继续时调用 {@link #toggleTurn()}。
     *
     * @return 落下的标记
     * @throws IllegalMoveException 非法落子
     */
    public Mark apply(Move m) {
        if (!board.inBounds(m.row(), m.col())) throw new IllegalMoveException(Reason.OUT_OF_RANGE, m);
        if (evaluateOutcome().isTerminal()) throw new IllegalMoveException(Reason.GAME_OVER, m);
        if (m.mark() != currentMark()) throw new IllegalMoveException(Reason.NOT_YOUR_TURN, m);
        if (!board.isEmpty(m.row(), m.col())) throw new IllegalMoveException(Reason.OCCUPIED, m);

        board.place(m.row(), m.col(), m.mark());
        lastMove = m;
        return m.mark();
    }

    /** 按胜利线顺序扫描棋盘得出结果（纯函数）。 */
    public Outcome evaluateOutcome() {
        return TicTacToeJudge.outcome(board, winningLines);
    }

    /** 轮次循环推进到下一个玩家。 */
    public void toggleTurn() {
        turnIndex = (turnIndex + 1) % players.size();
    }

    /** 清空棋盘，轮次回到第一个玩家。 */
    public void reset() {
        board.clear();
        lastMove = null;
        turnIndex = 0;
    }

    /** 深拷贝：棋盘与轮次独立，胜利线不可变故共享。 */
    @Override
    public TicTacToeState copy() {
        TicTacToeState s = new TicTacToeState(board.copy(), winningLines, players);
        s.turnIndex = this.turnIndex;
        s.lastMove = this.lastMove;
        return s;
    }
}
