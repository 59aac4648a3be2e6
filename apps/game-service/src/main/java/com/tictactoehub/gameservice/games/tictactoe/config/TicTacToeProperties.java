package com.tictactoehub.gameservice.games.tictactoe.config;

import com.tictactoehub.gameservice.games.tictactoe.domain.ai.SearchSettings;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoehub.gameservice.games.tictactoe.domain.model.Player;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * 井字棋配置
 *
 * 建局时固定：棋盘尺寸、人类执子、玩家颜色、AI 深度表。
 * 从 application.yml 或环境变量绑定。
 */
@ConfigurationProperties(prefix = "tictactoe")
public class TicTacToeProperties {

    /**
     * 棋盘边长 N（N x N），默认 3
     */
    private int boardSize = 3;

    /**
     * 建局未指定时人类的执子；AI 执另一方
     */
    private Mark humanMark = Mark.X;

    /** 玩家颜色 */
    private final Colors colors = new Colors();

    /** AI 搜索参数 */
    private final Ai ai = new Ai();

    /** 文本控制台 */
    private final Console console = new Console();

    public int getBoardSize() {
        return boardSize;
    }

    public void setBoardSize(int boardSize) {
        this.boardSize = boardSize;
    }

    public Mark getHumanMark() {
        return humanMark;
    }

    public void setHumanMark(Mark humanMark) {
        this.humanMark = humanMark;
    }

    public Colors getColors() {
        return colors;
    }

    public Ai getAi() {
        return ai;
    }

    public Console getConsole() {
        return console;
    }

    /** 玩家顺序：X 先，O 后 */
    public List<Player> playerList() {
        return List.of(new Player(Mark.X, colors.getX()), new Player(Mark.O, colors.getO()));
    }

    /** 由配置构造深度表 */
    public SearchSettings searchSettings() {
        return new SearchSettings(ai.getBaseDepth(), ai.getDepthGrowth());
    }

    public static class Colors {

        /**
         * X 的显示颜色
         */
        private String x = "blue";

        /**
         * O 的显示颜色
         */
        private String o = "green";

        public String getX() {
            return x;
        }

        public void setX(String x) {
            this.x = x;
        }

        public String getO() {
            return o;
        }

        public void setO(String o) {
            this.o = o;
        }
    }

    public static class Ai {

        /**
         * 开局时的搜索深度
         */
        private int baseDepth = 2;

        /**
         * 按已落子比例追加的深度
         */
        private int depthGrowth = 2;

        /**
         * 是否在棋盘副本上并行给根候选打分
         */
        private boolean parallel = false;

        public int getBaseDepth() {
            return baseDepth;
        }

        public void setBaseDepth(int baseDepth) {
            this.baseDepth = baseDepth;
        }

        public int getDepthGrowth() {
            return depthGrowth;
        }

        public void setDepthGrowth(int depthGrowth) {
            this.depthGrowth = depthGrowth;
        }

        public boolean isParallel() {
            return parallel;
        }

        public void setParallel(boolean parallel) {
            this.parallel = parallel;
        }
    }

    public static class Console {

        /**
         * 启动时是否开启文本控制台
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
