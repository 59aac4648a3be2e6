package com.tictactoehub.gameservice.games.tictactoe.domain.ai;

/**
 * 搜索深度表：{@code maxDepth = baseDepth + floor(filled / total * depthGrowth)}。
 * 开局浅搜 + 启发式兜底，残局接近穷举。
 */
public record SearchSettings(int baseDepth, int depthGrowth) {

    /** 默认 base=2, growth=2 */
    public static final SearchSettings DEFAULT = new SearchSettings(2, 2);

    public SearchSettings {
        if (baseDepth < 1) {
            throw new IllegalArgumentException("baseDepth must be >= 1, got " + baseDepth);
        }
        if (depthGrowth < 0) {
            throw new IllegalArgumentException("depthGrowth must be >= 0, got " + depthGrowth);
        }
    }

    /** 足够深、可把任何局面搜到终局的深度表 */
    public static SearchSettings exhaustive(int boardSize) {
        return new SearchSettings(boardSize * boardSize, 0);
    }

    /**
     * 本次搜索的最大深度。
     *
     * @param remainingEmptyCells AI 落子前的空格数
     * @param totalCells          棋盘总格数
     * @throws IllegalArgumentException remainingEmptyCells 不在 [0, totalCells] 内
     */
    public int maxDepth(int remainingEmptyCells, int totalCells) {
        if (remainingEmptyCells < 0 || remainingEmptyCells > totalCells) {
            throw new IllegalArgumentException(
                    "remaining cells " + remainingEmptyCells + " outside [0, " + totalCells + "]");
        }
        int filled = totalCells - remainingEmptyCells;
        return baseDepth + (filled * depthGrowth) / totalCells;
    }
}
