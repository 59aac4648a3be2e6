package com.tictactoehub.gameservice.games.tictactoe.domain.model;

/**
 * 格子标记。约定：EMPTY='.', X='X'（先手）, O='O'
 */
public enum Mark {
    /** 空位 */
    EMPTY('.'),
    /** 先手方 */
    X('X'),
    /** 后手方 */
    O('O');

    private final char symbol;

    Mark(char symbol) {
        this.symbol = symbol;
    }

    /** 显示符号 */
    public char symbol() {
        return symbol;
    }

    /**
     * 对方标记；EMPTY 没有对方。
     */
    public Mark opponent() {
        switch (this) {
            case X: return O;
            case O: return X;
            default: throw new IllegalArgumentException("EMPTY has no opponent");
        }
    }

    /**
     * 解析显示符号；' ' 与 '.' 都视为 EMPTY。
     */
    public static Mark fromSymbol(char c) {
        char u = Character.toUpperCase(c);
        if (u == 'X') return X;
        if (u == 'O') return O;
        if (u == '.' || u == ' ') return EMPTY;
        throw new IllegalArgumentException("unknown mark symbol: " + c);
    }
}
