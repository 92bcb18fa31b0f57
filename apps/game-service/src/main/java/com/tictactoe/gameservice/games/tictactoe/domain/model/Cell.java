package com.tictactoe.gameservice.games.tictactoe.domain.model;

/**
 * 格子内容：空 / X / O。
 * 约定：X 永远先手，双方严格交替。
 */
public enum Cell {
    /** 空位，渲染为 '.' */
    EMPTY('.'),
    /** 先手方，渲染为 'X' */
    X('X'),
    /** 后手方，渲染为 'O' */
    O('O');

    private final char symbol;

    Cell(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() { return symbol; }

    /** 是否是一方的棋子（非空） */
    public boolean isMark() { return this != EMPTY; }

    /**
     * 对手棋子。
     *
     * @throws IllegalArgumentException EMPTY 没有对手
     */
    public Cell opponent() {
        switch (this) {
            case X: return O;
            case O: return X;
            default: throw new IllegalArgumentException("EMPTY 没有对手");
        }
    }

    /** 由字符解析格子内容，大小写不敏感；'.'、'-'、' ' 均视为空位 */
    public static Cell of(char c) {
        switch (Character.toUpperCase(c)) {
            case 'X': return X;
            case 'O': return O;
            case '.':
            case '-':
            case ' ':
                return EMPTY;
            default: throw new IllegalArgumentException("无法识别的格子字符: '" + c + "'");
        }
    }
}
