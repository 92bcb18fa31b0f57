package com.tictactoe.gameservice.games.tictactoe.domain.rule;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Cell;

import java.util.Optional;

/** 对局结果：进行中 / X 胜 / O 胜 / 和棋 */
public enum Outcome {
    /** 对局进行中（尚未分出胜负） */
    ONGOING,
    /** X 方胜利 */
    X_WIN,
    /** O 方胜利 */
    O_WIN,
    /** 平局 */
    DRAW;

    /**
     * 根据棋子判断胜方。
     *
     * @param cell 连成三子的一方，X 或 O
     * @return X 返回 {@link #X_WIN}，O 返回 {@link #O_WIN}
     */
    public static Outcome winOf(Cell cell) {
        switch (cell) {
            case X: return X_WIN;
            case O: return O_WIN;
            default: throw new IllegalArgumentException("空格子不能获胜");
        }
    }

    /** 是否终局（胜或和） */
    public boolean isTerminal() {
        return this != ONGOING;
    }

    /** 胜方；进行中或和棋为空 */
    public Optional<Cell> winner() {
        switch (this) {
            case X_WIN: return Optional.of(Cell.X);
            case O_WIN: return Optional.of(Cell.O);
            default: return Optional.empty();
        }
    }
}
