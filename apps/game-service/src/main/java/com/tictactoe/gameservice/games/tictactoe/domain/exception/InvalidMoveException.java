package com.tictactoe.gameservice.games.tictactoe.domain.exception;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Cell;
import lombok.Getter;

/**
 * 非法落子：越界、已占、空棋子或未轮到该方。
 * 属于调用方参数错误，棋盘保持不变。
 */
@Getter
public class InvalidMoveException extends IllegalArgumentException {

    private final int index;
    private final Cell cell;

    public InvalidMoveException(int index, Cell cell, String reason) {
        super("INVALID_MOVE: " + reason + " (index=" + index + ", cell=" + cell + ")");
        this.index = index;
        this.cell = cell;
    }
}
