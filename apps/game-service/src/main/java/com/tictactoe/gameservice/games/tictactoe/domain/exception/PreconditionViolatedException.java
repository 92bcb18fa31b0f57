package com.tictactoe.gameservice.games.tictactoe.domain.exception;

/**
 * 搜索前置条件不满足（终局、棋盘不合法、搜索方不是当前执子方）。
 * 属于编程错误，不返回兜底落子。
 */
public class PreconditionViolatedException extends IllegalStateException {

    public PreconditionViolatedException(String message) {
        super("PRECONDITION_VIOLATED: " + message);
    }
}
