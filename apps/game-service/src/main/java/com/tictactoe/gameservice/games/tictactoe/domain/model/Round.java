package com.tictactoe.gameservice.games.tictactoe.domain.model;

import com.tictactoe.gameservice.games.tictactoe.domain.rule.Outcome;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;
import lombok.Data;

import java.util.concurrent.ScheduledFuture;

/**
 * 一盘棋实体：从空棋盘开始，交替落子直到终局。
 * 不提供 reset，开新盘即新建 Round。
 * 轮到谁、胜负均由棋盘推导，不单独存字段。
 */
@Data
public class Round {
    private final String roundId;   // UUID
    private final int index;        // 第几盘，从 1 开始
    private volatile Board board = Board.empty();
    private volatile ScheduledFuture<?> pendingAi; // 本盘的 AI 定时任务（方便取消）
    private boolean tallied;        // 结果是否已计入比分

    public Round(int index, String roundId) {
        this.index = index;
        this.roundId = roundId;
    }

    /** 校验并落子；失败时棋盘保持不变 */
    public Board apply(int cellIndex, Cell mark) {
        Board next = TicTacToeJudge.applyMove(board, cellIndex, mark);
        this.board = next;
        return next;
    }

    public Outcome outcome() {
        return TicTacToeJudge.evaluate(board);
    }

    /** 当前执子方；终局返回 null */
    public Cell sideToMove() {
        return outcome().isTerminal() ? null : TicTacToeJudge.turnOf(board);
    }

    public boolean over() {
        return outcome().isTerminal();
    }

    /** 是否有尚未执行的 AI 任务 */
    public boolean aiPending() {
        ScheduledFuture<?> f = pendingAi;
        return f != null && !f.isDone();
    }
}
