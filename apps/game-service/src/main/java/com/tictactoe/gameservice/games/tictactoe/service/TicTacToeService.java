package com.tictactoe.gameservice.games.tictactoe.service;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Cell;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoe.gameservice.games.tictactoe.domain.model.RoundSnapshot;
import com.tictactoe.gameservice.games.tictactoe.domain.model.SeriesView;

import java.util.Optional;
import java.util.concurrent.Future;

public interface TicTacToeService {
    /** 新开人机对局；humanCell 可 null（取配置默认值，X=先手）。AI 先手时立即安排 AI 落子 */
    String newMatch(Cell humanCell);

    /**
     * 玩家落子：
     *   - 校验轮到玩家且没有待执行的 AI 任务；
     *   - 终局则计分，否则按配置延迟安排 AI 落子；
     *   - 返回玩家这一步之后的快照（AI 那一步异步完成）。
     */
    RoundSnapshot play(String matchId, int index);

    /** 在同一对局开新一盘（取消未执行的 AI 任务，保留执子与比分） */
    RoundSnapshot newRound(String matchId);

    /** 只读获取当前盘快照 */
    RoundSnapshot snapshot(String matchId);

    /** 返回 X/O/和 以及玩家/AI 统计（一个只读视图） */
    SeriesView getSeries(String matchId);

    /** 给玩家一个提示（不自动下） */
    Move suggest(String matchId);

    /** 当前盘待执行的 AI 任务，供需要等待 AI 落子的调用方使用 */
    Optional<Future<?>> pendingAi(String matchId);

    /** 结束对局并释放资源 */
    void closeMatch(String matchId);
}
