package com.tictactoe.gameservice.games.tictactoe.domain.ai;

import com.tictactoe.gameservice.engine.core.AiAdvisor;
import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.PreconditionViolatedException;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Cell;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.Outcome;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TicTacToeAI：完整深度的极小化极大搜索（minimax），不剪枝、不缓存。
 * 1) 终局打分：搜索方胜 +1，对方胜 -1，和棋 0
 * 2) 非终局：由棋盘推导轮到谁，轮到搜索方取子节点最大值，轮到对方取最小值
 * 3) 根节点取分数最高的落点，同分取下标最小者（保证可复现）
 * <p>
 * 3x3 的博弈树最多 9! 条路径，穷举开销在毫秒级以内。
 * 无实例状态，可被多个对局共享。
 */
@Slf4j
public class TicTacToeAI implements AiAdvisor<Board, Move> {

    /** 计算 mark 在 board 上的最佳落点（mark 不必是当前执子方，比如替对手找必堵的点） */
    public int bestMove(Board board, Cell mark) {
        Map<Integer, Integer> scores = scoreMoves(board, mark);
        int best = -1;
        int bestScore = Integer.MIN_VALUE;
        // scores 按下标升序，严格大于才替换 -> 同分取最小下标
        for (Map.Entry<Integer, Integer> e : scores.entrySet()) {
            if (e.getValue() > bestScore) {
                bestScore = e.getValue();
                best = e.getKey();
            }
        }
        log.debug("minimax 选点: mark={}, board={}, index={}, score={}", mark, board, best, bestScore);
        return best;
    }

    /**
     * 每个合法落点的 minimax 分数（从 mark 视角），按下标升序。
     * 用于提示/调试展示，bestMove 也基于它选点。
     */
    public Map<Integer, Integer> scoreMoves(Board board, Cell mark) {
        checkSearchable(board, mark);
        NodeCounter counter = new NodeCounter();
        Map<Integer, Integer> scores = new LinkedHashMap<>();
        for (int idx : board.emptyIndices()) {
            scores.put(idx, score(board.place(idx, mark), mark, counter));
        }
        log.debug("minimax 完成: mark={}, board={}, nodes={}", mark, board, counter.nodes);
        return Collections.unmodifiableMap(scores);
    }

    /** 为当前执子方给出建议落子 */
    @Override
    public Move suggest(Board board) {
        Cell turn = TicTacToeJudge.turnOf(board);
        return new Move(bestMove(board, turn), turn);
    }

    /** 递归打分；执子方由棋盘推导，不单独传 maximizing 标志 */
    private int score(Board b, Cell maximizing, NodeCounter counter) {
        counter.nodes++;
        Outcome outcome = TicTacToeJudge.evaluate(b);
        if (outcome.isTerminal()) {
            return outcome.winner()
                    .map(w -> w == maximizing ? 1 : -1)
                    .orElse(0);
        }
        Cell turn = TicTacToeJudge.turnOf(b);
        boolean maximize = turn == maximizing;
        int best = maximize ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        for (int idx : b.emptyIndices()) {
            int s = score(b.place(idx, turn), maximizing, counter);
            best = maximize ? Math.max(best, s) : Math.min(best, s);
        }
        return best;
    }

    /**
     * 搜索前置条件：棋盘合法、未终局、mark 为 X 或 O。
     * 不要求 mark 是当前执子方：根节点替 mark 在每个空位试落，之后由子数推导轮次。
     */
    private void checkSearchable(Board board, Cell mark) {
        if (board == null) {
            throw new PreconditionViolatedException(String.format(GameMessages.MALFORMED_BOARD, "null"));
        }
        if (!TicTacToeJudge.isWellFormed(board)) {
            throw new PreconditionViolatedException(String.format(GameMessages.MALFORMED_BOARD, board));
        }
        Outcome outcome = TicTacToeJudge.evaluate(board);
        if (outcome.isTerminal()) {
            throw new PreconditionViolatedException(String.format(GameMessages.SEARCH_ON_TERMINAL, outcome));
        }
        if (mark == null || !mark.isMark()) {
            throw new PreconditionViolatedException(GameMessages.SEARCH_EMPTY_MARK);
        }
    }

    private static final class NodeCounter {
        private long nodes;
    }
}
