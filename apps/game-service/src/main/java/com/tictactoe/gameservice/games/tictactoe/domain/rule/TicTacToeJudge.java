package com.tictactoe.gameservice.games.tictactoe.domain.rule;

import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.GameAlreadyOverException;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.InvalidMoveException;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Cell;

import java.util.List;
import java.util.Optional;

/**
 * 核心规则判断
 * 井字棋规则判定：合法性、轮到谁、胜负、和棋，以及唯一的落子入口 applyMove。
 * 全部是纯函数，结果只取决于棋盘内容，不做任何缓存。
 */
public final class TicTacToeJudge {

    /** 8 条胜利线：3 行、3 列、2 条对角线 */
    static final int[][] LINES = {
            {0, 1, 2}, {3, 4, 5}, {6, 7, 8},  // 行
            {0, 3, 6}, {1, 4, 7}, {2, 5, 8},  // 列
            {0, 4, 8}, {2, 4, 6}              // 对角线
    };

    private TicTacToeJudge() {
    }

    /**
     * 落子：校验通过后返回新棋盘，原棋盘不变。
     *
     * @throws GameAlreadyOverException 棋盘已终局
     * @throws InvalidMoveException     越界 / 已占 / 空棋子 / 未轮到该方
     */
    public static Board applyMove(Board b, int index, Cell mark) {
        Outcome outcome = evaluate(b);
        if (outcome.isTerminal()) {
            throw new GameAlreadyOverException(outcome);
        }
        if (!Board.inBounds(index)) {
            throw new InvalidMoveException(index, mark, GameMessages.INDEX_OUT_OF_RANGE);
        }
        if (mark == null || !mark.isMark()) {
            throw new InvalidMoveException(index, mark, GameMessages.EMPTY_MARK);
        }
        if (!b.isEmpty(index)) {
            throw new InvalidMoveException(index, mark, GameMessages.CELL_OCCUPIED);
        }
        Cell turn = turnOf(b);
        if (mark != turn) {
            throw new InvalidMoveException(index, mark, GameMessages.formatNotYourTurn(turn));
        }
        return b.place(index, mark);
    }

    /**
     * 局面结果：任意一条线三子相同且非空 -> 该方胜；否则满盘 -> 和棋；否则进行中。
     * 多条线同时成立只可能出现在非法棋盘上，按 LINES 顺序取第一条。
     */
    public static Outcome evaluate(Board b) {
        return winningLine(b)
                .map(line -> Outcome.winOf(b.get(line[0])))
                .orElseGet(() -> isFull(b) ? Outcome.DRAW : Outcome.ONGOING);
    }

    /** 连成的那条线（供前端高亮）；没有则为空 */
    public static Optional<int[]> winningLine(Board b) {
        for (int[] line : LINES) {
            Cell first = b.get(line[0]);
            if (first.isMark() && first == b.get(line[1]) && first == b.get(line[2])) {
                return Optional.of(line.clone());
            }
        }
        return Optional.empty();
    }

    /** 所有空位，升序 */
    public static List<Integer> emptyIndices(Board b) {
        return b.emptyIndices();
    }

    /** 轮到谁：子数少的一方走，相等时 X 先 */
    public static Cell turnOf(Board b) {
        return b.count(Cell.X) <= b.count(Cell.O) ? Cell.X : Cell.O;
    }

    /** 该落点是否“棋盘内为空” */
    public static boolean isLegal(Board b, int index) {
        return Board.inBounds(index) && b.isEmpty(index);
    }

    /** 棋盘是否已满（用于和棋判断） */
    public static boolean isFull(Board b) {
        return b.count(Cell.EMPTY) == 0;
    }

    /**
     * 棋盘是否可能由合法交替落子得到：
     * X 比 O 多 0 或 1 个，且不会双方同时连成线。
     */
    public static boolean isWellFormed(Board b) {
        int diff = b.count(Cell.X) - b.count(Cell.O);
        if (diff != 0 && diff != 1) return false;
        return !(hasLine(b, Cell.X) && hasLine(b, Cell.O));
    }

    // ----------- private helpers -----------

    private static boolean hasLine(Board b, Cell mark) {
        for (int[] line : LINES) {
            if (b.get(line[0]) == mark && b.get(line[1]) == mark && b.get(line[2]) == mark) return true;
        }
        return false;
    }
}
