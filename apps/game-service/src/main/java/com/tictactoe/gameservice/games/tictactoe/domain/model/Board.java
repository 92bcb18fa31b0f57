package com.tictactoe.gameservice.games.tictactoe.domain.model;

import com.tictactoe.gameservice.engine.core.GameState;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 井字棋棋盘：3x3 网格，按行优先编号 0..8（第 r 行第 c 列 -> 3r+c）。
 * 约定：EMPTY='.', X='X', O='O'
 * <p>
 * 棋盘是不可变值对象：{@link #place(int, Cell)} 返回新棋盘，旧棋盘保持不变，
 * 因此 AI 模拟落子时不会污染实盘。
 * 轮到谁、胜负都不存字段，每次由 {@code TicTacToeJudge} 从格子内容推导。
 */
@EqualsAndHashCode
public final class Board implements GameState {
    /** 边长 */
    public static final int SIDE = 3;
    /** 格子总数 */
    public static final int CELLS = SIDE * SIDE;

    private static final Board EMPTY_BOARD = new Board(filled(Cell.EMPTY));

    private final Cell[] cells;

    private Board(Cell[] cells) {
        this.cells = cells;
    }

    /** 空棋盘（新一盘的起点） */
    public static Board empty() {
        return EMPTY_BOARD;
    }

    /**
     * 由 9 个字符解析棋盘，例如 {@code "XX.OO...."}；允许用 '/' 或空白分隔行。
     * 只做格式校验，不校验子数是否合法（由规则层判定）。
     */
    public static Board parse(String text) {
        if (text == null) throw new IllegalArgumentException("棋盘字符串不能为空");
        String compact = text.replace("/", "").replace("\n", "").replace("\r", "").replace(" ", "");
        if (compact.length() != CELLS) {
            throw new IllegalArgumentException("棋盘字符串必须是 " + CELLS + " 个格子: \"" + text + "\"");
        }
        Cell[] c = new Cell[CELLS];
        for (int i = 0; i < CELLS; i++) c[i] = Cell.of(compact.charAt(i));
        return new Board(c);
    }

    /** 下标是否在棋盘内 */
    public static boolean inBounds(int index) {
        return index >= 0 && index < CELLS;
    }

    /** 读取该格内容 */
    public Cell get(int index) { return cells[index]; }

    /** 该格是否为空（越界视为不可落子） */
    public boolean isEmpty(int index) {
        return inBounds(index) && cells[index] == Cell.EMPTY;
    }

    /**
     * 在 index 落子，返回新棋盘。
     * 不判断合法性（是否越界/是否已占/是否轮到），由规则层去做，职责单一。
     */
    public Board place(int index, Cell cell) {
        Cell[] next = cells.clone();
        next[index] = cell;
        return new Board(next);
    }

    /** 某种格子的数量 */
    public int count(Cell cell) {
        int n = 0;
        for (Cell c : cells) if (c == cell) n++;
        return n;
    }

    /** 所有空位下标，升序 */
    public List<Integer> emptyIndices() {
        List<Integer> list = new ArrayList<>(CELLS);
        for (int i = 0; i < CELLS; i++) if (cells[i] == Cell.EMPTY) list.add(i);
        return Collections.unmodifiableList(list);
    }

    /** 只读视图副本（用于快照/日志） */
    public char[] view() {
        char[] v = new char[CELLS];
        for (int i = 0; i < CELLS; i++) v[i] = cells[i].symbol();
        return v;
    }

    /** 三行文本，例如 "XX.\nOO.\n..." */
    public String render() {
        StringBuilder sb = new StringBuilder(CELLS + SIDE);
        for (int r = 0; r < SIDE; r++) {
            if (r > 0) sb.append('\n');
            for (int c = 0; c < SIDE; c++) sb.append(cells[r * SIDE + c].symbol());
        }
        return sb.toString();
    }

    @Override
    public Board copy() {
        return new Board(cells.clone());
    }

    /** 紧凑形式，可被 {@link #parse(String)} 读回 */
    @Override
    public String toString() {
        return new String(view());
    }

    private static Cell[] filled(Cell cell) {
        Cell[] c = new Cell[CELLS];
        Arrays.fill(c, cell);
        return c;
    }
}
