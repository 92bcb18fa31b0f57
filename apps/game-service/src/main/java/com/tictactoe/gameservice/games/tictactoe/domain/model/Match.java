package com.tictactoe.gameservice.games.tictactoe.domain.model;

import com.tictactoe.gameservice.games.tictactoe.domain.ai.TicTacToeAI;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.Outcome;
import lombok.Data;

/**
 *  人机对局实体：一名玩家对 AI，房间内可连续多盘，累计比分。
 */
@Data
public class Match {

    // ---- 基本信息 ----
    private final String id;
    private final Cell humanCell;  // 玩家执子
    private final Cell aiCell;     // AI 执子
    private final TicTacToeAI ai;

    // ---- 对局串（多盘）----
    private final Series series = new Series();

    public Match(String id, Cell humanCell, TicTacToeAI ai, String roundId) {
        this.id = id;
        this.humanCell = humanCell;
        this.aiCell = humanCell.opponent();
        this.ai = ai;
        // 构造即开第一盘
        startRound(roundId);
    }

    /** 开新一盘并推进局号 */
    public Round startRound(String roundId) {
        int idx = series.getNextIndex();
        Round r = new Round(idx, roundId);
        series.setCurrent(r);
        series.setNextIndex(idx + 1);
        return r;
    }

    public Round current() {
        return series.getCurrent();
    }

    /** 只读比分视图 */
    public SeriesView seriesView() {
        Round r = series.getCurrent();
        Outcome o = r.outcome();
        return new SeriesView(
                r.getIndex(), r.getRoundId(),
                series.getXWins(), series.getOWins(), series.getDraws(),
                countWins(humanCell), countWins(aiCell),
                o.isTerminal(), o.winner().orElse(null));
    }

    private int countWins(Cell cell) {
        return cell == Cell.X ? series.getXWins() : series.getOWins();
    }

    // ---- 对局内比分 ----
    @Data
    public static class Series {
        // 当前盘
        private Round current;
        // X 胜局数
        private int xWins;
        // O 胜局数
        private int oWins;
        // 平局局数
        private int draws;
        // 自增局号
        private int nextIndex = 1;

        /** 按结果计分；进行中不计 */
        public void record(Outcome outcome) {
            switch (outcome) {
                case X_WIN: xWins++; break;
                case O_WIN: oWins++; break;
                case DRAW: draws++; break;
                default: break;
            }
        }
    }
}
