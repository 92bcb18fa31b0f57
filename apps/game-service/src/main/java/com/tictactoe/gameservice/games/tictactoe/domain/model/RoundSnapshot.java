package com.tictactoe.gameservice.games.tictactoe.domain.model;

import com.tictactoe.gameservice.games.tictactoe.domain.rule.Outcome;

/**
 * Read-only snapshot of the current round, handed to the presentation layer.
 */
public final class RoundSnapshot {

    public final String matchId;
    public final String roundId;
    public final int round;
    public final char[] cells;
    public final Cell humanCell;
    public final Cell aiCell;
    /** 当前执子方；终局为 null */
    public final Cell sideToMove;
    public final Outcome outcome;
    /** 胜方；未分胜负为 null */
    public final Cell winner;
    /** 连成的三个格子；无则为 null */
    public final int[] winningLine;
    public final boolean aiPending;
    public final SeriesView series;

    public RoundSnapshot(String matchId,
                         String roundId,
                         int round,
                         char[] cells,
                         Cell humanCell,
                         Cell aiCell,
                         Cell sideToMove,
                         Outcome outcome,
                         Cell winner,
                         int[] winningLine,
                         boolean aiPending,
                         SeriesView series) {
        this.matchId = matchId;
        this.roundId = roundId;
        this.round = round;
        this.cells = cells;
        this.humanCell = humanCell;
        this.aiCell = aiCell;
        this.sideToMove = sideToMove;
        this.outcome = outcome;
        this.winner = winner;
        this.winningLine = winningLine;
        this.aiPending = aiPending;
        this.series = series;
    }

    public Board board() {
        return Board.parse(new String(cells));
    }
}
