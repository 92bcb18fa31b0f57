package com.tictactoe.gameservice.games.tictactoe.domain.rule;

import com.tictactoe.gameservice.games.tictactoe.domain.exception.GameAlreadyOverException;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.InvalidMoveException;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Cell;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TicTacToeJudgeTest {

    // ── evaluate ────────────────────────────────────────────────────────────

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "XXXOO....,X_WIN",
            "OX.OX.O.X,O_WIN",
            "X..OX.O.X,X_WIN",
            "OOX.X.X..,X_WIN",
            "XO.XO.X..,X_WIN",
            ".........,ONGOING",
            "XX.OO....,ONGOING",
            "XOXXOOOXX,DRAW"
    })
    void evaluateDetectsLinesAndDraws(String board, Outcome expected) {
        assertThat(TicTacToeJudge.evaluate(Board.parse(board))).isEqualTo(expected);
    }

    @Test
    void winOnTheLastCellIsAWinNotADraw() {
        // 满盘但 X 在对角线连成
        Board b = Board.parse("XOXOXOOXX");
        assertThat(TicTacToeJudge.evaluate(b)).isEqualTo(Outcome.X_WIN);
    }

    @Test
    void winningLineIsReported() {
        assertThat(TicTacToeJudge.winningLine(Board.parse("X..OX.O.X"))).hasValueSatisfying(
                line -> assertThat(line).containsExactly(0, 4, 8));
        assertThat(TicTacToeJudge.winningLine(Board.parse("XX.OO...."))).isEmpty();
    }

    @Test
    void queriesAreIdempotent() {
        Board b = Board.parse("XO.X.O...");
        assertThat(TicTacToeJudge.evaluate(b)).isEqualTo(TicTacToeJudge.evaluate(b));
        assertThat(TicTacToeJudge.emptyIndices(b)).isEqualTo(TicTacToeJudge.emptyIndices(b));
    }

    // ── turn ────────────────────────────────────────────────────────────────

    @Test
    void turnIsDerivedFromPieceCounts() {
        assertThat(TicTacToeJudge.turnOf(Board.empty())).isEqualTo(Cell.X);
        assertThat(TicTacToeJudge.turnOf(Board.parse("X........"))).isEqualTo(Cell.O);
        assertThat(TicTacToeJudge.turnOf(Board.parse("XO......."))).isEqualTo(Cell.X);
    }

    @Test
    void sideWithFewerMarksMovesNext() {
        // O 多于 X 的局面（比如替 O 试落之后）轮到 X
        assertThat(TicTacToeJudge.turnOf(Board.parse("O........"))).isEqualTo(Cell.X);
        assertThat(TicTacToeJudge.turnOf(Board.parse("XOXOXOO.."))).isEqualTo(Cell.X);

        assertThatThrownBy(() -> TicTacToeJudge.applyMove(Board.parse("O........"), 4, Cell.O))
                .isInstanceOf(InvalidMoveException.class);
        assertThat(TicTacToeJudge.applyMove(Board.parse("O........"), 4, Cell.X))
                .isEqualTo(Board.parse("O...X...."));
    }

    @Test
    void legalityChecksRangeAndOccupancy() {
        Board b = Board.parse("X........");
        assertThat(TicTacToeJudge.isLegal(b, 0)).isFalse();
        assertThat(TicTacToeJudge.isLegal(b, 1)).isTrue();
        assertThat(TicTacToeJudge.isLegal(b, 9)).isFalse();
        assertThat(TicTacToeJudge.isFull(b)).isFalse();
        assertThat(TicTacToeJudge.isFull(Board.parse("XOXXOOOXX"))).isTrue();
    }

    // ── applyMove ───────────────────────────────────────────────────────────

    @Test
    void applyMovePlacesMarkOnNewBoard() {
        Board before = Board.parse("X........");
        Board after = TicTacToeJudge.applyMove(before, 4, Cell.O);

        assertThat(after).isEqualTo(Board.parse("X...O...."));
        assertThat(before).isEqualTo(Board.parse("X........"));
    }

    @Test
    void applyMoveIsDeterministic() {
        Board b = Board.parse("XO.......");
        assertThat(TicTacToeJudge.applyMove(b, 4, Cell.X)).isEqualTo(TicTacToeJudge.applyMove(b, 4, Cell.X));
    }

    @Test
    void occupiedCellIsRejectedAndBoardUnchanged() {
        Board b = Board.parse("X........");
        assertThatThrownBy(() -> TicTacToeJudge.applyMove(b, 0, Cell.O))
                .isInstanceOf(InvalidMoveException.class)
                .hasMessageContaining("INVALID_MOVE");
        assertThat(b).isEqualTo(Board.parse("X........"));
    }

    @ParameterizedTest
    @CsvSource({"-1", "9", "42"})
    void outOfRangeIndexIsRejected(int index) {
        assertThatThrownBy(() -> TicTacToeJudge.applyMove(Board.empty(), index, Cell.X))
                .isInstanceOf(InvalidMoveException.class);
    }

    @Test
    void wrongSideIsRejected() {
        assertThatThrownBy(() -> TicTacToeJudge.applyMove(Board.empty(), 4, Cell.O))
                .isInstanceOf(InvalidMoveException.class)
                .satisfies(e -> assertThat(((InvalidMoveException) e).getIndex()).isEqualTo(4));
        assertThatThrownBy(() -> TicTacToeJudge.applyMove(Board.parse("X........"), 4, Cell.X))
                .isInstanceOf(InvalidMoveException.class);
    }

    @Test
    void emptyMarkIsRejected() {
        assertThatThrownBy(() -> TicTacToeJudge.applyMove(Board.empty(), 4, Cell.EMPTY))
                .isInstanceOf(InvalidMoveException.class);
    }

    @Test
    void fullDrawnBoardRejectsFurtherMoves() {
        Board draw = Board.parse("XOXXOOOXX");
        assertThat(TicTacToeJudge.evaluate(draw)).isEqualTo(Outcome.DRAW);
        assertThatThrownBy(() -> TicTacToeJudge.applyMove(draw, 0, Cell.O))
                .isInstanceOf(GameAlreadyOverException.class)
                .satisfies(e -> assertThat(((GameAlreadyOverException) e).getOutcome()).isEqualTo(Outcome.DRAW));
    }

    @Test
    void wonBoardRejectsMovesOnEmptyCells() {
        Board won = Board.parse("XXXOO....");
        assertThatThrownBy(() -> TicTacToeJudge.applyMove(won, 5, Cell.O))
                .isInstanceOf(GameAlreadyOverException.class);
    }

    // ── reachable boards ────────────────────────────────────────────────────

    @Test
    void everyReachableBoardIsWellFormedWithAtMostOneWinner() {
        Set<Board> seen = new HashSet<>();
        walk(Board.empty(), seen);

        // 3x3 井字棋合法局面总数（含空盘）
        assertThat(seen).hasSize(5478);
        for (Board b : seen) {
            assertThat(TicTacToeJudge.isWellFormed(b)).as(b.render()).isTrue();
        }
    }

    @Test
    void malformedBoardsAreDetected() {
        assertThat(TicTacToeJudge.isWellFormed(Board.parse("OO......."))).isFalse();
        assertThat(TicTacToeJudge.isWellFormed(Board.parse("XXX......"))).isFalse();
        assertThat(TicTacToeJudge.isWellFormed(Board.parse("XXXOOO..."))).isFalse();
    }

    private static void walk(Board b, Set<Board> seen) {
        if (!seen.add(b)) return;
        if (TicTacToeJudge.evaluate(b).isTerminal()) return;
        Cell turn = TicTacToeJudge.turnOf(b);
        for (int idx : b.emptyIndices()) {
            walk(TicTacToeJudge.applyMove(b, idx, turn), seen);
        }
    }
}
