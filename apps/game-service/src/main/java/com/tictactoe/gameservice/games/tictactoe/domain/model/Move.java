package com.tictactoe.gameservice.games.tictactoe.domain.model;

/**
 * 一步棋：在 index（0..8，行优先）落下 cell（X 或 O）。
 */
public record Move(int index, Cell cell) {

    public int row() { return index / Board.SIDE; }

    public int col() { return index % Board.SIDE; }
}
