package com.tictactoe.gameservice.games.tictactoe.domain.exception;

import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.Outcome;
import lombok.Getter;

/**
 * 终局后仍尝试落子。
 */
@Getter
public class GameAlreadyOverException extends IllegalStateException {

    private final Outcome outcome;

    public GameAlreadyOverException(Outcome outcome) {
        super("GAME_ALREADY_OVER: " + GameMessages.formatGameAlreadyOver(outcome));
        this.outcome = outcome;
    }
}
