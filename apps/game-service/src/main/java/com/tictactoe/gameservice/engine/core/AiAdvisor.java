package com.tictactoe.gameservice.engine.core;

/**
 * AI 建议器抽象：给定状态，返回一条建议的命令（例如井字棋的“建议落在 4 号格”）。
 * - 泛型 S、C 保持与具体游戏解耦；
 * - 井字棋状态空间很小，穷举即可，因此不需要时间预算参数。
 */
public interface AiAdvisor<S extends GameState, C> {

    C suggest(S state);
}
