package com.tictactoe.gameservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：便于 AI 搜索时假设落子而不污染实盘。
 * - 具体游戏（如井字棋 Board）实现此接口。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝快照。
     */
    GameState copy();
}
