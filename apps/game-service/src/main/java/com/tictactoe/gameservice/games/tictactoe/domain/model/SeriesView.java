package com.tictactoe.gameservice.games.tictactoe.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对局比分（Series）概要信息视图：
 * 用于前端显示比分、第几盘、当前局 ID。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeriesView {
    /** 当前第几盘（从 1 开始） */
    private int index;

    /** 当前局唯一ID（roundId） */
    private String roundId;

    /** X 方胜场 */
    private int xWins;

    /** O 方胜场 */
    private int oWins;

    /** 平局数 */
    private int draws;

    /** 玩家胜场 */
    private int humanWins;

    /** AI 胜场 */
    private int aiWins;

    /** 当前局是否结束 */
    private boolean over;

    /** 当前局胜者（可能为空） */
    private Cell winner;

}
