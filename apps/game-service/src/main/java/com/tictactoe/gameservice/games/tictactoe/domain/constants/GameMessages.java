package com.tictactoe.gameservice.games.tictactoe.domain.constants;

/**
 * 井字棋相关的消息常量
 * 统一管理异常与提示消息，避免硬编码
 *
 * 使用示例：
 *   throw new InvalidMoveException(index, cell, GameMessages.CELL_OCCUPIED);
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 落子校验 ==========

    /** 下标越界 */
    public static final String INDEX_OUT_OF_RANGE = "落子位置越界（应为 0..8）";

    /** 该格已有棋子 */
    public static final String CELL_OCCUPIED = "该格已有棋子";

    /** 棋子不能为空格 */
    public static final String EMPTY_MARK = "落子方不能是空格";

    /** 未轮到该方走棋 */
    public static final String NOT_YOUR_TURN = "未轮到该方走棋（当前应为 %s）";

    /**
     * 格式化未轮到该方走棋消息
     */
    public static String formatNotYourTurn(Object currentSide) {
        return String.format(NOT_YOUR_TURN, currentSide);
    }

    // ========== 对局状态 ==========

    /** 对局已结束 */
    public static final String GAME_ALREADY_OVER = "对局已结束（%s），不能继续落子";

    public static String formatGameAlreadyOver(Object outcome) {
        return String.format(GAME_ALREADY_OVER, outcome);
    }

    /** AI 正在思考，暂不接受玩家落子 */
    public static final String AI_THINKING = "AI 正在思考，请稍候";

    /** 对局不存在 */
    public static final String MATCH_NOT_FOUND = "MATCH_NOT_FOUND";

    // ========== 搜索前置条件 ==========

    /** 终局不能搜索 */
    public static final String SEARCH_ON_TERMINAL = "终局（%s）不能再搜索最佳落子";

    /** 棋盘子数或胜负不合法 */
    public static final String MALFORMED_BOARD = "棋盘不合法: %s";

    /** 搜索方必须是 X 或 O */
    public static final String SEARCH_EMPTY_MARK = "搜索方必须是 X 或 O";
}
