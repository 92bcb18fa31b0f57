package com.tictactoe.gameservice.platform.config;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Cell;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 井字棋人机对局相关配置。
 *
 * 支持通过 application.yml 或环境变量覆盖。
 */
@Component
@ConfigurationProperties(prefix = "tictactoe")
public class TicTacToeProperties {

    /**
     * 新对局默认的玩家执子（X 先手）
     */
    private Cell humanCell = Cell.X;

    private final Ai ai = new Ai();

    public Cell getHumanCell() {
        return humanCell;
    }

    public void setHumanCell(Cell humanCell) {
        this.humanCell = humanCell;
    }

    public Ai getAi() {
        return ai;
    }

    public static class Ai {

        /**
         * AI 落子前的延迟（毫秒），模拟思考时间
         */
        private long delayMs = 500;

        /**
         * AI 调度线程数
         */
        private int poolSize = 2;

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
