package com.tictactoe.gameservice.games.tictactoe.service.impl;

import com.tictactoe.gameservice.games.tictactoe.domain.ai.TicTacToeAI;
import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Cell;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Match;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Round;
import com.tictactoe.gameservice.games.tictactoe.domain.model.RoundSnapshot;
import com.tictactoe.gameservice.games.tictactoe.domain.model.SeriesView;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.Outcome;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;
import com.tictactoe.gameservice.games.tictactoe.service.TicTacToeService;
import com.tictactoe.gameservice.platform.config.TicTacToeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;


@Slf4j
@Service
@RequiredArgsConstructor
public class TicTacToeServiceImpl implements TicTacToeService {

    // ====== 内存对局表 ======
    private final Map<String, Match> matches = new ConcurrentHashMap<>();

    /** 无状态，所有对局共用 */
    private final TicTacToeAI ai = new TicTacToeAI();

    private final TicTacToeProperties props;
    private final ScheduledExecutorService aiScheduler;

    /**
     * 新开人机对局
     */
    @Override
    public String newMatch(Cell humanCell) {
        Cell human = (humanCell == null ? props.getHumanCell() : humanCell);
        if (human == null || !human.isMark()) {
            throw new IllegalArgumentException("玩家执子必须是 X 或 O: " + humanCell);
        }
        String matchId = UUID.randomUUID().toString();
        Match m = new Match(matchId, human, ai, UUID.randomUUID().toString());
        matches.put(matchId, m);
        log.info("新建人机对局: matchId={}, human={}, ai={}", matchId, m.getHumanCell(), m.getAiCell());

        // AI 执 X 时先手
        synchronized (m) {
            maybeScheduleAi(m);
        }
        return matchId;
    }

    /**
     * 玩家落子
     */
    @Override
    public RoundSnapshot play(String matchId, int index) {
        Match m = getMatchOrThrow(matchId);
        synchronized (m) {
            Round r = m.current();
            if (r.aiPending()) {
                log.warn("AI 尚未落子，拒绝玩家落子: matchId={}, index={}", matchId, index);
                throw new IllegalStateException(GameMessages.AI_THINKING);
            }
            try {
                r.apply(index, m.getHumanCell());
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.warn("玩家落子被拒绝: matchId={}, round={}, index={}, reason={}",
                        matchId, r.getIndex(), index, e.getMessage());
                throw e;
            }
            log.debug("玩家落子: matchId={}, round={}, index={}, board={}",
                    matchId, r.getIndex(), index, r.getBoard());

            if (r.over()) {
                tally(m, r);
            } else {
                maybeScheduleAi(m);
            }
            return toSnapshot(m);
        }
    }

    /**
     * 同一对局开新一盘
     */
    @Override
    public RoundSnapshot newRound(String matchId) {
        Match m = getMatchOrThrow(matchId);
        synchronized (m) {
            cancelPendingAi(m.current());
            Round r = m.startRound(UUID.randomUUID().toString());
            log.info("开始新一盘: matchId={}, round={}, roundId={}", matchId, r.getIndex(), r.getRoundId());
            maybeScheduleAi(m);
            return toSnapshot(m);
        }
    }

    @Override
    public RoundSnapshot snapshot(String matchId) {
        Match m = getMatchOrThrow(matchId);
        synchronized (m) {
            return toSnapshot(m);
        }
    }

    @Override
    public SeriesView getSeries(String matchId) {
        Match m = getMatchOrThrow(matchId);
        synchronized (m) {
            return m.seriesView();
        }
    }

    /**
     * 玩家提示：只在轮到玩家时给出，不自动落子
     */
    @Override
    public Move suggest(String matchId) {
        Match m = getMatchOrThrow(matchId);
        synchronized (m) {
            Board b = m.current().getBoard();
            Cell turn = TicTacToeJudge.turnOf(b);
            if (!TicTacToeJudge.evaluate(b).isTerminal() && turn != m.getHumanCell()) {
                throw new IllegalStateException(GameMessages.formatNotYourTurn(turn));
            }
            return m.getAi().suggest(b);
        }
    }

    @Override
    public Optional<Future<?>> pendingAi(String matchId) {
        Match m = getMatchOrThrow(matchId);
        synchronized (m) {
            return Optional.<Future<?>>ofNullable(m.current().getPendingAi());
        }
    }

    @Override
    public void closeMatch(String matchId) {
        Match m = matches.remove(matchId);
        if (m == null) return;
        synchronized (m) {
            cancelPendingAi(m.current());
        }
        log.info("对局已关闭: matchId={}", matchId);
    }

    // ----------- private helpers -----------

    private Match getMatchOrThrow(String matchId) {
        Match m = (matchId == null ? null : matches.get(matchId));
        if (m == null) throw new IllegalArgumentException(GameMessages.MATCH_NOT_FOUND + ": " + matchId);
        return m;
    }

    /**
     * 如果轮到 AI 行动，则按配置延迟安排 AI 落子。调用方需持有对局锁。
     */
    private void maybeScheduleAi(Match m) {
        Round r = m.current();
        if (r.sideToMove() != m.getAiCell()) return;

        // 取消该盘之前的 AI 任务（防止重复执行）
        cancelPendingAi(r);
        final String matchId = m.getId();
        final String roundIdAtSchedule = r.getRoundId();
        long delay = Math.max(0L, props.getAi().getDelayMs());
        ScheduledFuture<?> fut = aiScheduler.schedule(
                () -> runAiTurn(matchId, roundIdAtSchedule), delay, TimeUnit.MILLISECONDS);
        r.setPendingAi(fut);
    }

    /**
     * AI 任务体：校验 roundId，搜索并落子，终局计分。
     */
    private void runAiTurn(String matchId, String roundIdAtSchedule) {
        Match m = matches.get(matchId);
        if (m == null) return;
        synchronized (m) {
            Round r = m.current();
            // 检查是否还是同一盘（防止跨盘操作）
            if (!roundIdAtSchedule.equals(r.getRoundId()) || r.over()) return;
            try {
                int index = m.getAi().bestMove(r.getBoard(), m.getAiCell());
                r.apply(index, m.getAiCell());
                log.debug("AI 落子: matchId={}, round={}, index={}, board={}",
                        matchId, r.getIndex(), index, r.getBoard());
                if (r.over()) tally(m, r);
            } catch (RuntimeException e) {
                log.error("AI 落子失败: matchId={}, roundId={}", matchId, roundIdAtSchedule, e);
                throw e;
            }
        }
    }

    private void cancelPendingAi(Round r) {
        ScheduledFuture<?> old = r.getPendingAi();
        if (old != null && !old.isDone()) old.cancel(false);
    }

    /** 终局计分，每盘只计一次 */
    private void tally(Match m, Round r) {
        if (r.isTallied()) return;
        Outcome o = r.outcome();
        m.getSeries().record(o);
        r.setTallied(true);
        log.info("第 {} 盘结束: matchId={}, outcome={}, board={}", r.getIndex(), m.getId(), o, r.getBoard());
    }

    private RoundSnapshot toSnapshot(Match m) {
        Round r = m.current();
        Board b = r.getBoard();
        Outcome o = TicTacToeJudge.evaluate(b);
        return new RoundSnapshot(
                m.getId(),
                r.getRoundId(),
                r.getIndex(),
                b.view(),
                m.getHumanCell(),
                m.getAiCell(),
                o.isTerminal() ? null : TicTacToeJudge.turnOf(b),
                o,
                o.winner().orElse(null),
                TicTacToeJudge.winningLine(b).orElse(null),
                r.aiPending(),
                m.seriesView());
    }
}
