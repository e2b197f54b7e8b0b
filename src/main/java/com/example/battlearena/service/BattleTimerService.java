package com.example.battlearena.service;

import com.example.battlearena.model.domain.BattleSession;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Delayed steps of a battle (opponent turn, end of an awakening cutscene). A session owns at
 * most one pending task; scheduling a new one replaces it.
 */
@Service
public class BattleTimerService {

    private final TaskScheduler taskScheduler;

    public BattleTimerService(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    public void schedule(BattleSession session, long delayMs, Runnable task) {
        // Cancel existing timer first to avoid two pending steps on one session
        cancel(session);

        Instant startTime = Instant.now().plusMillis(delayMs);
        ScheduledFuture<?> future = taskScheduler.schedule(task, startTime);
        session.setPendingTimer(future);
    }

    public void cancel(BattleSession session) {
        ScheduledFuture<?> timer = session.getPendingTimer();
        if (timer != null && !timer.isDone()) {
            timer.cancel(false);
        }
        session.setPendingTimer(null);
    }
}
