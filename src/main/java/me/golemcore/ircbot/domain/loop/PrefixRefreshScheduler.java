package me.golemcore.ircbot.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.LibReaction;
import me.golemcore.ircbot.domain.model.ServerId;
import me.golemcore.ircbot.domain.service.BotState;
import me.golemcore.ircbot.outbox.Outbox;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the cached own prefix fresh. The bot sends itself a sentinel PRIVMSG;
 * the server echoes it back with the prefix it actually uses, which the
 * router then stores.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PrefixRefreshScheduler {

    public static final String UPDATE_MSG_PREFIX_SENTINEL = "!!! UPDATE MESSAGE PREFIX !!!";

    private final BotState state;
    private final Outbox outbox;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> refreshTask;

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        Duration interval = state.getProperties().getPrefixRefreshInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            log.info("[PrefixRefresh] Periodic refresh disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "irc-prefix-refresh");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = interval.toMillis();
        refreshTask = scheduler.scheduleAtFixedRate(this::refreshAll, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
        log.info("[PrefixRefresh] Started with interval {}", interval);
    }

    public synchronized void stop() {
        if (refreshTask != null) {
            refreshTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
    }

    /**
     * Queues the sentinel message for one server.
     */
    public void requestRefresh(ServerId serverId) {
        String nick = state.nick(serverId);
        outbox.push(serverId, LibReaction.of(IrcMessage.privmsg(nick, UPDATE_MSG_PREFIX_SENTINEL)));
    }

    void refreshAll() {
        for (ServerId serverId : state.serverIds()) {
            try {
                requestRefresh(serverId);
            } catch (Exception e) { // NOSONAR - must not kill scheduler thread
                log.warn("[PrefixRefresh] Could not request refresh for {}: {}", serverId, e.getMessage());
            }
        }
    }
}
