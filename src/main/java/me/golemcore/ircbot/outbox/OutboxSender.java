package me.golemcore.ircbot.outbox;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.ircbot.domain.model.IrcBotException;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.LibReaction;
import me.golemcore.ircbot.domain.model.OutboxRecord;
import me.golemcore.ircbot.domain.model.ServerId;
import me.golemcore.ircbot.domain.service.BotState;
import me.golemcore.ircbot.port.outbound.IrcConnection;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * The single worker that drains the {@link Outbox} in order and writes to the
 * connections.
 *
 * <p>
 * A record for an unknown server is dropped with a warning. A failed send is
 * handed to the error handler and whatever it answers is sent once more; if
 * that fails as well it is only logged.
 */
@Component
@Slf4j
public class OutboxSender {

    static final int MAX_ERROR_DEPTH = 1;
    private static final long STOP_TIMEOUT_MS = 5000;

    private final Outbox outbox;
    private final BotState state;
    private final ApplicationEventPublisher eventPublisher;
    private final List<OutgoingMessageFilter> filters;

    private volatile boolean running;
    private Thread worker;

    @Autowired
    public OutboxSender(Outbox outbox, BotState state, ApplicationEventPublisher eventPublisher,
            ObjectProvider<OutgoingMessageFilter> filters) {
        this(outbox, state, eventPublisher, filters.orderedStream().toList());
    }

    OutboxSender(Outbox outbox, BotState state, ApplicationEventPublisher eventPublisher,
            List<OutgoingMessageFilter> filters) {
        this.outbox = outbox;
        this.state = state;
        this.eventPublisher = eventPublisher;
        this.filters = List.copyOf(filters);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        worker = new Thread(this::drain, "irc-outbox-sender");
        worker.setDaemon(true);
        worker.start();
        log.info("[Outbox] Sender started");
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        worker.interrupt();
        try {
            worker.join(STOP_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Outbox] Sender stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Sends one record on the calling thread.
     */
    public void send(OutboxRecord outboxRecord) {
        sendReaction(outboxRecord.serverId(), outboxRecord.reaction(), 0);
    }

    private void drain() {
        while (running) {
            try {
                send(outbox.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) { // NOSONAR - must not kill the sender thread
                log.error("[Outbox] Unexpected failure while sending", e);
            }
        }
    }

    private void sendReaction(ServerId serverId, LibReaction reaction, int errorDepth) {
        Optional<IrcConnection> connection = state.connection(serverId);
        if (connection.isEmpty()) {
            log.warn("[Outbox] Unknown server {}, dropping {}", serverId, reaction.messages());
            return;
        }
        for (IrcMessage message : reaction.messages()) {
            if (!accepted(serverId, message)) {
                log.debug("[Outbox] Filtered out {}", message);
                continue;
            }
            try {
                connection.get().send(message);
            } catch (IOException | RuntimeException e) {
                handleSendFailure(serverId, message, errorDepth, e);
                continue;
            }
            if (IrcMessage.QUIT.equals(message.command())) {
                log.info("[Outbox] Sent QUIT to {}", serverId);
                eventPublisher.publishEvent(new QuitSentEvent(serverId, message.param(0)));
            }
        }
    }

    private void handleSendFailure(ServerId serverId, IrcMessage message, int errorDepth, Exception cause) {
        if (errorDepth >= MAX_ERROR_DEPTH) {
            log.error("[Outbox] Failed to send error reaction {} to {}, giving up", message.command(), serverId,
                    cause);
            return;
        }
        log.error("[Outbox] Failed to send {} to {}", message.command(), serverId, cause);
        Optional<LibReaction> errorReaction = state.handleError(IrcBotException.sendFailed(serverId, cause));
        errorReaction.ifPresent(r -> sendReaction(serverId, r, errorDepth + 1));
    }

    private boolean accepted(ServerId serverId, IrcMessage message) {
        for (OutgoingMessageFilter filter : filters) {
            if (!filter.accept(serverId, message)) {
                return false;
            }
        }
        return true;
    }
}
