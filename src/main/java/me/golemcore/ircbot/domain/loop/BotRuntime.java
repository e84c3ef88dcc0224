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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ircbot.domain.model.IrcBotException;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.LibReaction;
import me.golemcore.ircbot.domain.model.ModuleLoadMode;
import me.golemcore.ircbot.domain.model.ServerId;
import me.golemcore.ircbot.domain.service.BotState;
import me.golemcore.ircbot.infrastructure.config.BotProperties;
import me.golemcore.ircbot.module.api.Module;
import me.golemcore.ircbot.module.api.ModuleProvider;
import me.golemcore.ircbot.outbox.Outbox;
import me.golemcore.ircbot.outbox.OutboxSender;
import me.golemcore.ircbot.outbox.QuitSentEvent;
import me.golemcore.ircbot.port.inbound.IrcInboundPort;
import me.golemcore.ircbot.port.outbound.IrcConnection;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Lifecycle of the bot: loads the modules, runs the outbox sender and the
 * prefix refresh, and owns one receive thread per connected server.
 *
 * <p>
 * The bot stops talking to a server once a QUIT has been sent to it or the
 * server closes the connection. {@link #awaitShutdown()} returns when no
 * server is left.
 */
@Service
@Slf4j
public class BotRuntime {

    private final BotState state;
    private final List<ModuleProvider> moduleProviders;
    private final Outbox outbox;
    private final OutboxSender outboxSender;
    private final PrefixRefreshScheduler prefixRefreshScheduler;
    private final IrcInboundPort inboundPort;

    private final Map<ServerId, Thread> receiveThreads = new ConcurrentHashMap<>();
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private volatile boolean started;

    @Autowired
    public BotRuntime(BotState state, ObjectProvider<ModuleProvider> moduleProviders, Outbox outbox,
            OutboxSender outboxSender, PrefixRefreshScheduler prefixRefreshScheduler, IrcInboundPort inboundPort) {
        this(state, moduleProviders.orderedStream().toList(), outbox, outboxSender, prefixRefreshScheduler,
                inboundPort);
    }

    BotRuntime(BotState state, List<ModuleProvider> moduleProviders, Outbox outbox, OutboxSender outboxSender,
            PrefixRefreshScheduler prefixRefreshScheduler, IrcInboundPort inboundPort) {
        this.state = state;
        this.moduleProviders = List.copyOf(moduleProviders);
        this.outbox = outbox;
        this.outboxSender = outboxSender;
        this.prefixRefreshScheduler = prefixRefreshScheduler;
        this.inboundPort = inboundPort;
    }

    /**
     * Loads the bundled modules and starts the workers. A module error the
     * error handler answers with a quit aborts startup.
     */
    @PostConstruct
    public synchronized void start() {
        if (started) {
            return;
        }
        List<Module> modules = moduleProviders.stream().map(ModuleProvider::module).toList();
        List<IrcBotException> errors = state.getRegistry().loadModules(modules, ModuleLoadMode.ADD);
        for (IrcBotException error : errors) {
            if (state.handleError(error).isPresent()) {
                throw new IllegalStateException("Terminal error while loading modules: " + error.getMessage(),
                        error);
            }
        }

        outboxSender.start();
        prefixRefreshScheduler.start();
        started = true;
        log.info("[Runtime] Started with modules {}", state.getRegistry().moduleNames());
    }

    /**
     * Registers a connection, queues the registration commands and starts
     * reading from it.
     */
    public ServerId connect(IrcConnection connection) {
        ServerId serverId = ServerId.random();
        state.registerServer(serverId, connection);

        BotProperties properties = state.getProperties();
        outbox.push(serverId, LibReaction.ofAll(List.of(
                IrcMessage.of(IrcMessage.NICK, properties.getNickname()),
                IrcMessage.of(IrcMessage.USER, properties.getUsername(), "0", "*", properties.getRealname()))));

        Thread receiver = new Thread(() -> receiveLoop(serverId, connection), "irc-recv-" + connection.describe());
        receiver.setDaemon(true);
        receiveThreads.put(serverId, receiver);
        receiver.start();
        return serverId;
    }

    public void disconnect(ServerId serverId) {
        state.deregisterServer(serverId).ifPresent(connection -> {
            connection.close();
            log.info("[Runtime] Disconnected from {} ({})", serverId, connection.describe());
        });
        if (state.serverIds().isEmpty()) {
            shutdownLatch.countDown();
        }
    }

    @EventListener
    public void onQuitSent(QuitSentEvent event) {
        log.info("[Runtime] Quit {} with message: {}", event.serverId(), event.quitMessage());
        disconnect(event.serverId());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public boolean awaitShutdown(long timeout, TimeUnit unit) throws InterruptedException {
        return shutdownLatch.await(timeout, unit);
    }

    public boolean isStarted() {
        return started;
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (!started) {
            return;
        }
        started = false;
        prefixRefreshScheduler.stop();
        outboxSender.stop();
        for (ServerId serverId : state.serverIds()) {
            disconnect(serverId);
        }
        log.info("[Runtime] Shut down");
    }

    private void receiveLoop(ServerId serverId, IrcConnection connection) {
        try {
            IrcMessage message;
            while ((message = connection.receive()) != null) {
                try {
                    inboundPort.handle(serverId, message);
                } catch (Exception e) { // NOSONAR - must not kill receive loop
                    log.error("[Runtime] Failed to handle {} from {}", message.command(), serverId, e);
                }
            }
            log.info("[Runtime] Connection {} closed by the server", connection.describe());
        } catch (IOException e) {
            if (state.connection(serverId).isPresent()) {
                log.warn("[Runtime] Receive from {} failed: {}", connection.describe(), e.getMessage());
            }
        } finally {
            receiveThreads.remove(serverId);
            disconnect(serverId);
        }
    }
}
