package me.golemcore.ircbot.domain.service;

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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ircbot.domain.model.ErrorReaction;
import me.golemcore.ircbot.domain.model.IrcBotException;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.LibReaction;
import me.golemcore.ircbot.domain.model.MsgDest;
import me.golemcore.ircbot.domain.model.MsgMetadata;
import me.golemcore.ircbot.domain.model.MsgPrefix;
import me.golemcore.ircbot.domain.model.ServerId;
import me.golemcore.ircbot.infrastructure.config.BotProperties;
import me.golemcore.ircbot.module.context.ModuleRegistry;
import me.golemcore.ircbot.port.outbound.IrcConnection;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Mutable state shared by all dispatch workers and the outbox sender: the
 * module registry, the random generator, and per server the connection and
 * the bot's own cached message prefix.
 */
@Component
@Slf4j
public class BotState {

    @Getter
    private final BotProperties properties;
    @Getter
    private final ModuleRegistry registry;
    private final ErrorHandler errorHandler;

    private final Random random;
    private final Lock randomLock = new ReentrantLock();

    private final ReadWriteLock serverLock = new ReentrantReadWriteLock();
    private final Map<ServerId, MsgPrefix> msgPrefixes = new HashMap<>();
    private final Map<ServerId, IrcConnection> connections = new HashMap<>();

    public BotState(BotProperties properties, ModuleRegistry registry, ErrorHandler errorHandler,
            @Qualifier("botRandom") Random random) {
        if (properties.getNickname() == null || properties.getNickname().isBlank()) {
            throw IrcBotException.config("bot.nickname must not be blank");
        }
        if (properties.getUsername() == null || properties.getUsername().isBlank()) {
            properties.setUsername(properties.getNickname());
        }
        this.properties = properties;
        this.registry = registry;
        this.errorHandler = errorHandler;
        this.random = random;
    }

    public void registerServer(ServerId serverId, IrcConnection connection) {
        serverLock.writeLock().lock();
        try {
            connections.put(serverId, connection);
            msgPrefixes.put(serverId, MsgPrefix.initial(properties.getNickname(), properties.getUsername()));
        } finally {
            serverLock.writeLock().unlock();
        }
        log.info("[State] Registered {} ({})", serverId, connection.describe());
    }

    public Optional<IrcConnection> deregisterServer(ServerId serverId) {
        serverLock.writeLock().lock();
        try {
            msgPrefixes.remove(serverId);
            return Optional.ofNullable(connections.remove(serverId));
        } finally {
            serverLock.writeLock().unlock();
        }
    }

    public Optional<IrcConnection> connection(ServerId serverId) {
        serverLock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(serverId));
        } finally {
            serverLock.readLock().unlock();
        }
    }

    public Set<ServerId> serverIds() {
        serverLock.readLock().lock();
        try {
            return Set.copyOf(connections.keySet());
        } finally {
            serverLock.readLock().unlock();
        }
    }

    /**
     * The bot's best knowledge of how the server renders its own prefix.
     *
     * @throws IrcBotException
     *             of kind {@code UNKNOWN_SERVER}
     */
    public MsgPrefix msgPrefix(ServerId serverId) {
        serverLock.readLock().lock();
        try {
            MsgPrefix prefix = msgPrefixes.get(serverId);
            if (prefix == null) {
                throw IrcBotException.unknownServer(serverId);
            }
            return prefix;
        } finally {
            serverLock.readLock().unlock();
        }
    }

    public String nick(ServerId serverId) {
        String nick = msgPrefix(serverId).nick();
        if (nick == null) {
            throw IrcBotException.nicknameUnknown(serverId);
        }
        return nick;
    }

    public int msgPrefixLength(ServerId serverId) {
        return msgPrefix(serverId).echoLength();
    }

    /**
     * Merges a prefix the server echoed back into the cached one.
     */
    public void updateMsgPrefix(ServerId serverId, MsgPrefix observed) {
        serverLock.writeLock().lock();
        try {
            MsgPrefix current = msgPrefixes.get(serverId);
            if (current == null) {
                throw IrcBotException.unknownServer(serverId);
            }
            MsgPrefix updated = current.mergedWith(observed);
            msgPrefixes.put(serverId, updated);
            log.debug("[State] Own prefix on {} is now {}", serverId, updated.toEchoString());
        } finally {
            serverLock.writeLock().unlock();
        }
    }

    public void updateNick(ServerId serverId, String newNick) {
        serverLock.writeLock().lock();
        try {
            MsgPrefix current = msgPrefixes.get(serverId);
            if (current == null) {
                throw IrcBotException.unknownServer(serverId);
            }
            msgPrefixes.put(serverId, current.withNick(newNick));
        } finally {
            serverLock.writeLock().unlock();
        }
        log.info("[State] Own nick on {} changed to {}", serverId, newNick);
    }

    /**
     * Runs {@code selection} with exclusive use of the shared random generator.
     */
    public <T> T withRandom(Function<Random, T> selection) {
        randomLock.lock();
        try {
            return selection.apply(random);
        } finally {
            randomLock.unlock();
        }
    }

    public String addresseeSuffix() {
        return properties.getAddresseeSuffix();
    }

    /**
     * Whether the message was sent to the bot's nick rather than a channel.
     */
    public boolean isPrivate(MsgMetadata metadata) {
        return metadata.target().equals(nick(metadata.serverId()));
    }

    public MsgDest guessReplyDest(MsgMetadata metadata) {
        if (isPrivate(metadata) && metadata.prefix().nick() != null) {
            return new MsgDest(metadata.serverId(), metadata.prefix().nick());
        }
        return metadata.dest();
    }

    /**
     * Passes the error to the error handler.
     *
     * @return the quit message to send if the handler decided to quit
     */
    public Optional<LibReaction> handleError(IrcBotException error) {
        ErrorReaction reaction = errorHandler.handle(error);
        if (!reaction.isQuit()) {
            return Optional.empty();
        }
        String message = reaction.getQuitMessage() != null ? reaction.getQuitMessage() : defaultQuitMessage();
        return Optional.of(LibReaction.of(IrcMessage.quit(message)));
    }

    public String defaultQuitMessage() {
        return properties.defaultQuitMessage();
    }
}
