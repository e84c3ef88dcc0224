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
import me.golemcore.ircbot.domain.model.IrcBotException;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.LibReaction;
import me.golemcore.ircbot.domain.model.MsgDest;
import me.golemcore.ircbot.domain.model.MsgMetadata;
import me.golemcore.ircbot.domain.model.MsgPrefix;
import me.golemcore.ircbot.domain.model.Reaction;
import me.golemcore.ircbot.domain.model.ServerId;
import me.golemcore.ircbot.domain.service.Addressing;
import me.golemcore.ircbot.domain.service.BotState;
import me.golemcore.ircbot.domain.service.ReactionResolver;
import me.golemcore.ircbot.outbox.Outbox;
import me.golemcore.ircbot.port.inbound.IrcInboundPort;
import org.springframework.stereotype.Component;

/**
 * Routes inbound server messages.
 *
 * <p>
 * A PRIVMSG addressed to the bot is answered with {@code Yes?} when empty,
 * updates the cached own prefix when it is the refresh sentinel the bot sent
 * itself, and is dispatched to a worker otherwise. Messages not addressed to
 * the bot are ignored. {@code 004} starts a prefix refresh, {@code PING} is
 * answered, and a {@code NICK} change of the bot is recorded.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IrcMessageRouter implements IrcInboundPort {

    private final BotState state;
    private final DispatchCoordinator dispatchCoordinator;
    private final ReactionResolver reactionResolver;
    private final PrefixRefreshScheduler prefixRefreshScheduler;
    private final Outbox outbox;

    @Override
    public void handle(ServerId serverId, IrcMessage message) {
        try {
            switch (message.command()) {
                case IrcMessage.PRIVMSG -> handlePrivmsg(serverId, message);
                case IrcMessage.RPL_MYINFO -> prefixRefreshScheduler.requestRefresh(serverId);
                case IrcMessage.PING -> outbox.push(serverId, LibReaction.of(IrcMessage.pong(lastParam(message))));
                case IrcMessage.NICK -> handleNick(serverId, message);
                default -> log.trace("[Router] Ignoring {}", message.command());
            }
        } catch (IrcBotException e) {
            state.handleError(e).ifPresent(r -> outbox.push(serverId, r));
        }
    }

    private void handlePrivmsg(ServerId serverId, IrcMessage message) {
        String target = message.param(0);
        String text = message.param(1);
        if (target == null || text == null) {
            log.debug("[Router] Ignoring PRIVMSG without target or text: {}", message);
            return;
        }
        String nick = state.nick(serverId);
        if (!Addressing.isAddressedTo(nick, target, text)) {
            return;
        }

        MsgPrefix sender = message.parsedPrefix();
        MsgMetadata metadata = new MsgMetadata(new MsgDest(serverId, target), sender);

        if (target.equals(sender.nick())
                && PrefixRefreshScheduler.UPDATE_MSG_PREFIX_SENTINEL.equals(text.trim())) {
            state.updateMsgPrefix(serverId, sender);
            return;
        }

        String commandLine = Addressing.commandLine(nick, text);
        if (commandLine.isEmpty()) {
            reactionResolver.resolve(metadata, Reaction.reply("Yes?")).ifPresent(r -> outbox.push(serverId, r));
            return;
        }
        dispatchCoordinator.dispatch(metadata, commandLine);
    }

    private void handleNick(ServerId serverId, IrcMessage message) {
        String newNick = message.param(0);
        if (newNick != null && state.nick(serverId).equals(message.parsedPrefix().nick())) {
            state.updateNick(serverId, newNick);
        }
    }

    private static String lastParam(IrcMessage message) {
        return message.params().isEmpty() ? "" : message.params().get(message.params().size() - 1);
    }
}
