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

import lombok.RequiredArgsConstructor;
import me.golemcore.ircbot.domain.model.IrcBotException;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.LibReaction;
import me.golemcore.ircbot.domain.model.MsgMetadata;
import me.golemcore.ircbot.domain.model.Reaction;
import me.golemcore.ircbot.domain.model.ServerId;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Turns reactions into wire-ready messages.
 *
 * <p>
 * Private messages are answered to the sender's nick without an addressee;
 * channel messages are answered in the channel, and {@code Reply} variants
 * get {@code <sender-nick><suffix>} in front. Each line of text is then
 * wrapped so that the line the server relays to others, with the bot's own
 * prefix in front, stays within 512 bytes.
 */
@Service
@RequiredArgsConstructor
public class ReactionResolver {

    /** Longest line the protocol allows, terminator included. */
    public static final int MAX_LINE_LENGTH = 512;

    /** Two colons, three spaces and the CR LF terminator. */
    static final int LINE_PUNCTUATION_LENGTH = 7;

    /** Room for the widest UTF-8 code point, so a hard cut always fits. */
    static final int MIN_LINE_BUDGET = 4;

    private final BotState state;

    /**
     * @return the messages to send, or empty when there is nothing to send
     */
    public Optional<LibReaction> resolve(MsgMetadata metadata, Reaction reaction) {
        if (reaction instanceof Reaction.None) {
            return Optional.empty();
        }
        if (reaction instanceof Reaction.Msg msg) {
            return composeMsgs(metadata, false, List.of(msg.text()));
        }
        if (reaction instanceof Reaction.Msgs msgs) {
            return composeMsgs(metadata, false, msgs.texts());
        }
        if (reaction instanceof Reaction.Reply reply) {
            return composeMsgs(metadata, true, List.of(reply.text()));
        }
        if (reaction instanceof Reaction.Replies replies) {
            return composeMsgs(metadata, true, replies.texts());
        }
        if (reaction instanceof Reaction.RawMsg raw) {
            return Optional.of(LibReaction.of(IrcMessage.parse(raw.line())));
        }
        if (reaction instanceof Reaction.Quit quit) {
            String message = quit.message() != null ? quit.message() : state.defaultQuitMessage();
            return Optional.of(LibReaction.of(IrcMessage.quit(message)));
        }
        throw new IllegalArgumentException("Reaction must be expanded before resolution: " + reaction);
    }

    /**
     * Content bytes available per PRIVMSG line to {@code target}.
     */
    public int lineBudget(ServerId serverId, String target) {
        return MAX_LINE_LENGTH - (state.msgPrefixLength(serverId) + IrcMessage.PRIVMSG.length()
                + LineWrapper.utf8Length(target) + LINE_PUNCTUATION_LENGTH);
    }

    /**
     * Builds the PRIVMSG lines for {@code text}. Each embedded line is wrapped
     * on its own; blank lines are skipped.
     *
     * @param addressee
     *            nick put in front of the text, or {@code null}
     * @throws IrcBotException
     *             of kind {@code LINE_BUDGET_EXHAUSTED} when the prefix and
     *             target leave less than {@value #MIN_LINE_BUDGET} bytes
     */
    public List<IrcMessage> composeLines(ServerId serverId, String target, String addressee, String text) {
        String full = addressee != null ? addressee + state.addresseeSuffix() + text : text;
        int budget = lineBudget(serverId, target);
        if (budget < MIN_LINE_BUDGET) {
            throw IrcBotException.lineBudgetExhausted(target, budget);
        }
        List<IrcMessage> messages = new ArrayList<>();
        Iterator<String> lines = full.lines().iterator();
        while (lines.hasNext()) {
            String line = lines.next();
            if (line.isBlank()) {
                continue;
            }
            for (String wrapped : LineWrapper.wrap(line, budget)) {
                messages.add(IrcMessage.privmsg(target, wrapped));
            }
        }
        return messages;
    }

    private Optional<LibReaction> composeMsgs(MsgMetadata metadata, boolean addressed, List<String> texts) {
        ServerId serverId = metadata.serverId();
        String target;
        String addressee;
        if (state.isPrivate(metadata) && metadata.prefix().nick() != null) {
            target = metadata.prefix().nick();
            addressee = null;
        } else {
            target = metadata.target();
            addressee = addressed ? metadata.prefix().nick() : null;
        }

        List<IrcMessage> messages = new ArrayList<>();
        for (String text : texts) {
            messages.addAll(composeLines(serverId, target, addressee, text));
        }
        return Optional.ofNullable(LibReaction.ofAll(messages));
    }
}
