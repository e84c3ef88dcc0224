package me.golemcore.ircbot.domain.model;

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

import java.nio.charset.StandardCharsets;

/**
 * Sender prefix of an IRC message, {@code nick!user@host}. Each field may be
 * {@code null} when the server did not send it.
 */
public record MsgPrefix(String nick, String user, String host) {

    public static final MsgPrefix EMPTY = new MsgPrefix(null, null, null);

    /**
     * Splits a raw prefix. The host follows the last {@code '@'}, the user
     * follows the first {@code '!'} of what precedes it. Empty components are
     * absent.
     */
    public static MsgPrefix parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        String rest = raw;
        String host = null;
        int at = raw.lastIndexOf('@');
        if (at >= 0) {
            host = raw.substring(at + 1);
            rest = raw.substring(0, at);
        }
        String nick = rest;
        String user = null;
        int bang = rest.indexOf('!');
        if (bang >= 0) {
            nick = rest.substring(0, bang);
            user = rest.substring(bang + 1);
        }
        return new MsgPrefix(emptyToNull(nick), emptyToNull(user), emptyToNull(host));
    }

    /**
     * The prefix the bot assumes for itself before the server has echoed one.
     */
    public static MsgPrefix initial(String nick, String user) {
        return new MsgPrefix(nick, user, null);
    }

    /**
     * Returns a prefix taking every field {@code observed} knows and keeping
     * the current value for the others.
     */
    public MsgPrefix mergedWith(MsgPrefix observed) {
        return new MsgPrefix(
                observed.nick() != null ? observed.nick() : nick,
                observed.user() != null ? observed.user() : user,
                observed.host() != null ? observed.host() : host);
    }

    public MsgPrefix withNick(String newNick) {
        return new MsgPrefix(newNick, user, host);
    }

    /**
     * Echo form used for the line budget: {@code nick!user@host} with absent
     * fields rendered empty.
     */
    public String toEchoString() {
        return orEmpty(nick) + "!" + orEmpty(user) + "@" + orEmpty(host);
    }

    public int echoLength() {
        return toEchoString().getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Wire form, omitting the separators of absent fields.
     */
    public String toWireString() {
        StringBuilder sb = new StringBuilder(orEmpty(nick));
        if (user != null) {
            sb.append('!').append(user);
        }
        if (host != null) {
            sb.append('@').append(host);
        }
        return sb.toString();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
