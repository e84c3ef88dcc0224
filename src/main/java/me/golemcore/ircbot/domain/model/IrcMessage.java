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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One IRC protocol line: optional sender prefix, command keyword and
 * parameters. Serialization always puts the last parameter after a colon.
 */
public record IrcMessage(String prefix, String command, List<String> params) {

    public static final String PRIVMSG = "PRIVMSG";
    public static final String QUIT = "QUIT";
    public static final String PING = "PING";
    public static final String PONG = "PONG";
    public static final String NICK = "NICK";
    public static final String USER = "USER";
    public static final String RPL_MYINFO = "004";

    /** Carriage return plus line feed. */
    public static final int TERMINATOR_LENGTH = 2;

    public IrcMessage {
        Objects.requireNonNull(command, "command");
        params = params != null ? List.copyOf(params) : List.of();
    }

    public static IrcMessage of(String command, String... params) {
        return new IrcMessage(null, command, List.of(params));
    }

    public static IrcMessage privmsg(String target, String text) {
        return of(PRIVMSG, target, text);
    }

    public static IrcMessage quit(String message) {
        return of(QUIT, message);
    }

    public static IrcMessage pong(String token) {
        return of(PONG, token);
    }

    /**
     * Parses a raw line. Message tags are skipped, a trailing CR/LF is
     * tolerated.
     *
     * @throws IrcBotException
     *             of kind {@code MSG_PARSE} when no command is present
     */
    public static IrcMessage parse(String line) {
        if (line == null) {
            throw IrcBotException.msgParse("null", "no input");
        }
        String rest = stripTerminator(line);
        if (rest.startsWith("@")) {
            int space = rest.indexOf(' ');
            if (space < 0) {
                throw IrcBotException.msgParse(line, "tags without command");
            }
            rest = rest.substring(space + 1).stripLeading();
        }
        String prefix = null;
        if (rest.startsWith(":")) {
            int space = rest.indexOf(' ');
            if (space < 0) {
                throw IrcBotException.msgParse(line, "prefix without command");
            }
            prefix = rest.substring(1, space);
            rest = rest.substring(space + 1).stripLeading();
        }
        String trailing = null;
        int trailingStart = rest.startsWith(":") ? 0 : rest.indexOf(" :");
        if (trailingStart >= 0) {
            trailing = rest.substring(trailingStart == 0 ? 1 : trailingStart + 2);
            rest = rest.substring(0, trailingStart);
        }
        List<String> words = new ArrayList<>();
        for (String word : rest.trim().split(" +")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        if (words.isEmpty()) {
            throw IrcBotException.msgParse(line, "missing command");
        }
        String command = words.remove(0).toUpperCase(Locale.ROOT);
        if (trailing != null) {
            words.add(trailing);
        }
        return new IrcMessage(prefix, command, words);
    }

    public String param(int index) {
        return index < params.size() ? params.get(index) : null;
    }

    public MsgPrefix parsedPrefix() {
        return MsgPrefix.parse(prefix);
    }

    public String toWireString() {
        StringBuilder sb = new StringBuilder();
        if (prefix != null) {
            sb.append(':').append(prefix).append(' ');
        }
        sb.append(command);
        for (int i = 0; i < params.size(); i++) {
            sb.append(' ');
            if (i == params.size() - 1) {
                sb.append(':');
            }
            sb.append(params.get(i));
        }
        return sb.toString();
    }

    /**
     * Length in bytes on the wire, terminator included.
     */
    public int wireLength() {
        return toWireString().getBytes(StandardCharsets.UTF_8).length + TERMINATOR_LENGTH;
    }

    @Override
    public String toString() {
        return toWireString();
    }

    private static String stripTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }
}
