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

import java.util.List;

/**
 * What a handler wants the bot to do, before reply target and line length
 * are resolved. {@code Reply} variants are addressed to the sender,
 * {@code Msg} variants are not.
 */
public interface Reaction {

    None NONE = new None();

    record None() implements Reaction {
    }

    record Msg(String text) implements Reaction {
    }

    record Msgs(List<String> texts) implements Reaction {
        public Msgs {
            texts = List.copyOf(texts);
        }
    }

    record Reply(String text) implements Reaction {
    }

    record Replies(List<String> texts) implements Reaction {
        public Replies {
            texts = List.copyOf(texts);
        }
    }

    /** A protocol line sent verbatim, without wrapping. */
    record RawMsg(String line) implements Reaction {
    }

    /** A command line dispatched again as if the sender had typed it. */
    record BotCmd(String commandLine) implements Reaction {
    }

    /** Quit with the given message, or the default one when {@code null}. */
    record Quit(String message) implements Reaction {
    }

    static Reaction none() {
        return NONE;
    }

    static Reaction msg(String text) {
        return new Msg(text);
    }

    static Reaction msgs(List<String> texts) {
        return new Msgs(texts);
    }

    static Reaction reply(String text) {
        return new Reply(text);
    }

    static Reaction replies(List<String> texts) {
        return new Replies(texts);
    }

    static Reaction raw(String line) {
        return new RawMsg(line);
    }

    static Reaction botCmd(String commandLine) {
        return new BotCmd(commandLine);
    }

    static Reaction quit(String message) {
        return new Quit(message);
    }
}
