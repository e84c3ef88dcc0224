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

import java.util.ArrayList;
import java.util.List;

/**
 * Wire-ready output of the reaction resolver.
 */
public interface LibReaction {

    /**
     * All protocol messages in send order.
     */
    List<IrcMessage> messages();

    static LibReaction of(IrcMessage message) {
        return new RawMsg(message);
    }

    /**
     * Single message for one element, {@link Multi} for more, {@code null}
     * for none.
     */
    static LibReaction ofAll(List<IrcMessage> messages) {
        if (messages.isEmpty()) {
            return null;
        }
        if (messages.size() == 1) {
            return new RawMsg(messages.get(0));
        }
        List<LibReaction> parts = new ArrayList<>(messages.size());
        for (IrcMessage message : messages) {
            parts.add(new RawMsg(message));
        }
        return new Multi(parts);
    }

    record RawMsg(IrcMessage message) implements LibReaction {
        @Override
        public List<IrcMessage> messages() {
            return List.of(message);
        }
    }

    record Multi(List<LibReaction> reactions) implements LibReaction {
        public Multi {
            reactions = List.copyOf(reactions);
        }

        @Override
        public List<IrcMessage> messages() {
            List<IrcMessage> all = new ArrayList<>();
            for (LibReaction reaction : reactions) {
                all.addAll(reaction.messages());
            }
            return all;
        }
    }
}
