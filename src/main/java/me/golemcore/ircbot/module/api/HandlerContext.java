package me.golemcore.ircbot.module.api;

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

import me.golemcore.ircbot.domain.model.MsgDest;
import me.golemcore.ircbot.domain.model.MsgMetadata;
import me.golemcore.ircbot.domain.model.MsgPrefix;
import me.golemcore.ircbot.domain.service.BotState;
import me.golemcore.ircbot.module.context.ModuleRegistry;

/**
 * Everything a handler gets besides its argument: the shared bot state, the
 * feature being run and the message that caused it.
 */
public record HandlerContext(BotState state, FeatureRef feature, MsgMetadata metadata) {

    public ModuleRegistry registry() {
        return state.getRegistry();
    }

    public MsgDest origin() {
        return metadata.dest();
    }

    public MsgPrefix invoker() {
        return metadata.prefix();
    }

    /**
     * Where a reply would go: the sender's nick for private messages, the
     * channel otherwise.
     */
    public MsgDest guessReplyDest() {
        return state.guessReplyDest(metadata);
    }

    /**
     * Whether the message arrived in a private chat with the bot.
     */
    public boolean isPrivate() {
        return state.isPrivate(metadata);
    }
}
