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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.ircbot.domain.model.BotCmdResult;
import me.golemcore.ircbot.domain.model.Reaction;

import java.util.function.BiFunction;

/**
 * Handler of a command. The argument has already been checked against the
 * command's usage schema.
 */
@FunctionalInterface
public interface BotCmdHandler {

    BotCmdResult handle(HandlerContext context, JsonNode argument);

    /**
     * Adapts a handler that always succeeds with a reaction.
     */
    static BotCmdHandler reacting(BiFunction<HandlerContext, JsonNode, Reaction> function) {
        return (context, argument) -> BotCmdResult.ok(function.apply(context, argument));
    }
}
