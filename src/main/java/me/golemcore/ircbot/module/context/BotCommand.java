package me.golemcore.ircbot.module.context;

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
import me.golemcore.ircbot.domain.model.AuthLevel;
import me.golemcore.ircbot.module.api.BotCmdHandler;
import me.golemcore.ircbot.module.api.Module;

/**
 * Registered command, bound to the module instance that provided it.
 */
public record BotCommand(String name, Module provider, AuthLevel authLevel, BotCmdHandler handler,
        String usage, JsonNode usageSchema, String help) {
}
