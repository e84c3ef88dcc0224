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

import me.golemcore.ircbot.domain.model.TriggerPriority;
import me.golemcore.ircbot.module.api.Module;
import me.golemcore.ircbot.module.api.SharedPattern;
import me.golemcore.ircbot.module.api.TriggerHandler;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.MatchResult;

/**
 * Registered trigger. The pattern is shared with the declaring module and may
 * change between two matches.
 */
public record Trigger(String name, Module provider, SharedPattern pattern, TriggerPriority priority,
        TriggerHandler handler, String help, UUID id) {

    public Optional<MatchResult> match(CharSequence text) {
        return pattern.match(text);
    }
}
