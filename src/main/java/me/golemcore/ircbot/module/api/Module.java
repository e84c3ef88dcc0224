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

import lombok.Getter;
import me.golemcore.ircbot.domain.model.AuthLevel;
import me.golemcore.ircbot.domain.model.TriggerPriority;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A named bundle of commands and triggers plus on-load callbacks. Every
 * instance gets its own id, so a reloaded module can be told apart from the
 * one it replaces.
 */
@Getter
public final class Module {

    private final String name;
    private final UUID uuid;
    private final List<ModuleFeature> features;
    private final List<ModuleLoadHandler> loadHandlers;

    private Module(Builder builder) {
        this.name = builder.name;
        this.uuid = UUID.randomUUID();
        this.features = List.copyOf(builder.features);
        this.loadHandlers = List.copyOf(builder.loadHandlers);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return "Module(" + name + ", " + uuid + ")";
    }

    public static final class Builder {

        private final String name;
        private final List<ModuleFeature> features = new ArrayList<>();
        private final List<ModuleLoadHandler> loadHandlers = new ArrayList<>();
        private final Set<String> commandNames = new HashSet<>();
        private final Set<String> triggerNames = new HashSet<>();

        private Builder(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Module name must not be blank");
            }
            this.name = name;
        }

        /**
         * Declares a command.
         *
         * @param usage
         *            YAML usage schema the argument is checked against
         * @throws IllegalArgumentException
         *             if the name contains whitespace or is declared twice
         */
        public Builder command(String commandName, String usage, String help, AuthLevel authLevel,
                BotCmdHandler handler) {
            ModuleFeature.CommandFeature feature = new ModuleFeature.CommandFeature(commandName, usage, help,
                    authLevel, handler);
            if (!commandNames.add(commandName)) {
                throw new IllegalArgumentException(
                        "Module \"" + name + "\" declares command \"" + commandName + "\" twice");
            }
            features.add(feature);
            return this;
        }

        /**
         * Declares a trigger whose regex is compiled case-insensitively.
         *
         * @throws IllegalArgumentException
         *             if the regex does not compile or the name is declared
         *             twice
         */
        public Builder trigger(String triggerName, String regex, String help, TriggerPriority priority,
                TriggerHandler handler) {
            return trigger(triggerName, SharedPattern.compile(regex), help, priority, handler);
        }

        public Builder trigger(String triggerName, Pattern pattern, String help, TriggerPriority priority,
                TriggerHandler handler) {
            return trigger(triggerName, new SharedPattern(pattern), help, priority, handler);
        }

        /**
         * Declares a trigger around an existing shared pattern, so the caller
         * can swap the regex later.
         */
        public Builder trigger(String triggerName, SharedPattern pattern, String help, TriggerPriority priority,
                TriggerHandler handler) {
            ModuleFeature.TriggerFeature feature = new ModuleFeature.TriggerFeature(triggerName, pattern, priority,
                    handler, help, UUID.randomUUID());
            if (!triggerNames.add(triggerName)) {
                throw new IllegalArgumentException(
                        "Module \"" + name + "\" declares trigger \"" + triggerName + "\" twice");
            }
            features.add(feature);
            return this;
        }

        public Builder onLoad(ModuleLoadHandler handler) {
            loadHandlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Module build() {
            return new Module(this);
        }
    }
}
