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

import me.golemcore.ircbot.domain.model.AuthLevel;
import me.golemcore.ircbot.domain.model.TriggerPriority;

import java.util.Objects;
import java.util.UUID;

/**
 * Something a module provides: an explicitly invoked command or a
 * pattern-matched trigger.
 */
public interface ModuleFeature {

    enum Kind {
        COMMAND("command"),
        TRIGGER("trigger");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    String name();

    String help();

    Kind kind();

    /**
     * Command declaration. Names must be non-empty and free of whitespace.
     */
    record CommandFeature(String name, String usage, String help, AuthLevel authLevel,
            BotCmdHandler handler) implements ModuleFeature {

        public CommandFeature {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(authLevel, "authLevel");
            Objects.requireNonNull(handler, "handler");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Command name must not be empty");
            }
            if (name.codePoints().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("Command name must not contain whitespace: \"" + name + "\"");
            }
            usage = usage != null ? usage : "";
            help = help != null ? help : "";
        }

        @Override
        public Kind kind() {
            return Kind.COMMAND;
        }
    }

    record TriggerFeature(String name, SharedPattern pattern, TriggerPriority priority,
            TriggerHandler handler, String help, UUID id) implements ModuleFeature {

        public TriggerFeature {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(priority, "priority");
            Objects.requireNonNull(handler, "handler");
            Objects.requireNonNull(id, "id");
            help = help != null ? help : "";
        }

        @Override
        public Kind kind() {
            return Kind.TRIGGER;
        }
    }
}
