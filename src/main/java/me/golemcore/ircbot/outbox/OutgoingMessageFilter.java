package me.golemcore.ircbot.outbox;

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

import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.ServerId;

/**
 * Hook consulted for every outgoing message right before it is written.
 * Declare a bean to use it.
 */
@FunctionalInterface
public interface OutgoingMessageFilter {

    /**
     * @return {@code false} to drop the message
     */
    boolean accept(ServerId serverId, IrcMessage message);
}
