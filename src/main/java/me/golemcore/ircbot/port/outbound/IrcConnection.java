package me.golemcore.ircbot.port.outbound;

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

import java.io.IOException;

/**
 * Port to one IRC server connection. Framing bytes into messages and the
 * socket itself belong to the adapter implementing this.
 */
public interface IrcConnection {

    /**
     * Short description for logs, such as {@code host:port}.
     */
    String describe();

    void send(IrcMessage message) throws IOException;

    /**
     * Blocks until the next message arrives.
     *
     * @return the message, or {@code null} once the connection has ended
     */
    IrcMessage receive() throws IOException;

    void close();
}
