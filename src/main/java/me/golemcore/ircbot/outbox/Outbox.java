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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.ircbot.domain.model.LibReaction;
import me.golemcore.ircbot.domain.model.OutboxRecord;
import me.golemcore.ircbot.domain.model.ServerId;
import me.golemcore.ircbot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO between the workers producing reactions and the single sender.
 * Pushing never blocks: when the queue is full the record is dropped and
 * logged.
 */
@Component
@Slf4j
public class Outbox {

    private final BlockingQueue<OutboxRecord> queue;
    private final int capacity;

    public Outbox(BotProperties properties) {
        this.capacity = properties.getOutbox().getCapacity();
        if (capacity < 1) {
            throw new IllegalArgumentException("bot.outbox.capacity must be positive, got " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueues a reaction for {@code serverId}. A {@code null} reaction is
     * nothing to send and is accepted.
     *
     * @return {@code false} if the record was dropped because the outbox is
     *         full
     */
    public boolean push(ServerId serverId, LibReaction reaction) {
        if (reaction == null) {
            return true;
        }
        if (!queue.offer(new OutboxRecord(serverId, reaction))) {
            log.error("[Outbox] Outbox is full ({} records), dropping message(s) to {}: {}", capacity, serverId,
                    reaction.messages());
            return false;
        }
        return true;
    }

    public OutboxRecord take() throws InterruptedException {
        return queue.take();
    }

    public OutboxRecord poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }
}
