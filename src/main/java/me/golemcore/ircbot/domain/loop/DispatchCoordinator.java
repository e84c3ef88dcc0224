package me.golemcore.ircbot.domain.loop;

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
import me.golemcore.ircbot.domain.model.IrcBotException;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.LibReaction;
import me.golemcore.ircbot.domain.model.MsgMetadata;
import me.golemcore.ircbot.domain.model.Reaction;
import me.golemcore.ircbot.domain.service.CommandDispatcher;
import me.golemcore.ircbot.domain.service.ReactionResolver;
import me.golemcore.ircbot.outbox.Outbox;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs each addressed command line on a dispatch worker and pushes the
 * resolved reaction onto the outbox. Workers finish in any order.
 */
@Service
@Slf4j
public class DispatchCoordinator {

    private final ExecutorService dispatchExecutor;
    private final CommandDispatcher commandDispatcher;
    private final ReactionResolver reactionResolver;
    private final Outbox outbox;

    public DispatchCoordinator(@Qualifier("ircDispatchExecutor") ExecutorService dispatchExecutor,
            CommandDispatcher commandDispatcher, ReactionResolver reactionResolver, Outbox outbox) {
        this.dispatchExecutor = dispatchExecutor;
        this.commandDispatcher = commandDispatcher;
        this.reactionResolver = reactionResolver;
        this.outbox = outbox;
    }

    public Future<?> dispatch(MsgMetadata metadata, String commandLine) {
        try {
            return dispatchExecutor.submit(() -> process(metadata, commandLine));
        } catch (RejectedExecutionException e) {
            log.warn("[Dispatch] Dispatch executor rejected command line from {}", metadata.prefix().nick());
            return CompletableFuture.completedFuture(null);
        }
    }

    void process(MsgMetadata metadata, String commandLine) {
        try {
            Reaction reaction = commandDispatcher.commandReaction(metadata, commandLine);
            reactionResolver.resolve(metadata, reaction).ifPresent(r -> outbox.push(metadata.serverId(), r));
        } catch (IrcBotException e) {
            log.error("[Dispatch] Failed to handle command line from {}: {}", metadata.prefix().nick(),
                    e.getMessage(), e);
            reportFailure(metadata, e);
        } catch (Exception e) { // NOSONAR - must not kill dispatch worker
            log.error("[Dispatch] Unexpected failure while handling command line from {}",
                    metadata.prefix().nick(), e);
        } catch (Error e) {
            log.error("[Dispatch] Fatal error while handling command line from {}", metadata.prefix().nick(), e);
            throw e;
        }
    }

    private void reportFailure(MsgMetadata metadata, IrcBotException failure) {
        String target = fallbackTarget(metadata);
        try {
            List<IrcMessage> lines = reactionResolver.composeLines(metadata.serverId(), target, null,
                    "Encountered error while trying to handle command: " + failure.getMessage());
            outbox.push(metadata.serverId(), LibReaction.ofAll(lines));
        } catch (IrcBotException e) {
            log.error("[Dispatch] Could not report the failure to {} on {}: {}", target, metadata.serverId(),
                    e.getMessage());
        }
    }

    private static String fallbackTarget(MsgMetadata metadata) {
        String target = metadata.target();
        boolean channel = !target.isEmpty() && "#&+!".indexOf(target.charAt(0)) >= 0;
        if (!channel && metadata.prefix().nick() != null) {
            return metadata.prefix().nick();
        }
        return target;
    }
}
