package me.golemcore.ircbot.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ircbot.domain.model.AuthLevel;
import me.golemcore.ircbot.domain.model.BotCmdResult;
import me.golemcore.ircbot.domain.model.MsgMetadata;
import me.golemcore.ircbot.domain.model.Reaction;
import me.golemcore.ircbot.module.api.FeatureRef;
import me.golemcore.ircbot.module.api.HandlerContext;
import me.golemcore.ircbot.module.api.ModuleFeature;
import me.golemcore.ircbot.module.context.Trigger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;

/**
 * Picks and runs the trigger reacting to a piece of text.
 *
 * <p>
 * Buckets are scanned from the highest priority down. The first bucket with at
 * least one matching trigger wins; one of its matching triggers is chosen
 * uniformly at random and lower buckets are never consulted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TriggerEngine {

    private final BotState state;
    private final HandlerInvoker handlerInvoker;

    /**
     * @return the handler's result, or empty when no trigger matched
     */
    public Optional<BotCmdResult> runAnyMatching(String text, MsgMetadata metadata) {
        return select(text).map(match -> run(match, metadata));
    }

    /**
     * Runs a selected trigger. Triggers have no authorization level, so a quit
     * they ask for is refused.
     */
    public BotCmdResult run(Match match, MsgMetadata metadata) {
        Trigger trigger = match.trigger();
        log.debug("[Triggers] Trigger {} of module {} matched", trigger.name(), trigger.provider().getName());

        HandlerContext context = new HandlerContext(state,
                new FeatureRef(ModuleFeature.Kind.TRIGGER, trigger.name(), trigger.provider()), metadata);
        BotCmdResult result = handlerInvoker.invoke(ModuleFeature.Kind.TRIGGER, trigger.name(),
                () -> trigger.handler().handle(context, match.captures()));
        if (result.isOk() && result.getReaction() instanceof Reaction.Quit quit) {
            return BotCmdResult.botErrMsg(String.format(
                    "Only commands at authorization level %s may tell the bot to quit, but the trigger \"%s\" "
                            + "from module \"%s\" has told the bot to quit with quit message %s.",
                    AuthLevel.maximum(), trigger.name(), trigger.provider().getName(),
                    describeQuitMessage(quit)));
        }
        return result;
    }

    /**
     * Chooses the trigger that would run for {@code text}, without running it.
     */
    public Optional<Match> select(String text) {
        for (List<Trigger> bucket : state.getRegistry().triggersByDescendingPriority()) {
            List<Match> matches = new ArrayList<>();
            for (Trigger trigger : bucket) {
                trigger.match(text).ifPresent(captures -> matches.add(new Match(trigger, captures)));
            }
            if (!matches.isEmpty()) {
                return Optional.of(state.withRandom(random -> matches.get(random.nextInt(matches.size()))));
            }
        }
        return Optional.empty();
    }

    static String describeQuitMessage(Reaction.Quit quit) {
        return quit.message() != null ? "\"" + quit.message() + "\"" : "(default)";
    }

    public record Match(Trigger trigger, MatchResult captures) {
    }
}
