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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.ircbot.domain.model.BotCmdResult;
import me.golemcore.ircbot.domain.model.IrcBotException;
import me.golemcore.ircbot.module.api.ModuleFeature;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs module handlers. Anything a handler throws, errors included, is
 * logged once here and returned as a {@code LIB_ERR} result of kind
 * {@code HANDLER_PANIC}.
 */
@Component
@Slf4j
public class HandlerInvoker {

    public BotCmdResult invoke(ModuleFeature.Kind kind, String featureName, Supplier<BotCmdResult> handler) {
        BotCmdResult result;
        try {
            result = handler.get();
        } catch (StackOverflowError e) {
            log.error("[Dispatch] Handler panic in {} {}: stack overflow", kind.label(), featureName);
            return BotCmdResult.libErr(IrcBotException.handlerPanic(kind.label(), featureName, e));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) { // NOSONAR - a failing handler must not kill the dispatch worker
            log.error("[Dispatch] Handler panic in {} {}", kind.label(), featureName, e);
            return BotCmdResult.libErr(IrcBotException.handlerPanic(kind.label(), featureName, e));
        }
        if (result == null) {
            log.warn("[Dispatch] Handler of {} {} returned no result", kind.label(), featureName);
            return BotCmdResult.ok(null);
        }
        return result;
    }
}
