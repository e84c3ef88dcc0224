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
import me.golemcore.ircbot.domain.model.ErrorReaction;
import me.golemcore.ircbot.domain.model.IrcBotException;

/**
 * Logs the error and keeps the bot running.
 */
@Slf4j
public class LoggingErrorHandler implements ErrorHandler {

    @Override
    public ErrorReaction handle(IrcBotException error) {
        log.error("[Errors] {}: {}", error.getKind(), error.getMessage(), error.getCause());
        return ErrorReaction.proceed();
    }
}
