package me.golemcore.ircbot.domain.model;

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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Decision of the error handler: keep running, or quit with a message.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ErrorReaction {

    private static final ErrorReaction PROCEED = new ErrorReaction(false, null);

    boolean quit;
    String quitMessage;

    public static ErrorReaction proceed() {
        return PROCEED;
    }

    public static ErrorReaction quit(String message) {
        return new ErrorReaction(true, message);
    }
}
