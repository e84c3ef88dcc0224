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
 * Outcome of running a command or trigger handler. Only {@link Kind#OK}
 * carries a reaction; the other kinds are turned into user-facing text by
 * the dispatcher.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BotCmdResult {

    public enum Kind {
        OK,
        UNAUTHORIZED,
        PARAM_UNAUTHORIZED,
        SYNTAX_ERR,
        ARG_MISSING,
        ARG_MISSING_1TO1,
        LIB_ERR,
        USER_ERR_MSG,
        BOT_ERR_MSG
    }

    Kind kind;
    Reaction reaction;
    /** Parameter name or message text, depending on the kind. */
    String detail;
    IrcBotException error;

    public static BotCmdResult ok(Reaction reaction) {
        return new BotCmdResult(Kind.OK, reaction != null ? reaction : Reaction.none(), null, null);
    }

    public static BotCmdResult unauthorized() {
        return new BotCmdResult(Kind.UNAUTHORIZED, null, null, null);
    }

    public static BotCmdResult paramUnauthorized(String param) {
        return new BotCmdResult(Kind.PARAM_UNAUTHORIZED, null, param, null);
    }

    public static BotCmdResult syntaxErr() {
        return new BotCmdResult(Kind.SYNTAX_ERR, null, null, null);
    }

    public static BotCmdResult argMissing(String arg) {
        return new BotCmdResult(Kind.ARG_MISSING, null, arg, null);
    }

    /**
     * The argument may only be omitted inside a channel.
     */
    public static BotCmdResult argMissing1To1(String arg) {
        return new BotCmdResult(Kind.ARG_MISSING_1TO1, null, arg, null);
    }

    public static BotCmdResult libErr(IrcBotException error) {
        return new BotCmdResult(Kind.LIB_ERR, null, error.getMessage(), error);
    }

    public static BotCmdResult userErrMsg(String message) {
        return new BotCmdResult(Kind.USER_ERR_MSG, null, message, null);
    }

    public static BotCmdResult botErrMsg(String message) {
        return new BotCmdResult(Kind.BOT_ERR_MSG, null, message, null);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }
}
