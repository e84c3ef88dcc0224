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

import lombok.Getter;

/**
 * Failure raised by the bot core. The {@link Kind} tells the error handler
 * what went wrong without parsing the message.
 */
@Getter
public class IrcBotException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        MODULE_REGISTRY_CLASH,
        MODULE_FEATURE_REGISTRY_CLASH,
        MODULE_LOAD_FAILED,
        INVALID_FEATURE,
        HANDLER_PANIC,
        UNKNOWN_SERVER,
        NICKNAME_UNKNOWN,
        MSG_PARSE,
        SEND_FAILED,
        BOT_CMD_DEPTH_EXCEEDED,
        LINE_BUDGET_EXHAUSTED,
        CONFIG
    }

    private final Kind kind;

    public IrcBotException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public IrcBotException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static IrcBotException moduleRegistryClash(String existingModule, String newModule) {
        return new IrcBotException(Kind.MODULE_REGISTRY_CLASH,
                "A module named \"" + newModule + "\" is already loaded (" + existingModule + ")");
    }

    public static IrcBotException featureRegistryClash(String featureKind, String featureName,
            String existingModule, String newModule) {
        return new IrcBotException(Kind.MODULE_FEATURE_REGISTRY_CLASH,
                "The " + featureKind + " \"" + featureName + "\" of module \"" + newModule
                        + "\" clashes with the one already provided by module \"" + existingModule + "\"");
    }

    public static IrcBotException moduleLoadFailed(String module, Throwable cause) {
        return new IrcBotException(Kind.MODULE_LOAD_FAILED,
                "On-load handler of module \"" + module + "\" failed: " + cause.getMessage(), cause);
    }

    public static IrcBotException invalidFeature(String module, String feature, String reason) {
        return new IrcBotException(Kind.INVALID_FEATURE,
                "Feature \"" + feature + "\" of module \"" + module + "\" is invalid: " + reason);
    }

    public static IrcBotException handlerPanic(String featureKind, String featureName, Throwable cause) {
        return new IrcBotException(Kind.HANDLER_PANIC,
                "The handler of the " + featureKind + " \"" + featureName + "\" failed unexpectedly", cause);
    }

    public static IrcBotException unknownServer(ServerId serverId) {
        return new IrcBotException(Kind.UNKNOWN_SERVER, "Unknown server " + serverId);
    }

    public static IrcBotException nicknameUnknown(ServerId serverId) {
        return new IrcBotException(Kind.NICKNAME_UNKNOWN, "Own nickname is not known for " + serverId);
    }

    public static IrcBotException msgParse(String line, String reason) {
        return new IrcBotException(Kind.MSG_PARSE, "Could not parse IRC line \"" + line + "\": " + reason);
    }

    public static IrcBotException sendFailed(ServerId serverId, Throwable cause) {
        return new IrcBotException(Kind.SEND_FAILED,
                "Failed to send to " + serverId + ": " + cause.getMessage(), cause);
    }

    public static IrcBotException botCmdDepthExceeded(int depth, String commandLine) {
        return new IrcBotException(Kind.BOT_CMD_DEPTH_EXCEEDED,
                "Command re-dispatch nested deeper than " + depth + " levels at \"" + commandLine + "\"");
    }

    public static IrcBotException lineBudgetExhausted(String target, int budget) {
        return new IrcBotException(Kind.LINE_BUDGET_EXHAUSTED,
                "No room left for text in a message to \"" + target + "\" (" + budget + " bytes)");
    }

    public static IrcBotException config(String message) {
        return new IrcBotException(Kind.CONFIG, message);
    }
}
