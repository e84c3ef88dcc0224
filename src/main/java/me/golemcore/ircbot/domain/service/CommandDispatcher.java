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
import me.golemcore.ircbot.domain.model.IrcBotException;
import me.golemcore.ircbot.domain.model.MsgMetadata;
import me.golemcore.ircbot.domain.model.Reaction;
import me.golemcore.ircbot.module.api.FeatureRef;
import me.golemcore.ircbot.module.api.HandlerContext;
import me.golemcore.ircbot.module.api.ModuleFeature;
import me.golemcore.ircbot.module.context.BotCommand;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a command line into a reaction.
 *
 * <p>
 * The first word names a command. If no command has that name the whole line
 * goes to the trigger engine, and if no trigger matches either the sender is
 * told the command is unknown. Error results become apologetic replies.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CommandDispatcher {

    static final int MAX_BOT_CMD_DEPTH = 8;

    private final BotState state;
    private final AuthorizationService authorizationService;
    private final CommandArgParser argParser;
    private final TriggerEngine triggerEngine;
    private final HandlerInvoker handlerInvoker;

    /**
     * Runs the named command.
     *
     * @return the result, or empty when no such command exists
     */
    public Optional<BotCmdResult> runCommand(String name, String argText, MsgMetadata metadata) {
        return state.getRegistry().command(name).map(command -> run(command, argText, metadata));
    }

    /**
     * Checks authorization and the argument, then runs the handler. A quit
     * from a command below the maximum authorization level is refused.
     */
    public BotCmdResult run(BotCommand command, String argText, MsgMetadata metadata) {
        if (!authorizationService.isAuthorized(command.authLevel(), metadata.prefix())) {
            log.debug("[Dispatch] {} is not authorized to use {}", metadata.prefix().toWireString(), command.name());
            return BotCmdResult.unauthorized();
        }

        CommandArgParser.ParsedArgument argument = argParser.parse(command.usageSchema(), argText);
        if (!argument.isValid()) {
            log.debug("[Dispatch] Rejected argument of {}: {}", command.name(), argument.failure().getKind());
            return argument.failure();
        }

        HandlerContext context = new HandlerContext(state,
                new FeatureRef(ModuleFeature.Kind.COMMAND, command.name(), command.provider()), metadata);
        BotCmdResult result = handlerInvoker.invoke(ModuleFeature.Kind.COMMAND, command.name(),
                () -> command.handler().handle(context, argument.value()));

        if (result.isOk() && result.getReaction() instanceof Reaction.Quit quit
                && !command.authLevel().isMaximum()) {
            return BotCmdResult.botErrMsg(String.format(
                    "Only commands at authorization level %s may tell the bot to quit, but the command \"%s\" "
                            + "from module \"%s\", at authorization level %s, has told the bot to quit "
                            + "with quit message %s.",
                    AuthLevel.maximum(), command.name(), command.provider().getName(), command.authLevel(),
                    TriggerEngine.describeQuitMessage(quit)));
        }
        return result;
    }

    /**
     * Resolves a full command line. {@link Reaction.BotCmd} results are
     * dispatched again with the same metadata.
     */
    public Reaction commandReaction(MsgMetadata metadata, String commandLine) {
        Reaction reaction = dispatchOnce(metadata, commandLine);
        int depth = 0;
        while (reaction instanceof Reaction.BotCmd botCmd) {
            if (++depth > MAX_BOT_CMD_DEPTH) {
                IrcBotException error = IrcBotException.botCmdDepthExceeded(MAX_BOT_CMD_DEPTH,
                        botCmd.commandLine());
                return toReaction(commandLine, "", BotCmdResult.libErr(error));
            }
            reaction = dispatchOnce(metadata, botCmd.commandLine());
        }
        return reaction;
    }

    private Reaction dispatchOnce(MsgMetadata metadata, String commandLine) {
        String[] parts = Addressing.splitCommand(commandLine);
        String name = parts[0];
        Optional<BotCommand> command = state.getRegistry().command(name);
        if (command.isPresent()) {
            return toReaction(name, command.get().usage(), run(command.get(), parts[1], metadata));
        }

        Optional<TriggerEngine.Match> match = triggerEngine.select(commandLine);
        if (match.isPresent()) {
            return toReaction(match.get().trigger().name(), "", triggerEngine.run(match.get(), metadata));
        }

        log.debug("[Dispatch] Unknown command {}", name);
        return Reaction.reply("Unknown command \"" + name + "\"; apologies.");
    }

    /**
     * User-facing form of a result. {@code OK} passes its reaction through.
     */
    public Reaction toReaction(String featureName, String usage, BotCmdResult result) {
        return switch (result.getKind()) {
            case OK -> result.getReaction();
            case UNAUTHORIZED -> Reaction.reply("My apologies, but you do not appear to have sufficient "
                    + "authority to use my \"" + featureName + "\" command.");
            case PARAM_UNAUTHORIZED -> Reaction.reply("My apologies, but you do not appear to have sufficient "
                    + "authority to use the \"" + result.getDetail() + "\" parameter of my \"" + featureName
                    + "\" command.");
            case SYNTAX_ERR -> Reaction.reply(("Syntax: " + featureName + " " + usage).trim());
            case ARG_MISSING -> Reaction.reply("Syntax error: For command \"" + featureName + "\", the argument \""
                    + result.getDetail() + "\" is required, but it was not given.");
            case ARG_MISSING_1TO1 -> Reaction.reply("Syntax error: When command \"" + featureName
                    + "\" is used outside of a channel, the argument \"" + result.getDetail()
                    + "\" is required, but it was not given.");
            case LIB_ERR -> {
                if (result.getError().getKind() != IrcBotException.Kind.HANDLER_PANIC) {
                    log.error("[Dispatch] {} failed: {}", featureName, result.getDetail(), result.getError());
                }
                yield Reaction.reply("Error: " + result.getDetail());
            }
            case USER_ERR_MSG -> {
                log.error("[Dispatch] {} reported a user error: {}", featureName, result.getDetail());
                yield Reaction.reply("User error: " + result.getDetail());
            }
            case BOT_ERR_MSG -> {
                log.error("[Dispatch] {} reported an internal error: {}", featureName, result.getDetail());
                yield Reaction.reply("Internal error: " + result.getDetail());
            }
        };
    }
}
