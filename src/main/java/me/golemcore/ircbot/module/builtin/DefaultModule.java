package me.golemcore.ircbot.module.builtin;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import me.golemcore.ircbot.domain.model.AuthLevel;
import me.golemcore.ircbot.domain.model.BotCmdResult;
import me.golemcore.ircbot.domain.model.Reaction;
import me.golemcore.ircbot.infrastructure.config.BotProperties;
import me.golemcore.ircbot.module.api.BotCmdHandler;
import me.golemcore.ircbot.module.api.HandlerContext;
import me.golemcore.ircbot.module.api.Module;
import me.golemcore.ircbot.module.api.ModuleProvider;
import me.golemcore.ircbot.module.context.BotCommand;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Commands every bot has: channel membership, quitting, and help.
 */
@Component
@RequiredArgsConstructor
public class DefaultModule implements ModuleProvider {

    public static final String NAME = "default";

    private static final List<String> HELP_LISTS = List.of("commands", "lists");

    private final BotProperties properties;

    @Override
    public Module module() {
        return Module.builder(NAME)
                .command("join", "<channel>",
                        "Have the bot join the given channel.",
                        AuthLevel.ADMIN, BotCmdHandler.reacting(DefaultModule::join))
                .command("part", "{chan: '[channel]', msg: '[message]'}",
                        "Have the bot part from the given channel (defaults to the current channel), "
                                + "with an optional part message.",
                        AuthLevel.ADMIN, DefaultModule::part)
                .command("quit", "{msg: '[message]'}",
                        "Have the bot quit.",
                        AuthLevel.ADMIN, BotCmdHandler.reacting(DefaultModule::quit))
                .command("ping", "",
                        "Request a short message from the bot, typically for testing purposes.",
                        AuthLevel.PUBLIC, BotCmdHandler.reacting((context, argument) -> Reaction.reply("pong")))
                .command("source", "",
                        "Request information about the bot, such as the URL of a Web page about its software.",
                        AuthLevel.PUBLIC, BotCmdHandler.reacting(this::source))
                .command("help", "{cmd: '[command]', list: '[list name]'}",
                        "Request help with the bot's features, such as commands.",
                        AuthLevel.PUBLIC, this::help)
                .build();
    }

    private static Reaction join(HandlerContext context, JsonNode argument) {
        return Reaction.raw("JOIN " + argument.asText());
    }

    private static BotCmdResult part(HandlerContext context, JsonNode argument) {
        String channel = text(argument, "chan");
        String comment = text(argument, "msg");
        if (channel == null) {
            if (context.isPrivate()) {
                return BotCmdResult.argMissing1To1("channel");
            }
            channel = context.origin().target();
        }
        return BotCmdResult.ok(Reaction.raw("PART " + channel + (comment != null ? " :" + comment : "")));
    }

    private static Reaction quit(HandlerContext context, JsonNode argument) {
        return Reaction.quit(text(argument, "msg"));
    }

    private Reaction source(HandlerContext context, JsonNode argument) {
        BotProperties.FrameworkProperties framework = properties.getFramework();
        if (framework.getHomepage() == null || framework.getHomepage().isBlank()) {
            return Reaction.reply("This bot is built with " + framework.getName() + " v" + framework.getVersion()
                    + ".");
        }
        return Reaction.reply("<" + framework.getHomepage() + ">");
    }

    private BotCmdResult help(HandlerContext context, JsonNode argument) {
        String commandName = text(argument, "cmd");
        String listName = text(argument, "list");

        if (commandName != null && listName != null) {
            return BotCmdResult.ok(Reaction.msg("Please ask for help with one thing at a time."));
        }
        if (commandName != null) {
            return BotCmdResult.ok(commandHelp(context, commandName));
        }
        if (listName != null) {
            return BotCmdResult.ok(listHelp(context, listName));
        }

        List<String> lines = new ArrayList<>();
        lines.add("For help with a command named 'foo', try `help cmd: foo`.");
        lines.add("To see a list of all available commands, try `help list: commands`.");
        String homepage = properties.getFramework().getHomepage();
        if (homepage != null && !homepage.isBlank()) {
            lines.add("For this bot software's documentation, including an introduction to the command syntax, "
                    + "see <" + homepage + ">");
        }
        return BotCmdResult.ok(Reaction.msgs(lines));
    }

    private static Reaction commandHelp(HandlerContext context, String commandName) {
        Optional<BotCommand> found = context.registry().command(commandName);
        if (found.isEmpty()) {
            return Reaction.msg("Command \"" + commandName + "\" not found.");
        }
        BotCommand command = found.get();
        List<String> lines = new ArrayList<>();
        lines.add("= Help for command \"" + command.name() + "\":");
        lines.add("- [module \"" + command.provider().getName() + "\", auth level " + command.authLevel() + "]");
        lines.add(("- Syntax: " + command.name() + " " + command.usage()).trim());
        if (!command.help().isBlank()) {
            lines.add(command.help());
        }
        return Reaction.msgs(lines);
    }

    private static Reaction listHelp(HandlerContext context, String listName) {
        return switch (listName) {
            case "commands" -> Reaction.msg("Available commands: " + context.registry().commandNames());
            case "lists" -> Reaction.msg("Available lists: " + HELP_LISTS);
            default -> Reaction.msg("List \"" + listName + "\" not found. Available lists: " + HELP_LISTS);
        };
    }

    private static String text(JsonNode argument, String field) {
        JsonNode value = argument.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
