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

import me.golemcore.ircbot.domain.model.AuthLevel;
import me.golemcore.ircbot.domain.model.Reaction;
import me.golemcore.ircbot.module.api.BotCmdHandler;
import me.golemcore.ircbot.module.api.Module;
import me.golemcore.ircbot.module.api.ModuleProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Diagnostic commands for line wrapping and handler failure isolation.
 * Enabled with {@code bot.modules.test-enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "bot.modules", name = "test-enabled", havingValue = "true")
public class TestModule implements ModuleProvider {

    public static final String NAME = "test";

    static final String LOREM_IPSUM_TEXT = "Lorem ipsum dolor sit amet, consectetur adipiscing elit. Integer et "
            + "tincidunt nibh. Nullam aliquet imperdiet cursus. Duis at turpis mollis, iaculis quam sed, efficitur "
            + "arcu. Sed vel massa sit amet magna efficitur hendrerit. Donec auctor auctor ligula nec semper. Nulla "
            + "a odio suscipit, suscipit velit in, ullamcorper velit. In bibendum pulvinar ipsum. Fusce elementum "
            + "maximus mattis. Donec sed mauris nec ante eleifend dapibus non faucibus massa. Vivamus a auctor "
            + "ligula. Cras hendrerit, velit sit amet sagittis placerat, elit elit feugiat quam, vel aliquet ligula "
            + "elit sit amet nibh. Fusce dignissim, orci vitae sodales ornare, lacus risus facilisis sem, a "
            + "imperdiet lectus massa at velit. Etiam sed magna congue, pulvinar diam quis, facilisis risus. Sed "
            + "semper, lectus vulputate luctus fermentum, quam lacus consectetur arcu, ac mollis ipsum metus vel "
            + "nunc. Ut posuere arcu enim, id dictum arcu sagittis in. Mauris a lectus nec ligula eleifend rutrum. "
            + "Class aptent taciti sociosqu ad litora torquent per conubia massa nunc.";

    @Override
    public Module module() {
        return Module.builder(NAME)
                .command("test-line-wrap", "",
                        "Request a long message from the bot, to test its line-wrapping function.",
                        AuthLevel.ADMIN,
                        BotCmdHandler.reacting((context, argument) -> Reaction.reply(LOREM_IPSUM_TEXT)))
                .command("test-panic-catching", "",
                        "This command's handler fails on purpose, to test how handler failures are contained.",
                        AuthLevel.ADMIN, (context, argument) -> {
                            throw new IllegalStateException("Failing for testing purposes....");
                        })
                .build();
    }
}
