package me.golemcore.ircbot.infrastructure.config;

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

import lombok.Data;
import me.golemcore.ircbot.domain.model.AdminMatchPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bot settings bound from the {@code bot.*} properties of the embedding
 * application.
 */
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String nickname = "golembot";
    private String username = "golembot";
    private String realname = "GolemCore IRC bot";

    /** Appended to the sender's nick in front of replies. */
    private String addresseeSuffix = ": ";

    private List<AdminProperties> admins = new ArrayList<>();
    private AdminMatchPolicy adminMatchPolicy = AdminMatchPolicy.NICK_USER_HOST;

    /** How often the bot re-reads its own prefix from the server. */
    private Duration prefixRefreshInterval = Duration.ofMinutes(10);

    private OutboxProperties outbox = new OutboxProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private FrameworkProperties framework = new FrameworkProperties();
    private ModulesProperties modules = new ModulesProperties();

    /**
     * One configured administrator. Unset fields match any sender.
     */
    @Data
    public static class AdminProperties {
        private String nick;
        private String user;
        private String host;
    }

    @Data
    public static class OutboxProperties {
        private int capacity = 1024;
    }

    @Data
    public static class DispatchProperties {
        /** 0 starts a short-lived thread per message, otherwise a fixed pool. */
        private int maxWorkers = 0;
    }

    @Data
    public static class FrameworkProperties {
        private String name = "golemcore-ircbot";
        private String version = "0.1.0";
        /** Shown by the source command and in the default quit message when set. */
        private String homepage;
    }

    @Data
    public static class ModulesProperties {
        private boolean testEnabled = false;
    }

    public String defaultQuitMessage() {
        String builtWith = framework.getHomepage() != null && !framework.getHomepage().isBlank()
                ? framework.getHomepage()
                : framework.getName();
        return "Built with " + builtWith + " v" + framework.getVersion();
    }
}
