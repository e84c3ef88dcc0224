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

import me.golemcore.ircbot.domain.service.ErrorHandler;
import me.golemcore.ircbot.domain.service.LoggingErrorHandler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration of the bot core. Import it from the application that
 * provides the connections.
 */
@Configuration
@EnableConfigurationProperties(BotProperties.class)
@ComponentScan(basePackages = {
        "me.golemcore.ircbot.domain",
        "me.golemcore.ircbot.module",
        "me.golemcore.ircbot.outbox"
})
public class IrcBotConfiguration {

    @Bean(name = "ircDispatchExecutor", destroyMethod = "shutdown")
    public ExecutorService ircDispatchExecutor(BotProperties properties) {
        int maxWorkers = properties.getDispatch().getMaxWorkers();
        ThreadFactory threadFactory = dispatchThreadFactory();
        return maxWorkers > 0
                ? Executors.newFixedThreadPool(maxWorkers, threadFactory)
                : Executors.newCachedThreadPool(threadFactory);
    }

    @Bean(name = "botRandom")
    public Random botRandom() {
        return new Random();
    }

    @Bean
    @ConditionalOnMissingBean(ErrorHandler.class)
    public ErrorHandler errorHandler() {
        return new LoggingErrorHandler();
    }

    private static ThreadFactory dispatchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "irc-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
