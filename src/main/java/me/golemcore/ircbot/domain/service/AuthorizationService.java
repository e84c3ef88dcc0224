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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ircbot.domain.model.AdminMatchPolicy;
import me.golemcore.ircbot.domain.model.AuthLevel;
import me.golemcore.ircbot.domain.model.MsgPrefix;
import me.golemcore.ircbot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Decides whether a sender may use a command of a given authorization level.
 *
 * <p>
 * {@link AuthLevel#PUBLIC} always passes. {@link AuthLevel#ADMIN} requires the
 * sender to match one configured admin on every axis the
 * {@link AdminMatchPolicy} checks. An axis left unset in the admin entry
 * matches anything; a set axis requires the sender to have an equal value.
 * An entry that sets none of the checked axes is ignored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuthorizationService {

    private final BotProperties properties;

    @PostConstruct
    void warnAboutIgnoredAdmins() {
        AdminMatchPolicy policy = properties.getAdminMatchPolicy();
        for (int i = 0; i < properties.getAdmins().size(); i++) {
            if (!hasCheckedKey(properties.getAdmins().get(i), policy)) {
                log.warn("[Auth] Admins list entry {} has no keys checked by {}; ignoring.", i, policy);
            }
        }
    }

    public boolean isAuthorized(AuthLevel required, MsgPrefix sender) {
        return switch (required) {
            case PUBLIC -> true;
            case ADMIN -> isAdmin(sender);
        };
    }

    public boolean isAdmin(MsgPrefix sender) {
        AdminMatchPolicy policy = properties.getAdminMatchPolicy();
        for (BotProperties.AdminProperties admin : properties.getAdmins()) {
            if (hasCheckedKey(admin, policy) && matches(admin, sender, policy)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasCheckedKey(BotProperties.AdminProperties admin, AdminMatchPolicy policy) {
        return (policy.checksNick() && admin.getNick() != null)
                || (policy.checksUser() && admin.getUser() != null)
                || (policy.checksHost() && admin.getHost() != null);
    }

    private static boolean matches(BotProperties.AdminProperties admin, MsgPrefix sender,
            AdminMatchPolicy policy) {
        return (!policy.checksNick() || credentialMatches(sender.nick(), admin.getNick()))
                && (!policy.checksUser() || credentialMatches(sender.user(), admin.getUser()))
                && (!policy.checksHost() || credentialMatches(sender.host(), admin.getHost()));
    }

    private static boolean credentialMatches(String candidate, String control) {
        if (control == null) {
            return true;
        }
        return Objects.equals(candidate, control);
    }
}
