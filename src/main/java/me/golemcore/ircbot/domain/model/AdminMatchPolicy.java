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

/**
 * Which identity fields of a sender are compared against a configured admin
 * entry.
 */
public enum AdminMatchPolicy {
    NICK_ONLY(true, false, false),
    USER_ONLY(false, true, false),
    NICK_AND_USER(true, true, false),
    NICK_USER_HOST(true, true, true);

    private final boolean checkNick;
    private final boolean checkUser;
    private final boolean checkHost;

    AdminMatchPolicy(boolean checkNick, boolean checkUser, boolean checkHost) {
        this.checkNick = checkNick;
        this.checkUser = checkUser;
        this.checkHost = checkHost;
    }

    public boolean checksNick() {
        return checkNick;
    }

    public boolean checksUser() {
        return checkUser;
    }

    public boolean checksHost() {
        return checkHost;
    }
}
