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

/**
 * Rules for recognizing a message addressed to the bot and extracting the
 * command line from it.
 */
public final class Addressing {

    private Addressing() {
    }

    /**
     * A message is addressed to the bot when it was sent to the bot's nick,
     * when its text is the nick, or when the text starts with the nick
     * immediately followed by {@code ':'} or {@code ','}.
     */
    public static boolean isAddressedTo(String nick, String target, String text) {
        if (target.equals(nick) || text.equals(nick)) {
            return true;
        }
        return text.startsWith(nick) && text.length() > nick.length()
                && isAddressSeparator(text.charAt(nick.length()));
    }

    /**
     * Strips a leading nick and the separators after it, then trims.
     */
    public static String commandLine(String nick, String text) {
        String rest = text.startsWith(nick) ? text.substring(nick.length()) : text;
        int start = 0;
        while (start < rest.length() && isAddressSeparator(rest.charAt(start))) {
            start++;
        }
        return rest.substring(start).trim();
    }

    /**
     * Splits a command line at its first whitespace into name and argument
     * text. The argument is empty when there is none.
     */
    public static String[] splitCommand(String commandLine) {
        String line = commandLine.trim();
        for (int i = 0; i < line.length(); i++) {
            if (Character.isWhitespace(line.charAt(i))) {
                return new String[] {line.substring(0, i), line.substring(i + 1).trim()};
            }
        }
        return new String[] {line, ""};
    }

    private static boolean isAddressSeparator(char c) {
        return c == ':' || c == ',';
    }
}
