package me.golemcore.ircbot.domain.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class AddressingTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "#golem   | golembot: ping   | true",
            "#golem   | golembot, ping   | true",
            "#golem   | golembot         | true",
            "golembot | ping             | true",
            "#golem   | golembot ping    | false",
            "#golem   | golembots: ping  | false",
            "#golem   | hey golembot: hi | false",
            "#golem   | GOLEMBOT: ping   | false"
    })
    void isAddressedTo_followsNickAndSeparatorRules(String target, String text, boolean expected) {
        assertEquals(expected, Addressing.isAddressedTo("golembot", target, text));
    }

    @Test
    void commandLine_stripsNickAndSeparators() {
        assertEquals("help cmd: ping", Addressing.commandLine("golembot", "golembot:, help cmd: ping "));
        assertEquals("ping", Addressing.commandLine("golembot", "ping"));
        assertEquals("", Addressing.commandLine("golembot", "golembot:"));
        assertEquals("", Addressing.commandLine("golembot", "golembot"));
    }

    @Test
    void splitCommand_separatesNameFromArgument() {
        assertArrayEquals(new String[] {"help", "cmd: ping"}, Addressing.splitCommand("help   cmd: ping"));
        assertArrayEquals(new String[] {"ping", ""}, Addressing.splitCommand("  ping "));
        assertArrayEquals(new String[] {"join", "#golem"}, Addressing.splitCommand("join\t#golem"));
    }
}
