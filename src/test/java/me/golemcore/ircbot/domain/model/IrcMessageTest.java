package me.golemcore.ircbot.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IrcMessageTest {

    @Test
    void parse_readsPrefixCommandAndTrailing() {
        IrcMessage message = IrcMessage.parse(":alice!a@example.org PRIVMSG #golem :golembot: help cmd: ping\r\n");

        assertEquals("alice!a@example.org", message.prefix());
        assertEquals(IrcMessage.PRIVMSG, message.command());
        assertEquals(List.of("#golem", "golembot: help cmd: ping"), message.params());
        assertEquals("alice", message.parsedPrefix().nick());
    }

    @Test
    void parse_handlesMessagesWithoutPrefixOrTrailing() {
        IrcMessage ping = IrcMessage.parse("PING :irc.example.net");
        IrcMessage numeric = IrcMessage.parse(":irc.example.net 004 golembot irc.example.net ircd-2.0 iow biklmnopstv");

        assertNull(ping.prefix());
        assertEquals(List.of("irc.example.net"), ping.params());
        assertEquals("004", numeric.command());
        assertEquals(5, numeric.params().size());
    }

    @Test
    void parse_skipsTagsAndUppercasesCommand() {
        IrcMessage message = IrcMessage.parse("@time=2026-01-01T00:00:00Z :nick!u@h privmsg #c :hi");

        assertEquals("PRIVMSG", message.command());
        assertEquals(List.of("#c", "hi"), message.params());
    }

    @Test
    void parse_keepsEmptyTrailing() {
        assertEquals(List.of(""), IrcMessage.parse("QUIT :").params());
    }

    @Test
    void parse_rejectsLinesWithoutCommand() {
        assertThrows(IrcBotException.class, () -> IrcMessage.parse(""));
        assertThrows(IrcBotException.class, () -> IrcMessage.parse(":prefix.only"));
    }

    @Test
    void toWireString_putsColonBeforeLastParameter() {
        assertEquals("PRIVMSG #golem :hello there", IrcMessage.privmsg("#golem", "hello there").toWireString());
        assertEquals("USER bot 0 * :Real Name",
                IrcMessage.of(IrcMessage.USER, "bot", "0", "*", "Real Name").toWireString());
        assertEquals(":srv PONG :token", new IrcMessage("srv", "PONG", List.of("token")).toWireString());
    }

    @Test
    void wireLength_countsUtf8BytesAndTerminator() {
        // "PRIVMSG #c :é" is 13 characters and 14 bytes
        assertEquals(16, IrcMessage.privmsg("#c", "é").wireLength());
    }
}
