package me.golemcore.ircbot.domain.service;

import me.golemcore.ircbot.domain.model.ErrorReaction;
import me.golemcore.ircbot.domain.model.IrcBotException;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.LibReaction;
import me.golemcore.ircbot.domain.model.MsgDest;
import me.golemcore.ircbot.domain.model.MsgMetadata;
import me.golemcore.ircbot.domain.model.MsgPrefix;
import me.golemcore.ircbot.domain.model.Reaction;
import me.golemcore.ircbot.domain.model.ServerId;
import me.golemcore.ircbot.infrastructure.config.BotProperties;
import me.golemcore.ircbot.module.context.ModuleRegistry;
import me.golemcore.ircbot.port.outbound.IrcConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class ReactionResolverTest {

    private static final MsgPrefix ALICE = MsgPrefix.parse("alice!alice@example.org");

    private BotState state;
    private ReactionResolver resolver;
    private ServerId serverId;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.setNickname("golembot");
        properties.setUsername("golembot");
        state = new BotState(properties, new ModuleRegistry(new CommandArgParser()),
                error -> ErrorReaction.proceed(), new Random(0));
        serverId = ServerId.random();
        state.registerServer(serverId, mock(IrcConnection.class));
        // "golembot!golembot@" is 18 bytes, so the echoed prefix is 93 bytes long
        state.updateMsgPrefix(serverId, new MsgPrefix(null, null, "h".repeat(75)));
        resolver = new ReactionResolver(state);
    }

    @Test
    void lineBudget_subtractsPrefixCommandTargetAndPunctuation() {
        assertEquals(93, state.msgPrefixLength(serverId));
        assertEquals(400, resolver.lineBudget(serverId, "#test"));
    }

    @Test
    void resolve_wrapsLongChannelReplyWithAddresseeOnFirstLineOnly() {
        List<String> words = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            words.add("abcdefgh" + (char) ('a' + i % 26));
        }
        String text = String.join(" ", words) + "!";
        assertEquals(600, text.length());

        LibReaction reaction = resolver.resolve(channelMessage("#test"), Reaction.reply(text)).orElseThrow();
        List<IrcMessage> messages = reaction.messages();

        assertTrue(messages.size() > 1);
        assertTrue(messages.get(0).param(1).startsWith("alice: "));
        List<String> sentWords = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            IrcMessage message = messages.get(i);
            assertEquals(IrcMessage.PRIVMSG, message.command());
            assertEquals("#test", message.param(0));
            if (i > 0) {
                assertFalse(message.param(1).startsWith("alice: "));
            }
            assertTrue(LineWrapper.utf8Length(message.param(1)) <= 400);
            String echoed = ":" + state.msgPrefix(serverId).toEchoString() + " " + message.toWireString() + "\r\n";
            assertTrue(echoed.getBytes(StandardCharsets.UTF_8).length <= 512);
            sentWords.addAll(List.of(message.param(1).split(" ")));
        }
        List<String> expected = new ArrayList<>();
        expected.add("alice:");
        expected.addAll(List.of(text.split(" ")));
        assertEquals(expected, sentWords);
    }

    @Test
    void resolve_answersPrivateMessageToSenderWithoutAddressee() {
        LibReaction reaction = resolver.resolve(channelMessage("golembot"), Reaction.reply("hi")).orElseThrow();

        assertEquals(List.of(IrcMessage.privmsg("alice", "hi")), reaction.messages());
    }

    @Test
    void resolve_doesNotAddressPlainMessages() {
        LibReaction reaction = resolver.resolve(channelMessage("#test"), Reaction.msg("hello")).orElseThrow();

        assertEquals(List.of(IrcMessage.privmsg("#test", "hello")), reaction.messages());
    }

    @Test
    void resolve_wrapsEachEmbeddedLineSeparately() {
        LibReaction reaction = resolver.resolve(channelMessage("#test"), Reaction.reply("one\ntwo\r\n\nthree"))
                .orElseThrow();

        assertEquals(List.of(
                IrcMessage.privmsg("#test", "alice: one"),
                IrcMessage.privmsg("#test", "two"),
                IrcMessage.privmsg("#test", "three")), reaction.messages());
    }

    @Test
    void resolve_addressesEveryReplyOfReplies() {
        LibReaction reaction = resolver.resolve(channelMessage("#test"), Reaction.replies(List.of("a", "b")))
                .orElseThrow();

        assertEquals(List.of(
                IrcMessage.privmsg("#test", "alice: a"),
                IrcMessage.privmsg("#test", "alice: b")), reaction.messages());
    }

    @Test
    void resolve_parsesRawMessageVerbatim() {
        LibReaction reaction = resolver.resolve(channelMessage("#test"), Reaction.raw("JOIN #golem"))
                .orElseThrow();

        assertEquals(List.of(IrcMessage.of("JOIN", "#golem")), reaction.messages());
    }

    @Test
    void resolve_usesDefaultQuitMessage() {
        LibReaction reaction = resolver.resolve(channelMessage("#test"), Reaction.quit(null)).orElseThrow();

        assertEquals(List.of(IrcMessage.quit("Built with golemcore-ircbot v0.1.0")), reaction.messages());
    }

    @Test
    void resolve_returnsEmptyForNoneAndEmptyText() {
        assertEquals(Optional.empty(), resolver.resolve(channelMessage("#test"), Reaction.none()));
        assertEquals(Optional.empty(), resolver.resolve(channelMessage("#test"), Reaction.msg("")));
    }

    @Test
    void resolve_isIdempotentForUnchangedState() {
        Reaction reaction = Reaction.reply("x ".repeat(500));

        Optional<LibReaction> first = resolver.resolve(channelMessage("#test"), reaction);
        Optional<LibReaction> second = resolver.resolve(channelMessage("#test"), reaction);

        assertEquals(first, second);
    }

    @Test
    void resolve_rejectsUnexpandedBotCmd() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(channelMessage("#test"), Reaction.botCmd("ping")));
    }

    private MsgMetadata channelMessage(String target) {
        return new MsgMetadata(new MsgDest(serverId, target), ALICE);
    }

    @Test
    void resolve_failsWithTypedErrorWhenTargetLeavesNoRoom() {
        String longChannel = "#" + "c".repeat(420);

        IrcBotException error = assertThrows(IrcBotException.class,
                () -> resolver.resolve(channelMessage(longChannel), Reaction.reply("hello")));

        assertEquals(IrcBotException.Kind.LINE_BUDGET_EXHAUSTED, error.getKind());
    }
}
