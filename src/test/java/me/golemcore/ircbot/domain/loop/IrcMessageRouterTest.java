package me.golemcore.ircbot.domain.loop;

import me.golemcore.ircbot.domain.model.ErrorReaction;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.MsgDest;
import me.golemcore.ircbot.domain.model.MsgMetadata;
import me.golemcore.ircbot.domain.model.MsgPrefix;
import me.golemcore.ircbot.domain.model.OutboxRecord;
import me.golemcore.ircbot.domain.model.ServerId;
import me.golemcore.ircbot.domain.service.BotState;
import me.golemcore.ircbot.domain.service.CommandArgParser;
import me.golemcore.ircbot.domain.service.ErrorHandler;
import me.golemcore.ircbot.domain.service.ReactionResolver;
import me.golemcore.ircbot.infrastructure.config.BotProperties;
import me.golemcore.ircbot.module.context.ModuleRegistry;
import me.golemcore.ircbot.outbox.Outbox;
import me.golemcore.ircbot.port.outbound.IrcConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IrcMessageRouterTest {

    private ErrorHandler errorHandler;
    private BotState state;
    private Outbox outbox;
    private DispatchCoordinator dispatchCoordinator;
    private IrcMessageRouter router;
    private ServerId serverId;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.setNickname("golembot");
        properties.setUsername("golembot");
        errorHandler = mock(ErrorHandler.class);
        when(errorHandler.handle(any())).thenReturn(ErrorReaction.proceed());
        state = new BotState(properties, new ModuleRegistry(new CommandArgParser()), errorHandler, new Random(0));
        outbox = new Outbox(properties);
        dispatchCoordinator = mock(DispatchCoordinator.class);
        router = new IrcMessageRouter(state, dispatchCoordinator, new ReactionResolver(state),
                new PrefixRefreshScheduler(state, outbox), outbox);
        serverId = ServerId.random();
        state.registerServer(serverId, mock(IrcConnection.class));
    }

    @Test
    void handle_answersBareAddressWithYes() throws InterruptedException {
        router.handle(serverId, IrcMessage.parse(":alice!alice@example.org PRIVMSG #golem :golembot:"));

        List<IrcMessage> sent = nextMessages();
        assertEquals(List.of(IrcMessage.privmsg("#golem", "alice: Yes?")), sent);
        verify(dispatchCoordinator, never()).dispatch(any(), anyString());
    }

    @Test
    void handle_dispatchesAddressedCommandLine() {
        router.handle(serverId, IrcMessage.parse(":alice!alice@example.org PRIVMSG #golem :golembot, help  ping "));

        MsgMetadata expected = new MsgMetadata(new MsgDest(serverId, "#golem"),
                MsgPrefix.parse("alice!alice@example.org"));
        verify(dispatchCoordinator).dispatch(expected, "help  ping");
    }

    @Test
    void handle_dispatchesPrivateMessageWithoutNick() {
        router.handle(serverId, IrcMessage.parse(":alice!alice@example.org PRIVMSG golembot :ping"));

        verify(dispatchCoordinator).dispatch(any(), eq("ping"));
    }

    @Test
    void handle_ignoresMessageNotAddressedToBot() throws InterruptedException {
        router.handle(serverId, IrcMessage.parse(":alice!alice@example.org PRIVMSG #golem :golembotty: hi"));
        router.handle(serverId, IrcMessage.parse(":alice!alice@example.org PRIVMSG #golem :hello world"));

        verify(dispatchCoordinator, never()).dispatch(any(), anyString());
        assertNull(outbox.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void handle_storesOwnPrefixFromEchoedSentinel() {
        router.handle(serverId, IrcMessage.parse(
                ":golembot!~golembot@gateway.example.net PRIVMSG golembot :"
                        + PrefixRefreshScheduler.UPDATE_MSG_PREFIX_SENTINEL));

        assertEquals(new MsgPrefix("golembot", "~golembot", "gateway.example.net"), state.msgPrefix(serverId));
        verify(dispatchCoordinator, never()).dispatch(any(), anyString());
    }

    @Test
    void handle_requestsPrefixRefreshOnWelcomeInfo() throws InterruptedException {
        router.handle(serverId, IrcMessage.parse(":irc.example.net 004 golembot irc.example.net ircd-2.0 iow bik"));

        assertEquals(List.of(IrcMessage.privmsg("golembot", PrefixRefreshScheduler.UPDATE_MSG_PREFIX_SENTINEL)),
                nextMessages());
    }

    @Test
    void handle_answersPing() throws InterruptedException {
        router.handle(serverId, IrcMessage.parse("PING :irc.example.net"));

        assertEquals(List.of(IrcMessage.pong("irc.example.net")), nextMessages());
    }

    @Test
    void handle_tracksOwnNickChange() {
        router.handle(serverId, IrcMessage.parse(":golembot!golembot@host NICK :golemcore"));
        router.handle(serverId, IrcMessage.parse(":alice!alice@host NICK :alicia"));

        assertEquals("golemcore", state.nick(serverId));
    }

    @Test
    void handle_passesErrorsToErrorHandler() throws InterruptedException {
        when(errorHandler.handle(any())).thenReturn(ErrorReaction.quit("lost track"));

        router.handle(ServerId.random(), IrcMessage.parse(":alice!alice@host PRIVMSG #golem :golembot: ping"));

        OutboxRecord outboxRecord = outbox.poll(1, TimeUnit.SECONDS);
        assertEquals(List.of(IrcMessage.quit("lost track")), outboxRecord.reaction().messages());
        verify(dispatchCoordinator, never()).dispatch(any(), anyString());
    }

    private List<IrcMessage> nextMessages() throws InterruptedException {
        OutboxRecord outboxRecord = outbox.poll(1, TimeUnit.SECONDS);
        assertEquals(serverId, outboxRecord.serverId());
        return outboxRecord.reaction().messages();
    }
}
