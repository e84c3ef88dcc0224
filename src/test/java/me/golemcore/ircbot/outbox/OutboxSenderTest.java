package me.golemcore.ircbot.outbox;

import me.golemcore.ircbot.domain.model.ErrorReaction;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.LibReaction;
import me.golemcore.ircbot.domain.model.OutboxRecord;
import me.golemcore.ircbot.domain.model.ServerId;
import me.golemcore.ircbot.domain.service.BotState;
import me.golemcore.ircbot.domain.service.CommandArgParser;
import me.golemcore.ircbot.domain.service.ErrorHandler;
import me.golemcore.ircbot.infrastructure.config.BotProperties;
import me.golemcore.ircbot.module.context.ModuleRegistry;
import me.golemcore.ircbot.port.outbound.IrcConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboxSenderTest {

    private ErrorHandler errorHandler;
    private BotState state;
    private Outbox outbox;
    private ApplicationEventPublisher eventPublisher;
    private IrcConnection connection;
    private ServerId serverId;
    private OutboxSender sender;

    @BeforeEach
    void setUp() {
        errorHandler = mock(ErrorHandler.class);
        when(errorHandler.handle(any())).thenReturn(ErrorReaction.proceed());
        BotProperties properties = new BotProperties();
        state = new BotState(properties, new ModuleRegistry(new CommandArgParser()), errorHandler, new Random(1));
        outbox = new Outbox(properties);
        eventPublisher = mock(ApplicationEventPublisher.class);
        connection = mock(IrcConnection.class);
        serverId = ServerId.random();
        state.registerServer(serverId, connection);
        sender = new OutboxSender(outbox, state, eventPublisher, List.of());
    }

    @AfterEach
    void tearDown() {
        sender.stop();
    }

    @Test
    void start_drainsOutboxInOrder() throws IOException {
        IrcMessage first = IrcMessage.privmsg("#c", "one");
        IrcMessage second = IrcMessage.privmsg("#c", "two");
        IrcMessage third = IrcMessage.privmsg("#c", "three");
        outbox.push(serverId, LibReaction.ofAll(List.of(first, second)));
        outbox.push(serverId, LibReaction.of(third));

        sender.start();

        verify(connection, timeout(2000)).send(third);
        InOrder order = inOrder(connection);
        order.verify(connection).send(first);
        order.verify(connection).send(second);
        order.verify(connection).send(third);
    }

    @Test
    void send_dropsRecordForUnknownServer() throws IOException {
        sender.send(new OutboxRecord(ServerId.random(), LibReaction.of(IrcMessage.privmsg("#c", "lost"))));

        verify(connection, never()).send(any());
        verify(errorHandler, never()).handle(any());
    }

    @Test
    void send_passesFailureToErrorHandlerAndSendsItsQuitOnce() throws IOException {
        IrcMessage message = IrcMessage.privmsg("#c", "hello");
        doThrow(new IOException("broken pipe")).when(connection).send(any());
        when(errorHandler.handle(any())).thenReturn(ErrorReaction.quit("giving up"));

        sender.send(new OutboxRecord(serverId, LibReaction.of(message)));

        verify(errorHandler, times(1)).handle(any());
        verify(connection).send(message);
        verify(connection).send(IrcMessage.quit("giving up"));
        verify(connection, times(2)).send(any());
    }

    @Test
    void send_continuesWithNextMessageAfterFailure() throws IOException {
        IrcMessage failing = IrcMessage.privmsg("#c", "first");
        IrcMessage next = IrcMessage.privmsg("#c", "second");
        doThrow(new IOException("flaky")).when(connection).send(failing);

        sender.send(new OutboxRecord(serverId, LibReaction.ofAll(List.of(failing, next))));

        verify(connection).send(next);
    }

    @Test
    void send_publishesEventAfterQuit() throws IOException {
        sender.send(new OutboxRecord(serverId, LibReaction.of(IrcMessage.quit("bye"))));

        ArgumentCaptor<QuitSentEvent> captor = ArgumentCaptor.forClass(QuitSentEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals(new QuitSentEvent(serverId, "bye"), captor.getValue());
    }

    @Test
    void send_appliesOutgoingFilters() throws IOException {
        OutboxSender filtering = new OutboxSender(outbox, state, eventPublisher,
                List.of((id, message) -> !message.param(1).contains("secret")));

        filtering.send(new OutboxRecord(serverId, LibReaction.ofAll(List.of(
                IrcMessage.privmsg("#c", "the secret"),
                IrcMessage.privmsg("#c", "public")))));

        verify(connection).send(IrcMessage.privmsg("#c", "public"));
        verify(connection, times(1)).send(any());
    }
}
