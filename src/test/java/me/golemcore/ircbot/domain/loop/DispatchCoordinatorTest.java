package me.golemcore.ircbot.domain.loop;

import me.golemcore.ircbot.domain.model.AuthLevel;
import me.golemcore.ircbot.domain.model.BotCmdResult;
import me.golemcore.ircbot.domain.model.ErrorReaction;
import me.golemcore.ircbot.domain.model.IrcMessage;
import me.golemcore.ircbot.domain.model.ModuleLoadMode;
import me.golemcore.ircbot.domain.model.MsgDest;
import me.golemcore.ircbot.domain.model.MsgMetadata;
import me.golemcore.ircbot.domain.model.MsgPrefix;
import me.golemcore.ircbot.domain.model.OutboxRecord;
import me.golemcore.ircbot.domain.model.Reaction;
import me.golemcore.ircbot.domain.model.ServerId;
import me.golemcore.ircbot.domain.service.AuthorizationService;
import me.golemcore.ircbot.domain.service.BotState;
import me.golemcore.ircbot.domain.service.CommandArgParser;
import me.golemcore.ircbot.domain.service.CommandDispatcher;
import me.golemcore.ircbot.domain.service.HandlerInvoker;
import me.golemcore.ircbot.domain.service.LineWrapper;
import me.golemcore.ircbot.domain.service.ReactionResolver;
import me.golemcore.ircbot.domain.service.TriggerEngine;
import me.golemcore.ircbot.infrastructure.config.BotProperties;
import me.golemcore.ircbot.module.api.BotCmdHandler;
import me.golemcore.ircbot.module.api.Module;
import me.golemcore.ircbot.module.context.ModuleRegistry;
import me.golemcore.ircbot.outbox.Outbox;
import me.golemcore.ircbot.port.outbound.IrcConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class DispatchCoordinatorTest {

    private static final MsgPrefix ALICE = MsgPrefix.parse("alice!alice@example.org");

    private final CountDownLatch slowRelease = new CountDownLatch(1);
    private ExecutorService executor;
    private Outbox outbox;
    private DispatchCoordinator coordinator;
    private ServerId serverId;
    private BotState state;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.setNickname("golembot");
        CommandArgParser argParser = new CommandArgParser();
        ModuleRegistry registry = new ModuleRegistry(argParser);
        state = new BotState(properties, registry, error -> ErrorReaction.proceed(), new Random(3));
        serverId = ServerId.random();
        state.registerServer(serverId, mock(IrcConnection.class));

        Module module = Module.builder("timing")
                .command("slow", "", "Waits for the test.", AuthLevel.PUBLIC,
                        BotCmdHandler.reacting((context, argument) -> {
                            awaitRelease();
                            return Reaction.reply("slow done");
                        }))
                .command("fast", "", "Answers at once.", AuthLevel.PUBLIC,
                        BotCmdHandler.reacting((context, argument) -> Reaction.reply("fast done")))
                .command("broken", "", "Answers with a malformed raw line.", AuthLevel.PUBLIC,
                        BotCmdHandler.reacting((context, argument) -> Reaction.raw("@" + "x".repeat(700))))
                .command("recurse", "", "Never stops recursing.", AuthLevel.PUBLIC,
                        (context, argument) -> BotCmdResult.ok(Reaction.reply("depth " + recurse(0))))
                .build();
        assertTrue(registry.load(module, ModuleLoadMode.ADD).isEmpty());

        HandlerInvoker invoker = new HandlerInvoker();
        CommandDispatcher dispatcher = new CommandDispatcher(state, new AuthorizationService(properties), argParser,
                new TriggerEngine(state, invoker), invoker);
        executor = Executors.newFixedThreadPool(2);
        outbox = new Outbox(properties);
        coordinator = new DispatchCoordinator(executor, dispatcher, new ReactionResolver(state), outbox);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        slowRelease.countDown();
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void dispatch_letsLaterCommandFinishFirst() throws Exception {
        Future<?> slow = coordinator.dispatch(channelMessage(), "slow");
        Future<?> fast = coordinator.dispatch(channelMessage(), "fast");

        fast.get(5, TimeUnit.SECONDS);
        assertEquals(List.of(IrcMessage.privmsg("#golem", "alice: fast done")), nextMessages());
        assertNull(outbox.poll(50, TimeUnit.MILLISECONDS));

        slowRelease.countDown();
        slow.get(5, TimeUnit.SECONDS);
        assertEquals(List.of(IrcMessage.privmsg("#golem", "alice: slow done")), nextMessages());
    }

    @Test
    void process_repliesToUnknownCommand() throws InterruptedException {
        coordinator.process(channelMessage(), "nosuchcommand");

        assertEquals(List.of(IrcMessage.privmsg("#golem", "alice: Unknown command \"nosuchcommand\"; apologies.")),
                nextMessages());
    }

    @Test
    void process_reportsFrameworkErrorToSenderInPrivate() throws InterruptedException {
        MsgMetadata metadata = new MsgMetadata(new MsgDest(serverId, "golembot"), ALICE);

        coordinator.process(metadata, "broken");

        IrcMessage message = nextMessages().get(0);
        assertEquals("alice", message.param(0));
        assertTrue(message.param(1).startsWith("Encountered error while trying to handle command: "));
    }

    @Test
    void process_wrapsLongFrameworkErrorWithinLineLimit() throws InterruptedException {
        coordinator.process(channelMessage(), "broken");

        List<IrcMessage> messages = nextMessages();
        assertTrue(messages.size() > 1);
        for (IrcMessage message : messages) {
            assertEquals("#golem", message.param(0));
            String echoed = ":" + state.msgPrefix(serverId).toEchoString() + " " + message.toWireString() + "\r\n";
            assertTrue(LineWrapper.utf8Length(echoed) <= ReactionResolver.MAX_LINE_LENGTH);
        }
        assertTrue(messages.get(0).param(1).startsWith("Encountered error while trying to handle command: "));
    }

    @Test
    void process_dropsReplyWhenTargetLeavesNoRoom() throws InterruptedException {
        MsgMetadata metadata = new MsgMetadata(new MsgDest(serverId, "#" + "c".repeat(500)), ALICE);

        coordinator.process(metadata, "fast");

        assertNull(outbox.poll(50, TimeUnit.MILLISECONDS));
    }

    @Test
    void dispatch_reportsStackOverflowInHandler() throws Exception {
        coordinator.dispatch(channelMessage(), "recurse").get(5, TimeUnit.SECONDS);

        assertEquals(List.of(IrcMessage.privmsg("#golem",
                "alice: Error: The handler of the command \"recurse\" failed unexpectedly")), nextMessages());
    }

    private MsgMetadata channelMessage() {
        return new MsgMetadata(new MsgDest(serverId, "#golem"), ALICE);
    }

    private List<IrcMessage> nextMessages() throws InterruptedException {
        OutboxRecord outboxRecord = outbox.poll(5, TimeUnit.SECONDS);
        assertEquals(serverId, outboxRecord.serverId());
        return outboxRecord.reaction().messages();
    }

    private static int recurse(int depth) {
        return recurse(depth + 1) + 1;
    }

    private void awaitRelease() {
        try {
            if (!slowRelease.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("slow command was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
