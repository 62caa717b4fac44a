package p2pchat.cli;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import p2pchat.peer.DeliveryException;
import p2pchat.peer.ReceivedMessage;
import p2pchat.peer.UnknownPeerException;
import p2pchat.peer.protocol.ChatMessage;
import p2pchat.service.BroadcastReport;
import p2pchat.service.ChatService;
import p2pchat.service.DeliveryResult;
import p2pchat.service.MessageHistory;
import p2pchat.tracker.TrackerUnreachableException;
import p2pchat.tracker.model.PeerEntry;

class CommandInterfaceTest {

    private static final String NL = System.lineSeparator();

    private ChatService chatService;
    private MessageHistory history;
    private CommandInterface commands;

    @BeforeEach
    void setUp() {
        chatService = mock(ChatService.class);
        history = new MessageHistory(100);
        commands = new CommandInterface(chatService, history);
    }

    @Test
    void peersListsCacheAfterRefresh() {
        var bob = new PeerEntry("bob", "10.0.0.2", 6001);
        when(chatService.refreshPeers()).thenReturn(List.of(bob));
        when(chatService.knownPeers()).thenReturn(List.of(bob));

        var result = commands.execute("/peers");

        assertEquals("Available peers:" + NL + "  bob - 10.0.0.2:6001", result.output());
        assertFalse(result.quit());
        verify(chatService).refreshPeers();
    }

    @Test
    void peersFallsBackToCacheWhenTrackerIsDown() {
        when(chatService.refreshPeers()).thenThrow(new TrackerUnreachableException("connection refused"));
        when(chatService.knownPeers()).thenReturn(List.of());

        var output = commands.execute("/peers").output();

        assertEquals("Could not refresh peer list: connection refused" + NL + "No peers available", output);
    }

    @Test
    void refreshReportsCount() {
        when(chatService.refreshPeers()).thenReturn(List.of(
            new PeerEntry("bob", "10.0.0.2", 6001), new PeerEntry("carol", "10.0.0.3", 6002)));

        assertEquals("Updated peer list: 2 peers available", commands.execute("/refresh").output());
    }

    @Test
    void directMessageKeepsSpacesInContent() {
        assertEquals("Sent direct message to bob", commands.execute("/msg bob hello there  friend").output());
        verify(chatService).sendDirect("bob", "hello there  friend");
    }

    @Test
    void directMessageToUnknownPeer() {
        doThrow(new UnknownPeerException("Peer zed not found")).when(chatService).sendDirect(eq("zed"), anyString());

        assertEquals("Peer zed not found. Try /refresh", commands.execute("/msg zed hi").output());
    }

    @Test
    void directMessageDeliveryFailure() {
        doThrow(new DeliveryException("Connection refused")).when(chatService).sendDirect(eq("bob"), anyString());

        assertEquals("Failed to deliver to bob: Connection refused", commands.execute("/msg bob hi").output());
    }

    @Test
    void directMessageWithoutContentShowsUsage() {
        assertEquals("Usage: /msg <peer_id> <message>", commands.execute("/msg bob").output());
        assertEquals("Usage: /msg <peer_id> <message>", commands.execute("/msg").output());
        verifyNoInteractions(chatService);
    }

    @Test
    void broadcastListsFailures() {
        when(chatService.broadcast("hello all")).thenReturn(new BroadcastReport(List.of(
            DeliveryResult.delivered("bob"),
            DeliveryResult.failed("dave", "Connection refused"))));

        var output = commands.execute("/broadcast hello all").output();

        assertEquals("Broadcast sent to 1 of 2 peers" + NL + "  failed: dave (Connection refused)", output);
    }

    @Test
    void broadcastWithoutContentShowsUsage() {
        assertEquals("Usage: /broadcast <message>", commands.execute("/broadcast   ").output());
        verifyNoInteractions(chatService);
    }

    @Test
    void historyShowsReceivedMessages() {
        assertEquals("No message history", commands.execute("/history").output());

        history.onMessage(new ReceivedMessage(ChatMessage.direct("alice", "hi"), "10.0.0.1", Instant.now()));
        history.onMessage(new ReceivedMessage(ChatMessage.broadcast("carol", "hey all"), "10.0.0.3", Instant.now()));

        assertEquals("Message history:" + NL + "  [direct] alice: hi" + NL + "  [broadcast] carol: hey all",
            commands.execute("/history").output());
    }

    @Test
    void historyTypeLabelIgnoresDefaultLocale() {
        var previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            history.onMessage(new ReceivedMessage(ChatMessage.direct("alice", "merhaba"), "10.0.0.1", Instant.now()));

            assertEquals("Message history:" + NL + "  [direct] alice: merhaba", commands.execute("/history").output());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void historyShowsOnlyLatestLines() {
        for (int i = 0; i < CommandInterface.HISTORY_LINES + 5; i++) {
            history.onMessage(new ReceivedMessage(ChatMessage.direct("alice", "m" + i), "10.0.0.1", Instant.now()));
        }

        var lines = commands.execute("/history").output().split(NL);

        assertEquals(CommandInterface.HISTORY_LINES + 1, lines.length);
        assertEquals("  [direct] alice: m5", lines[1]);
    }

    @Test
    void helpListsEveryCommand() {
        var output = commands.execute("/help").output();
        for (ChatCommand command : ChatCommand.values()) {
            assertTrue(output.contains(command.getUsage()), command.name());
        }
    }

    @Test
    void quitEndsSession() {
        var result = commands.execute("/QUIT");
        assertTrue(result.quit());
        assertEquals("Exiting...", result.output());
    }

    @Test
    void unknownAndBlankInput() {
        assertEquals("Unknown command. Type /help for available commands", commands.execute("hello").output());
        assertEquals("", commands.execute("   ").output());
        verifyNoInteractions(chatService);
    }
}
