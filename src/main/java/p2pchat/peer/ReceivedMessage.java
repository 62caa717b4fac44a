package p2pchat.peer;

import java.time.Instant;

import p2pchat.peer.protocol.ChatMessage;

public record ReceivedMessage(ChatMessage message, String remoteAddress, Instant receivedAt) {
}
