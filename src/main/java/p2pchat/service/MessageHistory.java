package p2pchat.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import p2pchat.config.ChatProperties;
import p2pchat.peer.MessageSink;
import p2pchat.peer.ReceivedMessage;

/**
 * Bounded in-memory log of received messages, oldest evicted first.
 */
@Component
@ConditionalOnProperty(name = "app.mode", havingValue = "peer", matchIfMissing = true)
public class MessageHistory implements MessageSink {

	private final int capacity;
	private final Deque<ReceivedMessage> messages = new ArrayDeque<>();

	@Autowired
	public MessageHistory(ChatProperties config) {
		this(config.getHistorySize());
	}

	public MessageHistory(int capacity) {
		this.capacity = capacity;
	}

	@Override
	public synchronized void onMessage(ReceivedMessage message) {
		messages.addLast(message);
		while (messages.size() > capacity) {
			messages.removeFirst();
		}
	}

	/**
	 * @return up to {@code limit} most recent messages, oldest first
	 */
	public synchronized List<ReceivedMessage> recent(int limit) {
		final var all = new ArrayList<>(messages);
		return all.subList(Math.max(0, all.size() - limit), all.size());
	}

	public synchronized List<ReceivedMessage> all() {
		return new ArrayList<>(messages);
	}

	public synchronized int size() {
		return messages.size();
	}
}
