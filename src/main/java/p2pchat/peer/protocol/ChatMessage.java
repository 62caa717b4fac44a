package p2pchat.peer.protocol;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * One peer-to-peer message. Exactly one is sent per connection; the
 * recipient is implied by the socket it travels on.
 */
public record ChatMessage(Type type, String from, String content) {

	public enum Type {
		@SerializedName("direct")
		DIRECT,
		@SerializedName("broadcast")
		BROADCAST
	}

	private static final Gson GSON = new Gson();

	public static ChatMessage direct(String from, String content) {
		return new ChatMessage(Type.DIRECT, from, content);
	}

	public static ChatMessage broadcast(String from, String content) {
		return new ChatMessage(Type.BROADCAST, from, content);
	}

	public String toJson() {
		return GSON.toJson(this);
	}

	/**
	 * @throws JsonParseException if the payload is not a complete message
	 */
	public static ChatMessage fromJson(String json) {
		final var message = GSON.fromJson(json, ChatMessage.class);
		if (message == null || message.type() == null || message.from() == null || message.content() == null) {
			throw new JsonParseException("Incomplete chat message: " + json);
		}
		return message;
	}
}
