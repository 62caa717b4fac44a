package p2pchat.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import p2pchat.config.ChatProperties;
import p2pchat.peer.DeliveryException;
import p2pchat.peer.InboundListener;
import p2pchat.peer.MessageSink;
import p2pchat.peer.MessageTransport;
import p2pchat.peer.PeerCache;
import p2pchat.peer.SocketMessageTransport;
import p2pchat.peer.UnknownPeerException;
import p2pchat.peer.protocol.ChatMessage;
import p2pchat.tracker.TrackerClient;
import p2pchat.tracker.TrackerRejectedException;
import p2pchat.tracker.TrackerUnreachableException;
import p2pchat.tracker.model.PeerEntry;
import p2pchat.util.NetworkUtils;
import p2pchat.util.Threads;

/**
 * The chat peer: registers with the tracker and keeps the registration alive,
 * caches the tracker's peer list, and sends messages directly to peers from
 * that cache. Also owns the inbound listener so the peer can receive while it
 * sends.
 */
@Service
@ConditionalOnProperty(name = "app.mode", havingValue = "peer", matchIfMissing = true)
public class ChatService {

	private static final Logger logger = LoggerFactory.getLogger(ChatService.class);

	private final String peerId;
	private final String advertisedIp;
	private final long heartbeatIntervalMs;
	private final TrackerClient trackerClient;
	private final MessageTransport transport;
	private final InboundListener listener;
	private final PeerCache cache;

	private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(Threads.daemon("PeerHeartbeat"));
	private ScheduledFuture<?> heartbeatTask;
	private volatile boolean registered = false;
	private final AtomicBoolean stopped = new AtomicBoolean(false);
	private final Object registrationLock = new Object();

	@Autowired
	public ChatService(ChatProperties config, List<MessageSink> sinks) {
		this(config,
			new TrackerClient(config.getTrackerHost(), config.getTrackerPort(), config.getConnectTimeout(), config.getReadTimeout()),
			new SocketMessageTransport(config.getConnectTimeout()),
			new InboundListener(config.getListenPort(), config.getReadTimeout(), sinks));
	}

	public ChatService(ChatProperties config, TrackerClient trackerClient, MessageTransport transport, InboundListener listener) {
		this.peerId = config.getPeerId();
		this.advertisedIp = config.getAdvertisedIp() != null && !config.getAdvertisedIp().isBlank()
			? config.getAdvertisedIp()
			: NetworkUtils.detectLocalIp();
		this.heartbeatIntervalMs = config.getHeartbeatInterval().toMillis();
		this.trackerClient = trackerClient;
		this.transport = transport;
		this.listener = listener;
		this.cache = new PeerCache(peerId);
	}

	/**
	 * Starts receiving, then joins the network. A tracker that is down at
	 * startup is not fatal: the heartbeat task keeps trying to register.
	 */
	@PostConstruct
	public void start() {
		listener.start();
		logger.info("Peer {} advertising {}:{}", peerId, advertisedIp, listener.getLocalPort());

		try {
			register();
			refreshPeers();
		} catch (TrackerUnreachableException | TrackerRejectedException e) {
			logger.error("Failed to join via tracker {}:{}: {}", trackerClient.getHost(), trackerClient.getPort(), e.getMessage());
		}
		scheduleHeartbeat();
	}

	/**
	 * Sends REGISTER for this peer and starts the heartbeat task. Serialized
	 * with {@link #shutdown()}: a registration in flight completes before
	 * shutdown decides whether to UNREGISTER.
	 *
	 * @return number of peers known to the tracker
	 * @throws IllegalStateException if the peer has been shut down
	 */
	public int register() {
		final int peerCount;
		synchronized (registrationLock) {
			if (stopped.get()) {
				throw new IllegalStateException("Peer " + peerId + " has shut down");
			}
			peerCount = trackerClient.register(peerId, advertisedIp, listener.getLocalPort());
			registered = true;
		}
		logger.info("Registered with tracker, total peers in network: {}", peerCount);
		scheduleHeartbeat();
		return peerCount;
	}

	private synchronized void scheduleHeartbeat() {
		if (heartbeatTask != null || stopped.get()) {
			return;
		}
		heartbeatTask = heartbeatScheduler.scheduleAtFixedRate(
			this::heartbeatTick,
			heartbeatIntervalMs,
			heartbeatIntervalMs,
			TimeUnit.MILLISECONDS
		);
	}

	/**
	 * One heartbeat. Re-registers when the tracker has forgotten us (evicted
	 * or restarted). Never throws, so the schedule survives failures.
	 */
	void heartbeatTick() {
		if (stopped.get()) {
			return;
		}
		try {
			if (!registered) {
				register();
				return;
			}
			trackerClient.heartbeat(peerId);
			logger.debug("Heartbeat sent for {}", peerId);
		} catch (TrackerRejectedException e) {
			logger.warn("Tracker rejected heartbeat ({}), registering again", e.getMessage());
			registered = false;
			try {
				register();
			} catch (RuntimeException retry) {
				logger.warn("Re-registration failed: {}", retry.getMessage());
			}
		} catch (TrackerUnreachableException e) {
			logger.warn("Heartbeat failed: {}", e.getMessage());
		} catch (RuntimeException e) {
			logger.error("Unexpected heartbeat failure", e);
		}
	}

	/**
	 * Replaces the local cache with the tracker's current peer list.
	 *
	 * @return the new cache contents, without this peer
	 */
	public List<PeerEntry> refreshPeers() {
		final var peers = trackerClient.getPeers();
		cache.replace(peers);
		logger.info("Updated peer list: {} peers available", cache.size());
		return cache.snapshot();
	}

	public List<PeerEntry> knownPeers() {
		return cache.snapshot();
	}

	/**
	 * Sends a direct message to a peer from the local cache. The tracker is
	 * not consulted, and a failed delivery leaves the cache entry in place.
	 *
	 * @throws UnknownPeerException if {@code targetId} is not cached
	 * @throws DeliveryException if the peer cannot be reached
	 */
	public void sendDirect(String targetId, String content) {
		final var target = cache.find(targetId)
			.orElseThrow(() -> new UnknownPeerException("Peer " + targetId + " not found"));
		try {
			transport.deliver(target, ChatMessage.direct(peerId, content));
			logger.info("Sent direct message to {}", targetId);
		} catch (DeliveryException e) {
			logger.warn("Direct message to {} failed: {}", targetId, e.getMessage());
			throw e;
		}
	}

	/**
	 * Attempts every cached peer in turn. Individual failures are recorded
	 * and do not stop the remaining sends.
	 */
	public BroadcastReport broadcast(String content) {
		final var message = ChatMessage.broadcast(peerId, content);
		final var results = new ArrayList<DeliveryResult>();

		for (PeerEntry target : cache.snapshot()) {
			if (peerId.equals(target.peerId())) {
				continue;
			}
			try {
				transport.deliver(target, message);
				results.add(DeliveryResult.delivered(target.peerId()));
			} catch (RuntimeException e) {
				logger.warn("Broadcast to {} failed: {}", target.peerId(), e.getMessage());
				results.add(DeliveryResult.failed(target.peerId(), e.getMessage()));
			}
		}

		final var report = new BroadcastReport(results);
		logger.info("Broadcast sent to {} of {} peers", report.deliveredCount(), results.size());
		return report;
	}

	/**
	 * Stops heartbeats, tries once to UNREGISTER and closes the listener.
	 * Waits for a registration already in flight, so the tracker is never left
	 * listing a stopped peer. An unreachable tracker only costs the client
	 * timeouts.
	 */
	@PreDestroy
	public void shutdown() {
		if (!stopped.compareAndSet(false, true)) {
			return;
		}
		heartbeatScheduler.shutdownNow();

		synchronized (registrationLock) {
			if (registered) {
				try {
					trackerClient.unregister(peerId);
					logger.info("Unregistered from tracker");
				} catch (RuntimeException e) {
					logger.warn("Could not unregister from tracker: {}", e.getMessage());
				}
				registered = false;
			}
		}

		listener.stop();
		logger.info("Peer {} stopped", peerId);
	}

	public String getPeerId() {
		return peerId;
	}

	public String getAdvertisedIp() {
		return advertisedIp;
	}

	public int getListenPort() {
		return listener.getLocalPort();
	}

	public boolean isRegistered() {
		return registered;
	}
}
