/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import io.toolgate.spec.McpServerTransport;
import io.toolgate.spec.TransportKind;
import reactor.util.annotation.Nullable;

/**
 * Server side state of one connected client. Instances are created and mutated only by
 * the {@link SessionManager}; everything else reads them.
 */
public class ClientSession {

	private final String id;

	private final String clientId;

	private final McpServerTransport transport;

	private final TransportKind transportKind;

	private final long createdAt;

	private final Duration timeout;

	private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);

	private final Set<String> visibleTools = ConcurrentHashMap.newKeySet();

	private final Map<String, Object> metadata = new ConcurrentHashMap<>();

	private volatile long lastActivity;

	@Nullable
	private volatile UserContext user;

	private long requestsProcessed;

	private long toolsCalled;

	private long totalProcessingTime;

	private long lastRequest;

	ClientSession(String id, String clientId, @Nullable McpServerTransport transport, TransportKind transportKind,
			long createdAt, Duration timeout) {
		this.id = id;
		this.clientId = clientId;
		this.transport = transport;
		this.transportKind = transportKind;
		this.createdAt = createdAt;
		this.lastActivity = createdAt;
		this.timeout = timeout;
	}

	public String getId() {
		return id;
	}

	public String getClientId() {
		return clientId;
	}

	@Nullable
	public McpServerTransport getTransport() {
		return transport;
	}

	public TransportKind getTransportKind() {
		return transportKind;
	}

	public SessionState getState() {
		return state.get();
	}

	public boolean isLive() {
		return state.get().isLive();
	}

	public long getCreatedAt() {
		return createdAt;
	}

	public long getLastActivity() {
		return lastActivity;
	}

	public Duration getTimeout() {
		return timeout;
	}

	/**
	 * Tool names this client may see and call. An empty set means every tool is visible.
	 */
	public Set<String> getVisibleTools() {
		return Collections.unmodifiableSet(visibleTools);
	}

	public Map<String, Object> getMetadata() {
		return Collections.unmodifiableMap(metadata);
	}

	@Nullable
	public UserContext getUser() {
		return user;
	}

	public boolean isExpired(long now) {
		return now - lastActivity > timeout.toMillis();
	}

	public synchronized SessionStats getStats(long now) {
		double average = requestsProcessed == 0 ? 0 : (double) totalProcessingTime / requestsProcessed;
		return new SessionStats(now - createdAt, requestsProcessed, toolsCalled, average, lastRequest);
	}

	/**
	 * Moves the session forward. Returns {@code false} when the transition would go
	 * backwards or stay in place, which also makes the first of two concurrent
	 * transitions to the same state win.
	 */
	boolean transitionTo(SessionState next) {
		SessionState current;
		do {
			current = state.get();
			if (!current.canTransitionTo(next)) {
				return false;
			}
		}
		while (!state.compareAndSet(current, next));
		return true;
	}

	void touch(long now) {
		this.lastActivity = now;
	}

	synchronized void recordRequest(long now, long processingMillis) {
		this.lastActivity = now;
		this.lastRequest = now;
		this.requestsProcessed++;
		this.totalProcessingTime += Math.max(0, processingMillis);
	}

	synchronized void recordToolCall() {
		this.toolsCalled++;
	}

	void setUser(@Nullable UserContext user) {
		this.user = user;
	}

	void putMetadata(String key, Object value) {
		if (value == null) {
			this.metadata.remove(key);
		}
		else {
			this.metadata.put(key, value);
		}
	}

	void setVisibleTools(Set<String> toolNames) {
		this.visibleTools.clear();
		this.visibleTools.addAll(toolNames);
	}

	void clear() {
		this.visibleTools.clear();
		this.metadata.clear();
	}

	@Override
	public String toString() {
		return "ClientSession{id='" + id + "', clientId='" + clientId + "', transport=" + transportKind.id()
				+ ", state=" + state.get() + "}";
	}

}
