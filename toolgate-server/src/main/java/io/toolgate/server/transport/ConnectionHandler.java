/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolgate.json.McpJsonMapper;
import io.toolgate.server.MessageContext;
import io.toolgate.server.ProtocolRouter;
import io.toolgate.server.RouterReply;
import io.toolgate.session.ClientSession;
import io.toolgate.session.SessionManager;
import io.toolgate.spec.McpError;
import io.toolgate.spec.McpSchema.JSONRPCResponse;
import io.toolgate.util.Assert;

/**
 * Runs one client connection: opens a session, feeds every inbound line to the
 * {@link ProtocolRouter} and writes the replies back through the connection's
 * {@link LineTransport}. Messages of one connection are handled in arrival order on the
 * calling thread.
 */
public class ConnectionHandler {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

	public static final String REASON_CLIENT_DISCONNECTED = "client_disconnected";

	private static final Duration DISCONNECT_TIMEOUT = Duration.ofSeconds(10);

	private final SessionManager sessionManager;

	private final ProtocolRouter router;

	private final McpJsonMapper jsonMapper;

	public ConnectionHandler(SessionManager sessionManager, ProtocolRouter router, McpJsonMapper jsonMapper) {
		Assert.notNull(sessionManager, "sessionManager must not be null");
		Assert.notNull(router, "router must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.sessionManager = sessionManager;
		this.router = router;
		this.jsonMapper = jsonMapper;
	}

	/**
	 * Serves a connection until its input ends or the transport is closed. Blocks the
	 * calling thread.
	 * @param clientId identifier of the remote peer
	 * @param in the stream inbound messages are read from
	 * @param transport the transport replies are written to
	 */
	public void handle(String clientId, InputStream in, LineTransport transport) {
		ClientSession session;
		try {
			session = this.sessionManager.createSession(clientId, transport, transport.kind());
		}
		catch (McpError e) {
			logger.warn("Rejected connection from {}: {}", clientId, e.getMessage());
			try {
				write(transport, JSONRPCResponse.failure(null, e.getJsonRpcError()));
			}
			catch (TransportException writeFailure) {
				logger.debug("Failed to report rejection to {}: {}", clientId, writeFailure.getMessage());
			}
			closeQuietly(transport);
			return;
		}

		MessageContext context = MessageContext.of(session);
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
			String line;
			while (!transport.isClosed() && (line = reader.readLine()) != null) {
				if (line.isBlank()) {
					continue;
				}
				RouterReply reply = this.router.processMessage(line, context).block();
				if (reply != null) {
					write(transport, reply.payload());
				}
			}
			logger.debug("End of input for session {}", session.getId());
		}
		catch (IOException | TransportException e) {
			if (transport.isClosed()) {
				logger.debug("Connection for session {} closed", session.getId());
			}
			else {
				logger.warn("Connection for session {} failed: {}", session.getId(), e.getMessage());
			}
		}
		finally {
			this.sessionManager.disconnectSession(session.getId(), REASON_CLIENT_DISCONNECTED)
				.block(DISCONNECT_TIMEOUT);
		}
	}

	private void write(LineTransport transport, Object payload) {
		String json;
		try {
			json = this.jsonMapper.writeValueAsString(payload);
		}
		catch (IOException e) {
			throw new TransportException("Failed to serialize reply", e);
		}
		transport.sendMessage(json).block();
	}

	private static void closeQuietly(LineTransport transport) {
		transport.closeGracefully()
			.doOnError(e -> logger.debug("Failed to close rejected connection: {}", e.getMessage()))
			.onErrorComplete()
			.block();
	}

}
