/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.cli;

import java.io.InputStream;
import java.io.PrintStream;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import io.toolgate.server.McpToolServer;
import io.toolgate.server.ServerConfig;
import io.toolgate.server.transport.StdioTransportProvider;
import io.toolgate.server.transport.TcpTransportProvider;
import io.toolgate.server.transport.TransportProvider;

/**
 * Command line entry point. Exits with {@code 0} after a clean stop or {@code --help},
 * and with {@code 1} on invalid arguments or a failed start.
 */
public final class Main {

	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(35);

	private Main() {
	}

	public static void main(String[] args) {
		System.exit(run(args, System.in, System.out, System.err));
	}

	static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
		CommandLineOptions options;
		try {
			options = CommandLineOptions.parse(args);
		}
		catch (CommandLineException e) {
			err.println("Error: " + e.getMessage());
			err.println();
			err.print(CommandLineOptions.usage());
			return EXIT_FAILURE;
		}
		if (options.help()) {
			out.print(CommandLineOptions.usage());
			out.flush();
			return EXIT_OK;
		}

		configureLogLevel(options.logLevel());

		McpToolServer server;
		try {
			TransportProvider transport = options.useTcp() ? new TcpTransportProvider(options.host(), options.port())
					: new StdioTransportProvider(in, out);
			server = McpToolServer.builder(transport)
				.config(ServerConfig.builder().maxClients(options.maxClients()).build())
				.build();
			server.start();
		}
		catch (Exception e) {
			logger.error("Failed to start server: {}", e.getMessage(), e);
			return EXIT_FAILURE;
		}

		Thread shutdownHook = new Thread(() -> server.stop().block(SHUTDOWN_TIMEOUT), "toolgate-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);
		server.awaitTermination();
		try {
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
		}
		catch (IllegalStateException e) {
			logger.debug("JVM shutdown already in progress");
		}
		return EXIT_OK;
	}

	static void configureLogLevel(String level) {
		if (LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root) {
			root.setLevel(Level.toLevel(level, Level.INFO));
		}
		else {
			logger.warn("Logback is not the active SLF4J binding, ignoring log level {}", level);
		}
	}

}
