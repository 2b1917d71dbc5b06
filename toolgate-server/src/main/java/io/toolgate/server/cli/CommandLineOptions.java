/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.cli;

import java.util.List;
import java.util.Locale;

import gnu.getopt.Getopt;
import gnu.getopt.LongOpt;
import reactor.util.annotation.Nullable;

/**
 * Parsed command line of the server.
 *
 * @param port TCP port to listen on, or {@code null} to serve over stdio
 * @param host interface the TCP listener binds
 * @param logLevel root log level
 * @param maxClients maximum number of concurrent sessions
 * @param help whether usage was requested
 */
public record CommandLineOptions(@Nullable Integer port, String host, String logLevel, int maxClients,
		boolean help) {

	public static final String DEFAULT_HOST = "127.0.0.1";

	public static final String DEFAULT_LOG_LEVEL = "info";

	public static final int DEFAULT_MAX_CLIENTS = 100;

	static final List<String> LOG_LEVELS = List.of("trace", "debug", "info", "warn", "error");

	private static final String PROGRAM = "toolgate";

	private static final LongOpt[] LONG_OPTIONS = { new LongOpt("port", LongOpt.REQUIRED_ARGUMENT, null, 'p'),
			new LongOpt("host", LongOpt.REQUIRED_ARGUMENT, null, 'H'),
			new LongOpt("log-level", LongOpt.REQUIRED_ARGUMENT, null, 'l'),
			new LongOpt("max-clients", LongOpt.REQUIRED_ARGUMENT, null, 'm'),
			new LongOpt("help", LongOpt.NO_ARGUMENT, null, 'h') };

	/**
	 * Parses {@code args}.
	 * @throws CommandLineException on unknown options, missing or malformed values and
	 * stray arguments
	 */
	public static CommandLineOptions parse(String[] args) throws CommandLineException {
		Integer port = null;
		String host = DEFAULT_HOST;
		String logLevel = DEFAULT_LOG_LEVEL;
		int maxClients = DEFAULT_MAX_CLIENTS;
		boolean help = false;

		Getopt g = new Getopt(PROGRAM, args, ":p:H:l:m:h", LONG_OPTIONS);
		g.setOpterr(false);
		int c;
		while ((c = g.getopt()) != -1) {
			switch (c) {
				case 'p':
					port = parseInt("--port", g.getOptarg());
					if (port < 0 || port > 65535) {
						throw new CommandLineException("--port must be between 0 and 65535: " + g.getOptarg());
					}
					break;
				case 'H':
					host = g.getOptarg();
					if (host.isBlank()) {
						throw new CommandLineException("--host must not be empty");
					}
					break;
				case 'l':
					logLevel = g.getOptarg().toLowerCase(Locale.ROOT);
					if (!LOG_LEVELS.contains(logLevel)) {
						throw new CommandLineException(
								"--log-level must be one of " + String.join(", ", LOG_LEVELS) + ": " + g.getOptarg());
					}
					break;
				case 'm':
					maxClients = parseInt("--max-clients", g.getOptarg());
					if (maxClients <= 0) {
						throw new CommandLineException("--max-clients must be positive: " + g.getOptarg());
					}
					break;
				case 'h':
					help = true;
					break;
				case ':':
					throw new CommandLineException("Missing value for " + offending(args, g));
				case '?':
				default:
					throw new CommandLineException("Unknown option: " + offending(args, g));
			}
		}
		if (g.getOptind() < args.length) {
			throw new CommandLineException("Unexpected argument: " + args[g.getOptind()]);
		}
		return new CommandLineOptions(port, host, logLevel, maxClients, help);
	}

	public boolean useTcp() {
		return this.port != null;
	}

	public static String usage() {
		return """
				Usage: toolgate [options]

				Serves MCP tools over stdio, or over TCP when --port is given.

				Options:
				  -p, --port <n>          listen on TCP port n instead of stdio
				  -H, --host <addr>       interface to bind in TCP mode (default 127.0.0.1)
				  -l, --log-level <lvl>   trace, debug, info, warn or error (default info)
				  -m, --max-clients <n>   maximum concurrent sessions (default 100)
				  -h, --help              print this help and exit
				""";
	}

	private static int parseInt(String option, String value) throws CommandLineException {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new CommandLineException(option + " expects a number: " + value);
		}
	}

	private static String offending(String[] args, Getopt g) {
		if (g.getOptopt() > 0) {
			return "-" + (char) g.getOptopt();
		}
		int index = g.getOptind() - 1;
		return index >= 0 && index < args.length ? args[index] : "?";
	}

}
