// file: src/main/java/io/callroster/server/ServerConfig.java
package io.callroster.server;

/**
 * Sidecar configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:       port of the push/debug HTTP API
 *  - gatewayUrl:     base URL of the call gateway
 *  - callId:         call to follow
 *  - viewerId:       peer id of the local user
 *  - syncConfigPath: optional JSON file with engine tunables
 */
public record ServerConfig(
        int httpPort,
        String gatewayUrl,
        long callId,
        long viewerId,
        String syncConfigPath
) {

    public ServerConfig {
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("httpPort out of range: " + httpPort);
        }
        if (gatewayUrl == null || gatewayUrl.isBlank()) {
            throw new IllegalArgumentException("gatewayUrl is required");
        }
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,   -p <port>
     *   --gateway-url, -g <url>
     *   --call-id,     -c <id>
     *   --viewer-id,   -v <peerId>
     *   --sync-config, -s <path>
     *   --help,        -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     * Malformed values print a message and exit with status 1.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        int httpPort = 8080;
        String gatewayUrl = "http://localhost:9090";
        long callId = 1L;
        long viewerId = 1L;
        String syncConfigPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt(args[++i], "http-port");
                }

                case "--gateway-url", "-g" -> {
                    ensureValue(args, i);
                    gatewayUrl = args[++i];
                }

                case "--call-id", "-c" -> {
                    ensureValue(args, i);
                    callId = parseLong(args[++i], "call-id");
                }

                case "--viewer-id", "-v" -> {
                    ensureValue(args, i);
                    viewerId = parseLong(args[++i], "viewer-id");
                }

                case "--sync-config", "-s" -> {
                    ensureValue(args, i);
                    syncConfigPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, gatewayUrl, callId, viewerId, syncConfigPath);
    }

    private static int parseInt(String v, String name) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + v);
            System.exit(1);
            return -1;
        }
    }

    private static long parseLong(String v, String name) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + v);
            System.exit(1);
            return -1L;
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: callroster-server [options]

            Options:
              --http-port,   -p   HTTP port for pushes and debug reads (default: 8080)
              --gateway-url, -g   Base URL of the call gateway (default: http://localhost:9090)
              --call-id,     -c   Call to follow (default: 1)
              --viewer-id,   -v   Peer id of the local user (default: 1)
              --sync-config, -s   Path to JSON sync config (optional)
              --help,        -h   Show this help message
            """);
        System.exit(0);
    }
}
