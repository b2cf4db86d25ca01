// file: server/src/main/java/io/proxgraph/server/ServerConfig.java
package io.proxgraph.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - deployer:        identity that creates the registry and holds the dev capability
 *  - httpPort:        HTTP API port
 *  - walDir:          directory for WAL segments
 *  - snapDir:         directory for full graph snapshots
 *  - snapshotEvery:   write a full snapshot after this many WAL records
 *  - capabilityFile:  where the deployer's dev capability id is written at startup
 */
public record ServerConfig(
        String deployer,
        int httpPort,
        String walDir,
        String snapDir,
        int snapshotEvery,
        String capabilityFile
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --deployer,        -d   <identity>
     *   --http-port,       -p   <port>
     *   --wal,             -w   <path>
     *   --snap,            -s   <path>
     *   --snapshot-every        <records>
     *   --capability-file       <path>
     *   --help,            -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        String deployer = "deployer";
        int httpPort = 8080;
        String wal = "./data/wal";
        String snap = "./data/snap";
        int snapshotEvery = 1000;
        String capabilityFile = "./data/dev-capability";

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--deployer", "-d" -> {
                    ensureValue(args, i);
                    deployer = args[++i];
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt("http-port", args[++i]);
                }

                case "--wal", "-w" -> {
                    ensureValue(args, i);
                    wal = args[++i];
                }

                case "--snap", "-s" -> {
                    ensureValue(args, i);
                    snap = args[++i];
                }

                case "--snapshot-every" -> {
                    ensureValue(args, i);
                    snapshotEvery = parseInt("snapshot-every", args[++i]);
                }

                case "--capability-file" -> {
                    ensureValue(args, i);
                    capabilityFile = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(deployer, httpPort, wal, snap, snapshotEvery, capabilityFile);
    }

    private static int parseInt(String option, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + option + ": " + raw);
            System.exit(1);
            return -1; // unreachable
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
            Usage: proxgraph-server [options]

            Options:
              --deployer,       -d   Identity that owns the registry (default: deployer)
              --http-port,      -p   HTTP port (default: 8080)
              --wal,            -w   WAL directory (default: ./data/wal)
              --snap,           -s   Snapshot directory (default: ./data/snap)
              --snapshot-every       Full snapshot every N WAL records (default: 1000)
              --capability-file      File receiving the dev capability id (default: ./data/dev-capability)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
