// file: client/src/main/java/io/proxgraph/client/Cli.java
package io.proxgraph.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Simple CLI for interacting with a running proximity graph server over HTTP.
 *
 * Usage:
 *   proxgraph-cli [--base-url http://host:port] --as <identity> register [peer...]
 *   proxgraph-cli [--base-url http://host:port] --as <identity> update <userId> [peer...]
 *   proxgraph-cli [--base-url http://host:port] show <userId>
 *   proxgraph-cli [--base-url http://host:port] history <userId>
 *   proxgraph-cli [--base-url http://host:port] registry
 *   proxgraph-cli [--base-url http://host:port] --as <identity> spawn <capabilityId> <target> [peer...]
 *   proxgraph-cli [--base-url http://host:port] --as <identity> dev-update <capabilityId> <userId> [peer...]
 *
 * Examples:
 *   proxgraph-cli --as alice register bob carol
 *   proxgraph-cli --as alice update 5b1e... bob
 *   proxgraph-cli history 5b1e...
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";
    static final String IDENTITY_HEADER = "X-Proxgraph-Identity";

    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpClient http;

    /** A parsed command line. identity is null when --as was not given. */
    record Invocation(String baseUrl, String identity, String command, List<String> args) {}

    private Cli() {
        this.http = HttpClient.newHttpClient();
    }

    public static void main(String[] args) {
        try {
            Invocation inv = parse(args);
            new Cli().run(inv);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    // ---------- argument parsing ----------

    static Invocation parse(String[] args) {
        String baseUrl = DEFAULT_BASE_URL;
        String identity = null;
        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            switch (args[i]) {
                case "--base-url" -> baseUrl = value(args, i);
                case "--as" -> identity = value(args, i);
                case "--help" -> throw new CliException(usage());
                default -> throw new CliException("unknown option: " + args[i]);
            }
            i += 2;
        }
        if (i >= args.length) {
            throw new CliException("missing command\n" + usage());
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String cmd = args[i];
        List<String> rest = Arrays.asList(args).subList(i + 1, args.length);

        switch (cmd) {
            case "register" -> requireIdentity(cmd, identity);
            case "update" -> {
                requireIdentity(cmd, identity);
                requireArgs(rest, 1, "update requires <userId> [peer...]");
            }
            case "show" -> requireExactly(rest, 1, "show requires <userId>");
            case "history" -> requireExactly(rest, 1, "history requires <userId>");
            case "registry" -> requireExactly(rest, 0, "registry takes no arguments");
            case "spawn" -> {
                requireIdentity(cmd, identity);
                requireArgs(rest, 2, "spawn requires <capabilityId> <target> [peer...]");
            }
            case "dev-update" -> {
                requireIdentity(cmd, identity);
                requireArgs(rest, 2, "dev-update requires <capabilityId> <userId> [peer...]");
            }
            default -> throw new CliException("unknown command: " + cmd + "\n" + usage());
        }
        return new Invocation(baseUrl, identity, cmd, List.copyOf(rest));
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException(args[i] + " requires a value");
        }
        return args[i + 1];
    }

    private static void requireIdentity(String cmd, String identity) {
        if (identity == null || identity.isBlank()) {
            throw new CliException(cmd + " requires --as <identity>");
        }
    }

    private static void requireArgs(List<String> rest, int min, String msg) {
        if (rest.size() < min) throw new CliException(msg);
    }

    private static void requireExactly(List<String> rest, int n, String msg) {
        if (rest.size() != n) throw new CliException(msg);
    }

    // ---------- requests ----------

    /** Build the HTTP request for an invocation. No I/O. */
    static HttpRequest request(Invocation inv) {
        List<String> a = inv.args();
        return switch (inv.command()) {
            case "register" -> send(inv, "POST", "/users", neighbors(JSON.createObjectNode(), a));
            case "update" -> send(inv, "PUT", "/users/" + seg(a.get(0)) + "/node",
                    neighbors(JSON.createObjectNode(), a.subList(1, a.size())));
            case "show" -> get(inv, "/users/" + seg(a.get(0)));
            case "history" -> get(inv, "/users/" + seg(a.get(0)) + "/history");
            case "registry" -> get(inv, "/registry");
            case "spawn" -> {
                ObjectNode body = JSON.createObjectNode()
                        .put("capabilityId", a.get(0))
                        .put("target", a.get(1));
                yield send(inv, "POST", "/dev/users", neighbors(body, a.subList(2, a.size())));
            }
            case "dev-update" -> {
                ObjectNode body = JSON.createObjectNode().put("capabilityId", a.get(0));
                yield send(inv, "PUT", "/dev/users/" + seg(a.get(1)) + "/node",
                        neighbors(body, a.subList(2, a.size())));
            }
            default -> throw new CliException("unknown command: " + inv.command());
        };
    }

    private void run(Invocation inv) throws Exception {
        HttpResponse<String> resp = http.send(request(inv), HttpResponse.BodyHandlers.ofString());
        String pretty = pretty(resp.body());
        if (resp.statusCode() / 100 != 2) {
            throw new CliException(inv.command() + " failed (" + resp.statusCode() + "): " + pretty);
        }
        System.out.println(pretty);
    }

    private static ObjectNode neighbors(ObjectNode body, List<String> peers) {
        ArrayNode arr = body.putArray("neighbors");
        peers.forEach(arr::add);
        return body;
    }

    private static HttpRequest send(Invocation inv, String method, String path, ObjectNode body) {
        try {
            return builder(inv, path)
                    .header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofByteArray(JSON.writeValueAsBytes(body)))
                    .build();
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new IllegalStateException("cannot encode request body", e);
        }
    }

    private static HttpRequest get(Invocation inv, String path) {
        return builder(inv, path).GET().build();
    }

    private static HttpRequest.Builder builder(Invocation inv, String path) {
        HttpRequest.Builder b = HttpRequest.newBuilder().uri(URI.create(inv.baseUrl() + path));
        if (inv.identity() != null) {
            b.header(IDENTITY_HEADER, inv.identity());
        }
        return b;
    }

    private static String seg(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /** Pretty-print JSON; anything unparseable is returned as-is. */
    static String pretty(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = JSON.readTree(body);
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            return body;
        }
    }

    private static String usage() {
        return """
                Usage:
                  proxgraph-cli [--base-url http://host:port] --as <identity> register [peer...]
                  proxgraph-cli [--base-url http://host:port] --as <identity> update <userId> [peer...]
                  proxgraph-cli [--base-url http://host:port] show <userId>
                  proxgraph-cli [--base-url http://host:port] history <userId>
                  proxgraph-cli [--base-url http://host:port] registry
                  proxgraph-cli [--base-url http://host:port] --as <identity> spawn <capabilityId> <target> [peer...]
                  proxgraph-cli [--base-url http://host:port] --as <identity> dev-update <capabilityId> <userId> [peer...]
                """;
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
