// file: client/src/main/java/io/fset/client/Cli.java
package io.fset.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple CLI for interacting with a running fset server over HTTP.
 *
 * Usage:
 *   fset-cli [--base-url http://host:port] get <name>
 *   fset-cli [--base-url http://host:port] create [key]
 *   fset-cli [--base-url http://host:port] diff <name> <diff.json>
 *
 * Examples:
 *   fset-cli create billing
 *   fset-cli get billing
 *   fset-cli diff billing ./changes.json
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String baseUrl = parsed.getKey();
            String[] rest = parsed.getValue();

            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(baseUrl);

            switch (cmd) {
                case "get" -> {
                    if (rest.length != 2) {
                        usageAndExit("get requires <name>");
                    }
                    cli.get(rest[1]);
                }
                case "create" -> {
                    if (rest.length > 2) {
                        usageAndExit("create takes at most one <key>");
                    }
                    cli.create(rest.length == 2 ? rest[1] : null);
                }
                case "diff" -> {
                    if (rest.length != 3) {
                        usageAndExit("diff requires <name> <diff.json>");
                    }
                    cli.diff(rest[1], Path.of(rest[2]));
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private void get(String name) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/projects/" + encode(name)))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 404) {
            System.out.println("(not found)");
            return;
        }
        if (resp.statusCode() != 200) {
            throw new CliException("GET failed (" + resp.statusCode() + "): " + resp.body());
        }
        printPretty(resp.body());
    }

    private void create(String key) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        if (key != null) {
            body.put("key", key);
        }

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/projects"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 201) {
            throw new CliException("CREATE failed (" + resp.statusCode() + "): " + resp.body());
        }
        printPretty(resp.body());
    }

    private void diff(String name, Path diffFile) throws Exception {
        if (!Files.isRegularFile(diffFile)) {
            throw new CliException("no such file: " + diffFile);
        }
        // Parse locally first so obviously broken files never reach the server.
        JsonNode diff = json.readTree(diffFile.toFile());
        if (diff == null || !diff.isObject()) {
            throw new CliException("diff file must contain a JSON object");
        }

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/projects/" + encode(name) + "/diff"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(diff)))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("DIFF failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println("OK");
        printPretty(resp.body());
    }

    private void printPretty(String body) throws Exception {
        JsonNode node = json.readTree(body);
        System.out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(node));
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  fset-cli [--base-url http://host:port] get <name>
                  fset-cli [--base-url http://host:port] create [key]
                  fset-cli [--base-url http://host:port] diff <name> <diff.json>
                """);
        System.exit(1);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
