package io.github.depot2git.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.github.depot2git.UnrecognizedInputException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Reads the XML configuration file.
 *
 * <pre>{@code
 * <depot2git>
 *     <source depot="Trunk" username="joe" password="secret" start-transaction="1" end-transaction="now">
 *         <stream name="Trunk" branch-name="main"/>
 *         <stream name="Dev"/>
 *     </source>
 *     <git repo-path="trunk-git" message-style="normal">
 *         <remote name="origin" url="https://example.com/trunk.git" push-url="ssh://git@example.com/trunk.git"/>
 *     </git>
 *     <method>deep-hist</method>
 *     <merge-strategy>normal</merge-strategy>
 *     <retry attempts="3" delay-seconds="3"/>
 *     <usermaps>
 *         <map-user source="joe" name="Joe Bloggs" email="joe@example.com" timezone="+0100"/>
 *     </usermaps>
 * </depot2git>
 * }</pre>
 *
 * A relative {@code repo-path} is resolved against the directory holding the configuration file.
 */
public final class ConfigLoader {
    private static final Logger logger = LogManager.getLogger(ConfigLoader.class);
    private static final XmlMapper xmlMapper = new XmlMapper();

    public static final String DEFAULT_FILENAME = "depot2git.xml";

    private ConfigLoader() {}

    public static ConverterConfig load(Path file) throws IOException, UnrecognizedInputException {
        logger.debug("Loading configuration from {}", file);
        var base = file.toAbsolutePath().getParent();
        return parse(Files.readString(file), base == null ? Path.of("") : base);
    }

    public static ConverterConfig parse(String xml, Path baseDirectory) throws UnrecognizedInputException {
        JsonNode root;
        try {
            root = xmlMapper.readTree(xml);
        } catch (JsonProcessingException e) {
            throw new UnrecognizedInputException("Configuration is not well-formed XML: " + e.getOriginalMessage(), e);
        }
        if (root == null) {
            throw new UnrecognizedInputException("Configuration is empty");
        }

        var source = required(root, "source");
        var depot = requiredAttr(source, "depot");
        var git = required(root, "git");
        var repoPath = baseDirectory.resolve(requiredAttr(git, "repo-path")).normalize();

        var config = ConverterConfig.defaults(depot, repoPath);
        var start = attr(source, "start-transaction");
        if (start != null) {
            config = config.withStartTransaction(parseLong(start, "start-transaction"));
        }
        var end = attr(source, "end-transaction");
        if (end != null) {
            config = config.withEndTransaction(end);
        }
        var style = attr(git, "message-style");
        if (style != null) {
            config = config.withMessageStyle(MessageStyle.fromConfigName(style));
        }
        var method = text(root.get("method"));
        if (method != null) {
            config = config.withMethod(RetrievalMethod.fromConfigName(method));
        }
        var strategy = text(root.get("merge-strategy"));
        if (strategy != null) {
            config = config.withMergeStrategy(MergeStrategy.fromConfigName(strategy));
        }
        var retry = root.get("retry");
        if (retry != null) {
            var attempts = attr(retry, "attempts");
            var delay = attr(retry, "delay-seconds");
            config = config.withRetry(
                    attempts == null ? config.retryAttempts() : (int) parseLong(attempts, "attempts"),
                    delay == null ? config.retryDelay() : Duration.ofSeconds(parseLong(delay, "delay-seconds")));
            if (config.retryAttempts() < 1) {
                throw new UnrecognizedInputException("retry attempts must be at least 1");
            }
        }

        var streams = new ArrayList<StreamMapping>();
        for (var stream : children(source, "stream")) {
            streams.add(new StreamMapping(requiredAttr(stream, "name"), attr(stream, "branch-name")));
        }
        var users = new ArrayList<UserMapping>();
        var usermaps = root.get("usermaps");
        if (usermaps != null) {
            for (var user : children(usermaps, "map-user")) {
                users.add(new UserMapping(
                        requiredAttr(user, "source"),
                        requiredAttr(user, "name"),
                        requiredAttr(user, "email"),
                        attr(user, "timezone")));
            }
        }

        var remotes = new ArrayList<RemoteMapping>();
        for (var remote : children(git, "remote")) {
            var name = requiredAttr(remote, "name");
            if (remotes.stream().anyMatch(r -> r.name().equals(name))) {
                throw new UnrecognizedInputException("Remote " + name + " is configured twice");
            }
            remotes.add(new RemoteMapping(name, requiredAttr(remote, "url"), attr(remote, "push-url")));
        }

        var executable = attr(source, "executable");
        return new ConverterConfig(
                config.depot(),
                attr(source, "username"),
                attr(source, "password"),
                executable == null ? config.executable() : executable,
                config.startTransaction(),
                config.endTransaction(),
                streams,
                config.gitRepoPath(),
                config.messageStyle(),
                config.method(),
                config.mergeStrategy(),
                config.retryAttempts(),
                config.retryDelay(),
                users,
                remotes);
    }

    private static JsonNode required(JsonNode parent, String name) throws UnrecognizedInputException {
        var node = parent.get(name);
        if (node == null || node.isNull()) {
            throw new UnrecognizedInputException("Configuration is missing <" + name + ">");
        }
        return node;
    }

    private static List<JsonNode> children(JsonNode parent, String name) {
        var node = parent.get(name);
        if (node == null || node.isNull()) {
            return List.of();
        }
        var list = new ArrayList<JsonNode>();
        if (node.isArray()) {
            node.forEach(list::add);
        } else {
            list.add(node);
        }
        return list;
    }

    private static @Nullable String attr(JsonNode element, String name) {
        var node = element.get(name);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return node.asText().trim();
    }

    private static String requiredAttr(JsonNode element, String name) throws UnrecognizedInputException {
        var value = attr(element, name);
        if (value == null) {
            throw new UnrecognizedInputException("Configuration is missing the " + name + " attribute");
        }
        return value;
    }

    private static @Nullable String text(@Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        var text = node.isObject() && node.has("") ? node.get("").asText() : node.asText();
        return text.isBlank() ? null : text.trim();
    }

    private static long parseLong(String value, String what) throws UnrecognizedInputException {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new UnrecognizedInputException("Configuration value " + what + " is not a number: " + value, e);
        }
    }
}
