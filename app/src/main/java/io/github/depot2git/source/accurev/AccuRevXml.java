package io.github.depot2git.source.accurev;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.github.depot2git.TransientCommandException;
import io.github.depot2git.UnrecognizedInputException;
import io.github.depot2git.source.Depot;
import io.github.depot2git.source.ElementChange;
import io.github.depot2git.source.StreamDiff;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.StreamKind;
import io.github.depot2git.source.StreamRef;
import io.github.depot2git.source.Transaction;
import io.github.depot2git.source.TransactionKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;

/**
 * Parses the XML the {@code accurev} client prints with {@code -fx}. Malformed or truncated output is reported as a
 * transient failure so the command is retried; values outside the known vocabulary are fatal.
 */
public final class AccuRevXml {
    private static final XmlMapper xmlMapper = new XmlMapper();

    private AccuRevXml() {}

    public static List<Depot> depots(String xml) throws TransientCommandException {
        var depots = new ArrayList<Depot>();
        for (var element : children(read(xml), "Element")) {
            depots.add(new Depot(intAttr(element, "Number"), textAttr(element, "Name")));
        }
        return depots;
    }

    public static Set<String> users(String xml) throws TransientCommandException {
        var users = new TreeSet<String>();
        for (var element : children(read(xml), "Element")) {
            users.add(textAttr(element, "Name"));
        }
        return users;
    }

    public static List<StreamInfo> streams(String xml) throws TransientCommandException, UnrecognizedInputException {
        var streams = new ArrayList<StreamInfo>();
        for (var element : children(read(xml), "stream")) {
            var timeLock = optionalAttr(element, "time");
            var basisNumber = optionalAttr(element, "basisStreamNumber");
            streams.add(new StreamInfo(
                    intAttr(element, "streamNumber"),
                    textAttr(element, "name"),
                    textAttr(element, "depotName"),
                    StreamKind.fromWireName(textAttr(element, "type")),
                    basisNumber == null ? null : parseInt(basisNumber, "basisStreamNumber"),
                    optionalAttr(element, "basis"),
                    timeLock == null || timeLock.equals("0") ? null : parseLong(timeLock, "time"),
                    null,
                    null,
                    null));
        }
        streams.sort(Comparator.comparingInt(StreamInfo::number));
        return streams;
    }

    public static List<Transaction> transactions(String xml)
            throws TransientCommandException, UnrecognizedInputException {
        var transactions = new ArrayList<Transaction>();
        for (var element : children(read(xml), "transaction")) {
            transactions.add(transaction(element));
        }
        transactions.sort(Comparator.comparingLong(Transaction::id));
        return transactions;
    }

    public static StreamDiff diff(String xml, long fromTransaction, long toTransaction)
            throws TransientCommandException {
        var changes = new ArrayList<ElementChange>();
        for (var element : children(read(xml), "Element")) {
            for (var change : children(element, "Change")) {
                var from = children(change, "Stream1");
                var to = children(change, "Stream2");
                changes.add(new ElementChange(
                        from.isEmpty() ? null : normalizePath(optionalAttr(from.get(0), "Name")),
                        to.isEmpty() ? null : normalizePath(optionalAttr(to.get(0), "Name"))));
            }
        }
        return new StreamDiff(fromTransaction, toTransaction, changes);
    }

    private static Transaction transaction(JsonNode element)
            throws TransientCommandException, UnrecognizedInputException {
        var kind = TransactionKind.fromWireName(textAttr(element, "type"));
        var comment = textContent(element.get("comment"));

        @Nullable StreamRef stream = streamRef(element, "streamNumber", "streamName");
        @Nullable StreamRef from = streamRef(element, "fromStreamNumber", "fromStreamName");

        // older servers only name the streams through the versions' named versions
        var versions = children(element, "version");
        if (stream == null && !versions.isEmpty()) {
            stream = namedVersionStream(versions.get(0), "virtualNamedVersion", "virtual");
        }
        if (kind == TransactionKind.PROMOTE && from == null && !versions.isEmpty()) {
            from = namedVersionStream(versions.get(0), "realNamedVersion", "real");
        }
        return new Transaction(
                parseLong(textAttr(element, "id"), "id"),
                kind,
                textAttr(element, "user"),
                parseLong(textAttr(element, "time"), "time"),
                comment,
                stream,
                kind == TransactionKind.PROMOTE ? from : null);
    }

    private static @Nullable StreamRef streamRef(JsonNode element, String numberAttr, String nameAttr)
            throws TransientCommandException {
        var number = optionalAttr(element, numberAttr);
        var name = optionalAttr(element, nameAttr);
        if (number == null || name == null) {
            return null;
        }
        return new StreamRef(parseInt(number, numberAttr), name);
    }

    /** Named versions look like {@code Stream/12}, numbered ones like {@code 5/12}. */
    private static @Nullable StreamRef namedVersionStream(JsonNode version, String namedAttr, String numberedAttr)
            throws TransientCommandException {
        var named = optionalAttr(version, namedAttr);
        var numbered = optionalAttr(version, numberedAttr);
        if (named == null || numbered == null) {
            return null;
        }
        var name = named.substring(0, Math.max(0, named.lastIndexOf('/')));
        var number = numbered.substring(0, Math.max(0, numbered.indexOf('/')));
        return new StreamRef(parseInt(number, numberedAttr), name);
    }

    static @Nullable String normalizePath(@Nullable String path) {
        if (path == null) {
            return null;
        }
        var normalized = path.replace('\\', '/');
        if (normalized.startsWith("/./")) {
            normalized = normalized.substring(3);
        } else if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    private static JsonNode read(String xml) throws TransientCommandException {
        if (xml.isBlank()) {
            throw new TransientCommandException("accurev returned no output");
        }
        try {
            var root = xmlMapper.readTree(xml);
            return root == null || root.isMissingNode() ? xmlMapper.createObjectNode() : root;
        } catch (JsonProcessingException e) {
            throw new TransientCommandException("Unreadable accurev output: " + e.getOriginalMessage(), e);
        }
    }

    /** Repeated elements come back as an array, a single one as an object. */
    private static List<JsonNode> children(JsonNode parent, String name) {
        var node = parent.get(name);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            var list = new ArrayList<JsonNode>();
            node.forEach(list::add);
            return list;
        }
        return List.of(node);
    }

    private static String textContent(@Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isObject()) {
            var text = node.get("");
            return text == null ? "" : text.asText();
        }
        return node.asText();
    }

    private static @Nullable String optionalAttr(JsonNode element, String name) {
        var node = element.get(name);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String textAttr(JsonNode element, String name) throws TransientCommandException {
        var value = optionalAttr(element, name);
        if (value == null) {
            throw new TransientCommandException("accurev output is missing attribute " + name);
        }
        return value;
    }

    private static int intAttr(JsonNode element, String name) throws TransientCommandException {
        return parseInt(textAttr(element, name), name);
    }

    private static int parseInt(String value, String what) throws TransientCommandException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new TransientCommandException("Bad " + what + " in accurev output: " + value, e);
        }
    }

    private static long parseLong(String value, String what) throws TransientCommandException {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new TransientCommandException("Bad " + what + " in accurev output: " + value, e);
        }
    }
}
