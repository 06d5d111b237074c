package io.github.depot2git.git;

import com.google.common.base.Joiner;
import io.github.depot2git.config.MessageStyle;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.Transaction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Builds commit messages for branch commits. The source's own metadata ends up as aligned trailers in the
 * message, in a separate notes ref, or nowhere, depending on the {@link MessageStyle}.
 */
public final class CommitMessages {
    public static final String INFO_NOTES_REF = "refs/notes/depot2git-info";

    /** @param info raw source metadata destined for {@link #INFO_NOTES_REF}; null when it stays in the message */
    public record Message(String text, @Nullable String info) {}

    private final MessageStyle style;

    public CommitMessages(MessageStyle style) {
        this.style = style;
    }

    public MessageStyle style() {
        return style;
    }

    /**
     * @param title short description of what the converter did, e.g. a merge; may be null
     * @param destination promotion destination, null for other kinds
     * @param source promotion source, null for other kinds
     */
    public Message compose(
            Transaction transaction,
            StreamInfo stream,
            @Nullable String title,
            @Nullable StreamInfo destination,
            @Nullable StreamInfo source) {
        var comment = transaction.comment().strip();
        var trailers = trailers(transaction, stream, destination, source);
        return switch (style) {
            case CLEAN -> new Message(comment.isEmpty() ? fallback(transaction, title) : comment + "\n", null);
            case NORMAL -> new Message(join(title, comment, trailers), null);
            case NOTES -> new Message(join(title, comment, null), trailers);
        };
    }

    private static String fallback(Transaction transaction, @Nullable String title) {
        return (title != null ? title : "Transaction " + transaction.id()) + "\n";
    }

    private static String join(@Nullable String title, String comment, @Nullable String trailers) {
        var sections = new ArrayList<String>();
        if (title != null && !title.isBlank()) {
            sections.add(title.strip());
        }
        if (!comment.isEmpty()) {
            sections.add(comment);
        }
        if (trailers != null) {
            sections.add(trailers);
        }
        if (sections.isEmpty()) {
            return "\n";
        }
        return Joiner.on("\n\n").join(sections) + "\n";
    }

    static String trailers(
            Transaction transaction,
            StreamInfo stream,
            @Nullable StreamInfo destination,
            @Nullable StreamInfo source) {
        Map<String, String> lines = new LinkedHashMap<>();
        lines.put("Depot-transaction", transaction.id() + " (" + transaction.kind().wireName() + ")");
        lines.put("Depot-user", transaction.user());
        lines.put("Depot-stream", describe(stream));
        if (stream.basisName() != null) {
            lines.put("Depot-stream-basis", stream.basisName() + " (" + stream.basisNumber() + ")");
        }
        if (destination != null && destination.number() != stream.number()) {
            lines.put("Depot-destination-stream", describe(destination));
        }
        if (source != null) {
            lines.put("Depot-source-stream", describe(source));
        }

        int width = lines.keySet().stream().mapToInt(String::length).max().orElse(0) + 1;
        var result = new StringBuilder();
        for (var line : lines.entrySet()) {
            if (!result.isEmpty()) {
                result.append('\n');
            }
            var key = line.getKey() + ":";
            result.append(key).append(" ".repeat(width - key.length() + 1)).append(line.getValue());
        }
        return result.toString();
    }

    private static String describe(StreamInfo stream) {
        return stream.name() + " (" + stream.number() + ")";
    }
}
