package io.github.depot2git.git;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.depot2git.source.StreamInfo;
import io.github.depot2git.source.Transaction;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Links a branch commit back to the source transaction that produced it. Stored as a JSON note on the commit.
 * The destination and source fields are only set for promotions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Annotation(
        @JsonProperty("depot") String depot,
        @JsonProperty("stream") String stream,
        @JsonProperty("stream_number") int streamNumber,
        @JsonProperty("transaction_number") long transactionNumber,
        @JsonProperty("transaction_kind") String transactionKind,
        @JsonProperty("dst_stream") @Nullable String dstStream,
        @JsonProperty("dst_stream_number") @Nullable Integer dstStreamNumber,
        @JsonProperty("src_stream") @Nullable String srcStream,
        @JsonProperty("src_stream_number") @Nullable Integer srcStreamNumber) {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static Annotation of(String depot, StreamInfo stream, Transaction transaction) {
        return new Annotation(
                depot,
                stream.name(),
                stream.number(),
                transaction.id(),
                transaction.kind().wireName(),
                null,
                null,
                null,
                null);
    }

    public Annotation withPromotion(StreamInfo destination, @Nullable StreamInfo source) {
        return new Annotation(
                depot,
                stream,
                streamNumber,
                transactionNumber,
                transactionKind,
                destination.name(),
                destination.number(),
                source == null ? null : source.name(),
                source == null ? null : source.number());
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Annotation is not serializable", e);
        }
    }

    /** Empty when the text is not an annotation. */
    public static Optional<Annotation> parse(String json) {
        try {
            var annotation = objectMapper.readValue(json, Annotation.class);
            if (annotation.stream() == null || annotation.transactionKind() == null) {
                return Optional.empty();
            }
            return Optional.of(annotation);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
