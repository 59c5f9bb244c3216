package com.resonance.matrix.migration;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.error.CorruptionDetectedException;
import com.resonance.matrix.error.SourceUnavailableException;
import com.resonance.matrix.error.ValidationException;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads nodes one at a time from a JSON document with the Jackson streaming parser,
 * so that the whole collection is never held in memory.
 *
 * <p>The document root is either an array of nodes or an object with a {@code nodes}
 * array (the shape of {@code registry.json}). Array elements that are not objects are
 * returned as nodes without an id, so that validation rejects them at their index.
 * A well-formed object that does not bind to a node (a string where a number belongs,
 * say) is reported as {@link ValidationException} and the reader stays usable.</p>
 *
 * <p>Malformed JSON is reported as {@link CorruptionDetectedException}: once the parser
 * loses its position no later index can be trusted.</p>
 */
public class StreamingNodeReader implements Iterator<Node>, Closeable {

    private final Path source;
    private final ObjectMapper mapper;
    private final JsonParser parser;
    private boolean pending;
    private boolean exhausted;
    private long nextIndex;

    public StreamingNodeReader(Path source, ObjectMapper mapper) {
        this.source = source;
        this.mapper = mapper;
        if (!Files.isRegularFile(source)) {
            throw new SourceUnavailableException(source, "Migration input not found");
        }
        try {
            this.parser = mapper.getFactory().createParser(source.toFile());
            positionAtNodesArray();
        } catch (IOException e) {
            throw new CorruptionDetectedException("Cannot open node array in " + source, e);
        }
    }

    /**
     * Counts the nodes of a document in a separate streaming pass.
     */
    public static long count(Path source, ObjectMapper mapper) {
        try (StreamingNodeReader reader = new StreamingNodeReader(source, mapper)) {
            return reader.skip(Long.MAX_VALUE);
        }
    }

    @Override
    public boolean hasNext() {
        if (exhausted) {
            return false;
        }
        if (pending) {
            return true;
        }
        try {
            JsonToken token = parser.nextToken();
            if (token == null || token == JsonToken.END_ARRAY) {
                exhausted = true;
                return false;
            }
            pending = true;
            return true;
        } catch (IOException e) {
            throw corruption(e);
        }
    }

    @Override
    public Node next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        pending = false;
        long index = nextIndex++;
        JsonNode tree;
        try {
            if (parser.currentToken() != JsonToken.START_OBJECT) {
                parser.skipChildren();
                return Node.builder().build();
            }
            tree = mapper.readTree(parser);
        } catch (IOException e) {
            throw corruption(e);
        }
        try {
            return mapper.treeToValue(tree, Node.class);
        } catch (JsonProcessingException e) {
            JsonNode id = tree.get("id");
            throw new ValidationException(id != null && id.isTextual() ? id.asText() : null, index,
                    "Node does not bind: " + e.getOriginalMessage());
        }
    }

    /**
     * Advances past up to {@code count} nodes without binding them.
     *
     * @return the number of nodes actually skipped
     */
    public long skip(long count) {
        long skipped = 0;
        try {
            while (skipped < count && hasNext()) {
                pending = false;
                parser.skipChildren();
                nextIndex++;
                skipped++;
            }
        } catch (IOException e) {
            throw corruption(e);
        }
        return skipped;
    }

    @Override
    public void close() {
        try {
            parser.close();
        } catch (IOException e) {
            throw new CorruptionDetectedException("Cannot close " + source, e);
        }
    }

    private void positionAtNodesArray() throws IOException {
        JsonToken token = parser.nextToken();
        if (token == JsonToken.START_ARRAY) {
            return;
        }
        if (token != JsonToken.START_OBJECT) {
            throw new CorruptionDetectedException("Expected an array or an object with 'nodes' in " + source);
        }
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            JsonToken value = parser.nextToken();
            if ("nodes".equals(field) && value == JsonToken.START_ARRAY) {
                return;
            }
            parser.skipChildren();
        }
        throw new CorruptionDetectedException("No 'nodes' array found in " + source);
    }

    private CorruptionDetectedException corruption(IOException e) {
        return new CorruptionDetectedException("Malformed node stream in " + source + ": " + e.getMessage(), e);
    }
}
