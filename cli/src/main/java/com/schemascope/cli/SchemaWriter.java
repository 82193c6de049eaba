package com.schemascope.cli;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.schemascope.core.model.SchemaSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a snapshot as pretty-printed JSON: two-space indentation, one array element per line,
 * a trailing newline. The file appears at its target path only once it is complete.
 */
public class SchemaWriter {
    private static final Logger logger = LoggerFactory.getLogger(SchemaWriter.class);

    private final ObjectWriter writer;

    public SchemaWriter() {
        this.writer = new ObjectMapper().writer(new SnapshotPrettyPrinter());
    }

    public String toJson(SchemaSnapshot snapshot) throws JsonProcessingException {
        return writer.writeValueAsString(snapshot) + "\n";
    }

    public void write(SchemaSnapshot snapshot, Path target) throws IOException {
        String json = toJson(snapshot);

        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Files.createDirectories(directory);

        Path temp = Files.createTempFile(directory, "." + absolute.getFileName(), ".tmp");
        try {
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.info("Wrote {} bytes to {}", Files.size(absolute), absolute);
    }

    /**
     * Jackson's default printer with {@code "key": value} spacing and {@code []} / {@code {}} for
     * empty containers.
     */
    static class SnapshotPrettyPrinter extends DefaultPrettyPrinter {
        private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

        SnapshotPrettyPrinter() {
            indentArraysWith(INDENTER);
            indentObjectsWith(INDENTER);
        }

        SnapshotPrettyPrinter(SnapshotPrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new SnapshotPrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (nrOfValues > 0) {
                super.writeEndArray(g, nrOfValues);
                return;
            }
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            g.writeRaw(']');
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (nrOfEntries > 0) {
                super.writeEndObject(g, nrOfEntries);
                return;
            }
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            g.writeRaw('}');
        }
    }
}
