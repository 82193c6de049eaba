package com.schemascope.cli;

import com.schemascope.core.BackendKind;
import com.schemascope.core.SchemaAssembler;
import com.schemascope.core.model.Column;
import com.schemascope.core.model.DatabaseSchema;
import com.schemascope.core.model.DocumentCollection;
import com.schemascope.core.model.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SchemaWriterTest {
    private final SchemaWriter writer = new SchemaWriter();

    private static DatabaseSchema accounts() {
        return SchemaAssembler.relational("shop", BackendKind.POSTGRES, "public", List.of(
                new Table("accounts", "public", List.of(
                        new Column("id", "integer", "NO", null, 32, 0, true, true, "nextval('accounts_id_seq'::regclass)"),
                        new Column("email", "character varying", "YES", 255L, null, null, false, false, ""))),
                new Table("empty", "public", List.of())));
    }

    @Test
    void prettyPrintsWithTwoSpaceIndentation() throws Exception {
        String json = writer.toJson(accounts());

        assertTrue(json.startsWith("{\n  \"databaseName\": \"shop\",\n  \"dbType\": \"postgres\",\n"));
        assertTrue(json.contains("\n      \"columns\": [\n        {\n          \"columnName\": \"id\","));
        assertTrue(json.contains("\"columns\": []"));
        assertTrue(json.endsWith("}\n"));
        assertFalse(json.contains(" : "));
    }

    @Test
    void absentValuesAreLeftOut() throws Exception {
        String json = writer.toJson(accounts());
        String email = json.substring(json.indexOf("\"columnName\": \"email\""));
        email = email.substring(0, email.indexOf('}'));

        assertTrue(email.contains("\"maxLength\": 255"));
        assertFalse(email.contains("precision"));
        assertFalse(email.contains("scale"));
        assertFalse(email.contains("defaultValue"));
        assertTrue(json.contains("\"scale\": 0"));
    }

    @Test
    void collectionsWithoutIndexes() throws Exception {
        String json = writer.toJson(SchemaAssembler.document("catalog",
                List.of(DocumentCollection.named("users", "catalog"))));

        assertTrue(json.contains("\"dbType\": \"mongodb\""));
        assertTrue(json.contains("\"collectionName\": \"users\""));
        assertFalse(json.contains("indexes"));
        assertFalse(json.contains("sampleDocument"));
    }

    @Test
    void writesAndReplacesTarget(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("out/schema.json");
        Files.createDirectories(target.getParent());
        Files.writeString(target, "stale");

        writer.write(accounts(), target);

        assertEquals(writer.toJson(accounts()), Files.readString(target));
        assertEquals(List.of(target), listFiles(target.getParent()));
    }

    @Test
    void writesUtf8(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("schema.json");
        DatabaseSchema schema = SchemaAssembler.relational("Bücher", BackendKind.MYSQL, "Bücher", List.of(
                new Table("Größe", "Bücher", List.of(new Column("maß", "varchar", "YES", 10L, null, null, false, false, "")))));

        writer.write(schema, target);

        String json = writer.toJson(schema);
        assertEquals(json, Files.readString(target));
        assertEquals(json.getBytes(StandardCharsets.UTF_8).length, Files.size(target));
        assertTrue(Files.size(target) > json.length());
    }

    @Test
    void failedWriteLeavesNothingBehind(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("schema.json");
        Files.createDirectories(target);
        Files.writeString(target.resolve("keep.txt"), "occupied");

        assertThrows(IOException.class, () -> writer.write(accounts(), target));

        assertTrue(Files.isDirectory(target));
        assertEquals(List.of(target), listFiles(dir));
    }

    private static List<Path> listFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.toList();
        }
    }
}
