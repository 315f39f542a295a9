package com.raditha.treediff.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TreeDiffCLITest {

    private static final String OLD_SOURCE = "class A {\n    int f(int a, int b) {\n        return a + b;\n    }\n}\n";
    private static final String NEW_SOURCE = "class A {\n    int f(int a, int c) {\n        return a + c;\n    }\n}\n";

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmd = TreeDiffCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
    }

    private Path write(String name, String source) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, source);
        return file;
    }

    @Test
    void testTextDiffOfTwoFiles() throws IOException {
        Path oldFile = write("old/A.java", OLD_SOURCE);
        Path newFile = write("new/A.java", NEW_SOURCE);

        int exitCode = cmd.execute(oldFile.toString(), newFile.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("=== A.java ==="));
        assertTrue(out.toString().contains("~  replace  IDENTIFIER:LEAF \"b\""));
    }

    @Test
    void testJsonOutput() throws IOException {
        Path oldFile = write("old/A.java", OLD_SOURCE);
        Path newFile = write("new/A.java", NEW_SOURCE);

        int exitCode = cmd.execute("--json", "--mapping", oldFile.toString(), newFile.toString());

        assertEquals(0, exitCode, err.toString());
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertTrue(root.get("changed").asBoolean());
        assertTrue(root.get("mapping").size() > 0);
    }

    @Test
    void testUnchangedFile() throws IOException {
        Path oldFile = write("old/A.java", OLD_SOURCE);
        Path newFile = write("new/A.java", OLD_SOURCE);

        int exitCode = cmd.execute("--json", oldFile.toString(), newFile.toString());

        assertEquals(0, exitCode);
        assertFalse(new ObjectMapper().readTree(out.toString()).get("changed").asBoolean());
    }

    @Test
    void testMissingFileIsConfigurationError() throws IOException {
        Path oldFile = write("old/A.java", OLD_SOURCE);

        int exitCode = cmd.execute(oldFile.toString(), dir.resolve("missing.java").toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Not found"));
    }

    @Test
    void testConflictingPresets() throws IOException {
        Path oldFile = write("old/A.java", OLD_SOURCE);
        Path newFile = write("new/A.java", NEW_SOURCE);

        assertEquals(2, cmd.execute("--strict", "--lenient", oldFile.toString(), newFile.toString()));
    }

    @Test
    void testThresholdOutOfRange() throws IOException {
        Path oldFile = write("old/A.java", OLD_SOURCE);
        Path newFile = write("new/A.java", NEW_SOURCE);

        assertEquals(2, cmd.execute("--threshold", "150", oldFile.toString(), newFile.toString()));
    }

    @Test
    void testUnknownOption() {
        assertEquals(2, cmd.execute("--bogus", "a", "b"));
    }

    @Test
    void testFileAgainstDirectory() throws IOException {
        Path oldFile = write("old/A.java", OLD_SOURCE);
        Files.createDirectories(dir.resolve("new"));

        assertEquals(2, cmd.execute(oldFile.toString(), dir.resolve("new").toString()));
    }

    @Test
    void testDirectoriesPairedByRelativePath() throws IOException {
        write("old/p/A.java", OLD_SOURCE);
        write("new/p/A.java", NEW_SOURCE);
        write("old/p/Gone.java", "class Gone {}\n");
        write("new/p/Added.java", "class Added {}\n");

        int exitCode = cmd.execute("--threads", "2", dir.resolve("old").toString(), dir.resolve("new").toString());

        assertEquals(0, exitCode, err.toString());
        String output = out.toString();
        assertTrue(output.contains("A.java ==="));
        assertFalse(output.contains("Gone"));
        assertFalse(output.contains("Added"));
    }

    @Test
    void testCustomConfigFile() throws IOException {
        Path oldFile = write("old/A.java", OLD_SOURCE);
        Path newFile = write("new/A.java", NEW_SOURCE);
        Path config = write("treediff.yml", "tree_diff:\n  threshold: 0.2\n  metric: euclidean\n");

        int exitCode = cmd.execute("--config-file", config.toString(), oldFile.toString(), newFile.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("replace"));
    }

    @Test
    void testBadConfigFileValue() throws IOException {
        Path oldFile = write("old/A.java", OLD_SOURCE);
        Path newFile = write("new/A.java", NEW_SOURCE);
        Path config = write("treediff.yml", "tree_diff:\n  metric: manhattan\n");

        assertEquals(2, cmd.execute("--config-file", config.toString(), oldFile.toString(), newFile.toString()));
        assertTrue(err.toString().contains("manhattan"));
    }

    @Test
    void testMissingConfigFileIsIoError() throws IOException {
        Path oldFile = write("old/A.java", OLD_SOURCE);
        Path newFile = write("new/A.java", NEW_SOURCE);

        assertEquals(3, cmd.execute("--config-file", dir.resolve("none.yml").toString(),
                oldFile.toString(), newFile.toString()));
    }
}
