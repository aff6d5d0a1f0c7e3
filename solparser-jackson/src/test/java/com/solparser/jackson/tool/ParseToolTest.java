package com.solparser.jackson.tool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ParseToolTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private ParseTool tool;

    @AfterEach
    void shutdown() {
        if (tool != null) {
            tool.shutdown();
        }
    }

    private int run(String... args) throws IOException {
        ParseTool.Config config = ParseTool.Config.parse(args);
        assertNotNull(config);
        shutdown();
        tool = new ParseTool(config);
        return tool.run(new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testCleanFile() throws IOException {
        Path file = write("ok.sol", "// SPDX-License-Identifier: MIT\ncontract C {}\n");
        assertEquals(0, run("--verbose", file.toString()));
        assertEquals("[OK] " + file + System.lineSeparator(), output());
    }

    @Test
    void testSyntaxErrorSetsExitCode() throws IOException {
        Path file = write("bad.sol", "// SPDX-License-Identifier: MIT\ncontract C {");
        assertEquals(1, run(file.toString()));
        assertTrue(output().contains("Error 2314: Expected '}' but got end of source"), output());
    }

    @Test
    void testWarningsDoNotFail() throws IOException {
        Path file = write("nolicense.sol", "contract C {}");
        assertEquals(0, run(file.toString()));
        assertTrue(output().contains("Warning 1878"), output());
    }

    @Test
    void testRecoveryOption() throws IOException {
        Path file = write("broken.sol", "// SPDX-License-Identifier: MIT\n"
            + "contract C { function f() public { uint x = ; } }");
        assertEquals(1, run("--recovery", "--json", file.toString()));
        String output = output();
        assertTrue(output.contains("Error 6933"), output);
        assertTrue(output.contains("\"nodeType\" : \"SourceUnit\""), output);
    }

    @Test
    void testJsonOutput() throws IOException {
        Path file = write("token.sol", "// SPDX-License-Identifier: MIT\ncontract Token { uint total; }");
        assertEquals(0, run("--json", file.toString()));
        String output = output();
        assertTrue(output.contains("\"nodeType\" : \"ContractDefinition\""), output);
        assertTrue(output.contains("\"name\" : \"Token\""), output);
    }

    @Test
    void testDirectoryWalk() throws IOException {
        write("a/one.sol", "// SPDX-License-Identifier: MIT\ncontract A {}");
        write("a/b/two.sol", "// SPDX-License-Identifier: MIT\ncontract B {}");
        write("a/notes.txt", "not solidity");
        assertEquals(0, run("--verbose", "--threads=2", dir.resolve("a").toString()));
        String output = output();
        assertTrue(output.contains("one.sol"), output);
        assertTrue(output.contains("two.sol"), output);
        assertFalse(output.contains("notes.txt"), output);
    }

    @Test
    void testCompilerVersionOption() throws IOException {
        Path file = write("new.sol", "// SPDX-License-Identifier: MIT\npragma solidity ^0.8.0;\ncontract C {}");
        assertEquals(1, run(file.toString()));
        assertTrue(output().contains("Error 5333"), output());

        out.reset();
        assertEquals(0, run("--compiler-version=0.8.4", file.toString()));
    }

    @Test
    void testMissingInputIsReported() throws IOException {
        assertEquals(0, run(dir.resolve("missing.sol").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Input does not exist"));
    }

    @Test
    void testInvalidArguments() {
        assertNull(ParseTool.Config.parse(new String[]{}));
        assertNull(ParseTool.Config.parse(new String[]{"--help"}));
        assertNull(ParseTool.Config.parse(new String[]{"--threads=0", "a.sol"}));
        assertNull(ParseTool.Config.parse(new String[]{"--threads=many", "a.sol"}));
        assertNull(ParseTool.Config.parse(new String[]{"--compiler-version=0.8", "a.sol"}));
        assertNull(ParseTool.Config.parse(new String[]{"--bogus", "a.sol"}));

        ParseTool.Config config = ParseTool.Config.parse(new String[]{"--recovery", "--extensions=sol,spec", "a.sol"});
        assertNotNull(config);
        assertTrue(config.parserOptions().errorRecovery());
        assertEquals(2, config.extensions.size());
    }
}
