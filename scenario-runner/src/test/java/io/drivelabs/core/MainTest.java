/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.drivelabs.core;

import io.drivelabs.common.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    int execute(String... args) {
        Main main = new Main();
        main.out = new PrintStream(bytes, true, UTF_8);
        return new CommandLine(main).execute(args);
    }

    String output() {
        return bytes.toString(UTF_8);
    }

    File write(String name, String yaml) {
        File file = tempDir.resolve(name).toFile();
        FileUtils.writeToFile(file, yaml);
        return file;
    }

    @Test
    void testRunSucceeds() {
        File output = tempDir.resolve("out/result.json").toFile();
        int code = execute("src/test/resources/scenarios/turn-left.yaml",
                "--distance", "1", "--output", output.getPath());
        assertEquals(0, code);
        assertTrue(output().contains("SUCCEEDED after 3 tick(s)"));
        String json = FileUtils.toString(output);
        assertTrue(json.contains("\"name\":\"turn-left.yaml\""));
        assertTrue(json.contains("\"mileage\":3.0"));
    }

    @Test
    void testTimeout() {
        File scenario = write("never.yaml", """
                Story:
                  EndCondition:
                    Success: { Type: AlwaysFalse }
                """);
        assertEquals(1, execute(scenario.getPath(), "--ticks", "5"));
        assertTrue(output().contains("ONGOING after 5 tick(s) (timed out)"));
    }

    @Test
    void testDryRun() {
        File scenario = write("dry.yaml", """
                Story:
                  EndCondition:
                    Success: { All: [ { Type: AlwaysTrue }, { Not: { Type: AlwaysFalse } } ] }
                """);
        assertEquals(0, execute(scenario.getPath(), "--dryrun"));
        assertTrue(output().contains("Success: (And (Predicate AlwaysTrue) (Not (Predicate AlwaysFalse)))"));
        assertTrue(output().contains("Failure: (Or)"));
    }

    @Test
    void testLoadError() {
        File scenario = write("broken.yaml", """
                Story:
                  EndCondition:
                    Success: [ 1, 2 ]
                """);
        assertEquals(2, execute(scenario.getPath()));
        assertTrue(output().contains("Story.EndCondition.Success: expected a mapping"));
    }

    @Test
    void testOutputNotWritable() {
        File blocker = write("blocker", "not a directory");
        File output = new File(blocker, "result.json");
        int code = execute("src/test/resources/scenarios/turn-left.yaml",
                "--distance", "1", "--output", output.getPath());
        assertEquals(3, code);
        assertTrue(output().contains("SUCCEEDED after 3 tick(s)"));
        assertTrue(output().contains("error: cannot write result: " + output.getPath() + ": cannot write file"), output());
        assertFalse(output.exists());
    }

    @Test
    void testMissingArgument() {
        CommandLine commandLine = new CommandLine(new Main()).setErr(new PrintWriter(new ByteArrayOutputStream()));
        assertEquals(2, commandLine.execute());
    }

}
