package com.bhagwad.playground.compiler;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs generated modules with a real interpreter. Skipped when python3 is not installed.
 */
public class GeneratedPythonExecutionTest {

    private static final String PYTHON = "python3";

    private final BhagwadCompiler compiler = new BhagwadCompiler();

    @TempDir
    Path workDir;

    @BeforeAll
    static void requirePython() {
        assumeTrue(pythonAvailable(), "python3 is not installed");
    }

    private static boolean pythonAvailable() {
        try {
            Process process = new ProcessBuilder(PYTHON, "--version").redirectErrorStream(true).start();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String run(String source) throws Exception {
        Path script = workDir.resolve("main.py");
        Files.writeString(script, compiler.compile(source), StandardCharsets.UTF_8);
        Path output = workDir.resolve("out.txt");
        Process process = new ProcessBuilder(PYTHON, "-I", "-X", "utf8", script.toString())
                .redirectErrorStream(true)
                .redirectOutput(output.toFile())
                .start();
        assertTrue(process.waitFor(30, TimeUnit.SECONDS), "python did not finish");
        String text = Files.readString(output, StandardCharsets.UTF_8);
        assertEquals(0, process.exitValue(), text);
        return text.replace("\r\n", "\n");
    }

    private String runEntry(String body) throws Exception {
        return run("arjuna {\n" + body + "\n}");
    }

    @Test
    public void numberPlusTextConcatenates() throws Exception {
        assertEquals("5 apples\n", runEntry("manifest 5 + \" apples\""));
    }

    @Test
    public void numberPlusNumberAdds() throws Exception {
        assertEquals("8\n", runEntry("manifest 5 + 3"));
    }

    @Test
    public void rangeLoopRunsInclusive() throws Exception {
        assertEquals("10\n", runEntry("maya count = 0\nkarma i from 1 to 10 { count = count + 1 }\nmanifest count"));
    }

    @Test
    public void recursionAndForwardCalls() throws Exception {
        String source = "arjuna { manifest fact(5) }\n"
                + "shloka fact(sattva n) -> sattva { dharma (n <= 1) { moksha 1 }\n moksha n * fact(n - 1) }";
        assertEquals("120\n", run(source));
    }

    @Test
    public void namespaceMembersBothWays() throws Exception {
        String source = "yuga M { shloka sq(sattva x) -> sattva { moksha x * x }\n"
                + "shloka quad(sattva x) -> sattva { moksha sq(sq(x)) } }\n"
                + "arjuna { manifest M.sq(3)\n manifest quad(2) }";
        assertEquals("9\n16\n", run(source));
    }

    @Test
    public void shadowedVariableKeepsOuterValue() throws Exception {
        assertEquals("inner\n1\n", runEntry("maya x = 1\ndharma (true) { maya x = \"inner\"\n manifest x }\nmanifest x"));
    }

    @Test
    public void disturbanceCatchesRuntimeErrors() throws Exception {
        assertEquals("caught: division by zero\nafter\n",
                runEntry("meditation { manifest 1 / 0 } disturbance (err) { manifest \"caught: \" + err }\nmanifest \"after\""));
    }

    @Test
    public void arraysAndLength() throws Exception {
        assertEquals("3\n6\n", runEntry("maya a = [1, 2, 3]\nmanifest a.length\nmaya s = 0\nkarma v in a { s = s + v }\nmanifest s"));
    }

    @Test
    public void reservedNamesStillWork() throws Exception {
        assertEquals("3\n", runEntry("maya print = 1\nmaya str = 2\nmanifest print + str"));
    }

    @Test
    public void dunderLookalikeFunctionsKeepModuleIntact() throws Exception {
        String source = "shloka __name() { }\n"
                + "shloka __builtins() -> sattva { moksha 1 }\n"
                + "arjuna { __name()\nmanifest \"hi\" + __builtins() }";
        assertEquals("hi1\n", run(source));
    }

    @Test
    public void nonAsciiOutputSurvives() throws Exception {
        assertEquals("ॐ shanti\n", runEntry("manifest \"ॐ shanti\""));
    }

    @Test
    public void bareReturnInEntryStopsTheProgram() throws Exception {
        assertEquals("before\n", runEntry("manifest \"before\"\nmoksha;\nmanifest \"after\""));
    }
}
