package io.nodewright.cli.commands;

import io.nodewright.cli.files.WorkflowFiles;
import io.nodewright.core.NodewrightFactory;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/// Base class for CLI command tests with common utilities.
abstract class BaseWorkflowCommandTest {

    protected static final Clock FIXED_CLOCK =
            Clock.fixed(Instant.parse("2026-10-18T12:00:00Z"), ZoneOffset.UTC);

    protected ByteArrayOutputStream outContent;
    protected ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUpStreams() {
        originalOut = System.out;
        originalErr = System.err;
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    /// Injects a value into a field, searching up the class hierarchy.
    protected void injectField(Object target, String fieldName, Object value) throws Exception {
        Field field = findField(target.getClass(), fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }

    private Field findField(Class<?> clazz, String fieldName) throws NoSuchFieldException {
        Class<?> current = clazz;
        while (current != null) {
            try {
                return current.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                current = current.getSuperclass();
            }
        }
        throw new NoSuchFieldException(fieldName);
    }

    /// Wires a command the way CDI and picocli would: default engine, plain
    /// output, and the workflow file as first positional parameter.
    protected <T extends WorkflowCommand> T prepare(T command, Path workflow) throws Exception {
        injectField(command, "engine", NodewrightFactory.createEngine());
        injectField(command, "colorEnabled", false);
        injectField(command, "workflowFile", workflow);
        if (command instanceof MutatingCommand) {
            injectField(command, "files", new WorkflowFiles(true, FIXED_CLOCK));
        }
        return command;
    }

    /// Copies a workflow from `src/test/resources/workflows` into `dir`.
    protected Path copyFixture(String name, Path dir) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/workflows/" + name)) {
            if (in == null) {
                throw new IOException("Missing test fixture " + name);
            }
            Files.copy(in, target);
        }
        return target;
    }
}
