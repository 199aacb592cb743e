package me.golemcore.teams.tools;

import me.golemcore.teams.domain.exception.ToolValidationException;
import me.golemcore.teams.domain.model.ToolOutput;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceToolsTest {

    @TempDir
    Path workspace;

    private TeamsProperties properties;
    private ReadFileTool readFile;
    private WriteFileTool writeFile;
    private ListFilesTool listFiles;

    @BeforeEach
    void setUp() {
        properties = new TeamsProperties();
        properties.getTools().getWorkspace().setPath(workspace.toString());
        properties.getTools().getWorkspace().setMaxFileSize(64);
        readFile = new ReadFileTool(properties);
        writeFile = new WriteFileTool(properties);
        listFiles = new ListFilesTool(properties);
    }

    @Test
    void shouldWriteAndReadFile() throws IOException {
        ToolOutput written = writeFile.execute(Map.of("file_path", "notes/hello.txt", "content", "hi")).join();

        assertTrue(written.isSuccess());
        assertEquals("File written successfully: notes/hello.txt", written.getOutput());
        assertEquals("hi", Files.readString(workspace.resolve("notes/hello.txt"), StandardCharsets.UTF_8));

        ToolOutput read = readFile.execute(Map.of("file_path", "notes/hello.txt")).join();
        assertTrue(read.isSuccess());
        assertEquals("hi", read.getOutput());
    }

    @Test
    void shouldReportMissingFileAsProviderFailure() {
        ToolOutput output = readFile.execute(Map.of("file_path", "missing.txt")).join();

        assertFalse(output.isSuccess());
        assertTrue(output.getError().contains("File not found"));
    }

    @Test
    void shouldRejectPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> writeFile.execute(Map.of("file_path", "../escape.txt", "content", "x")).join());

        assertInstanceOf(ToolValidationException.class, error.getCause());
        assertFalse(Files.exists(workspace.getParent().resolve("escape.txt")));
    }

    @Test
    void shouldRejectAbsolutePath() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> readFile.execute(Map.of("file_path", "/etc/passwd")).join());

        assertInstanceOf(ToolValidationException.class, error.getCause());
    }

    @Test
    void shouldRejectSymlinkEscape(@TempDir Path outside) throws IOException {
        Files.writeString(outside.resolve("secret.txt"), "secret");
        Files.createSymbolicLink(workspace.resolve("link"), outside);

        CompletionException error = assertThrows(CompletionException.class,
                () -> readFile.execute(Map.of("file_path", "link/secret.txt")).join());

        assertInstanceOf(ToolValidationException.class, error.getCause());
    }

    @Test
    void shouldEnforceSizeLimitOnWrite() {
        ToolOutput output = writeFile.execute(Map.of("file_path", "big.txt", "content", "x".repeat(65))).join();

        assertFalse(output.isSuccess());
        assertFalse(Files.exists(workspace.resolve("big.txt")));
    }

    @Test
    void shouldEnforceSizeLimitOnRead() throws IOException {
        Files.writeString(workspace.resolve("big.txt"), "x".repeat(65));

        ToolOutput output = readFile.execute(Map.of("file_path", "big.txt")).join();

        assertFalse(output.isSuccess());
        assertTrue(output.getError().contains("File too large"));
    }

    @Test
    void shouldListDirectoriesFirst() throws IOException {
        Files.writeString(workspace.resolve("b.txt"), "b");
        Files.writeString(workspace.resolve("a.txt"), "a");
        Files.createDirectories(workspace.resolve("src"));

        ToolOutput output = listFiles.execute(Map.of()).join();

        assertTrue(output.isSuccess());
        assertEquals("Files in .:\n[DIR]  src/\n[FILE] a.txt\n[FILE] b.txt", output.getOutput());
    }

    @Test
    void shouldReportEmptyDirectory() {
        ToolOutput output = listFiles.execute(Map.of("directory", ".")).join();

        assertEquals("Directory . is empty", output.getOutput());
    }

    @Test
    void shouldBeDisabledByConfiguration() {
        properties.getTools().getWorkspace().setEnabled(false);

        assertFalse(new ReadFileTool(properties).isEnabled());
    }
}
