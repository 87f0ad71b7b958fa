package me.golemcore.warden.tools;

import me.golemcore.warden.domain.model.ToolResult;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WriteFileToolTest {

    private static final String PATH = "path";
    private static final String CONTENT = "content";

    @TempDir
    Path tempDir;

    private Path root;
    private WriteFileTool tool;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.toRealPath();
        WardenProperties properties = new WardenProperties();
        properties.getWorkspace().setRoot(root.toString());
        tool = new WriteFileTool(properties);
    }

    @Test
    void createsFileWithParentDirectories() throws Exception {
        Path file = root.resolve("src/main/App.java");

        ToolResult result = tool.execute(Map.of(PATH, file.toString(), CONTENT, "class App {}")).get();

        assertTrue(result.isSuccess());
        assertEquals("Successfully wrote 12 bytes to src/main/App.java", result.getOutput());
        assertEquals("class App {}", Files.readString(file));
        assertEquals(true, ((Map<?, ?>) result.getData()).get("created"));
    }

    @Test
    void overwritesExistingFile() throws Exception {
        Path file = root.resolve("notes.txt");
        Files.writeString(file, "old");

        ToolResult result = tool.execute(Map.of(PATH, file.toString(), CONTENT, "new")).get();

        assertTrue(result.isSuccess());
        assertEquals("new", Files.readString(file));
        assertEquals(false, ((Map<?, ?>) result.getData()).get("created"));
    }

    @Test
    void refusesToOverwriteDirectory() throws Exception {
        Files.createDirectory(root.resolve("docs"));

        ToolResult result = tool.execute(Map.of(PATH, root.resolve("docs").toString(), CONTENT, "x")).get();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("directory"));
    }

    @Test
    void writesUtf8Content() throws Exception {
        Path file = root.resolve("greeting.txt");

        tool.execute(Map.of(PATH, file.toString(), CONTENT, "Привет")).get();

        assertEquals("Привет", Files.readString(file));
    }
}
