package com.docview.cli;

import com.docview.format.IndentStyle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DocviewToolTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        DocviewTool.Config config = DocviewTool.Config.parse(args);
        assertNotNull(config);
        return new DocviewTool(config,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8)).run();
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    @Test
    @DisplayName("Options are parsed with sensible defaults")
    void testConfig_Parse() {
        DocviewTool.Config defaults = DocviewTool.Config.parse(new String[]{"a.json"});
        assertEquals(DocviewTool.Mode.FORMAT, defaults.mode);
        assertEquals(IndentStyle.TWO_SPACES, defaults.indent);
        assertNull(defaults.type);
        assertFalse(defaults.verbose);
        assertEquals(List.of(Path.of("a.json")), defaults.files);

        DocviewTool.Config custom = DocviewTool.Config.parse(
            new String[]{"--mode=tree", "--indent=tabs", "--type=xml", "-v", "a", "b"});
        assertEquals(DocviewTool.Mode.TREE, custom.mode);
        assertEquals(new IndentStyle.Tabs(), custom.indent);
        assertEquals(DocumentType.XML, custom.type);
        assertTrue(custom.verbose);
        assertEquals(2, custom.files.size());
    }

    @Test
    @DisplayName("Help, bad options and a missing file list stop the tool")
    void testConfig_Rejects() {
        assertNull(DocviewTool.Config.parse(new String[]{"--help"}));
        assertNull(DocviewTool.Config.parse(new String[]{"--mode=explode", "a.json"}));
        assertNull(DocviewTool.Config.parse(new String[]{"--indent=wide", "a.json"}));
        assertNull(DocviewTool.Config.parse(new String[]{"--type=yaml", "a.json"}));
        assertNull(DocviewTool.Config.parse(new String[]{"--frobnicate", "a.json"}));
        assertNull(DocviewTool.Config.parse(new String[]{"--verbose"}));
    }

    @Test
    @DisplayName("The file extension decides the type")
    void testTypeOf() {
        assertEquals(DocumentType.JSON, DocviewTool.typeOf(Path.of("data.JSON")));
        assertEquals(DocumentType.XML, DocviewTool.typeOf(Path.of("schema.xsd")));
        assertEquals(DocumentType.XML, DocviewTool.typeOf(Path.of("icon.svg")));
        assertNull(DocviewTool.typeOf(Path.of("notes.txt")));
    }

    @Test
    @DisplayName("Format mode prints the reformatted document")
    void testRun_Format() throws IOException {
        Path file = write("doc.json", "{\"a\":[1,2]}");

        assertEquals(0, run("--indent=spaces:4", file.toString()));
        assertEquals("{\n    \"a\": [\n        1,\n        2\n    ]\n}\n", stdout().replace("\r\n", "\n"));
        assertEquals("", stderr());
    }

    @Test
    @DisplayName("Several files get headers and are processed in order")
    void testRun_MultipleFiles() throws IOException {
        Path json = write("a.json", "[ 1 ]");
        Path xml = write("b.xml", "<r>\n  <x/>\n</r>");

        assertEquals(0, run("--mode=minify", json.toString(), xml.toString()));
        String printed = stdout().replace("\r\n", "\n");
        assertEquals("==> " + json + " <==\n[1]\n==> " + xml + " <==\n<r><x/></r>\n", printed);
    }

    @Test
    @DisplayName("Tree mode prints one row per node, with paths when verbose")
    void testRun_Tree() throws IOException {
        Path file = write("doc.json", "{\"name\":\"x\",\"list\":[1,2]}");

        assertEquals(0, run("--mode=tree", "--verbose", file.toString()));
        assertEquals("name: \"x\"    $.name\n"
            + "list    $.list\n"
            + "  0: 1    $.list[0]\n"
            + "  1: 2    $.list[1]\n", stdout().replace("\r\n", "\n"));
    }

    @Test
    @DisplayName("Validate mode prints statistics for JSON and a node count for XML")
    void testRun_Validate() throws IOException {
        Path json = write("doc.json", "{\"a\":true}");
        Path xml = write("doc.xml", "<a><b/></a>");

        assertEquals(0, run("--mode=validate", json.toString(), xml.toString()));
        String printed = stdout();
        assertTrue(printed.contains("\"isValid\":true"), printed);
        assertTrue(printed.contains("\"boolean_count\":1"), printed);
        assertTrue(printed.contains("[OK] " + xml + " (3 nodes)"), printed);
    }

    @Test
    @DisplayName("Broken, unreadable and untyped files fail the run")
    void testRun_Failures() throws IOException {
        Path broken = write("broken.xml", "<a>\n<b></a>");
        Path unknown = write("notes.txt", "{}");
        Path missing = dir.resolve("missing.json");

        assertEquals(1, run(broken.toString(), unknown.toString(), missing.toString()));
        String errors = stderr();
        assertTrue(errors.contains("[FAIL] " + broken + ": XML parse error: "), errors);
        assertTrue(errors.contains("[ERROR] Cannot tell whether " + unknown), errors);
        assertTrue(errors.contains("[ERROR] Cannot read " + missing), errors);
    }

    @Test
    @DisplayName("Tree mode reports where a document broke")
    void testRun_TreeFailure() throws IOException {
        Path broken = write("broken.json", "{\n\"a\": }");

        assertEquals(1, run("--mode=tree", broken.toString()));
        assertTrue(stderr().contains("at line 2, column"), stderr());
    }
}
