package io.surfworks.jobrunner.profile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptTemplatesTest {

    @TempDir
    Path tempDir;

    private ScriptTemplates templates;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("install.sh"), "#!/bin/bash\npip install -e .\n");
        Files.writeString(tempDir.resolve("run.sh"), "#!/bin/bash\n./bench\n");
        Files.writeString(tempDir.resolve("README.md"), "not a template");
        templates = new ScriptTemplates(tempDir);
    }

    @Test
    void readsTemplateBody() throws IOException {
        assertEquals("#!/bin/bash\npip install -e .\n", templates.read("install"));
    }

    @Test
    void missingTemplateIsAnIoError() {
        assertTrue(templates.locate("prepare").isEmpty());
        assertThrows(IOException.class, () -> templates.read("prepare"));
    }

    @Test
    void referencesMustBePlainNames() {
        assertFalse(ScriptTemplates.isWellFormed("../etc/passwd"));
        assertFalse(ScriptTemplates.isWellFormed("dir/run"));
        assertFalse(ScriptTemplates.isWellFormed(" "));
        assertTrue(ScriptTemplates.isWellFormed("run"));
        assertThrows(IllegalArgumentException.class, () -> templates.read("../run"));
    }

    @Test
    void listsOnlyTemplates() throws IOException {
        assertEquals(List.of("install", "run"), templates.list());
    }

    @Test
    void missingDirectoryListsNothing() throws IOException {
        assertEquals(List.of(), new ScriptTemplates(tempDir.resolve("absent")).list());
    }
}
