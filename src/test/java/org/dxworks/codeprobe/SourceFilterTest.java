package org.dxworks.codeprobe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SourceFilterTest {

    @TempDir
    Path dir;

    @Test
    void defaults_SkipDependencyBuildAndHiddenDirectories() {
        SourceFilter filter = SourceFilter.defaults();
        assertTrue(filter.accepts(dir, dir.resolve("src/a.js")));
        assertFalse(filter.accepts(dir, dir.resolve("node_modules/lib/index.js")));
        assertFalse(filter.accepts(dir, dir.resolve("packages/app/dist/bundle.js")));
        assertFalse(filter.accepts(dir, dir.resolve("src/coverage/report.js")));
        assertFalse(filter.accepts(dir, dir.resolve(".cache/c.js")));
        assertTrue(filter.accepts(dir, dir.resolve("src/.eslintrc.js")));
    }

    @Test
    void defaults_OnlyLookBelowTheInputRoot() {
        Path root = dir.resolve(".workspace/project");
        assertTrue(SourceFilter.defaults().accepts(root, root.resolve("src/a.js")));
    }

    @Test
    void load_AppliesIgnoreFileRules() throws IOException {
        Path ignoreFile = TestUtils.write(dir, ".ignore", "src/generated/**\n*.min.js\n");
        SourceFilter filter = SourceFilter.load(ignoreFile);

        assertFalse(filter.accepts(dir, dir.resolve("src/generated/api.js")));
        assertFalse(filter.accepts(dir, dir.resolve("lib/vendor.min.js")));
        assertTrue(filter.accepts(dir, dir.resolve("src/main.js")));
        assertFalse(filter.accepts(dir, dir.resolve("node_modules/x.js")));
    }

    @Test
    void load_RulesAreRelativeToTheIgnoreFile() throws IOException {
        Path ignoreFile = TestUtils.write(dir, ".ignore", "src/generated/**\n");
        SourceFilter filter = SourceFilter.load(ignoreFile);

        Path root = dir.resolve("src");
        assertFalse(filter.accepts(root, root.resolve("generated/api.js")));
        assertTrue(filter.accepts(root, root.resolve("app/generated/api.js")));
    }

    @Test
    void load_MissingFileFallsBackToDefaults() {
        SourceFilter filter = SourceFilter.load(dir.resolve("absent.ignore"));
        assertTrue(filter.accepts(dir, dir.resolve("src/generated/api.js")));
        assertFalse(filter.accepts(dir, dir.resolve("dist/a.js")));
    }
}
