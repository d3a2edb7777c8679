package com.phillippitts.gesturelauncher.service.platform;

import com.phillippitts.gesturelauncher.testutil.Executables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisabledOnOs(OS.WINDOWS)
class PathSearchTest {

    @TempDir
    Path root;

    @Test
    void findsFirstMatchInSearchOrder() throws Exception {
        Path first = Executables.create(root.resolve("a"), "tool");
        Executables.create(root.resolve("b"), "tool");
        String path = root.resolve("a") + File.pathSeparator + root.resolve("b");

        assertThat(new PathSearch(path, Platform.LINUX, null).which("tool")).contains(first.toAbsolutePath());
    }

    @Test
    void skipsNonExecutableFiles() throws Exception {
        Path dir = Files.createDirectories(root.resolve("a"));
        Files.writeString(dir.resolve("plain"), "data");

        assertThat(new PathSearch(dir.toString(), Platform.LINUX, null).which("plain")).isEmpty();
    }

    @Test
    void nameWithSeparatorIsCheckedDirectly() throws Exception {
        Path tool = Executables.create(root.resolve("x"), "tool");

        PathSearch empty = new PathSearch("", Platform.LINUX, null);

        assertThat(empty.which(tool.toString())).contains(tool.toAbsolutePath());
        assertThat(empty.which(root.resolve("x/missing").toString())).isEmpty();
    }

    @Test
    void windowsTriesPathExtensions() throws Exception {
        Path exe = Executables.create(root, "notepad.exe");

        PathSearch search = new PathSearch(root.toString(), Platform.WINDOWS, ".COM;.EXE");

        assertThat(search.which("notepad")).contains(exe.toAbsolutePath());
        assertThat(search.which("notepad.exe")).contains(exe.toAbsolutePath());
    }

    @Test
    void blankInputsResolveToEmpty() {
        PathSearch search = new PathSearch(null, Platform.LINUX, null);

        assertThat(search.which("ls")).isEmpty();
        assertThat(search.which("")).isEmpty();
        assertThat(search.which(null)).isEmpty();
    }
}
