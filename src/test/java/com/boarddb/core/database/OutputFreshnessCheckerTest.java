package com.boarddb.core.database;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class OutputFreshnessCheckerTest {

    private static final FileTime OLD = FileTime.from(Instant.parse("2024-01-01T00:00:00Z"));
    private static final FileTime GENERATED = FileTime.from(Instant.parse("2024-06-01T00:00:00Z"));
    private static final FileTime NEW = FileTime.from(Instant.parse("2024-12-01T00:00:00Z"));

    @TempDir
    Path srcDir;

    private Path configDir;
    private Path output;
    private final OutputFreshnessChecker checker = new OutputFreshnessChecker();

    @BeforeEach
    void setUp() throws IOException {
        configDir = Files.createDirectories(srcDir.resolve("configs"));
        file("configs/snow_defconfig", "CONFIG_SYS_ARCH=\"arm\"\n", OLD);
        file("Kconfig", "", OLD);
        file("board/samsung/MAINTAINERS", "", OLD);
        output = file("boards.cfg", BoardDatabaseWriter.COMMENT_BLOCK
                + "Active  arm  armv7  exynos  samsung  smdk5250  snow  -  Alice\n", GENERATED);
    }

    private Path file(String relative, String content, FileTime mtime) throws IOException {
        Path file = srcDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, mtime);
        return file;
    }

    private boolean upToDate() throws IOException {
        return checker.isUpToDate(output, configDir, srcDir);
    }

    @Test
    @DisplayName("fresh database is up to date")
    void fresh() throws IOException {
        assertTrue(upToDate());
    }

    @Test
    @DisplayName("missing database is stale")
    void missing() throws IOException {
        Files.delete(output);
        assertFalse(upToDate());
    }

    @Test
    @DisplayName("a newer defconfig makes it stale")
    void newerDefconfig() throws IOException {
        file("configs/peach_defconfig", "", NEW);
        assertFalse(upToDate());
    }

    @Test
    @DisplayName("a newer Kconfig variant makes it stale")
    void newerKconfig() throws IOException {
        file("arch/arm/Kconfig.debug", "", NEW);
        assertFalse(upToDate());
    }

    @Test
    @DisplayName("a newer MAINTAINERS file makes it stale")
    void newerMaintainers() throws IOException {
        Files.setLastModifiedTime(srcDir.resolve("board/samsung/MAINTAINERS"), NEW);
        assertFalse(upToDate());
    }

    @Test
    @DisplayName("editor backups and unrelated files are ignored")
    void backupsIgnored() throws IOException {
        file("Kconfig~", "", NEW);
        file("MAINTAINERS~", "", NEW);
        file("drivers/foo.c", "", NEW);
        assertTrue(upToDate());
    }

    @Test
    @DisplayName("a listed target whose defconfig is gone makes it stale")
    void removedTarget() throws IOException {
        Files.writeString(output, BoardDatabaseWriter.COMMENT_BLOCK
                + "Active  arm  armv7  exynos  samsung  smdk5250  snow  -  Alice\n"
                + "Active  arm  armv7  exynos  samsung  smdk5420  peach  -  Bob\n");
        Files.setLastModifiedTime(output, GENERATED);
        assertFalse(upToDate());
    }

    @Test
    @DisplayName("the legacy Options column makes it stale")
    void legacyFormat() throws IOException {
        Files.writeString(output, "# Status, Arch, CPU:SPLCPU, SoC, Vendor, Board name, Target, Options, Maintainers\n");
        Files.setLastModifiedTime(output, GENERATED);
        assertFalse(upToDate());
    }

    @Test
    @DisplayName("a line too short to have a target makes it stale")
    void malformedLine() throws IOException {
        Files.writeString(output, "Active  arm  armv7\n");
        Files.setLastModifiedTime(output, GENERATED);
        assertFalse(upToDate());
    }

    @Test
    @DisplayName("missing configs directory makes a database listing targets stale")
    void missingConfigDir() throws IOException {
        assertFalse(checker.isUpToDate(output, srcDir.resolve("no-configs"), srcDir));
    }

    @Test
    @DisplayName("an empty database is fresh for a tree without configs")
    void emptyDatabaseWithoutConfigs() throws IOException {
        Files.writeString(output, BoardDatabaseWriter.COMMENT_BLOCK);
        Files.setLastModifiedTime(output, GENERATED);
        assertTrue(checker.isUpToDate(output, srcDir.resolve("no-configs"), srcDir));
    }

    @Test
    @DisplayName("Kconfig and MAINTAINERS name matching")
    void nameMatching() {
        assertTrue(OutputFreshnessChecker.isKconfigOrMaintainers(Path.of("a/Kconfig")));
        assertTrue(OutputFreshnessChecker.isKconfigOrMaintainers(Path.of("a/Kconfig.spl")));
        assertTrue(OutputFreshnessChecker.isKconfigOrMaintainers(Path.of("MAINTAINERS")));
        assertFalse(OutputFreshnessChecker.isKconfigOrMaintainers(Path.of("Kconfig~")));
        assertFalse(OutputFreshnessChecker.isKconfigOrMaintainers(Path.of("MAINTAINERS.old")));
    }
}
