package com.boarddb.core.scanner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DefconfigEvaluatorTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("reads assignments and strips quotes")
    void readsAssignments() throws IOException {
        Path defconfig = write("configs/foo_defconfig", """
                CONFIG_SYS_ARCH="arm"
                CONFIG_SYS_CPU="armv8"
                CONFIG_TARGET_FOO=y
                CONFIG_NR_DRAM_BANKS=2
                """);
        try (var evaluator = new DefconfigEvaluator(EvaluatorContext.of(tempDir))) {
            evaluator.load(defconfig);
            assertEquals(Optional.of("arm"), evaluator.value("SYS_ARCH"));
            assertEquals(Optional.of("armv8"), evaluator.value("SYS_CPU"));
            assertEquals(Optional.of("2"), evaluator.value("NR_DRAM_BANKS"));
            assertTrue(evaluator.flag("TARGET_FOO"));
        }
    }

    @Test
    @DisplayName("'is not set' and empty values read as unset")
    void notSetIsEmpty() throws IOException {
        Path defconfig = write("configs/bar_defconfig", """
                # CONFIG_ARCH_RV32I is not set
                CONFIG_SYS_SOC=""
                """);
        try (var evaluator = new DefconfigEvaluator(EvaluatorContext.of(tempDir))) {
            evaluator.load(defconfig);
            assertFalse(evaluator.flag("ARCH_RV32I"));
            assertEquals(Optional.empty(), evaluator.value("SYS_SOC"));
            assertEquals(Optional.empty(), evaluator.value("NEVER_DEFINED"));
            assertFalse(evaluator.flag("NEVER_DEFINED"));
        }
    }

    @Test
    @DisplayName("defaults apply unless the fragment overrides them")
    void defaultsApply() throws IOException {
        Path defconfig = write("configs/baz_defconfig", "CONFIG_SYS_VENDOR=\"acme\"\n");
        var context = new EvaluatorContext(tempDir, Map.of("SYS_VENDOR", "generic", "SYS_ARCH", "sandbox"));
        try (var evaluator = new DefconfigEvaluator(context)) {
            evaluator.load(defconfig);
            assertEquals(Optional.of("acme"), evaluator.value("SYS_VENDOR"));
            assertEquals(Optional.of("sandbox"), evaluator.value("SYS_ARCH"));
        }
    }

    @Test
    @DisplayName("Kconfig defaults in the tree are not consulted")
    void kconfigNotRead() throws IOException {
        write("Kconfig", """
                config SYS_VENDOR
                	string
                	default "acme"
                """);
        Path defconfig = write("configs/plain_defconfig", "CONFIG_SYS_ARCH=\"arm\"\n");
        try (var evaluator = new DefconfigEvaluator(EvaluatorContext.of(tempDir))) {
            evaluator.load(defconfig);
            assertEquals(Optional.empty(), evaluator.value("SYS_VENDOR"));
            assertFalse(evaluator.symbols().containsKey("SYS_VENDOR"));
        }
    }

    @Test
    @DisplayName("loading a second fragment forgets the first")
    void reloadResets() throws IOException {
        Path first = write("configs/a_defconfig", "CONFIG_SYS_BOARD=\"a\"\nCONFIG_ONLY_A=y\n");
        Path second = write("configs/b_defconfig", "CONFIG_SYS_BOARD=\"b\"\n");
        try (var evaluator = new DefconfigEvaluator(EvaluatorContext.of(tempDir))) {
            evaluator.load(first);
            evaluator.load(second);
            assertEquals(Optional.of("b"), evaluator.value("SYS_BOARD"));
            assertFalse(evaluator.symbols().containsKey("ONLY_A"));
        }
    }

    @Test
    @DisplayName("#include is resolved next to the fragment, then in the source tree")
    void resolvesIncludes() throws IOException {
        write("configs/common.config", "CONFIG_SYS_ARCH=\"riscv\"\n");
        write("board/acme/extra.config", "CONFIG_ARCH_RV32I=y\n");
        Path defconfig = write("configs/qux_defconfig", """
                #include "common.config"
                #include <board/acme/extra.config>
                CONFIG_SYS_CPU="generic"
                """);
        try (var evaluator = new DefconfigEvaluator(EvaluatorContext.of(tempDir))) {
            evaluator.load(defconfig);
            assertEquals(Optional.of("riscv"), evaluator.value("SYS_ARCH"));
            assertTrue(evaluator.flag("ARCH_RV32I"));
            assertEquals(Optional.of("generic"), evaluator.value("SYS_CPU"));
        }
    }

    @Test
    @DisplayName("missing include fails the load")
    void missingIncludeFails() throws IOException {
        Path defconfig = write("configs/bad_defconfig", "#include \"nowhere.config\"\n");
        try (var evaluator = new DefconfigEvaluator(EvaluatorContext.of(tempDir))) {
            assertThrows(IOException.class, () -> evaluator.load(defconfig));
        }
    }

    @Test
    @DisplayName("self-including fragment fails instead of recursing forever")
    void includeCycleFails() throws IOException {
        Path defconfig = write("configs/loop_defconfig", "#include \"loop_defconfig\"\n");
        try (var evaluator = new DefconfigEvaluator(EvaluatorContext.of(tempDir))) {
            assertThrows(IOException.class, () -> evaluator.load(defconfig));
        }
    }

    @Test
    @DisplayName("closed evaluator rejects further use")
    void closedEvaluatorRejectsUse() {
        var evaluator = new DefconfigEvaluator(EvaluatorContext.of(tempDir));
        evaluator.close();
        assertThrows(IllegalStateException.class, () -> evaluator.value("SYS_ARCH"));
    }
}
