package com.boarddb.core.model;

import java.util.List;

/**
 * Parameters of one build target as extracted from its defconfig fragment.
 * <p>
 * Unset scalar values are carried as {@link #UNSET}. {@code status} and
 * {@code maintainers} are filled in by the maintainers merge; before that they
 * hold {@code "-"} and {@code ""}.
 *
 * @param arch        architecture, e.g. {@code arm}, {@code aarch64}, {@code riscv64}
 * @param cpu         CPU name
 * @param soc         SoC name
 * @param vendor      board vendor
 * @param board       board name
 * @param target      build-target name, the defconfig name without {@code _defconfig}
 * @param config      build-configuration header name
 * @param status      {@code Active}, {@code Orphan} or {@code -}
 * @param maintainers maintainers joined with {@code :}, possibly empty
 */
public record BoardParams(
    String arch,
    String cpu,
    String soc,
    String vendor,
    String board,
    String target,
    String config,
    String status,
    String maintainers
) {

    public static final String UNSET = "-";

    /** Column order of the generated database. */
    public static final List<String> COLUMNS = List.of(
            "status", "arch", "cpu", "soc", "vendor", "board", "target", "config", "maintainers");

    public static BoardParams of(String arch, String cpu, String soc, String vendor,
                                 String board, String target, String config) {
        return new BoardParams(arch, cpu, soc, vendor, board, target, config, UNSET, "");
    }

    public BoardParams withArch(String newArch) {
        return new BoardParams(newArch, cpu, soc, vendor, board, target, config, status, maintainers);
    }

    public BoardParams withOwnership(String newStatus, String newMaintainers) {
        return new BoardParams(arch, cpu, soc, vendor, board, target, config, newStatus, newMaintainers);
    }

    /** Values in {@link #COLUMNS} order. */
    public List<String> columns() {
        return List.of(status, arch, cpu, soc, vendor, board, target, config, maintainers);
    }
}
