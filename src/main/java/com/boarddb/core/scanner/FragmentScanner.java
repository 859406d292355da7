package com.boarddb.core.scanner;

import com.boarddb.core.model.BoardParams;
import com.boarddb.core.model.ScanOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;

/**
 * Extracts the board parameters of a single defconfig fragment.
 * <p>
 * Not thread-safe: each scan worker owns one scanner and its evaluator.
 */
public class FragmentScanner {

    private static final Logger log = LoggerFactory.getLogger(FragmentScanner.class);

    static final String SYM_ARCH = "SYS_ARCH";
    static final String SYM_CPU = "SYS_CPU";
    static final String SYM_SOC = "SYS_SOC";
    static final String SYM_VENDOR = "SYS_VENDOR";
    static final String SYM_BOARD = "SYS_BOARD";
    static final String SYM_CONFIG = "SYS_CONFIG_NAME";
    static final String SYM_RV32I = "ARCH_RV32I";

    private static final String TARGET_PREFIX = "TARGET_";

    private final FragmentEvaluator evaluator;

    public FragmentScanner(FragmentEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Loads a fragment and returns its board parameters.
     *
     * @param defconfig   path of the fragment to scan
     * @param warnTargets whether to check that exactly one {@code TARGET_xxx} is enabled
     * @return the parameters plus any warnings found
     * @throws InvalidFragmentNameException if the file name does not end in {@code _defconfig}
     * @throws IOException                  if the fragment cannot be read
     */
    public ScanOutcome scan(Path defconfig, boolean warnTargets) throws IOException {
        String leaf = defconfig.getFileName().toString();
        String expectTarget = Defconfigs.targetName(leaf)
                .orElseThrow(() -> new InvalidFragmentNameException(leaf + " : invalid defconfig"));

        evaluator.load(defconfig);

        var warnings = new ArrayList<String>();
        if (warnTargets) {
            checkTargets(leaf, expectTarget, warnings);
        }

        BoardParams params = BoardParams.of(
                valueOrUnset(SYM_ARCH),
                valueOrUnset(SYM_CPU),
                valueOrUnset(SYM_SOC),
                valueOrUnset(SYM_VENDOR),
                valueOrUnset(SYM_BOARD),
                expectTarget,
                valueOrUnset(SYM_CONFIG));

        return new ScanOutcome(normalizeArch(params), warnings);
    }

    private String valueOrUnset(String symbol) {
        return evaluator.value(symbol).orElse(BoardParams.UNSET);
    }

    private void checkTargets(String leaf, String expectTarget, ArrayList<String> warnings) {
        String target = null;
        for (Map.Entry<String, String> sym : evaluator.symbols().entrySet()) {
            if (!sym.getKey().startsWith(TARGET_PREFIX) || !"y".equals(sym.getValue())) {
                continue;
            }
            String tname = sym.getKey().substring(TARGET_PREFIX.length()).toLowerCase(Locale.ROOT);
            if (target != null) {
                warnings.add("WARNING: " + leaf + ": Duplicate TARGET_xxx: " + target + " and " + tname);
            } else {
                target = tname;
            }
        }
        if (target == null) {
            String cfgName = expectTarget.replace('-', '_').toUpperCase(Locale.ROOT);
            warnings.add("WARNING: " + leaf + ": No TARGET_" + cfgName + " enabled");
        }
    }

    /**
     * Applies the architecture fix-ups. Running it on an already normalized
     * record returns the record unchanged.
     */
    BoardParams normalizeArch(BoardParams params) {
        if ("arm".equals(params.arch()) && "armv8".equals(params.cpu())) {
            return params.withArch("aarch64");
        }
        if ("riscv".equals(params.arch())) {
            return params.withArch(isRv32() ? "riscv32" : "riscv64");
        }
        return params;
    }

    private boolean isRv32() {
        try {
            return evaluator.flag(SYM_RV32I);
        } catch (RuntimeException e) {
            log.debug("Cannot read {}, assuming 64-bit RISC-V: {}", SYM_RV32I, e.getMessage());
            return false;
        }
    }
}
