package com.boarddb.core.maintainers;

import com.boarddb.core.model.OwnershipEntry;
import com.boarddb.core.scanner.Defconfigs;
import com.boarddb.core.scanner.SourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The database of board status and maintainers, built from MAINTAINERS files.
 * <p>
 * A MAINTAINERS file is a sequence of records separated by blank lines. Within
 * a record:
 * <ul>
 *   <li>{@code M:} (or the commented-out {@code #M:}) adds a maintainer</li>
 *   <li>{@code S:} sets the status; the last one wins</li>
 *   <li>{@code F:} is a glob relative to the source tree; matches that are
 *       {@code configs/<name>_defconfig} add target {@code <name>}</li>
 *   <li>{@code N:} is a regex searched for in every defconfig name (without the
 *       suffix) under {@code configs/}; each hit adds that target</li>
 * </ul>
 * When the record ends, every target it collected is bound to its status and
 * maintainers. A target bound again by a later record takes the later binding.
 * <p>
 * Missing or unusual data is reported through {@link #warnings()} rather than exceptions.
 */
public class MaintainersDatabase {

    private static final Logger log = LoggerFactory.getLogger(MaintainersDatabase.class);

    private static final String NO_STATUS = "-";
    private static final String CONFIGS_PREFIX = Defconfigs.CONFIG_DIR + "/";

    private final Map<String, OwnershipEntry> database = new HashMap<>();
    private final List<String> warnings = new ArrayList<>();
    private final Map<Path, List<String>> configNamesBySrcDir = new HashMap<>();

    public Optional<OwnershipEntry> entry(String target) {
        return Optional.ofNullable(database.get(target));
    }

    public int size() {
        return database.size();
    }

    /** Warnings collected so far, in the order they were raised. */
    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Returns the status of the given board: {@code Active}, {@code Orphan} or
     * {@code -}. Adds a warning and returns {@code -} when the target is unknown
     * or its status is not recognised.
     */
    public String getStatus(String target) {
        OwnershipEntry entry = database.get(target);
        if (entry == null) {
            warnings.add("WARNING: no status info for '" + target + "'");
            return "-";
        }
        String status = entry.status();
        if (status.startsWith("Maintained") || status.startsWith("Supported")) {
            return "Active";
        }
        if (status.startsWith("Orphan")) {
            return "Orphan";
        }
        warnings.add("WARNING: " + status + ": unknown status for '" + target + "'");
        return "-";
    }

    /**
     * Returns the maintainers of the given board separated by colons. Adds a
     * warning and returns an empty string when the target is unknown, orphaned,
     * or has no maintainer other than {@code -}.
     */
    public String getMaintainers(String target) {
        OwnershipEntry entry = database.get(target);
        if (entry != null && !entry.status().startsWith("Orphan")) {
            List<String> maintainers = entry.maintainers();
            if (maintainers.size() > 1 || (!maintainers.isEmpty() && !"-".equals(maintainers.get(0)))) {
                return String.join(":", maintainers);
            }
        }
        warnings.add("WARNING: no maintainers for '" + target + "'");
        return "";
    }

    /**
     * Parses one MAINTAINERS file and merges its records into the database.
     *
     * @param srcDir source tree that {@code F:} globs and the {@code configs/} directory are relative to
     * @param file   the MAINTAINERS file
     * @throws IOException if the file cannot be read
     */
    public void parseFile(Path srcDir, Path file) throws IOException {
        var targets = new ArrayList<String>();
        var maintainers = new ArrayList<String>();
        String status = NO_STATUS;
        int lineNumber = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.startsWith("#M:")) {
                    line = line.substring(1);
                }
                if (line.isEmpty()) {
                    bind(targets, status, maintainers);
                    targets.clear();
                    maintainers.clear();
                    status = NO_STATUS;
                    continue;
                }
                String tag = line.length() >= 2 ? line.substring(0, 2) : line;
                String rest = line.length() > 2 ? line.substring(2).strip() : "";
                switch (tag) {
                    case "M:" -> maintainers.add(rest);
                    case "S:" -> status = rest;
                    case "F:" -> targets.addAll(globTargets(srcDir, rest, file, lineNumber));
                    case "N:" -> targets.addAll(nameTargets(srcDir, rest, file, lineNumber));
                    default -> {
                        // other tags do not concern boards
                    }
                }
            }
        }
        bind(targets, status, maintainers);
        log.debug("Parsed {} ({} lines), database now has {} targets", file, lineNumber, database.size());
    }

    private void bind(List<String> targets, String status, List<String> maintainers) {
        if (targets.isEmpty()) {
            return;
        }
        var entry = new OwnershipEntry(status, List.copyOf(maintainers));
        for (String target : targets) {
            database.put(target, entry);
        }
    }

    /**
     * Expands an {@code F:} glob and keeps the defconfig files under
     * {@code <srcDir>/configs/}, returning their target names. A malformed glob
     * is reported as a warning and selects nothing.
     */
    private List<String> globTargets(Path srcDir, String glob, Path file, int lineNumber) throws IOException {
        List<String> matches;
        try {
            matches = expandGlob(srcDir, glob);
        } catch (PatternSyntaxException e) {
            warnings.add("WARNING: " + file + ":" + lineNumber + ": invalid F: pattern '" + glob + "'");
            return List.of();
        }
        var result = new ArrayList<String>();
        for (String relative : matches) {
            if (!relative.startsWith(CONFIGS_PREFIX)) {
                continue;
            }
            Defconfigs.targetName(relative.substring(CONFIGS_PREFIX.length())).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Returns the paths, relative to {@code srcDir} and using {@code /}, that
     * match {@code glob}. {@code *} and {@code ?} do not cross directory boundaries.
     *
     * @throws PatternSyntaxException if the glob is malformed
     */
    static List<String> expandGlob(Path srcDir, String glob) throws IOException {
        String pattern = stripLeadingDotSlash(glob);
        if (pattern.isEmpty()) {
            return List.of();
        }
        if (!hasGlobChars(pattern)) {
            return Files.exists(srcDir.resolve(pattern)) ? List.of(pattern) : List.of();
        }

        String[] segments = pattern.split("/");
        int fixed = 0;
        while (fixed < segments.length && !hasGlobChars(segments[fixed])) {
            fixed++;
        }
        Path base = srcDir;
        for (int i = 0; i < fixed; i++) {
            base = base.resolve(segments[i]);
        }
        if (!Files.isDirectory(base)) {
            return List.of();
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        int depth = segments.length - fixed;
        var matches = new ArrayList<String>();
        try (var stream = Files.walk(base, depth)) {
            stream.map(p -> srcDir.relativize(p))
                  .filter(rel -> rel.getNameCount() == segments.length)
                  .filter(matcher::matches)
                  .forEach(rel -> matches.add(toSlashPath(rel)));
        }
        Collections.sort(matches);
        return matches;
    }

    /**
     * Targets under {@code configs/} whose name contains a match for {@code regex}.
     * An invalid expression is reported as a warning and selects nothing.
     */
    private List<String> nameTargets(Path srcDir, String regex, Path file, int lineNumber) throws IOException {
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            warnings.add("WARNING: " + file + ":" + lineNumber + ": invalid N: pattern '" + regex + "'");
            return List.of();
        }
        var result = new ArrayList<String>();
        for (String name : configNames(srcDir)) {
            if (pattern.matcher(name).find()) {
                result.add(name);
            }
        }
        return result;
    }

    /**
     * Target names of every defconfig below {@code <srcDir>/configs}, including
     * any subdirectory part. Computed once per source tree.
     */
    private List<String> configNames(Path srcDir) throws IOException {
        List<String> cached = configNamesBySrcDir.get(srcDir);
        if (cached != null) {
            return cached;
        }
        Path configDir = srcDir.resolve(Defconfigs.CONFIG_DIR);
        var names = new ArrayList<String>();
        for (Path file : SourceTree.regularFiles(configDir, p -> true)) {
            Defconfigs.targetName(toSlashPath(configDir.relativize(file))).ifPresent(names::add);
        }
        configNamesBySrcDir.put(srcDir, names);
        return names;
    }

    private static boolean hasGlobChars(String s) {
        return s.indexOf('*') >= 0 || s.indexOf('?') >= 0 || s.indexOf('[') >= 0;
    }

    private static String stripLeadingDotSlash(String s) {
        String result = s;
        while (result.startsWith("./")) {
            result = result.substring(2);
        }
        return result;
    }

    private static String toSlashPath(Path relative) {
        var sb = new StringBuilder();
        for (Path part : relative) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(part);
        }
        return sb.toString();
    }
}
