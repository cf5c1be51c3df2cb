package org.dxworks.codeprobe;

import org.eclipse.jgit.ignore.FastIgnoreRule;
import org.eclipse.jgit.ignore.IgnoreNode;
import org.eclipse.jgit.ignore.IgnoreNode.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides which discovered files are analyzed. Two gitignore-style rule sets apply: built-in rules
 * for dependency, build output and hidden directories, matched against the path below the input
 * root, and the rules of an optional {@code .ignore} file, matched against the path below the
 * directory holding that file.
 */
public class SourceFilter {

    private static final Logger LOG = LoggerFactory.getLogger(SourceFilter.class);

    static final String IGNORE_FILE_NAME = ".ignore";
    static final List<String> DEFAULT_RULES = List.of("node_modules/", "dist/", "build/", "coverage/", ".*/");

    private final IgnoreNode defaults;
    private final IgnoreNode rules;
    private final Path rulesBase;

    private SourceFilter(IgnoreNode rules, Path rulesBase) {
        this.defaults = new IgnoreNode(DEFAULT_RULES.stream().map(FastIgnoreRule::new).collect(Collectors.toList()));
        this.rules = rules;
        this.rulesBase = rulesBase;
    }

    public static SourceFilter defaults() {
        return new SourceFilter(new IgnoreNode(), null);
    }

    /** Reads {@value #IGNORE_FILE_NAME} from the working directory, as the CLI does. */
    public static SourceFilter load() {
        return load(Paths.get(IGNORE_FILE_NAME));
    }

    public static SourceFilter load(Path ignoreFile) {
        if (!Files.isRegularFile(ignoreFile)) {
            return defaults();
        }
        IgnoreNode node = new IgnoreNode();
        try (InputStream in = Files.newInputStream(ignoreFile)) {
            node.parse(in);
        } catch (IOException e) {
            LOG.warn("Could not read {}, only built-in exclusions apply: {}", ignoreFile, e.getMessage());
            return defaults();
        }
        Path base = ignoreFile.toAbsolutePath().normalize().getParent();
        LOG.debug("Loaded {} ignore rule(s) from {}", node.getRules().size(), ignoreFile);
        return new SourceFilter(node, base);
    }

    public boolean accepts(Path root, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path relativeToRoot = root.toAbsolutePath().normalize().relativize(absolute);
        if (isIgnored(defaults, relativeToRoot)) {
            return false;
        }
        return rulesBase == null || !absolute.startsWith(rulesBase)
                || !isIgnored(rules, rulesBase.relativize(absolute));
    }

    // A file inside an ignored directory stays ignored, as in git.
    private static boolean isIgnored(IgnoreNode node, Path relative) {
        Path parent = relative.getParent();
        if (parent != null) {
            Path directory = null;
            for (Path segment : parent) {
                directory = directory == null ? segment : directory.resolve(segment);
                if (node.isIgnored(unixPath(directory), true) == MatchResult.IGNORED) {
                    return true;
                }
            }
        }
        return node.isIgnored(unixPath(relative), false) == MatchResult.IGNORED;
    }

    private static String unixPath(Path path) {
        return path.toString().replace('\\', '/');
    }
}
