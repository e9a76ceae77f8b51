package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts the inline script metadata block from a script's comments.
 *
 * <p>The block sits between a {@code # /// script} line and a
 * {@code # ///} line. Each line in between loses its {@code #} and one
 * following space, and the result is read as TOML:</p>
 * <pre>
 * # /// script
 * # requires-python = "&gt;=3.11"
 * # dependencies = ["requests&gt;=2.28.0"]
 * # ///
 * </pre>
 *
 * <p>When the TOML does not parse, a single-line
 * {@code dependencies = [...]} assignment is still recognized. A missing
 * or unusable block is normal input: {@link #parse(String)} then returns
 * null and never throws for content reasons.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InlineMetadataParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            InlineMetadataParser.class);

    private static final String OPENING_MARKER = "# /// script";

    private static final String CLOSING_MARKER = "# ///";

    private static final String DEPENDENCIES_ASSIGNMENT = "dependencies = ";

    /**
     * Parses the metadata block of a script.
     *
     * @param text the script text
     * @return the block, or null if there is none
     */
    public InlineMetadataBlock parse(final String text) {
        Preconditions.requireNonNull(text, "Script text is required");
        final List<String> lines = blockLines(text);
        if (lines == null || lines.isEmpty()) {
            return null;
        }

        final TomlParseResult toml = Toml.parse(String.join("\n", lines));
        if (!toml.hasErrors()) {
            return fromToml(toml);
        }
        LOG.debug("Inline metadata is not valid TOML ({}), trying the"
                + " dependencies line", toml.errors().get(0).getMessage());
        return fromDependenciesLine(lines);
    }

    /** Returns the un-prefixed block lines, or null without a marker pair. */
    private List<String> blockLines(final String text) {
        List<String> lines = null;
        for (final String line : text.split("\n", -1)) {
            final String stripped = line.strip();
            if (lines == null) {
                if (stripped.equals(OPENING_MARKER)) {
                    lines = new ArrayList<>();
                }
            } else if (stripped.equals(CLOSING_MARKER)) {
                return lines;
            } else if (stripped.startsWith("#")) {
                final String content = stripped.substring(1);
                lines.add(content.startsWith(" ")
                        ? content.substring(1) : content);
            }
        }
        return null;
    }

    private InlineMetadataBlock fromToml(final TomlTable toml) {
        final List<String> dependencies = new ArrayList<>();
        final Object declared = toml.get(List.of("dependencies"));
        if (declared instanceof TomlArray) {
            for (final Object dependency : ((TomlArray) declared).toList()) {
                dependencies.add(String.valueOf(dependency));
            }
        }
        final Object requires = toml.get(List.of("requires-python"));
        final Object tool = toml.get(List.of("tool"));
        final Map<String, Object> toolConfig = tool instanceof TomlTable
                ? toMap((TomlTable) tool) : Map.of();
        return new InlineMetadataBlock(dependencies,
                requires == null ? null : String.valueOf(requires),
                toolConfig);
    }

    private InlineMetadataBlock fromDependenciesLine(final List<String> lines) {
        List<String> dependencies = List.of();
        for (final String line : lines) {
            if (!line.startsWith(DEPENDENCIES_ASSIGNMENT)) {
                continue;
            }
            final String list = line.substring(
                    DEPENDENCIES_ASSIGNMENT.length()).strip();
            if (list.startsWith("[") && list.endsWith("]")) {
                dependencies = new ArrayList<>();
                for (final String item : list.substring(1, list.length() - 1)
                        .split(",")) {
                    if (!item.isBlank()) {
                        dependencies.add(stripQuotes(item));
                    }
                }
            }
        }
        if (dependencies.isEmpty()) {
            return null;
        }
        return new InlineMetadataBlock(dependencies, null, Map.of());
    }

    private static String stripQuotes(final String item) {
        int start = 0;
        int end = item.length();
        while (start < end && " \"'".indexOf(item.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && " \"'".indexOf(item.charAt(end - 1)) >= 0) {
            end--;
        }
        return item.substring(start, end);
    }

    private static Map<String, Object> toMap(final TomlTable table) {
        final Map<String, Object> map = new LinkedHashMap<>();
        for (final String key : table.keySet()) {
            map.put(key, plain(table.get(List.of(key))));
        }
        return map;
    }

    private static Object plain(final Object value) {
        if (value instanceof TomlTable) {
            return toMap((TomlTable) value);
        }
        if (value instanceof TomlArray) {
            final List<Object> list = new ArrayList<>();
            for (final Object item : ((TomlArray) value).toList()) {
                list.add(plain(item));
            }
            return list;
        }
        if (value instanceof String || value instanceof Number
                || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }

}
