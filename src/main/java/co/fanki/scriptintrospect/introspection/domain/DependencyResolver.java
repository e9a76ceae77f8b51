package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Merges declared and inferred dependency candidates.
 *
 * <p>Declared candidates come from the inline metadata block, in order,
 * split into name and version specifier. Inferred candidates come from
 * every import of a top-level, absolute module ({@code import os},
 * {@code from requests import get}); standard library modules are not
 * filtered out. Declared candidates come first and a name may appear
 * once per provenance.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DependencyResolver {

    /** Version operators, longest first. */
    private static final Pattern VERSION_OPERATOR = Pattern.compile(
            "===|==|~=|!=|>=|<=|>|<");

    private static final Pattern PACKAGE_NAME = Pattern.compile(
            "^[A-Za-z0-9][A-Za-z0-9._-]*");

    /**
     * Resolves the dependency candidates of a script.
     *
     * @param block the inline metadata block, may be null
     * @param imports the imports of the script in source order
     * @return declared candidates followed by inferred ones
     */
    public List<DependencyInfo> resolve(final InlineMetadataBlock block,
            final List<ImportInfo> imports) {
        Preconditions.requireNonNull(imports, "Imports are required");
        final List<DependencyInfo> dependencies = new ArrayList<>();
        if (block != null) {
            for (final String specifier : block.dependencies()) {
                dependencies.add(declared(specifier));
            }
        }
        for (final ImportInfo info : imports) {
            final String module = info.module();
            if (!module.isEmpty() && !module.startsWith(".")
                    && !module.contains(".")) {
                dependencies.add(new DependencyInfo(module, null,
                        DependencyProvenance.INFERRED));
            }
        }
        return dependencies;
    }

    /**
     * Splits a specifier such as {@code requests[socks]>=2.28; os_name
     * == "nt"} into {@code requests} and {@code >=2.28; os_name == "nt"}.
     *
     * <p>The version keeps everything from the first operator on, markers
     * included. Operators inside a marker do not count, so a specifier
     * without a version constraint has a null version.</p>
     */
    static DependencyInfo declared(final String specifier) {
        final String trimmed = specifier.strip();
        final int marker = trimmed.indexOf(';');
        final String requirement = marker >= 0
                ? trimmed.substring(0, marker) : trimmed;

        final Matcher operator = VERSION_OPERATOR.matcher(requirement);
        final boolean versioned = operator.find();
        final String head = (versioned
                ? requirement.substring(0, operator.start())
                : requirement).strip();

        final Matcher name = PACKAGE_NAME.matcher(head);
        final String packageName = name.find() ? name.group() : head;
        final String versionSpec = versioned
                ? trimmed.substring(operator.start()).strip() : null;
        return new DependencyInfo(packageName, versionSpec,
                DependencyProvenance.DECLARED);
    }

}
