package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A dependency candidate of a script.
 *
 * @param name the package name without version operators
 * @param versionSpec the version specifier, e.g. {@code >=2.28.0}, or null
 * @param provenance where the candidate came from
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"name", "version_spec", "provenance"})
public record DependencyInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version_spec") String versionSpec,
        @JsonProperty("provenance") DependencyProvenance provenance
) {

    /**
     * Creates a dependency candidate.
     *
     * @param name the package name, required
     * @param versionSpec the version specifier, may be null
     * @param provenance the provenance, required
     */
    public DependencyInfo {
        Preconditions.requireNonNull(name, "Dependency name is required");
        Preconditions.requireNonNull(provenance, "Provenance is required");
    }

}
