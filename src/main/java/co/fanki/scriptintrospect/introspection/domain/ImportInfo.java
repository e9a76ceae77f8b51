package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * An import found in a script.
 *
 * <p>A plain {@code import a.b as c} yields one record per imported
 * module with no names; a {@code from} import yields one record with the
 * imported names. Relative modules keep their leading dots, and a bare
 * {@code from . import x} has an empty module.</p>
 *
 * @param module the dotted module path
 * @param names the imported names, empty for a plain import
 * @param alias the local alias of a plain import, or null
 * @param fromImport whether it is a {@code from} import
 * @param line the 1-based line of the statement
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"module", "names", "alias", "is_from_import", "line"})
public record ImportInfo(
        @JsonProperty("module") String module,
        @JsonProperty("names") List<String> names,
        @JsonProperty("alias") String alias,
        @JsonProperty("is_from_import") boolean fromImport,
        @JsonProperty("line") int line
) {

    /** Creates the import, copying its names. */
    public ImportInfo {
        names = List.copyOf(names);
    }

}
