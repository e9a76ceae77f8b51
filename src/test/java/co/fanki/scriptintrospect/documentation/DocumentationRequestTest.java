package co.fanki.scriptintrospect.documentation;

import co.fanki.scriptintrospect.introspection.domain.DependencyInfo;
import co.fanki.scriptintrospect.introspection.domain.DependencyProvenance;
import co.fanki.scriptintrospect.introspection.domain.EntryPointInfo;
import co.fanki.scriptintrospect.introspection.domain.EntryPointKind;
import co.fanki.scriptintrospect.introspection.domain.FunctionInfo;
import co.fanki.scriptintrospect.introspection.domain.IntrospectionResult;
import co.fanki.scriptintrospect.introspection.domain.ScriptMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DocumentationRequest}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DocumentationRequestTest {

    @Test
    void whenBuilding_givenIntrospectionResult_shouldSummarizeIt() {
        final DocumentationRequest request = DocumentationRequest.from(
                "import click\n", result(List.of(
                        EntryPointInfo.of("main", EntryPointKind.MAIN_FUNCTION),
                        EntryPointInfo.of("sync", EntryPointKind.CLI_COMMAND),
                        EntryPointInfo.of("push",
                                EntryPointKind.CLI_COMMAND)),
                        "Syncs files."));

        assertEquals("MainFunction, CliCommand", request.entryPoint());
        assertEquals(List.of(new FunctionSummary("main", "Runs.", 3)),
                request.functions());
        assertEquals(List.of("click", "click"), request.dependencies());
        assertEquals("Syncs files.", request.currentDescription());
        assertEquals(DocumentationRequest.DEFAULT_MAX_LENGTH,
                request.maxLength());
    }

    @Test
    void whenBuilding_givenNoEntryPointsOrDescription_shouldUseDefaults() {
        final DocumentationRequest request = DocumentationRequest.from(
                "pass\n", result(List.of(), null), 40);

        assertEquals("Unknown", request.entryPoint());
        assertEquals("", request.currentDescription());
        assertEquals(40, request.maxLength());
    }

    @Test
    void whenBuilding_givenNonPositiveMaxLength_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> DocumentationRequest.from("pass\n",
                        result(List.of(), null), 0));
    }

    @Test
    void whenSerializing_givenRequest_shouldUseSnakeCaseFields()
            throws Exception {
        final String json = new ObjectMapper().writeValueAsString(
                DocumentationRequest.from("pass\n", result(List.of(), null)));

        assertTrue(json.startsWith("{\"script_content\":\"pass\\n\","
                + "\"entry_point\":\"Unknown\",\"functions\":[{\"name\":"
                + "\"main\",\"docstring\":\"Runs.\",\"line_number\":3}]"));
        assertTrue(json.endsWith("\"max_length\":80}"));
    }

    private static IntrospectionResult result(
            final List<EntryPointInfo> entryPoints, final String description) {
        final ScriptMetadata metadata = new ScriptMetadata("tool",
                "/work/tool.py", description, null, null, List.of(
                        new DependencyInfo("click", ">=8",
                                DependencyProvenance.DECLARED),
                        new DependencyInfo("click", null,
                                DependencyProvenance.INFERRED)),
                entryPoints, List.of(new FunctionInfo("main", 3, "Runs.",
                        List.of(), null, List.of(), false)),
                List.of(), List.of(), null, List.of());
        return new IntrospectionResult("1.0.0", "Java 17", "abc", metadata);
    }

}
