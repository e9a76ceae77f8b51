package co.fanki.scriptintrospect.introspection.domain.python;

import co.fanki.scriptintrospect.introspection.domain.EntryPointKind;
import co.fanki.scriptintrospect.introspection.domain.ErrorKind;
import co.fanki.scriptintrospect.introspection.domain.FunctionInfo;
import co.fanki.scriptintrospect.introspection.domain.ParameterInfo;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PythonAstEngine}.
 *
 * <p>Checks that the analyzer script loads into the GraalPy context and
 * that annotations, defaults and decorators come back as the
 * {@code ast} module renders them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PythonAstEngineTest {

    private static PythonAstEngine engine;

    @BeforeAll
    static void startEngine() throws IOException {
        engine = new PythonAstEngine();
    }

    @AfterAll
    static void stopEngine() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    void whenAnalyzing_givenPlainScript_shouldReturnDecodedText()
            throws IOException {
        final ModuleAnalysis analysis = analyze("import os\r\nx = 1\r\n");

        assertFalse(analysis.isFailed());
        assertEquals("import os\nx = 1\n", analysis.text());
        assertNull(analysis.docstring());
    }

    @Test
    void whenAnalyzing_givenAnnotationsAndDefaults_shouldRenderThem()
            throws IOException {
        final ModuleAnalysis analysis = analyze("""
                def build(a: Optional[str], b: Dict[str, List[int]] = {"k": 1},
                          c: typing.Any = c ** -d, d: "Quoted" = 'it\\'s',
                          e=lambda x: x + 1, f=(1, 2)) -> Tuple[int, ...]:
                    pass
                """);

        final FunctionInfo build = analysis.functions().get(0);
        assertEquals(List.of(
                new ParameterInfo("a", "Optional[str]", null, false),
                new ParameterInfo("b", "Dict[str, List[int]]", "{'k': 1}",
                        true),
                new ParameterInfo("c", "typing.Any", "c ** (-d)", true),
                new ParameterInfo("d", "'Quoted'", "\"it's\"", true),
                new ParameterInfo("e", null, "lambda x: x + 1", true),
                new ParameterInfo("f", null, "(1, 2)", true)),
                build.parameters());
        assertEquals("Tuple[int, ...]", build.returns());
    }

    @Test
    void whenAnalyzing_givenDecorators_shouldRenderEachShape()
            throws IOException {
        final ModuleAnalysis analysis = analyze("""
                @staticmethod
                @click.option("--name", "-n", default=None, help='Who')
                @(lambda f: f)
                @registry["tools"]
                async def run():
                    pass
                """);

        final FunctionInfo run = analysis.functions().get(0);
        assertEquals(List.of("staticmethod",
                "click.option('--name', '-n', default=None, help='Who')",
                "lambda f: f", "registry['tools']"), run.decorators());
        assertTrue(run.async());
    }

    @Test
    void whenAnalyzing_givenCommandDecorator_shouldReportEntryPoint()
            throws IOException {
        final ModuleAnalysis analysis = engine.analyze("""
                @cli.command(name="sync")
                def sync():
                    pass
                """.getBytes(StandardCharsets.UTF_8), "tool.py",
                List.of("cli.command"));

        assertEquals(1, analysis.entryPoints().size());
        assertEquals("sync", analysis.entryPoints().get(0).callable());
        assertEquals(EntryPointKind.CLI_COMMAND,
                analysis.entryPoints().get(0).kind());
    }

    @Test
    void whenAnalyzing_givenCleanedDocstrings_shouldDedentThem()
            throws IOException {
        final ModuleAnalysis analysis = analyze("""
                class Job:
                    \"""
                    Runs a job.

                        Indented detail.
                    \"""
                """);

        assertEquals("Runs a job.\n\n    Indented detail.",
                analysis.classes().get(0).docstring());
    }

    @Test
    void whenAnalyzing_givenSyntaxError_shouldUseTheFileNameInTheMessage()
            throws IOException {
        final ModuleAnalysis analysis = analyze("def f(:\n    pass\n");

        assertTrue(analysis.isFailed());
        assertEquals(ErrorKind.SYNTAX_ERROR, analysis.error().kind());
        assertEquals("invalid syntax (tool.py, line 1)",
                analysis.error().message());
        assertEquals(1, analysis.error().line());
        assertTrue(analysis.functions().isEmpty());
    }

    private static ModuleAnalysis analyze(final String text)
            throws IOException {
        return engine.analyze(text.getBytes(StandardCharsets.UTF_8),
                "tool.py", List.of("click.command"));
    }

}
