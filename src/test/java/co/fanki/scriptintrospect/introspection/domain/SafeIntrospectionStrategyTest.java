package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.introspection.domain.python.PythonAstEngine;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link SafeIntrospectionStrategy}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SafeIntrospectionStrategyTest {

    private static PythonAstEngine engine;

    private SafeIntrospectionStrategy strategy;

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

    @BeforeEach
    void setUp() {
        strategy = new SafeIntrospectionStrategy(new InlineMetadataParser(),
                new SyntaxAnalyzer(List.of("click.command"), engine),
                new DependencyResolver(), new CliFrameworkDetector());
    }

    @Test
    void whenIntrospecting_givenClickScript_shouldExtractEverything()
            throws Exception {
        final ScriptSource source = ScriptSource.read(script("hello.py"));

        final ScriptMetadata metadata = strategy.introspect(source);

        assertEquals("hello", metadata.name());
        assertEquals(source.path().toString(), metadata.path());
        assertEquals("Greets someone from the terminal.",
                metadata.description());
        assertEquals("Greets someone from the terminal.\n\n"
                + "Usage: hello.py [NAME]\n", metadata.docstring());

        assertEquals(List.of("click>=8.0.0", "rich>=13.0.0"),
                metadata.inlineMetadataBlock().dependencies());
        assertEquals(">=3.11", metadata.inlineMetadataBlock().minInterpreter());
        assertEquals(List.of(
                new DependencyInfo("click", ">=8.0.0",
                        DependencyProvenance.DECLARED),
                new DependencyInfo("rich", ">=13.0.0",
                        DependencyProvenance.DECLARED),
                new DependencyInfo("click", null,
                        DependencyProvenance.INFERRED)),
                metadata.dependencies());

        assertEquals(List.of(
                new ImportInfo("click", List.of(), null, false, 14),
                new ImportInfo("rich.console", List.of("Console"), null,
                        true, 15)), metadata.imports());

        final FunctionInfo main = metadata.functions().get(0);
        assertEquals("main", main.name());
        assertEquals(22, main.line());
        assertEquals("Say hello with style.", main.docstring());
        assertEquals(List.of(new ParameterInfo("name", "str", null, false)),
                main.parameters());
        assertEquals(List.of("click.command()",
                "click.argument('name', default='World')"),
                main.decorators());

        assertEquals(List.of(EntryPointInfo.of("main",
                EntryPointKind.MAIN_FUNCTION)), metadata.entryPoints());
        assertEquals(CliFrameworkInfo.named("click"), metadata.cliFramework());
        assertTrue(metadata.classes().isEmpty());
        assertTrue(metadata.errors().isEmpty());
    }

    @Test
    void whenIntrospecting_givenTyperScript_shouldPreferTyper()
            throws Exception {
        final ScriptMetadata metadata = strategy.introspect(
                ScriptSource.read(script("typer_script.py")));

        assertEquals("typer_script", metadata.name());
        assertEquals("typer", metadata.cliFramework().name());
        assertTrue(metadata.entryPoints().isEmpty());
        assertEquals(List.of(
                new DependencyInfo("typer", null,
                        DependencyProvenance.DECLARED),
                new DependencyInfo("typer", null,
                        DependencyProvenance.INFERRED),
                new DependencyInfo("click", null,
                        DependencyProvenance.INFERRED)),
                metadata.dependencies());

        final FunctionInfo count = metadata.functions().get(0);
        assertEquals("int", count.returns());
        assertEquals(List.of("app.command()"), count.decorators());
        assertEquals(new ParameterInfo("verbose", "bool", "False", true),
                count.parameters().get(1));
    }

    @Test
    void whenIntrospecting_givenPlainScript_shouldInferStandardModules()
            throws Exception {
        final ScriptMetadata metadata = strategy.introspect(
                ScriptSource.read(script("plain.py")));

        assertNull(metadata.inlineMetadataBlock());
        assertNull(metadata.docstring());
        assertNull(metadata.description());
        assertNull(metadata.cliFramework());
        assertTrue(metadata.entryPoints().isEmpty());
        assertEquals(List.of("os", "sys", "collections"),
                metadata.dependencies().stream().map(DependencyInfo::name)
                        .toList());
        assertEquals(List.of("register", "run"),
                metadata.functions().stream().map(FunctionInfo::name)
                        .toList());

        final ClassInfo registry = metadata.classes().get(0);
        assertEquals("Registry", registry.name());
        assertEquals(6, registry.line());
        assertEquals(List.of("OrderedDict"), registry.baseClasses());
        assertEquals("Keeps entries in insertion order.",
                registry.docstring());
        assertEquals(new ParameterInfo("value", null, "None", true),
                registry.methods().get(0).parameters().get(2));
    }

    @Test
    void whenIntrospecting_givenMinimalHelloScript_shouldReportMain() {
        final ScriptMetadata metadata = strategy.introspect(ScriptSource.of(
                Path.of("hello_container.py"), """
                \"""Simple hello script for container testing.\"""


                def main():
                    print("Hello")
                """.getBytes(StandardCharsets.UTF_8)));

        assertEquals("Simple hello script for container testing.",
                metadata.docstring());
        assertEquals(metadata.docstring(), metadata.description());
        assertNull(metadata.inlineMetadataBlock());
        assertEquals(List.of(EntryPointInfo.of("main",
                EntryPointKind.MAIN_FUNCTION)), metadata.entryPoints());
        assertTrue(metadata.functions().get(0).parameters().isEmpty());
    }

    @Test
    void whenIntrospecting_givenBrokenScript_shouldReturnFallbackShape()
            throws Exception {
        final ScriptMetadata metadata = strategy.introspect(
                ScriptSource.read(script("broken.py")));

        assertEquals("broken", metadata.name());
        assertNull(metadata.docstring());
        assertNull(metadata.inlineMetadataBlock());
        assertTrue(metadata.imports().isEmpty());
        assertTrue(metadata.dependencies().isEmpty());
        assertTrue(metadata.functions().isEmpty());
        assertEquals(List.of(new ErrorRecord(ErrorKind.SYNTAX_ERROR,
                "invalid syntax (broken.py, line 5)", 5)), metadata.errors());
    }

    @Test
    void whenIntrospecting_givenFailingCollaborator_shouldReturnRuntimeError()
            throws Exception {
        final DependencyResolver resolver = mock(DependencyResolver.class);
        when(resolver.resolve(any(), anyList())).thenThrow(
                new IllegalStateException("resolver down"));
        final SafeIntrospectionStrategy failing = new SafeIntrospectionStrategy(
                new InlineMetadataParser(), new SyntaxAnalyzer(
                        List.of("click.command"), engine),
                resolver, new CliFrameworkDetector());

        final ScriptMetadata metadata = failing.introspect(
                ScriptSource.read(script("hello.py")));

        assertTrue(metadata.functions().isEmpty());
        assertNull(metadata.description());
        assertEquals(List.of(new ErrorRecord(ErrorKind.RUNTIME_ERROR,
                "Introspection failed: resolver down", null)),
                metadata.errors());
    }

    static Path script(final String name) throws URISyntaxException {
        return Path.of(SafeIntrospectionStrategyTest.class
                .getResource("/scripts/" + name).toURI());
    }

}
