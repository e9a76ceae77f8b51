package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes result envelopes to JSON and back.
 *
 * <p>Non-ASCII text is written as is. Pretty output uses two-space
 * indentation, {@code "key": value} pairs and {@code []}/{@code {}} for
 * empty containers; null fields are always written.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ResultWriter {

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    /**
     * Creates a new writer.
     *
     * @param theObjectMapper the Jackson mapper
     * @param pretty whether to indent the output
     */
    public ResultWriter(final ObjectMapper theObjectMapper,
            final boolean pretty) {
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required");
        this.writer = pretty
                ? objectMapper.writer(new EnvelopePrettyPrinter())
                : objectMapper.writer();
    }

    /**
     * Serializes a result.
     *
     * @param result the result
     * @return the JSON text, without a trailing newline
     */
    public String toJson(final IntrospectionResult result) {
        Preconditions.requireNonNull(result, "Result is required");
        try {
            return writer.writeValueAsString(result);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize result", e);
        }
    }

    /**
     * Writes a result to a file as UTF-8, replacing it if present.
     *
     * @param result the result
     * @param output the file to write
     * @throws IOException if the file cannot be written
     */
    public void write(final IntrospectionResult result, final Path output)
            throws IOException {
        Preconditions.requireNonNull(output, "Output path is required");
        Files.writeString(output, toJson(result), StandardCharsets.UTF_8);
    }

    /**
     * Reads a result back from its JSON form.
     *
     * @param json the JSON text
     * @return the result
     * @throws JsonProcessingException if the text is not a valid envelope
     */
    public IntrospectionResult read(final String json)
            throws JsonProcessingException {
        Preconditions.requireNonNull(json, "JSON is required");
        return objectMapper.readValue(json, IntrospectionResult.class);
    }

    /** Indents like a two-space JSON dump. */
    private static final class EnvelopePrettyPrinter
            extends DefaultPrettyPrinter {

        private static final long serialVersionUID = 1L;

        EnvelopePrettyPrinter() {
            final DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new EnvelopePrettyPrinter();
        }

        @Override
        public void writeObjectFieldValueSeparator(final JsonGenerator g)
                throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeEndObject(final JsonGenerator g,
                final int nrOfEntries) throws IOException {
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfEntries > 0) {
                _objectIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw('}');
        }

        @Override
        public void writeEndArray(final JsonGenerator g, final int nrOfValues)
                throws IOException {
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfValues > 0) {
                _arrayIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw(']');
        }
    }

}
