package co.fanki.scriptintrospect.cli;

import co.fanki.scriptintrospect.introspection.domain.IntrospectionMode;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Converts {@code --mode} values, ignoring case.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class IntrospectionModeConverter
        implements ITypeConverter<IntrospectionMode> {

    @Override
    public IntrospectionMode convert(final String value) {
        try {
            return IntrospectionMode.fromLabel(value);
        } catch (final IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage());
        }
    }

}
