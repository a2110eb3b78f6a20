package im.arun.markuptree.cli;

import im.arun.markuptree.render.FormattingMode;
import picocli.CommandLine;

/**
 * Maps option keys such as {@code indented} or {@code source} to a {@link FormattingMode}.
 */
public class FormattingModeConverter implements CommandLine.ITypeConverter<FormattingMode> {

    @Override
    public FormattingMode convert(String value) {
        try {
            return FormattingMode.fromKey(value);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(e.getMessage());
        }
    }
}
