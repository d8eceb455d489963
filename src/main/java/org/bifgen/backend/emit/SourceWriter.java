package org.bifgen.backend.emit;

import java.io.IOException;
import java.io.Writer;
import java.util.Locale;

/**
 * Line-oriented writer for generated C sources. Lines always end in {@code \n}
 * regardless of the platform, so output is byte-identical everywhere.
 */
public final class SourceWriter {

    private final Writer out;

    /**
     * @param out The destination; not closed by this writer.
     */
    public SourceWriter(Writer out) {
        this.out = out;
    }

    public SourceWriter line(String text) throws IOException {
        out.write(text);
        out.write('\n');
        return this;
    }

    public SourceWriter line() throws IOException {
        out.write('\n');
        return this;
    }

    /**
     * Writes a formatted line using the root locale.
     */
    public SourceWriter format(String format, Object... args) throws IOException {
        return line(String.format(Locale.ROOT, format, args));
    }

    /**
     * Writes the comment that opens every artifact.
     * @param context The emission context naming the generator and its inputs.
     */
    public SourceWriter banner(EmissionContext context) throws IOException {
        format("/* Automatically generated by the program '%s'", context.programName());
        format("   from the files '%s' and '%s'.  */", context.builtinFile(), context.overloadFile());
        return line();
    }

    public void flush() throws IOException {
        out.flush();
    }
}
