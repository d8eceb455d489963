package org.bifgen;

import org.bifgen.api.GenerationException;
import org.bifgen.api.GenerationSummary;
import org.bifgen.api.GeneratorErrorCode;
import org.bifgen.api.GeneratorOptions;
import org.bifgen.api.GeneratorPaths;
import org.bifgen.api.IBuiltinGenerator;
import org.bifgen.api.InternalGeneratorError;
import org.bifgen.backend.emit.ArtifactKind;
import org.bifgen.backend.emit.EmissionContext;
import org.bifgen.backend.emit.EmissionRegistry;
import org.bifgen.backend.emit.IArtifactEmitter;
import org.bifgen.backend.emit.SourceWriter;
import org.bifgen.backend.output.GeneratedOutputs;
import org.bifgen.diagnostics.Diagnostic;
import org.bifgen.diagnostics.DiagnosticsEngine;
import org.bifgen.frontend.lexer.LineScanner;
import org.bifgen.frontend.parser.AbstractDefinitionParser;
import org.bifgen.frontend.parser.BuiltinFileParser;
import org.bifgen.frontend.parser.OverloadFileParser;
import org.bifgen.frontend.parser.ParseException;
import org.bifgen.frontend.semantics.SymbolTables;
import org.bifgen.model.GeneratorModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The generator implementation. It runs the pipeline strictly in sequence:
 * open inputs, create outputs, parse the built-in file, parse the overload file,
 * then write declarations, definitions and aliases. The first failure aborts the
 * run and removes every output created so far. It is not thread-safe.
 */
public class BuiltinGenerator implements IBuiltinGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(BuiltinGenerator.class);

    /** Name written into the banner of every artifact unless another one is given. */
    public static final String DEFAULT_PROGRAM_NAME = "bifgen";

    private final GeneratorOptions options;
    private final String programName;
    private final EmissionRegistry emissionRegistry = EmissionRegistry.initializeWithDefaults();
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    /**
     * Creates a generator with the classpath default options.
     */
    public BuiltinGenerator() {
        this(GeneratorOptions.defaults());
    }

    public BuiltinGenerator(GeneratorOptions options) {
        this(options, DEFAULT_PROGRAM_NAME);
    }

    /**
     * @param options The policy settings.
     * @param programName The generator name recorded in the artifact banners.
     */
    public BuiltinGenerator(GeneratorOptions options, String programName) {
        this.options = options;
        this.programName = programName;
    }

    @Override
    public GenerationSummary generate(GeneratorPaths paths) throws GenerationException {
        diagnostics = new DiagnosticsEngine();
        LOG.debug("Generating from '{}' and '{}'", paths.builtinFile(), paths.overloadFile());
        try (LineScanner builtinScanner = openInput(paths.builtinFile(), GeneratorErrorCode.BUILTIN_INPUT_NOT_FOUND, "built-in");
             LineScanner overloadScanner = openInput(paths.overloadFile(), GeneratorErrorCode.OVERLOAD_INPUT_NOT_FOUND, "overload")) {
            return generate(paths, builtinScanner, overloadScanner);
        } catch (IOException e) {
            throw new GenerationException(GeneratorErrorCode.INTERNAL_ERROR, "Cannot close input: " + e.getMessage(), e);
        }
    }

    private GenerationSummary generate(GeneratorPaths paths, LineScanner builtinScanner, LineScanner overloadScanner)
            throws GenerationException {
        GeneratedOutputs outputs = createOutputs(paths);
        try {
            SymbolTables tables = new SymbolTables(options);

            BuiltinFileParser builtinParser = new BuiltinFileParser(builtinScanner, options,
                    diagnostics.forFile(builtinScanner.fileName()), tables);
            parse(builtinParser, paths.builtinFile(), GeneratorErrorCode.BUILTIN_PARSE_FAILURE);
            tables.builtinIds().freeze();
            LOG.info("Parsed {} built-ins in {} stanzas from '{}'",
                    builtinParser.entries().size(), builtinParser.stanzaCount(), paths.builtinFile());

            OverloadFileParser overloadParser = new OverloadFileParser(overloadScanner, options,
                    diagnostics.forFile(overloadScanner.fileName()), tables);
            parse(overloadParser, paths.overloadFile(), GeneratorErrorCode.OVERLOAD_PARSE_FAILURE);
            LOG.info("Parsed {} overloads in {} stanzas from '{}'",
                    overloadParser.entries().size(), overloadParser.stanzas().size(), paths.overloadFile());

            diagnostics.getDiagnostics().stream()
                    .filter(d -> d.type() == Diagnostic.Type.WARNING)
                    .forEach(warning -> LOG.warn("{}", warning));

            GeneratorModel model = new GeneratorModel(builtinParser.entries(), builtinParser.stanzaCount(),
                    overloadParser.stanzas(), overloadParser.entries(), tables);
            EmissionContext context = new EmissionContext(options, programName,
                    paths.builtinFile().toString(), paths.overloadFile().toString(),
                    String.valueOf(paths.declarationsFile().getFileName()));
            for (IArtifactEmitter emitter : emissionRegistry.emitters()) {
                emit(emitter, model, context, outputs);
            }

            return new GenerationSummary(model.builtins().size(), model.builtinStanzaCount(),
                    model.overloads().size(), model.overloadStanzas().size(), model.functionTypes().size());
        } catch (GenerationException e) {
            outputs.discard(e);
            throw e;
        } catch (InternalGeneratorError e) {
            LOG.error("Internal error, aborting: {}", e.getMessage());
            GenerationException failure = new GenerationException(GeneratorErrorCode.INTERNAL_ERROR,
                    "Internal error: " + e.getMessage(), e);
            outputs.discard(failure);
            throw failure;
        }
    }

    private LineScanner openInput(Path file, GeneratorErrorCode failureCode, String label) throws GenerationException {
        try {
            return new LineScanner(Files.newBufferedReader(file, StandardCharsets.UTF_8), file.toString());
        } catch (IOException e) {
            String message = "Cannot find input " + label + " file '" + file + "'";
            LOG.error("{}.", message);
            throw new GenerationException(failureCode, message, e);
        }
    }

    private GeneratedOutputs createOutputs(GeneratorPaths paths) throws GenerationException {
        try {
            return GeneratedOutputs.create(paths);
        } catch (GenerationException e) {
            LOG.error("{}.", e.getMessage());
            throw e;
        }
    }

    private void parse(AbstractDefinitionParser parser, Path file, GeneratorErrorCode failureCode) throws GenerationException {
        try {
            parser.parse();
        } catch (ParseException e) {
            LOG.error("Parsing of '{}' failed, aborting. {}", file, e.getMessage());
            throw new GenerationException(failureCode, e.getMessage(), e.getSourceInfo(), e);
        } catch (IOException e) {
            LOG.error("Parsing of '{}' failed, aborting. Read error: {}", file, e.getMessage());
            throw new GenerationException(failureCode, "Cannot read '" + file + "': " + e.getMessage(), e);
        }
    }

    private void emit(IArtifactEmitter emitter, GeneratorModel model, EmissionContext context, GeneratedOutputs outputs)
            throws GenerationException {
        ArtifactKind kind = emitter.kind();
        Path path = outputs.path(kind);
        try {
            emitter.emit(model, context, new SourceWriter(outputs.writer(kind)));
            outputs.finish(kind);
            LOG.debug("Wrote {} to '{}'", kind.label(), path);
        } catch (IOException e) {
            LOG.error("Writing {} to '{}' failed, aborting. {}", kind.label(), path, e.getMessage());
            throw new GenerationException(kind.writeFailureCode(),
                    "Cannot write " + kind.label() + " file '" + path + "': " + e.getMessage(), e);
        }
    }

    /**
     * @return The diagnostics of the most recent run, including warnings.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
