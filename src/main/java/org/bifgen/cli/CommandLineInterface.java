package org.bifgen.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.bifgen.BuiltinGenerator;
import org.bifgen.api.GenerationException;
import org.bifgen.api.GenerationSummary;
import org.bifgen.api.GeneratorErrorCode;
import org.bifgen.api.GeneratorOptions;
import org.bifgen.api.GeneratorPaths;
import org.bifgen.cli.config.ConfigLoader;
import org.bifgen.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "bifgen",
    mixinStandardHelpOptions = true,
    version = "bifgen 1.0",
    description = "Generates built-in function declarations, initialization code and overload aliases "
            + "from a built-in and an overload definition file."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Parameters(index = "0", paramLabel = "BUILTINS", description = "The built-in definition file.")
    private Path builtinFile;

    @Parameters(index = "1", paramLabel = "OVERLOADS", description = "The overload definition file.")
    private Path overloadFile;

    @Parameters(index = "2", paramLabel = "DECLARATIONS", description = "The declarations (header) file to write.")
    private Path declarationsFile;

    @Parameters(index = "3", paramLabel = "DEFINITIONS", description = "The definitions (initialization) file to write.")
    private Path definitionsFile;

    @Parameters(index = "4", paramLabel = "ALIASES", description = "The macro alias file to write.")
    private Path aliasesFile;

    @Option(
        names = {"-c", "--config"},
        description = "Path to a HOCON configuration file overriding the built-in defaults."
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();

        GeneratorOptions options;
        try {
            Config config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            options = GeneratorOptions.fromConfig(config);
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return GeneratorErrorCode.BAD_ARGS.exitCode();
        }

        BuiltinGenerator generator = new BuiltinGenerator(options, spec.name());
        GeneratorPaths paths = new GeneratorPaths(builtinFile, overloadFile, declarationsFile, definitionsFile, aliasesFile);
        try {
            GenerationSummary summary = generator.generate(paths);
            LOG.info("Generated {} built-ins, {} overloads and {} function types",
                    summary.builtins(), summary.overloads(), summary.functionTypes());
            return GeneratorErrorCode.OK.exitCode();
        } catch (GenerationException e) {
            err.println(e.getMessage());
            err.println("Generation failed: " + e.getErrorCode() + " (" + e.getErrorCode().description() + ")");
            return e.getErrorCode().exitCode();
        }
    }

    /**
     * Creates the command line with the generator's exit code conventions: any
     * parameter error, such as a wrong number of paths, exits with {@link GeneratorErrorCode#BAD_ARGS}.
     *
     * @return A ready-to-execute command line.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setParameterExceptionHandler((ex, args) -> {
            CommandLine cmd = ex.getCommandLine();
            cmd.getErr().println(ex.getMessage());
            cmd.usage(cmd.getErr());
            return GeneratorErrorCode.BAD_ARGS.exitCode();
        });
        return commandLine;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
