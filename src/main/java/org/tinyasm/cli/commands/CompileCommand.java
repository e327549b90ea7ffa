package org.tinyasm.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.tinyasm.cli.CommandLineInterface;
import org.tinyasm.compiler.Compiler;
import org.tinyasm.compiler.CompilerOptions;
import org.tinyasm.compiler.api.CompilationException;
import org.tinyasm.compiler.api.CompiledProgram;
import org.tinyasm.compiler.api.ToolchainException;
import org.tinyasm.compiler.backend.emit.ListingEmitter;
import org.tinyasm.compiler.backend.toolchain.ExternalToolchain;
import org.tinyasm.compiler.backend.toolchain.Toolchain;
import org.tinyasm.compiler.backend.toolchain.ToolchainOptions;
import org.tinyasm.compiler.diagnostics.CompilerLogger;
import org.tinyasm.config.ConfigLoader;
import org.tinyasm.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(name = "compile", description = "Compiles a JSON syntax-tree document to a NASM listing and optionally a binary.")
public class CompileCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_COMPILE_ERROR = 1;
    public static final int EXIT_TOOLCHAIN_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @Option(names = {"-i", "--input"}, required = true, description = "The JSON tree document.")
    private File input;

    @Option(names = {"-o", "--output"}, description = "Write the listing to this file instead of stdout.")
    private File output;

    @Option(names = {"-b", "--binary"}, description = "Assemble and link the listing and copy the binary here.")
    private File binary;

    @Option(names = "--no-dse", description = "Disable dead-store elimination.")
    private boolean noDeadStoreElimination;

    @Option(names = "--no-peephole", description = "Disable peephole rewriting.")
    private boolean noPeephole;

    @Option(names = {"-j", "--workers"}, description = "Number of threads lowering functions.")
    private Integer workers;

    @Option(names = "-v", description = "Increase verbosity (repeatable).")
    private boolean[] verbose = new boolean[0];

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Function<ToolchainOptions, Toolchain> toolchainFactory;

    public CompileCommand() {
        this(ExternalToolchain::new);
    }

    /**
     * @param toolchainFactory Creates the toolchain from the configured command templates.
     */
    public CompileCommand(Function<ToolchainOptions, Toolchain> toolchainFactory) {
        this.toolchainFactory = toolchainFactory;
    }

    @Override
    public Integer call() throws IOException {
        PrintWriter err = spec.commandLine().getErr();
        Config config;
        try {
            config = parent != null ? parent.getConfig() : ConfigLoader.load();
        } catch (ConfigException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            return EXIT_COMPILE_ERROR;
        }
        LoggingConfigurator.applyVerbosity(verbose.length);

        CompilerOptions options = CompilerOptions.fromConfig(config);
        options = options.withOptimizations(options.deadStoreElimination() && !noDeadStoreElimination,
                options.peephole() && !noPeephole);
        if (workers != null) {
            options = options.withWorkers(workers);
        }

        Compiler compiler = new Compiler(options);
        compiler.setVerbosity(CompilerLogger.INFO + verbose.length);
        CompiledProgram program;
        try {
            program = compiler.compile(input.toPath());
        } catch (CompilationException e) {
            err.println("Compilation failed [" + e.errorCode() + "]: " + e.getMessage());
            return EXIT_COMPILE_ERROR;
        } catch (IOException e) {
            err.println("Cannot read " + input + ": " + e.getMessage());
            return EXIT_COMPILE_ERROR;
        }
        String listing = new ListingEmitter().render(program);

        if (output != null) {
            Files.writeString(output.toPath(), listing, StandardCharsets.UTF_8);
            LOG.info("Wrote listing to {}", output);
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.print(listing);
            out.flush();
        }

        if (binary != null) {
            Toolchain toolchain = toolchainFactory.apply(ToolchainOptions.fromConfig(config));
            Path target = binary.toPath();
            try {
                toolchain.build(listing, produced -> {
                    Files.copy(produced, target, StandardCopyOption.REPLACE_EXISTING);
                    if (!target.toFile().setExecutable(true)) {
                        LOG.warn("Could not mark {} as executable", target);
                    }
                    return target;
                });
            } catch (ToolchainException e) {
                err.println("Toolchain failed with exit code " + e.exitCode() + ":");
                err.println(e.output());
                return EXIT_TOOLCHAIN_ERROR;
            }
            LOG.info("Wrote binary to {}", target);
        }
        return EXIT_OK;
    }
}
