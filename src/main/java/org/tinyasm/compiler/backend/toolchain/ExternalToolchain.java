package org.tinyasm.compiler.backend.toolchain;

import org.tinyasm.compiler.api.ToolchainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs the configured assemble and link commands as child processes inside a private
 * temporary directory. The exit code of each command is its only success signal.
 */
public final class ExternalToolchain implements Toolchain {

    private static final Logger LOG = LoggerFactory.getLogger(ExternalToolchain.class);

    static final String INPUT = "{input}";
    static final String OUTPUT = "{output}";

    private final ToolchainOptions options;

    /**
     * @param options The command templates.
     */
    public ExternalToolchain(ToolchainOptions options) {
        this.options = options;
    }

    @Override
    public <T> T build(String listing, BinaryHandler<T> handler) throws ToolchainException, IOException {
        Path workDir = Files.createTempDirectory("tinyasm-");
        try {
            Path source = workDir.resolve("program.asm");
            Files.writeString(source, listing, StandardCharsets.UTF_8);
            Path binary = workDir.resolve(options.binaryName());
            if (options.link().isEmpty()) {
                run("assemble", options.assemble(), source, binary, workDir);
            } else {
                Path object = workDir.resolve("program.o");
                run("assemble", options.assemble(), source, object, workDir);
                run("link", options.link(), object, binary, workDir);
            }
            if (!Files.exists(binary)) {
                throw new ToolchainException("Toolchain finished but produced no file " + binary.getFileName(), 0, "", null);
            }
            return handler.handle(binary);
        } finally {
            deleteRecursively(workDir);
        }
    }

    private static void run(String step, List<String> template, Path input, Path output, Path workDir) throws ToolchainException {
        List<String> command = expand(template, input, output);
        LOG.debug("Running {} step: {}", step, String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ToolchainException("Failed to start " + step + " command '" + command.get(0)
                    + "'. Please ensure it is installed and in your PATH.", -1, e.getMessage(), e);
        }
        String captured;
        int exitCode;
        try (InputStream stream = process.getInputStream()) {
            captured = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            exitCode = process.waitFor();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new ToolchainException("Failed to read output of " + step + " command", -1, "", e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolchainException("Interrupted while waiting for " + step + " command", -1, "", e);
        }
        if (exitCode != 0) {
            LOG.warn("{} step failed with exit code {}", step, exitCode);
            throw new ToolchainException(step + " command exited with code " + exitCode + ": " + captured.strip(), exitCode, captured, null);
        }
        if (!captured.isBlank()) {
            LOG.debug("{} output: {}", step, captured.strip());
        }
    }

    static List<String> expand(List<String> template, Path input, Path output) {
        List<String> command = new ArrayList<>(template.size());
        for (String part : template) {
            command.add(part.replace(INPUT, input.toString()).replace(OUTPUT, output.toString()));
        }
        return command;
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    LOG.warn("Failed to delete temporary file {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            LOG.warn("Failed to clean up temporary directory {}: {}", dir, e.getMessage());
        }
    }
}
