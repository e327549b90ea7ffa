package org.tinyasm.compiler.backend.toolchain;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Command templates of the external toolchain. The placeholders {@code {input}} and
 * {@code {output}} are replaced by file paths.
 *
 * @param assemble The assemble command, e.g. {@code nasm -f elf64 -o {output} {input}}.
 * @param link The link command, or an empty list to use the assembler output as the binary.
 * @param binaryName The file name of the produced binary.
 */
public record ToolchainOptions(List<String> assemble, List<String> link, String binaryName) {

    public ToolchainOptions {
        if (assemble.isEmpty()) {
            throw new IllegalArgumentException("Assemble command must not be empty");
        }
        assemble = List.copyOf(assemble);
        link = List.copyOf(link);
    }

    /**
     * Reads the {@code tinyasm.toolchain} block.
     * @param config The resolved configuration.
     * @return The options.
     */
    public static ToolchainOptions fromConfig(Config config) {
        Config c = config.getConfig("tinyasm.toolchain");
        return new ToolchainOptions(c.getStringList("assemble"), c.getStringList("link"), c.getString("binary-name"));
    }
}
