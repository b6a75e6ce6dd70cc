package org.bpmnlite.compiler;

import org.bpmnlite.compiler.bytecode.ProgramWriter;
import org.bpmnlite.compiler.bytecode.models.Program;
import org.bpmnlite.compiler.config.CompilerConfig;
import org.bpmnlite.compiler.config.CompilerConfigHelper;
import org.bpmnlite.compiler.config.CompilerOptions;
import org.bpmnlite.compiler.errors.BpmnCompileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point: {@code Main <input.bpmn> [output.json] [--config <config.json>]}.
 * Without an output path the program JSON goes to stdout.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_IO_ERROR = 3;

    private String inputPath;
    private String outputPath;
    private String configPath;

    public static void main(String[] args) {
        System.exit(new Main().run(args));
    }

    int run(String[] args) {
        if (!parseArguments(args)) {
            System.err.println("Usage: Main <input.bpmn> [output.json] [--config <config.json>]");
            return EXIT_USAGE;
        }

        try {
            CompilerOptions options = loadOptions();
            String xml = Files.readString(Path.of(inputPath), StandardCharsets.UTF_8);
            Program program = new BpmnCompiler(options).compile(xml);

            ProgramWriter writer = new ProgramWriter(options.prettyPrintOutput());
            if (outputPath == null) {
                System.out.println(writer.toJson(program));
            } else {
                writer.writeToFile(program, Path.of(outputPath));
                log.info("Wrote {}", outputPath);
            }
            return EXIT_OK;
        } catch (BpmnCompileException e) {
            log.error("Compilation of {} failed: {}: {}", inputPath, e.getKind(), e.getMessage());
            return EXIT_COMPILE_ERROR;
        } catch (IOException e) {
            log.error("I/O error: {}", e.getMessage(), e);
            return EXIT_IO_ERROR;
        }
    }

    private boolean parseArguments(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg)) {
                if (i + 1 >= args.length) {
                    return false;
                }
                configPath = args[++i];
            } else if (inputPath == null) {
                inputPath = arg;
            } else if (outputPath == null) {
                outputPath = arg;
            } else {
                return false;
            }
        }
        return inputPath != null;
    }

    private CompilerOptions loadOptions() throws IOException {
        CompilerConfig config = configPath != null
                ? CompilerConfigHelper.loadConfigFile(configPath)
                : CompilerConfigHelper.loadDefaults();
        return CompilerConfigHelper.toOptions(config);
    }
}
