package org.bpmnlite.compiler;

import org.bpmnlite.compiler.bpmn.BpmnParser;
import org.bpmnlite.compiler.bpmn.BpmnSchemaValidator;
import org.bpmnlite.compiler.bpmn.models.IRGraph;
import org.bpmnlite.compiler.bytecode.BytecodeGenerator;
import org.bpmnlite.compiler.bytecode.models.Program;
import org.bpmnlite.compiler.config.CompilerOptions;
import org.bpmnlite.compiler.verifier.BpmnVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline: optional schema check, parse, verify, lower.
 * An instance only holds its options and can be reused for any number of documents.
 */
public class BpmnCompiler {
    private static final Logger log = LoggerFactory.getLogger(BpmnCompiler.class);

    private final CompilerOptions options;

    public BpmnCompiler() {
        this(CompilerOptions.defaults());
    }

    public BpmnCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public Program compile(String xml) {
        if (xml == null) {
            throw new IllegalArgumentException("BPMN document must not be null");
        }

        if (options.strictSchema()) {
            BpmnSchemaValidator.validate(xml);
            log.info("Schema check passed");
        }

        IRGraph graph = new BpmnParser(options).parse(xml);
        log.info("Parsed {} nodes, {} flows", graph.nodeCount(), graph.edgeCount());

        BpmnVerifier.verify(graph);
        log.info("Verification passed");

        Program program = BytecodeGenerator.lower(graph);
        log.info("Lowered to {} instructions, {} task types, version {}",
                program.instructions().size(), program.taskManifest().size(), program.bytecodeVersion());
        return program;
    }
}
