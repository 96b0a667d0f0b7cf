package org.learningjava.pyml.application.usecase;

import org.learningjava.pyml.domain.error.TranspileException;
import org.learningjava.pyml.domain.model.options.BlockStyle;
import org.learningjava.pyml.domain.model.options.TranspileOptions;
import org.learningjava.pyml.domain.model.program.TranspiledProgram;
import org.learningjava.pyml.domain.service.Transpiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TranspileUseCase {

    private static final Logger log = LoggerFactory.getLogger(TranspileUseCase.class);

    private final Transpiler defaultTranspiler;

    public TranspileUseCase(Transpiler defaultTranspiler) {
        this.defaultTranspiler = defaultTranspiler;
    }

    public TranspiledProgram transpile(String source) {
        return run(defaultTranspiler, source);
    }

    /**
     * Runs with per-request overrides; null arguments keep the configured
     * defaults. Option errors are raised before the source is looked at.
     */
    public TranspiledProgram transpile(String source, String blockStyle, String indentationUnit, Boolean keepComments) {
        TranspileOptions options = defaultTranspiler.options();
        if (blockStyle != null) {
            options = options.withBlockStyle(BlockStyle.parse(blockStyle));
        }
        if (indentationUnit != null) {
            options = options.withIndentationUnit(indentationUnit);
        }
        if (keepComments != null) {
            options = options.withKeepComments(keepComments);
        }
        Transpiler transpiler = options.equals(defaultTranspiler.options())
                ? defaultTranspiler
                : new Transpiler(options);
        return run(transpiler, source);
    }

    private TranspiledProgram run(Transpiler transpiler, String source) {
        log.info("Transpiling document of {} chars ({})", source.length(), transpiler.options().blockStyle());
        try {
            TranspiledProgram program = transpiler.transpile(source);
            log.info("Transpiled {} statements into {} lines", program.nodeCount(), program.lineCount());
            return program;
        } catch (TranspileException e) {
            log.warn("Transpilation failed: {}", e.getMessage());
            throw e;
        }
    }
}
