package org.learningjava.pyml.domain.service;

import org.learningjava.pyml.domain.model.options.TranspileOptions;
import org.learningjava.pyml.domain.model.program.TranspiledProgram;
import org.learningjava.pyml.domain.model.source.LogicalLine;
import org.learningjava.pyml.domain.model.tree.Node;
import org.learningjava.pyml.domain.service.classify.NodeClassifier;
import org.learningjava.pyml.domain.service.classify.SymbolTable;
import org.learningjava.pyml.domain.service.codegen.BlockDialect;
import org.learningjava.pyml.domain.service.codegen.CodeGenerator;
import org.learningjava.pyml.domain.service.codegen.EmissionBuffer;
import org.learningjava.pyml.domain.service.expression.ExpressionTranslator;
import org.learningjava.pyml.domain.service.scan.LineScanner;
import org.learningjava.pyml.domain.service.tree.BlockBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The whole pipeline: scan, build, classify, generate. Stateless between
 * calls, so one instance can serve concurrent runs.
 */
public class Transpiler {

    private static final Logger log = LoggerFactory.getLogger(Transpiler.class);

    private final TranspileOptions options;
    private final ExpressionTranslator translator = new ExpressionTranslator();

    public Transpiler(TranspileOptions options) {
        this.options = options;
    }

    public TranspileOptions options() {
        return options;
    }

    public TranspiledProgram transpile(String source) {
        List<LogicalLine> lines = new LineScanner(options.sourceIndentWidth(), options.keepComments()).scan(source);
        List<Node> roots = new BlockBuilder().build(lines);
        SymbolTable symbols = new NodeClassifier().classify(roots);

        EmissionBuffer out = new EmissionBuffer(options.indentationUnit());
        new CodeGenerator(translator, BlockDialect.forStyle(options.blockStyle()), symbols).generate(roots, out);

        log.debug("Generated {} lines for {} statements ({} functions)",
                out.lineCount(), roots.size(), symbols.functionNames().size());
        return new TranspiledProgram(out.render(), out.lineCount(), roots.size());
    }
}
