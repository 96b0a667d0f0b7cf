package org.learningjava.pyml.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.learningjava.pyml.application.usecase.TranspileUseCase;
import org.learningjava.pyml.domain.model.program.TranspiledProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/transpile")
public class TranspileController {

    private static final Logger log = LoggerFactory.getLogger(TranspileController.class);

    private final TranspileUseCase useCase;

    public TranspileController(TranspileUseCase useCase) {
        this.useCase = useCase;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public TranspileResponse transpile(@Valid @RequestBody TranspileRequest req) {
        if (log.isDebugEnabled()) {
            log.debug("transpile: blockStyle={}, indentationUnit='{}', keepComments={}",
                    req.blockStyle(), req.indentationUnit(), req.keepComments());
        }
        TranspiledProgram program = useCase.transpile(
                req.source(),
                req.blockStyle(),
                req.indentationUnit(),
                req.keepComments()
        );
        return TranspileResponse.from(program);
    }

    /** Plain-text variant with the configured defaults. */
    @PostMapping(path = "/raw", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public String transpileRaw(@RequestBody String source) {
        return useCase.transpile(source).code();
    }

    // ---------- DTOs ----------
    public record TranspileRequest(
            @NotNull String source,
            String blockStyle,
            String indentationUnit,
            Boolean keepComments
    ) {
    }

    public record TranspileResponse(String code, int lineCount) {
        static TranspileResponse from(TranspiledProgram program) {
            return new TranspileResponse(program.code(), program.lineCount());
        }
    }
}
