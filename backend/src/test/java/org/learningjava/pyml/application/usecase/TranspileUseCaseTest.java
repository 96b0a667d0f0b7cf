// src/test/java/org/learningjava/pyml/application/usecase/TranspileUseCaseTest.java
package org.learningjava.pyml.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.pyml.domain.error.ConfigurationException;
import org.learningjava.pyml.domain.error.StructuralException;
import org.learningjava.pyml.domain.model.options.TranspileOptions;
import org.learningjava.pyml.domain.model.program.TranspiledProgram;
import org.learningjava.pyml.domain.service.Transpiler;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TranspileUseCaseTest {

    private Transpiler transpiler;
    private TranspileUseCase useCase;

    @BeforeEach
    void setUp() {
        transpiler = mock(Transpiler.class);
        when(transpiler.options()).thenReturn(TranspileOptions.defaults());
        useCase = new TranspileUseCase(transpiler);
    }

    @Test
    void transpile_delegates_to_default_transpiler() {
        TranspiledProgram expected = new TranspiledProgram("x = 1\n", 1, 1);
        when(transpiler.transpile("x: 1")).thenReturn(expected);

        TranspiledProgram out = useCase.transpile("x: 1");

        assertSame(expected, out);
        verify(transpiler, times(1)).transpile("x: 1");
    }

    @Test
    void overrides_equal_to_defaults_reuse_default_transpiler() {
        TranspiledProgram expected = new TranspiledProgram("x = 1\n", 1, 1);
        when(transpiler.transpile("x: 1")).thenReturn(expected);

        TranspiledProgram out = useCase.transpile("x: 1", "colon-indent", "  ", false);

        assertSame(expected, out);
        verify(transpiler).transpile("x: 1");
    }

    @Test
    void null_overrides_keep_defaults() {
        when(transpiler.transpile(anyString())).thenReturn(new TranspiledProgram("", 0, 0));

        useCase.transpile("", null, null, null);

        verify(transpiler).transpile("");
    }

    @Test
    void block_style_override_runs_a_dedicated_transpiler() {
        TranspiledProgram out = useCase.transpile("x: 1\nif x:\n  print: x\n", "brace", null, null);

        assertEquals("x = 1\nif x {\n  print(x)\n}\n", out.code());
        assertEquals(4, out.lineCount());
        verify(transpiler, never()).transpile(anyString());
    }

    @Test
    void indentation_override_is_applied() {
        TranspiledProgram out = useCase.transpile("if true:\n  print: 1\n", null, "    ", null);

        assertEquals("if True:\n    print(1)\n", out.code());
    }

    @Test
    void invalid_option_fails_before_transpiling() {
        assertThrows(ConfigurationException.class, () -> useCase.transpile("x: 1", "curly", null, null));
        assertThrows(ConfigurationException.class, () -> useCase.transpile("x: 1", null, "xx", null));

        verify(transpiler, never()).transpile(anyString());
    }

    @Test
    void transpile_errors_propagate() {
        when(transpiler.transpile("bad")).thenThrow(new StructuralException(1, "broken"));

        StructuralException ex = assertThrows(StructuralException.class, () -> useCase.transpile("bad"));

        assertEquals(1, ex.line());
        assertEquals("broken", ex.detail());
    }
}
