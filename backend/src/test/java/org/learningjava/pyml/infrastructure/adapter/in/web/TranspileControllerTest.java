// src/test/java/org/learningjava/pyml/infrastructure/adapter/in/web/TranspileControllerTest.java
package org.learningjava.pyml.infrastructure.adapter.in.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.pyml.application.usecase.TranspileUseCase;
import org.learningjava.pyml.domain.error.ConfigurationException;
import org.learningjava.pyml.domain.error.StructuralException;
import org.learningjava.pyml.domain.model.program.TranspiledProgram;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.*;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class TranspileControllerTest {

    private TranspileUseCase useCase;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        useCase = Mockito.mock(TranspileUseCase.class);

        TranspileController controller = new TranspileController(useCase);

        // ApiError.timestamp is an Instant
        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        mvc = MockMvcBuilders
                .standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new StringHttpMessageConverter(StandardCharsets.UTF_8),
                        new MappingJackson2HttpMessageConverter(om))
                .build();
    }

    @Test
    void transpile_returnsCode_and_lineCount() throws Exception {
        when(useCase.transpile("x: 1", null, null, null))
                .thenReturn(new TranspiledProgram("x = 1\n", 1, 1));

        mvc.perform(post("/transpile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"x: 1\"}")
                        .accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.code", is("x = 1\n")))
                .andExpect(jsonPath("$.lineCount", is(1)))
                .andExpect(jsonPath("$.nodeCount").doesNotExist());

        verify(useCase).transpile("x: 1", null, null, null);
        verifyNoMoreInteractions(useCase);
    }

    @Test
    void transpile_passes_options_through() throws Exception {
        when(useCase.transpile("x: 1", "brace", "\t", true))
                .thenReturn(new TranspiledProgram("x = 1\n", 1, 1));

        mvc.perform(post("/transpile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"source":"x: 1","blockStyle":"brace","indentationUnit":"\\t","keepComments":true}
                                """)
                        .accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk());

        verify(useCase).transpile("x: 1", "brace", "\t", true);
    }

    @Test
    void missing_source_returns_400() throws Exception {
        mvc.perform(post("/transpile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"blockStyle\":\"brace\"}")
                        .accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status", is(400)))
                .andExpect(jsonPath("$.message", containsString("source")))
                .andExpect(jsonPath("$.path", is("/transpile")));

        verifyNoInteractions(useCase);
    }

    @Test
    void transpile_error_returns_422_with_kind_and_line() throws Exception {
        when(useCase.transpile(any(), any(), any(), any()))
                .thenThrow(new StructuralException(3, "indentation of 3 spaces is not a multiple of 2"));

        mvc.perform(post("/transpile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"x: 1\\nif x:\\n   y: 2\"}")
                        .accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status", is(422)))
                .andExpect(jsonPath("$.kind", is("STRUCTURAL")))
                .andExpect(jsonPath("$.line", is(3)))
                .andExpect(jsonPath("$.message", startsWith("structural error at line 3")))
                .andExpect(jsonPath("$.timestamp", notNullValue()));
    }

    @Test
    void configuration_error_returns_400() throws Exception {
        when(useCase.transpile(any(), any(), any(), any()))
                .thenThrow(new ConfigurationException("unrecognized block style 'curly'"));

        mvc.perform(post("/transpile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"x: 1\",\"blockStyle\":\"curly\"}")
                        .accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind", is("CONFIGURATION")))
                .andExpect(jsonPath("$.line", is(nullValue())));
    }

    @Test
    void raw_endpoint_returns_plain_code() throws Exception {
        when(useCase.transpile("print: 1\n")).thenReturn(new TranspiledProgram("print(1)\n", 1, 1));

        mvc.perform(post("/transpile/raw")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("print: 1\n")
                        .accept(MediaType.TEXT_PLAIN))
                .andExpect(status().isOk())
                .andExpect(content().string("print(1)\n"));

        verify(useCase).transpile("print: 1\n");
    }
}
