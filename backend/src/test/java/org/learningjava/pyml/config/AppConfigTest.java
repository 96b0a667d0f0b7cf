package org.learningjava.pyml.config;

import org.junit.jupiter.api.Test;
import org.learningjava.pyml.domain.error.ConfigurationException;
import org.learningjava.pyml.domain.model.options.BlockStyle;
import org.learningjava.pyml.domain.model.options.TranspileOptions;
import org.learningjava.pyml.domain.service.Transpiler;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    private final AppConfig config = new AppConfig();

    @Test
    void default_properties_give_default_options() {
        assertEquals(TranspileOptions.defaults(), config.transpileOptions(new PymlProperties()));
    }

    @Test
    void properties_are_bound_into_options() {
        PymlProperties props = new PymlProperties();
        props.setBlockStyle("brace");
        props.setIndentationUnit("    ");
        props.setSourceIndentWidth(4);
        props.setKeepComments(true);

        TranspileOptions options = config.transpileOptions(props);
        Transpiler transpiler = config.transpiler(options);

        assertEquals(new TranspileOptions(BlockStyle.BRACE, "    ", 4, true), transpiler.options());
    }

    @Test
    void invalid_properties_fail_fast() {
        PymlProperties props = new PymlProperties();
        props.setSourceIndentWidth(0);

        assertThrows(ConfigurationException.class, () -> config.transpileOptions(props));
    }
}
