package org.learningjava.pyml.config;

import org.learningjava.pyml.domain.model.options.TranspileOptions;
import org.learningjava.pyml.domain.service.Transpiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    // invalid values fail the context at startup with a ConfigurationException
    @Bean
    TranspileOptions transpileOptions(PymlProperties props) {
        TranspileOptions options = TranspileOptions.of(
                props.getBlockStyle(),
                props.getIndentationUnit(),
                props.getSourceIndentWidth(),
                props.isKeepComments()
        );
        log.info("Default transpile options: {}", options);
        return options;
    }

    @Bean
    Transpiler transpiler(TranspileOptions options) {
        return new Transpiler(options);
    }
}
