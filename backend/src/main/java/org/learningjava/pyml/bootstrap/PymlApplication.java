package org.learningjava.pyml.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.pyml")
public class PymlApplication {
    public static void main(String[] args) {
        SpringApplication.run(PymlApplication.class, args);
    }
}
