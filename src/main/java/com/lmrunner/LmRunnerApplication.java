package com.lmrunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for lmrunner - a uniform chat completion front over multiple LLM providers.
 */
@SpringBootApplication
public class LmRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LmRunnerApplication.class, args);
    }
}
