package com.testall.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and runs {@link TestAllCommand}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TestAllCommand testAllCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TestAllCommand testAllCommand, IFactory factory) {
        this.testAllCommand = testAllCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // Spring-style property overrides (--testall.timeout-seconds=30) are consumed by Spring Boot
        String[] commandArgs = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--testall.") && !arg.startsWith("--logging.")
                        && !arg.startsWith("--spring."))
                .toArray(String[]::new);
        exitCode = new CommandLine(testAllCommand, factory).execute(commandArgs);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
