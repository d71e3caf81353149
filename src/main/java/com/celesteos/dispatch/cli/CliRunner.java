package com.celesteos.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the {@code celeste} command line once the context is up and hands picocli's exit
 * code back to Spring Boot.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final String SERVE = "serve";

    private final CelesteCommand celesteCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(CelesteCommand celesteCommand, IFactory factory) {
        this.celesteCommand = celesteCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // the embedded server keeps the JVM alive; classify and health exit after one run
        if (Arrays.asList(args).contains(SERVE)) {
            return;
        }
        exitCode = new CommandLine(celesteCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
