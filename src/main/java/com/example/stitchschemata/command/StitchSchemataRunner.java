package com.example.stitchschemata.command;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Runs the command line once the context is up and reports picocli's exit code
 * back to Spring.
 */
@Component
@RequiredArgsConstructor
public class StitchSchemataRunner implements CommandLineRunner, ExitCodeGenerator {

    private final StitchSchemataCommand command;
    private final SpringCommandFactory factory;
    private final Environment environment;

    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(command, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setDefaultValueProvider(new EnvironmentDefaultProvider(environment))
                .setExecutionExceptionHandler(new ErrorMessageHandler());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
