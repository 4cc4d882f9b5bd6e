package com.example.stitchschemata.command;

import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; every action lives in a subcommand.
 */
@Component
@Command(
        name = "stitch-schemata",
        mixinStandardHelpOptions = true,
        version = "stitch-schemata 1.0.0",
        description = "Stitches scanned pages of oversized schematics and makes them searchable.",
        subcommands = {StitchCommand.class, OcrCommand.class, CombineCommand.class}
)
public class StitchSchemataCommand implements Runnable {

    static final String BASE_PACKAGE = "com.example.stitchschemata";

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    /**
     * Raises this application's log level to DEBUG for the rest of the run.
     */
    static void enableDebugLogging() {
        LoggingSystem.get(StitchSchemataCommand.class.getClassLoader()).setLogLevel(BASE_PACKAGE, LogLevel.DEBUG);
    }
}
