package com.example.stitchschemata.command;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

import java.io.PrintWriter;

/**
 * Prints a failed command's error kind and message on stderr instead of a
 * stack trace; the trace goes to the debug log.
 */
@Slf4j
public class ErrorMessageHandler implements CommandLine.IExecutionExceptionHandler {

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        log.debug("Command '{}' failed", commandLine.getCommandName(), ex);
        PrintWriter err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(ex.getClass().getSimpleName()));
        err.println(commandLine.getColorScheme().errorText(String.valueOf(ex.getMessage())));
        err.flush();
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
