package com.example.stitchschemata.command;

import org.springframework.core.env.Environment;
import picocli.CommandLine;
import picocli.CommandLine.Model.ArgSpec;
import picocli.CommandLine.Model.OptionSpec;

/**
 * Supplies option defaults from the Spring environment under
 * {@code <subcommand>.<long-option-name>}, e.g. {@code stitch.tile-width}.
 */
public class EnvironmentDefaultProvider implements CommandLine.IDefaultValueProvider {

    private final Environment environment;

    public EnvironmentDefaultProvider(Environment environment) {
        this.environment = environment;
    }

    @Override
    public String defaultValue(ArgSpec argSpec) {
        if (!argSpec.isOption() || argSpec.command() == null) {
            return null;
        }
        OptionSpec option = (OptionSpec) argSpec;
        return environment.getProperty(key(argSpec.command().name(), option.longestName()));
    }

    static String key(String command, String optionName) {
        return command + "." + optionName.replaceFirst("^-+", "");
    }
}
