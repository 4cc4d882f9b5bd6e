package com.example.stitchschemata.command;

import com.example.stitchschemata.service.pdf.PdfCombineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.support.ResourcePropertySource;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class EnvironmentDefaultProviderTest {

    private EnvironmentDefaultProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources().addFirst(new ResourcePropertySource("classpath:application.properties"));
        provider = new EnvironmentDefaultProvider(environment);
    }

    @Test
    void keyCombinesCommandAndLongOptionName() {
        assertThat(EnvironmentDefaultProvider.key("stitch", "--tile-width")).isEqualTo("stitch.tile-width");
        assertThat(EnvironmentDefaultProvider.key("ocr", "-i")).isEqualTo("ocr.i");
    }

    @Test
    void readsDefaultsOfSubcommandOptions() {
        CommandSpec spec = new CommandLine(new CombineCommand(mock(PdfCombineService.class))).getCommandSpec();

        assertThat(provider.defaultValue(spec.findOption("--creator-tool"))).isEqualTo("stitch-schemata");
        assertThat(provider.defaultValue(spec.findOption("-o"))).isNull();
        assertThat(provider.defaultValue(spec.positionalParameters().get(0))).isNull();
    }
}
