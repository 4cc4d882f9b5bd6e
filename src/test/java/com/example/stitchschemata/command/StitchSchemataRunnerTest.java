package com.example.stitchschemata.command;

import com.example.stitchschemata.model.CombineConfig;
import com.example.stitchschemata.model.OcrConfig;
import com.example.stitchschemata.service.ProgressService;
import com.example.stitchschemata.service.StitchService;
import com.example.stitchschemata.service.ocr.OcrService;
import com.example.stitchschemata.service.pdf.PdfCombineService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.support.GenericApplicationContext;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.support.ResourcePropertySource;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class StitchSchemataRunnerTest {

    private final OcrService ocrService = mock(OcrService.class);
    private final PdfCombineService combineService = mock(PdfCombineService.class);
    private GenericApplicationContext context;
    private StitchSchemataRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources().addFirst(new ResourcePropertySource("classpath:application.properties"));

        ProgressService progressService = new ProgressService(new PrintStream(OutputStream.nullOutputStream()));
        context = new GenericApplicationContext();
        context.registerBean(StitchCommand.class, () -> new StitchCommand(mock(StitchService.class), progressService));
        context.registerBean(OcrCommand.class, () -> new OcrCommand(ocrService));
        context.registerBean(CombineCommand.class, () -> new CombineCommand(combineService));
        context.refresh();

        runner = new StitchSchemataRunner(new StitchSchemataCommand(), new SpringCommandFactory(context), environment);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void combineSubcommandUsesConfiguredCreatorTool() {
        runner.run("combine", "-o", "all.pdf", "first.pdf", "second.pdf");

        assertThat(runner.getExitCode()).isZero();
        ArgumentCaptor<CombineConfig> captor = ArgumentCaptor.forClass(CombineConfig.class);
        verify(combineService).combine(eq(List.of(Path.of("first.pdf"), Path.of("second.pdf"))), captor.capture());
        assertThat(captor.getValue().getOutputPath()).isEqualTo(Path.of("all.pdf"));
        assertThat(captor.getValue().getCreatorTool()).isEqualTo("stitch-schemata");
    }

    @Test
    void ocrSubcommandUsesOcrDefaults() {
        runner.run("ocr", "-i", "scan.png", "-o", "scan.pdf", "--ocr-language", "eng");

        assertThat(runner.getExitCode()).isZero();
        ArgumentCaptor<OcrConfig> captor = ArgumentCaptor.forClass(OcrConfig.class);
        verify(ocrService).ocr(eq(Path.of("scan.png")), eq(Path.of("scan.pdf")), captor.capture());
        OcrConfig config = captor.getValue();
        assertThat(config.getDpi()).isEqualTo(600);
        assertThat(config.getQuality()).isEqualTo(90);
        assertThat(config.getPsm()).isEqualTo(11);
        assertThat(config.getLanguage()).isEqualTo("eng");
        assertThat(config.getConfidenceMin()).isEqualTo(60.0);
    }

    @Test
    void missingSubcommandIsUsageError() {
        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(2);
    }

    @Test
    void unknownOptionIsUsageError() {
        runner.run("ocr", "-i", "scan.png", "-o", "scan.pdf", "--colour");

        assertThat(runner.getExitCode()).isEqualTo(2);
    }

    @Test
    void versionIsPrinted() {
        runner.run("--version");

        assertThat(runner.getExitCode()).isZero();
    }
}
