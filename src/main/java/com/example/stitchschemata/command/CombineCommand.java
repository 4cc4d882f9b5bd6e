package com.example.stitchschemata.command;

import com.example.stitchschemata.model.CombineConfig;
import com.example.stitchschemata.service.pdf.PdfCombineService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * {@code stitch-schemata combine}.
 */
@Component
@Command(name = "combine", mixinStandardHelpOptions = true,
        description = "Combines PDF/A-1b documents into a single PDF/A-1b document.")
public class CombineCommand implements Callable<Integer> {

    private final PdfCombineService combineService;

    @Option(names = {"-o", "--output"}, required = true, description = "The combined output file.")
    private Path output;

    @Option(names = "--creator-tool", description = "The creator tool recorded in the metadata. Default: ${DEFAULT-VALUE}.")
    private String creatorTool;

    @Parameters(arity = "1..*", paramLabel = "<documents>", description = "The PDF documents, in order.")
    private List<Path> documents;

    public CombineCommand(PdfCombineService combineService) {
        this.combineService = combineService;
    }

    @Override
    public Integer call() {
        combineService.combine(documents, CombineConfig.builder()
                .outputPath(output)
                .creatorTool(creatorTool)
                .build());
        return 0;
    }
}
