package com.example.stitchschemata.service.pdf;

import com.example.stitchschemata.exception.StitchException;
import com.example.stitchschemata.model.CombineConfig;
import com.example.stitchschemata.service.ProgressService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;

/**
 * Concatenates PDF documents page by page into one, restamping its metadata and
 * keeping the highest PDF version of the inputs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PdfCombineService {

    private final PdfMetadataStamper metadataStamper;
    private final ProgressService progressService;

    public void combine(List<Path> inputs, CombineConfig config) {
        if (inputs.isEmpty()) {
            throw new StitchException("No PDF documents to combine.");
        }
        long start = System.currentTimeMillis();
        // sources must stay open until the combined document is saved
        List<PDDocument> sources = new ArrayList<>();
        try (PDDocument combined = new PDDocument()) {
            PDFMergerUtility merger = new PDFMergerUtility();
            float version = combined.getVersion();

            for (Path input : inputs) {
                progressService.sendProgress("Appending " + input.getFileName());
                PDDocument source = PDDocument.load(input.toFile());
                sources.add(source);
                merger.appendDocument(combined, source);
                version = Math.max(version, source.getVersion());
                log.debug("Appended {} ({} pages, version {})", input, source.getNumberOfPages(), source.getVersion());
            }

            combined.setVersion(version);
            metadataStamper.stamp(combined, config.getCreatorTool(), Calendar.getInstance());
            combined.save(config.getOutputPath().toFile());
            log.info("Combined {} documents into {} ({} pages, {} ms)", inputs.size(), config.getOutputPath(),
                    combined.getNumberOfPages(), System.currentTimeMillis() - start);
        } catch (IOException e) {
            throw new StitchException("Unable to combine PDF documents: " + e.getMessage(), e);
        } finally {
            sources.forEach(this::closeResource);
        }
        progressService.sendProgress("Saved " + config.getOutputPath());
    }

    private void closeResource(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close resource", e);
        }
    }
}
