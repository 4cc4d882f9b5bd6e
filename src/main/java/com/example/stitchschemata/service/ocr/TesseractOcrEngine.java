package com.example.stitchschemata.service.ocr;

import com.example.stitchschemata.exception.StitchException;
import com.example.stitchschemata.model.OcrConfig;
import com.example.stitchschemata.model.OcrWord;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Tesseract through tess4j. The language data directory comes from
 * {@code ocr.tessdata}, then {@code TESSDATA_PREFIX}, then a local {@code tessdata}
 * folder; when none exists Tesseract's compiled-in default applies.
 */
@Component
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

    @Value("${ocr.tessdata:}")
    private String tessdata;

    @Override
    public List<OcrWord> recognize(BufferedImage image, OcrConfig config) {
        Tesseract tesseract = new Tesseract();
        String datapath = resolveDatapath();
        if (datapath != null) {
            tesseract.setDatapath(datapath);
        }
        tesseract.setLanguage(config.getLanguage());
        tesseract.setPageSegMode(config.getPsm());
        tesseract.setVariable("user_defined_dpi", String.valueOf(config.getDpi()));

        List<Word> words;
        try {
            words = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            throw new StitchException("Tesseract OCR failed: " + e.getMessage(), e);
        }

        List<OcrWord> result = new ArrayList<>(words.size());
        for (Word word : words) {
            String text = word.getText() == null ? "" : word.getText().trim();
            if (!text.isEmpty()) {
                result.add(new OcrWord(text, word.getBoundingBox(), word.getConfidence()));
            }
        }
        log.debug("Tesseract recognized {} words (language {}, psm {})", result.size(),
                config.getLanguage(), config.getPsm());
        return result;
    }

    private String resolveDatapath() {
        if (tessdata != null && !tessdata.isBlank()) {
            return tessdata;
        }
        String prefix = System.getenv("TESSDATA_PREFIX");
        if (prefix != null && !prefix.isBlank()) {
            return prefix;
        }
        File local = new File("tessdata");
        return local.isDirectory() ? local.getAbsolutePath() : null;
    }
}
