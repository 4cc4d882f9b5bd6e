package com.example.stitchschemata.service;

import com.example.stitchschemata.model.ScanMetadata;
import org.springframework.stereotype.Service;

import java.io.PrintStream;
import java.util.List;

/**
 * User-facing progress on the console.
 */
@Service
public class ProgressService {

    private final PrintStream out;

    public ProgressService() {
        this(System.out);
    }

    public ProgressService(PrintStream out) {
        this.out = out;
    }

    public void sendProgress(String message) {
        out.println(message);
        out.flush();
    }

    public void sendRotationDetected(String page, double angle) {
        sendProgress(String.format("  %s: orientation %.4f°", page, angle));
    }

    /**
     * Renders one row per page: file, rotation, translation.
     */
    public void sendMetadata(List<ScanMetadata> pages) {
        int nameWidth = "File".length();
        for (ScanMetadata page : pages) {
            nameWidth = Math.max(nameWidth, page.getPath().getFileName().toString().length());
        }
        String header = String.format("%-" + nameWidth + "s  %10s  %11s  %11s", "File", "Rotation", "Translate X", "Translate Y");
        out.println(header);
        out.println("-".repeat(header.length()));
        for (ScanMetadata page : pages) {
            out.println(String.format("%-" + nameWidth + "s  %10.4f  %11d  %11d",
                    page.getPath().getFileName(), page.getRotation(), page.getTranslateX(), page.getTranslateY()));
        }
        out.flush();
    }
}
