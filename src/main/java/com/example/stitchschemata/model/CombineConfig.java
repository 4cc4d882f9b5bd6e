package com.example.stitchschemata.model;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;

@Getter
@Builder
public class CombineConfig {
    private final Path outputPath;
    private final String creatorTool;
}
