package com.example.stitchschemata.model;

import com.example.stitchschemata.exception.UnsupportedOutputFormatException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputFormatTest {

    @Test
    void resolvesFormatFromExtension() {
        assertThat(OutputFormat.of(Path.of("out", "plan.PNG"))).isEqualTo(OutputFormat.PNG);
        assertThat(OutputFormat.of(Path.of("plan.jpg"))).isEqualTo(OutputFormat.JPEG);
        assertThat(OutputFormat.of(Path.of("plan.Jpeg"))).isEqualTo(OutputFormat.JPEG);
        assertThat(OutputFormat.of(Path.of("plan.pdf"))).isEqualTo(OutputFormat.PDF);
    }

    @Test
    void rejectsOtherExtensions() {
        assertThatThrownBy(() -> OutputFormat.of(Path.of("plan.gif")))
                .isInstanceOf(UnsupportedOutputFormatException.class)
                .hasMessage("Unsupported output format: 'plan.gif'.");
        assertThatThrownBy(() -> OutputFormat.of(Path.of("plan")))
                .isInstanceOf(UnsupportedOutputFormatException.class);
    }
}
