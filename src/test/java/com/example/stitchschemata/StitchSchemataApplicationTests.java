package com.example.stitchschemata;

import com.example.stitchschemata.command.StitchSchemataRunner;
import com.example.stitchschemata.service.StitchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(args = "--version")
class StitchSchemataApplicationTests {

    @Autowired
    private StitchSchemataRunner runner;

    @Autowired
    private StitchService stitchService;

    @Test
    void contextLoadsAndRunsCommandLine() {
        assertThat(stitchService).isNotNull();
        assertThat(runner.getExitCode()).isZero();
    }
}
