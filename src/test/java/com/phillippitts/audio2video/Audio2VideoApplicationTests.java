package com.phillippitts.audio2video;

import com.phillippitts.audio2video.service.orchestration.ConversionController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "audio2video.cli.enabled=false", // no command-line batch in tests
        "conversion.concurrency=2"
    }
)
class Audio2VideoApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(ConversionController.class).isRunning()).isFalse();
        assertThat(context.containsBean("conversionExecutor")).isTrue();
        assertThat(context.containsBean("batchConversionRunner")).isFalse();
    }
}
