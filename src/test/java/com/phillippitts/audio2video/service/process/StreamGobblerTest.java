package com.phillippitts.audio2video.service.process;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class StreamGobblerTest {

    @Test
    void deliversEveryLineInOrder() {
        List<String> lines = new CopyOnWriteArrayList<>();
        InputStream in = new ByteArrayInputStream("a\nb\r\nc".getBytes(StandardCharsets.UTF_8));

        StreamGobbler gobbler = StreamGobbler.start(in, "test-gobbler", lines::add);

        assertThat(gobbler.join(Duration.ofSeconds(2))).isTrue();
        assertThat(lines).containsExactly("a", "b", "c");
        assertThat(gobbler.failure()).isEmpty();
    }

    @Test
    void keepsReadFailure() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("pipe closed");
            }
        };

        StreamGobbler gobbler = StreamGobbler.start(broken, "broken-gobbler", line -> { });

        assertThat(gobbler.join(Duration.ofSeconds(2))).isTrue();
        assertThat(gobbler.failure()).isPresent();
        assertThat(gobbler.failure().get()).hasMessage("pipe closed");
    }
}
