package com.phillippitts.audio2video.service.process;

import com.phillippitts.audio2video.testutil.ProcessTestDoubles.FakeProcess;
import com.phillippitts.audio2video.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.audio2video.testutil.ProcessTestDoubles.StubProcessFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedProcessRunnerTest {

    @Test
    void capturesBothStreamsAndExitCode() throws Exception {
        // Arrange
        FakeProcess process = new FakeProcess(new ProcessBehavior("205.470000\n", "warning: x\n", 0, 0));
        BoundedProcessRunner runner = new BoundedProcessRunner(new StubProcessFactory(process));

        // Act
        ProcessResult result = runner.run(List.of("ffprobe", "a.mp3"), Duration.ofSeconds(2));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.timedOut()).isFalse();
        assertThat(result.stdout()).isEqualTo("205.470000");
        assertThat(result.stderr()).isEqualTo("warning: x");
    }

    @Test
    void nonZeroExitIsNotSuccess() throws Exception {
        FakeProcess process = new FakeProcess(new ProcessBehavior("", "No such file", 1, 0));
        BoundedProcessRunner runner = new BoundedProcessRunner(new StubProcessFactory(process));

        ProcessResult result = runner.run(List.of("ffprobe"), Duration.ofSeconds(2));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.stderr()).contains("No such file");
    }

    @Test
    void timeoutTerminatesProcess() throws Exception {
        FakeProcess process = new FakeProcess(new ProcessBehavior("", "", 0, -1));
        BoundedProcessRunner runner = new BoundedProcessRunner(new StubProcessFactory(process));

        long start = System.nanoTime();
        ProcessResult result = runner.run(List.of("ffprobe"), Duration.ofMillis(200));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(result.timedOut()).isTrue();
        assertThat(result.exitCode()).isEqualTo(-1);
        assertThat(process.wasDestroyCalled()).isTrue();
        assertThat(process.isAlive()).isFalse();
        assertThat(elapsedMs).isLessThan(3000);
    }

    @Test
    void launchFailurePropagates() {
        BoundedProcessRunner runner = new BoundedProcessRunner(StubProcessFactory.failing("no such binary"));

        assertThatThrownBy(() -> runner.run(List.of("missing"), Duration.ofSeconds(1)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no such binary");
    }

    @Test
    void capsCapturedOutput() throws Exception {
        String line = "x".repeat(1000) + "\n";
        FakeProcess process = new FakeProcess(new ProcessBehavior(line.repeat(200), "", 0, 0));
        BoundedProcessRunner runner = new BoundedProcessRunner(new StubProcessFactory(process));

        ProcessResult result = runner.run(List.of("noisy"), Duration.ofSeconds(2));

        assertThat(result.stdout().length()).isLessThanOrEqualTo(BoundedProcessRunner.MAX_CAPTURE_CHARS);
    }
}
