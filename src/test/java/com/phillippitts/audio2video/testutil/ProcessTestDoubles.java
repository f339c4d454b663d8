package com.phillippitts.audio2video.testutil;

import com.phillippitts.audio2video.service.process.ProcessFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared test doubles for external-process tests.
 * Provides fake Process implementations for hermetic testing without a real ffmpeg binary.
 */
public final class ProcessTestDoubles {

    private ProcessTestDoubles() {}

    /**
     * Encapsulates test process behavior configuration.
     *
     * @param stdout stdout content to return
     * @param stderr stderr content to return
     * @param exitCode process exit code
     * @param finishAfterMillis delay before process finishes (-1 means never finish)
     */
    public record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {}

    /**
     * Stub ProcessFactory that returns a pre-configured Process and records every command.
     *
     * <p>With {@code createOutput}, the last command argument is created as a file when the
     * process starts, the way the encoder opens its output right away.
     */
    public static final class StubProcessFactory implements ProcessFactory {
        private final List<FakeProcess> processes;
        private final boolean createOutput;
        private final IOException launchFailure;
        private final List<List<String>> commands = new CopyOnWriteArrayList<>();
        private volatile Path lastWorkingDir;

        public StubProcessFactory(FakeProcess p, boolean createOutput) {
            this.processes = List.of(p);
            this.createOutput = createOutput;
            this.launchFailure = null;
        }

        public StubProcessFactory(FakeProcess p) {
            this(p, false);
        }

        private StubProcessFactory(List<FakeProcess> processes) {
            this.processes = List.copyOf(processes);
            this.createOutput = false;
            this.launchFailure = null;
        }

        private StubProcessFactory(IOException launchFailure) {
            this.processes = List.of();
            this.createOutput = false;
            this.launchFailure = launchFailure;
        }

        /**
         * Factory returning the given processes in order; the last one repeats.
         */
        public static StubProcessFactory sequence(FakeProcess... processes) {
            return new StubProcessFactory(List.of(processes));
        }

        /**
         * Factory whose every start fails, like a missing binary.
         */
        public static StubProcessFactory failing(String message) {
            return new StubProcessFactory(new IOException(message));
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            commands.add(List.copyOf(command));
            lastWorkingDir = workingDir;
            if (launchFailure != null) {
                throw launchFailure;
            }
            if (createOutput) {
                Path out = Path.of(command.get(command.size() - 1));
                Files.createDirectories(out.toAbsolutePath().getParent());
                Files.write(out, new byte[]{0x00, 0x00, 0x01, (byte) 0xBA});
            }
            int index = Math.min(commands.size(), processes.size()) - 1;
            return processes.get(index);
        }

        public List<List<String>> commands() {
            return commands;
        }

        public List<String> lastCommand() {
            return commands.isEmpty() ? List.of() : commands.get(commands.size() - 1);
        }

        /**
         * Working directory passed with the most recent start, {@code null} when inherited.
         */
        public Path lastWorkingDir() {
            return lastWorkingDir;
        }
    }

    /**
     * Fake Process with controllable output, exit code and termination timing.
     *
     * <p>Like a real pipe, stdout and stderr serve their content and then stay open until the
     * process exits. {@link #destroy()} ends the process with exit code 255 unless
     * {@link #ignoreTerminate()} was called; {@link #destroyForcibly()} always ends it.
     */
    public static final class FakeProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final CountDownLatch exited = new CountDownLatch(1);
        private volatile int exitCode;
        private volatile boolean ignoreTerminate;
        private volatile boolean destroyCalled;
        private volatile boolean destroyForciblyCalled;

        public FakeProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            long finishAfterMillis = behavior.finishAfterMillis();

            if (finishAfterMillis == 0) {
                exited.countDown();
            } else if (finishAfterMillis > 0) {
                Thread finisher = new Thread(() -> {
                    try {
                        Thread.sleep(finishAfterMillis);
                        exited.countDown();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }, "fake-proc-finisher");
                finisher.setDaemon(true);
                finisher.start();
            }
        }

        public FakeProcess ignoreTerminate() {
            this.ignoreTerminate = true;
            return this;
        }

        public boolean wasDestroyCalled() {
            return destroyCalled;
        }

        public boolean wasDestroyForciblyCalled() {
            return destroyForciblyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new OpenUntilExitStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new OpenUntilExitStream(err);
        }

        @Override
        public int waitFor() throws InterruptedException {
            exited.await();
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return exited.await(timeout, unit);
        }

        @Override
        public int exitValue() {
            if (exited.getCount() > 0) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            if (!ignoreTerminate) {
                exit(255);
            }
        }

        @Override
        public Process destroyForcibly() {
            destroyForciblyCalled = true;
            exit(137);
            return this;
        }

        @Override
        public boolean isAlive() {
            return exited.getCount() > 0;
        }

        private void exit(int code) {
            if (exited.getCount() > 0) {
                this.exitCode = code;
                exited.countDown();
            }
        }

        private final class OpenUntilExitStream extends InputStream {
            private final byte[] data;
            private int pos;

            OpenUntilExitStream(byte[] data) {
                this.data = data;
            }

            @Override
            public int read() throws IOException {
                byte[] one = new byte[1];
                int n = read(one, 0, 1);
                return n < 0 ? -1 : one[0] & 0xFF;
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                if (len == 0) {
                    return 0;
                }
                if (pos < data.length) {
                    int n = Math.min(len, data.length - pos);
                    System.arraycopy(data, pos, b, off, n);
                    pos += n;
                    return n;
                }
                try {
                    exited.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("interrupted waiting for process exit");
                }
                return -1;
            }
        }
    }
}
