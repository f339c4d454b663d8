package com.phillippitts.audio2video.service.naming;

import com.phillippitts.audio2video.exception.ConversionErrorKind;
import com.phillippitts.audio2video.exception.ConversionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputPathResolverTest {

    @TempDir
    Path dir;

    @Test
    void usesBaseNameWhenFree() {
        OutputPathResolver resolver = new OutputPathResolver();

        Path path = resolver.reserve(dir, "track", "mpg");

        assertThat(path).isEqualTo(dir.toAbsolutePath().normalize().resolve("track.mpg"));
        assertThat(resolver.isReserved(path)).isTrue();
    }

    @Test
    void numbersAroundExistingFiles() throws Exception {
        // Arrange
        Files.createFile(dir.resolve("track.mpg"));
        OutputPathResolver resolver = new OutputPathResolver();

        // Act
        Path first = resolver.reserve(dir, "track", "mpg");
        Path second = resolver.reserve(dir, "track", ".mpg");

        // Assert
        assertThat(first.getFileName()).hasToString("track (1).mpg");
        assertThat(second.getFileName()).hasToString("track (2).mpg");
    }

    @Test
    void releasedNameBecomesAvailableAgain() {
        OutputPathResolver resolver = new OutputPathResolver();
        Path first = resolver.reserve(dir, "track", "mpg");

        resolver.release(first);

        assertThat(resolver.reserve(dir, "track", "mpg")).isEqualTo(first);
    }

    @Test
    void releaseIgnoresUnknownAndNullPaths() {
        OutputPathResolver resolver = new OutputPathResolver();

        resolver.release(null);
        resolver.release(dir.resolve("never.mpg"));

        assertThat(resolver.reservationCount()).isZero();
    }

    @Test
    void stripsWhitespaceAndFallsBackForBlankNames() {
        OutputPathResolver resolver = new OutputPathResolver();

        assertThat(resolver.reserve(dir, "  Song  ", "mpg").getFileName()).hasToString("Song.mpg");
        assertThat(resolver.reserve(dir, "   ", "mpg").getFileName()).hasToString("output.mpg");
    }

    @Test
    void givesUpAfterMaxAttempts() throws Exception {
        Files.createFile(dir.resolve("a.mpg"));
        Files.createFile(dir.resolve("a (1).mpg"));
        Files.createFile(dir.resolve("a (2).mpg"));
        OutputPathResolver resolver = new OutputPathResolver(3);

        assertThatThrownBy(() -> resolver.reserve(dir, "a", "mpg"))
                .isInstanceOf(ConversionException.class)
                .satisfies(e -> assertThat(((ConversionException) e).getKind())
                        .isEqualTo(ConversionErrorKind.NAMING_COLLISION_EXHAUSTED));
    }

    @Test
    void concurrentReservationsNeverCollide() throws Exception {
        OutputPathResolver resolver = new OutputPathResolver();
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<List<Path>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                Callable<List<Path>> task = () -> {
                    go.await();
                    List<Path> mine = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        mine.add(resolver.reserve(dir, "track", "mpg"));
                    }
                    return mine;
                };
                futures.add(pool.submit(task));
            }
            go.countDown();

            Set<Path> all = new HashSet<>();
            for (Future<List<Path>> f : futures) {
                all.addAll(f.get(10, TimeUnit.SECONDS));
            }

            assertThat(all).hasSize(threads * perThread);
            assertThat(resolver.reservationCount()).isEqualTo(threads * perThread);
        } finally {
            pool.shutdownNow();
        }
    }
}
