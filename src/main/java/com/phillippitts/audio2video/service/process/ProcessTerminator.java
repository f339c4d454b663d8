package com.phillippitts.audio2video.service.process;

import com.phillippitts.audio2video.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Two-phase process teardown: cooperative termination, bounded wait, then forced kill.
 */
public final class ProcessTerminator {

    private static final Logger LOG = LogManager.getLogger(ProcessTerminator.class);

    private ProcessTerminator() {
        // Utility class - prevent instantiation
    }

    /**
     * Terminates {@code process}, escalating to a forced kill after {@code gracePeriod}.
     *
     * <p>Returns within {@code gracePeriod} plus {@link ProcessTimeouts#FORCEFUL_SHUTDOWN_TIMEOUT}.
     *
     * @param process process to stop (may already be dead)
     * @param gracePeriod time allowed for a cooperative exit
     * @return {@code true} if the process is no longer alive
     */
    public static boolean terminate(Process process, Duration gracePeriod) {
        if (process == null) {
            return true;
        }
        try {
            if (!process.isAlive()) {
                return true;
            }
            process.destroy();
            boolean exited = process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                LOG.debug("Process did not exit within {}ms; forcing termination", gracePeriod.toMillis());
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                    return false;
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while terminating process; forcing kill");
            process.destroyForcibly();
            return !process.isAlive();
        }
    }
}
