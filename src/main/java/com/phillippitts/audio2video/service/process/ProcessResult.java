package com.phillippitts.audio2video.service.process;

/**
 * Outcome of a bounded helper process run.
 *
 * @param exitCode process exit code, or -1 when it timed out
 * @param stdout captured standard output (capped)
 * @param stderr captured standard error (capped)
 * @param timedOut whether the run hit its timeout and was terminated
 * @param durationMs wall-clock time of the run
 */
public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut, long durationMs) {

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }
}
