/**
 * Domain model for batch conversion: the {@link com.phillippitts.audio2video.domain.ConversionJob}
 * record, its {@link com.phillippitts.audio2video.domain.JobStatus} lifecycle guarded by
 * {@link com.phillippitts.audio2video.domain.JobStateMachine}, and the value types it carries
 * ({@link com.phillippitts.audio2video.domain.Progress}, {@link com.phillippitts.audio2video.domain.LogTail}).
 *
 * @since 1.0
 */
package com.phillippitts.audio2video.domain;
