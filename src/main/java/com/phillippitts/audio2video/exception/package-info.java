/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.audio2video.exception.Audio2VideoException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.audio2video.exception.ConversionException} - A single conversion
 *       failed; its {@link com.phillippitts.audio2video.exception.ConversionErrorKind} decides whether
 *       the queue keeps draining</li>
 *   <li>{@link com.phillippitts.audio2video.exception.JobBusyException} - Removal or clearing of a
 *       running job was attempted</li>
 *   <li>{@link com.phillippitts.audio2video.exception.JobNotFoundException} - Unknown job id</li>
 *   <li>{@link com.phillippitts.audio2video.exception.IllegalJobTransitionException} - Status change
 *       not permitted by the job state machine</li>
 *   <li>{@link com.phillippitts.audio2video.exception.MissingCoverImageException} and
 *       {@link com.phillippitts.audio2video.exception.EmptyAudioListException} - Batch preconditions
 *       checked once when conversion starts</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}.
 *
 * @since 1.0
 */
package com.phillippitts.audio2video.exception;
