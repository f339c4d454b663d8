package com.phillippitts.audio2video.service.encoder;

/**
 * Fixed output profile of every conversion: MPEG-PS with MPEG-2 video and MP2 audio at
 * 1280x720, 30 fps.
 */
public final class EncoderConstants {

    public static final String OUTPUT_EXTENSION = "mpg";
    public static final String CONTAINER_FORMAT = "mpeg";
    public static final String VIDEO_CODEC = "mpeg2video";
    public static final String AUDIO_CODEC = "mp2";
    public static final int WIDTH = 1280;
    public static final int HEIGHT = 720;
    public static final int FRAME_RATE = 30;
    public static final String VIDEO_BITRATE = "4000k";
    public static final String AUDIO_BITRATE = "192k";
    public static final String PIXEL_FORMAT = "yuv420p";

    /** Scale to fit inside the frame, then pad to exactly WIDTHxHEIGHT, centered. */
    public static final String VIDEO_FILTER = "scale=" + WIDTH + ":" + HEIGHT
            + ":force_original_aspect_ratio=decrease,pad=" + WIDTH + ":" + HEIGHT
            + ":(ow-iw)/2:(oh-ih)/2,format=" + PIXEL_FORMAT;

    private EncoderConstants() {
        // Constants class - prevent instantiation
    }
}
