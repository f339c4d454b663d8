package com.phillippitts.audio2video.service.encoder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the ffmpeg argument list for one conversion.
 *
 * <p>The invocation is fixed; only the binary and the three paths vary. Arguments are passed
 * to the process directly, never through a shell, so paths need no quoting.
 */
public final class EncoderCommandBuilder {

    private EncoderCommandBuilder() {
        // Utility class - prevent instantiation
    }

    /**
     * @param ffmpegBinary resolved ffmpeg executable
     * @param spec paths of the encode
     * @return immutable argument list, binary first
     */
    public static List<String> build(String ffmpegBinary, EncodeSpec spec) {
        Objects.requireNonNull(ffmpegBinary, "ffmpegBinary");
        Objects.requireNonNull(spec, "spec");
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegBinary);
        cmd.add("-hide_banner");
        cmd.add("-nostdin");
        cmd.add("-y");
        cmd.add("-loop");
        cmd.add("1");
        cmd.add("-i");
        cmd.add(spec.coverImage().toString());
        cmd.add("-i");
        cmd.add(spec.audio().toString());
        // audio files may carry embedded artwork; only the cover becomes video
        cmd.add("-map");
        cmd.add("0:v:0");
        cmd.add("-map");
        cmd.add("1:a:0");
        cmd.add("-c:v");
        cmd.add(EncoderConstants.VIDEO_CODEC);
        cmd.add("-c:a");
        cmd.add(EncoderConstants.AUDIO_CODEC);
        cmd.add("-b:v");
        cmd.add(EncoderConstants.VIDEO_BITRATE);
        cmd.add("-b:a");
        cmd.add(EncoderConstants.AUDIO_BITRATE);
        cmd.add("-vf");
        cmd.add(EncoderConstants.VIDEO_FILTER);
        cmd.add("-r");
        cmd.add(String.valueOf(EncoderConstants.FRAME_RATE));
        cmd.add("-shortest");
        cmd.add("-f");
        cmd.add(EncoderConstants.CONTAINER_FORMAT);
        cmd.add("-progress");
        cmd.add("pipe:1");
        cmd.add("-nostats");
        cmd.add(spec.output().toString());
        return List.copyOf(cmd);
    }
}
