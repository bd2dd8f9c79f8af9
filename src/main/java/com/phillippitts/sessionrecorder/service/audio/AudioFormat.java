package com.phillippitts.sessionrecorder.service.audio;

/**
 * Single source of truth for the recording format.
 * Captured audio is 16 kHz, 16-bit signed PCM, mono, little-endian, stored as WAV.
 */
public final class AudioFormat {

    /** Sample rate in Hz. */
    public static final int SAMPLE_RATE = 16_000;
    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int CHANNELS = 1;

    /** Signed PCM flag for Java Sound. */
    public static final boolean SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS;  // 2 bytes
    /** Bytes per second. */
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;           // 32,000

    /** Size of the canonical PCM WAV header. */
    public static final int WAV_HEADER_SIZE = 44;

    /** File extension of persisted recordings. */
    public static final String FILE_EXTENSION = "wav";

    private AudioFormat() {}

    /** Java Sound format matching the constants above. */
    public static javax.sound.sampled.AudioFormat javaSoundFormat() {
        return new javax.sound.sampled.AudioFormat(SAMPLE_RATE, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }

    /** Duration in milliseconds of {@code pcmBytes} bytes of raw PCM. */
    public static long pcmBytesToMillis(long pcmBytes) {
        return (pcmBytes * 1000L) / BYTE_RATE;
    }

    /** Number of raw PCM bytes in {@code millis} milliseconds, rounded down to a whole frame. */
    public static int millisToPcmBytes(long millis) {
        long bytes = (millis * BYTE_RATE) / 1000L;
        return (int) (bytes - (bytes % BLOCK_ALIGN));
    }
}
