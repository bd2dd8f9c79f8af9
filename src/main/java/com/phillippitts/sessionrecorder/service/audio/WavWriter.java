package com.phillippitts.sessionrecorder.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.sessionrecorder.service.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.phillippitts.sessionrecorder.service.audio.AudioFormat.BLOCK_ALIGN;
import static com.phillippitts.sessionrecorder.service.audio.AudioFormat.BYTE_RATE;
import static com.phillippitts.sessionrecorder.service.audio.AudioFormat.CHANNELS;
import static com.phillippitts.sessionrecorder.service.audio.AudioFormat.SAMPLE_RATE;
import static com.phillippitts.sessionrecorder.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Encodes raw PCM into a minimal WAV container in the fixed recording format.
 *
 * <p>Capture sessions hand the recorder an in-memory WAV payload, so the primary entry point is
 * {@link #encode(byte[])}; {@link #write(byte[], Path)} serves the transcription coordinator, which
 * needs a file on disk for the external binary.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Wraps the given raw PCM16LE mono 16 kHz samples in a WAV header.
     *
     * @param pcm raw PCM samples
     * @return header followed by the samples
     */
    public static byte[] encode(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream(WAV_HEADER_SIZE + pcm.length);
        try {
            writeTo(out, pcm);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Writes an already encoded payload to disk, creating or overwriting {@code target}.
     *
     * @param wav WAV bytes (header included)
     * @param target destination file
     */
    public static void write(byte[] wav, Path target) {
        Objects.requireNonNull(wav, "wav must not be null");
        Objects.requireNonNull(target, "target must not be null");
        try {
            Files.write(target, wav);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write WAV file to " + target, e);
        }
    }

    /** True if {@code data} starts with a RIFF/WAVE header. */
    public static boolean isWav(byte[] data) {
        return data != null && data.length >= WAV_HEADER_SIZE
                && data[0] == 'R' && data[1] == 'I' && data[2] == 'F' && data[3] == 'F'
                && data[8] == 'W' && data[9] == 'A' && data[10] == 'V' && data[11] == 'E';
    }

    private static void writeTo(OutputStream os, byte[] pcm) throws IOException {
        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + pcm.length);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, 16);                        // PCM fmt chunk size
        writeLEShort(os, (short) 1);               // PCM
        writeLEShort(os, (short) CHANNELS);
        writeLEInt(os, SAMPLE_RATE);
        writeLEInt(os, BYTE_RATE);
        writeLEShort(os, (short) BLOCK_ALIGN);
        writeLEShort(os, (short) BITS_PER_SAMPLE);

        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, pcm.length);
        os.write(pcm);
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
