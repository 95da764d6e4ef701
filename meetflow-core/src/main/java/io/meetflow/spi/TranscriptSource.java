package io.meetflow.spi;

import io.meetflow.model.Meeting;
import io.meetflow.model.Transcript;

import java.io.IOException;

/**
 * Downloads raw transcript content from a meeting platform.
 *
 * <p>Implementations perform exactly one attempt and must bound their own network I/O.
 * The caller also runs them under a timeout.
 */
@FunctionalInterface
public interface TranscriptSource {

    /**
     * Fetches the transcript located by {@link Transcript#sourceRef()}.
     *
     * @return raw content in {@link Transcript#format()}
     * @throws IOException          on transport or platform errors
     * @throws InterruptedException if the calling thread is interrupted
     */
    String fetch(Meeting meeting, Transcript transcript) throws IOException, InterruptedException;
}
