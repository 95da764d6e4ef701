package io.meetflow.transcript;

import io.meetflow.model.Transcript;

/**
 * Outcome of a single transcript acquisition attempt.
 */
public sealed interface AcquisitionResult {

    /**
     * The transcript is ready.
     */
    record Acquired(Transcript transcript) implements AcquisitionResult {}

    /**
     * The attempt failed.
     *
     * @param interrupted {@code true} if the attempt was cut short by thread interruption
     */
    record Failed(String error, boolean interrupted) implements AcquisitionResult {}
}
