package io.meetflow.spi;

import io.meetflow.model.DeadLetter;

/**
 * Delivers the operator notification owed for every dead letter.
 */
@FunctionalInterface
public interface DeadLetterAlerter {

    /**
     * @throws RuntimeException if delivery failed; the alert stays pending and is retried
     */
    void alert(DeadLetter deadLetter);
}
