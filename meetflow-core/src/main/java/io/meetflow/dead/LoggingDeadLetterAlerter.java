package io.meetflow.dead;

import io.meetflow.model.DeadLetter;
import io.meetflow.spi.DeadLetterAlerter;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default alerter: writes the dead letter to the log at {@code SEVERE}.
 */
public final class LoggingDeadLetterAlerter implements DeadLetterAlerter {
    private static final Logger logger = Logger.getLogger(LoggingDeadLetterAlerter.class.getName());

    @Override
    public void alert(DeadLetter deadLetter) {
        logger.log(Level.SEVERE, "Dead letter {0}: {1} {2} step {3} for {4} failed {5} times, last error: {6}",
            new Object[]{
                deadLetter.id(),
                deadLetter.platform().code(),
                deadLetter.eventType(),
                deadLetter.step().code(),
                deadLetter.referenceId(),
                deadLetter.totalAttempts(),
                deadLetter.error()});
    }
}
