package io.meetflow.progress;

import io.meetflow.model.Meeting;

/**
 * Result of {@link ProcessingStateMachine#register}.
 *
 * @param created {@code false} if the meeting already existed
 */
public record MeetingRegistration(Meeting meeting, boolean created) {}
