package com.phillippitts.leaderkey.service.dispatch.event;

import com.phillippitts.leaderkey.domain.ActionType;

import java.time.Instant;

/**
 * Published for every action handed to the dispatcher. An OS integration listens for this
 * event and performs the launch or open.
 */
public record ActionDispatchedEvent(ActionType type, String value, String openWith, Instant at) { }
