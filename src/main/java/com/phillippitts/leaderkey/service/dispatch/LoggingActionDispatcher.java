package com.phillippitts.leaderkey.service.dispatch;

import com.phillippitts.leaderkey.domain.Action;
import com.phillippitts.leaderkey.service.dispatch.event.ActionDispatchedEvent;
import com.phillippitts.leaderkey.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Shipped dispatcher: logs the action and publishes an {@link ActionDispatchedEvent}.
 * Process spawning and URL opening are left to whoever listens for the event.
 */
@Component
public class LoggingActionDispatcher implements ActionDispatcher {

    private static final Logger LOG = LogManager.getLogger(LoggingActionDispatcher.class);
    private static final int MAX_VALUE_PREVIEW = 80;

    private final ApplicationEventPublisher publisher;

    public LoggingActionDispatcher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void runAction(Action action) {
        LOG.info("Dispatching {} action '{}': {}", action.type().jsonName(), action.displayName(),
                LogSanitizer.preview(action.value(), MAX_VALUE_PREVIEW));
        publisher.publishEvent(new ActionDispatchedEvent(action.type(), action.value(), action.openWith(),
                Instant.now()));
    }
}
