package com.questrail.pubsub.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Production implementation of ChannelObservabilitySink that emits logs via SLF4J.
 *
 * <p>Each topic logs under its own logger, {@code com.questrail.pubsub.channel.<name>},
 * where the name is the topic with separator and wildcard characters replaced by
 * underscores, so per-topic levels can be set in the logging backend.</p>
 */
public final class Slf4jChannelObservabilitySink implements ChannelObservabilitySink {
    static final String LOGGER_PREFIX = "com.questrail.pubsub.channel.";

    private static final Pattern UNSAFE = Pattern.compile("[:,*&?!@#$%]");

    @Override
    public void onStateTransition(ChannelStateTransitionEvent event) {
        Logger log = loggerFor(event.topic());
        if (event.isChange()) {
            log.info("Channel {}: {} -> {}", event.topic(), event.oldState(), event.newState());
        } else {
            log.debug("Channel {}: re-entered {}", event.topic(), event.newState());
        }
    }

    @Override
    public void onProtocolEvent(ChannelProtocolEvent event) {
        Logger log = loggerFor(event.topic());
        switch (event.kind()) {
            case JOIN_ERROR, JOIN_TIMEOUT -> log.warn("Channel {}: {} {}", event.topic(), event.kind(), event.detail());
            default -> log.debug("Channel {}: {} {}", event.topic(), event.kind(), event.detail());
        }
    }

    @Override
    public void onError(ChannelErrorEvent event) {
        loggerFor(event.topic()).error("Channel {} error: {}", event.topic(), event.message(), event.cause());
    }

    /**
     * Logger name suffix for a topic.
     */
    public static String loggerName(String topic) {
        return UNSAFE.matcher(topic).replaceAll("_");
    }

    private static Logger loggerFor(String topic) {
        return LoggerFactory.getLogger(LOGGER_PREFIX + loggerName(topic == null ? "unknown" : topic));
    }
}
