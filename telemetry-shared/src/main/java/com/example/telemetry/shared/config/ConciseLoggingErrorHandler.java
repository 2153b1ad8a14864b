package com.example.telemetry.shared.config;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.util.backoff.BackOff;

/**
 * Logs one structured line per failed ingest record instead of a stack trace per retry.
 */
public class ConciseLoggingErrorHandler extends DefaultErrorHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConciseLoggingErrorHandler.class);

    public ConciseLoggingErrorHandler(DeadLetterPublishingRecoverer deadLetterPublishingRecoverer, BackOff backOff) {
        super(deadLetterPublishingRecoverer, backOff);
    }

    @Override
    public boolean handleOne(Exception thrownException, ConsumerRecord<?, ?> record, Consumer<?, ?> consumer, MessageListenerContainer container) {
        log(record, thrownException);
        return super.handleOne(thrownException, record, consumer, container);
    }

    private void log(ConsumerRecord<?, ?> record, Exception exception) {
        LOGGER.error(
            "Error ingesting analytics record. topic={}, partition={}, offset={}, key={}, exception_message='{}'",
            record.topic(),
            record.partition(),
            record.offset(),
            record.key(),
            exception.getCause() != null ? exception.getCause().getMessage() : exception.getMessage()
        );

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Full stack trace for failed record:", exception);
        }
    }
}
