package com.sproutsocial.rmq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Destructive or requeuing retrieval through a broker subscription, acknowledged with the caller's ack mode.
 */
public class ConsumeService extends BaseRetrievalService {

    private static final Logger logger = LoggerFactory.getLogger(ConsumeService.class);

    public ConsumeService(Client client, RetrievalOptions retrievalOptions, OutputOptions outputOptions,
                          FileConfig fileConfig, StatusOutput status, RetrievalResultWriter resultWriter) {
        super(client, retrievalOptions, outputOptions, fileConfig, status, resultWriter);
    }

    public ConsumeService(Client client, RetrievalOptions retrievalOptions, OutputOptions outputOptions,
                          FileConfig fileConfig, PrintStream err) {
        super(client, retrievalOptions, outputOptions, fileConfig, err);
    }

    public ConsumeService(Client client, RetrievalOptions retrievalOptions, OutputOptions outputOptions, FileConfig fileConfig) {
        this(client, retrievalOptions, outputOptions, fileConfig, System.err);
    }

    @Override
    protected boolean beforeRetrieval(BrokerChannel channel, QueueInfo queueInfo, long messageCount) {
        if (retrievalOptions.getAckMode() == AckMode.REQUEUE && messageCount <= 0) {
            status.warning("Requeue mode with no message count keeps redelivering the same messages. "
                    + "Press Ctrl+C to stop, or set a message count.");
        }
        int prefetch = retrievalOptions.getPrefetchCount();
        if (prefetch > 0) {
            try {
                channel.setPrefetchCount(prefetch);
                logger.debug("prefetch count set to {}", prefetch);
            }
            catch (IOException e) {
                throw new RmqException("could not set prefetch count " + prefetch, e);
            }
        }
        return true;
    }

    @Override
    protected RetrievalStrategy createStrategy() {
        return new SubscriptionStrategy(client.getExecutor());
    }

    @Override
    protected AckMode getAckMode() {
        return retrievalOptions.getAckMode();
    }

    @Override
    protected AckDispatcher createAckDispatcher() {
        return new AckDispatcher();
    }

    @Override
    protected String getOperation() {
        return "consume";
    }

    @Override
    protected String getProgressVerb() {
        return "Consuming";
    }

    @Override
    protected String getCompletedVerb() {
        return "Consumed";
    }

}
