package com.sproutsocial.rmq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Non destructive retrieval: polls messages and requeues every one of them, whatever ack mode was asked for.
 * The count is capped at the queue depth seen before retrieval so requeued messages are not fetched again.
 */
public class PeekService extends BaseRetrievalService {

    static final int LARGE_PEEK_WARNING = 300;

    private static final Logger logger = LoggerFactory.getLogger(PeekService.class);

    public PeekService(Client client, RetrievalOptions retrievalOptions, OutputOptions outputOptions,
                       FileConfig fileConfig, StatusOutput status, RetrievalResultWriter resultWriter) {
        super(client, retrievalOptions, outputOptions, fileConfig, status, resultWriter);
    }

    public PeekService(Client client, RetrievalOptions retrievalOptions, OutputOptions outputOptions,
                       FileConfig fileConfig, PrintStream err) {
        super(client, retrievalOptions, outputOptions, fileConfig, err);
    }

    public PeekService(Client client, RetrievalOptions retrievalOptions, OutputOptions outputOptions, FileConfig fileConfig) {
        this(client, retrievalOptions, outputOptions, fileConfig, System.err);
    }

    @Override
    protected long getMessageCount(QueueInfo queueInfo) {
        long requested = retrievalOptions.getMessageCount();
        long available = queueInfo.getMessageCount();
        if (requested <= 0 || requested > available) {
            logger.debug("peeking {} available messages, {} requested", available, requested);
            return available;
        }
        return requested;
    }

    @Override
    protected boolean beforeRetrieval(BrokerChannel channel, QueueInfo queueInfo, long messageCount) {
        if (queueInfo.getMessageCount() == 0) {
            status.warning("Target queue is empty, no messages will be peeked. Consider using 'rmq consume' instead.");
            return false;
        }
        if (messageCount > LARGE_PEEK_WARNING) {
            status.warning("Peek mode uses polling (basic.get) which is inefficient and wasteful for large message counts. "
                    + "Peeking " + messageCount + " messages may take a while. Consider using 'rmq consume' instead.");
        }
        return true;
    }

    @Override
    protected void afterRetrieval(RetrievalResult result, long messageCount) {
        long requested = retrievalOptions.getMessageCount();
        if (result.isSuccess() && !result.isCancelled() && requested > 0 && result.getMessagesReceived() < requested) {
            status.warning("Only " + Util.messageCountString(result.getMessagesReceived()) + " were available in queue.");
        }
    }

    @Override
    protected RetrievalStrategy createStrategy() {
        return new PollingStrategy();
    }

    @Override
    protected AckMode getAckMode() {
        return AckMode.REQUEUE;
    }

    @Override
    protected AckDispatcher createAckDispatcher() {
        return new AckDispatcher(true);
    }

    @Override
    protected String getOperation() {
        return "peek";
    }

    @Override
    protected String getProgressVerb() {
        return "Peeking";
    }

    @Override
    protected String getCompletedVerb() {
        return "Peeked";
    }

}
