package com.sproutsocial.rmq;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Starts the two downstream stages of a retrieval run: the output task draining the receive queue
 * and the ack task draining the ack queue. Retrieval itself is driven by the caller, which must make sure
 * the receive queue gets closed.
 */
public class MessagePipeline {

    private final ListeningExecutorService executor;

    private static final Logger logger = LoggerFactory.getLogger(MessagePipeline.class);

    public MessagePipeline(ListeningExecutorService executor) {
        this.executor = checkNotNull(executor);
    }

    public PipelineHandle start(HandoffQueue<RetrievedMessage> receiveQueue,
                                HandoffQueue<AckIntent> ackQueue,
                                BrokerChannel channel,
                                OutputOptions outputOptions,
                                FileConfig fileConfig,
                                long messageCount,
                                AckMode ackMode,
                                AckDispatcher dispatcher,
                                CancellationSignal cancellation) {
        MessageOutput output = MessageOutput.create(outputOptions, fileConfig, messageCount);
        return start(receiveQueue, ackQueue, channel, output, ackMode, dispatcher, cancellation);
    }

    public PipelineHandle start(final HandoffQueue<RetrievedMessage> receiveQueue,
                                final HandoffQueue<AckIntent> ackQueue,
                                final BrokerChannel channel,
                                final MessageOutput output,
                                final AckMode ackMode,
                                final AckDispatcher dispatcher,
                                final CancellationSignal cancellation) {
        checkNotNull(channel);
        checkNotNull(ackMode);
        final CancellationSignal abort = new CancellationSignal("output-failure:" + receiveQueue.getName());

        ListenableFuture<MessageOutputResult> outputFuture = executor.submit(new Callable<MessageOutputResult>() {
            public MessageOutputResult call() {
                logger.debug("output task started, destination:{} ackMode:{}", output.getDestination(), ackMode);
                return output.writeMessages(receiveQueue, ackQueue, ackMode, cancellation, abort);
            }
        });

        ListenableFuture<Void> ackFuture = executor.submit(new Callable<Void>() {
            public Void call() throws InterruptedException {
                dispatcher.dispatchAcknowledgments(ackQueue, channel);
                return null;
            }
        });

        return new PipelineHandle(outputFuture, ackFuture, abort, output, dispatcher);
    }

}
