package com.sproutsocial.rmq;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;

/**
 * The running output and ack tasks of one retrieval run.
 */
public class PipelineHandle {

    private final ListenableFuture<MessageOutputResult> outputFuture;
    private final ListenableFuture<Void> ackFuture;
    private final CancellationSignal abort;
    private final MessageOutput output;
    private final AckDispatcher dispatcher;

    private static final Logger logger = LoggerFactory.getLogger(PipelineHandle.class);

    PipelineHandle(ListenableFuture<MessageOutputResult> outputFuture, ListenableFuture<Void> ackFuture,
                   CancellationSignal abort, MessageOutput output, AckDispatcher dispatcher) {
        this.outputFuture = outputFuture;
        this.ackFuture = ackFuture;
        this.abort = abort;
        this.output = output;
        this.dispatcher = dispatcher;
    }

    /**
     * Waits for both tasks, with no timeout.
     * @return the output stage's result
     * @throws RmqException if either task failed unexpectedly
     */
    public MessageOutputResult awaitCompletion() throws InterruptedException {
        try {
            //wait for both even when one fails, the ack task must finish before the channel closes
            Futures.successfulAsList(outputFuture, ackFuture).get();
        }
        catch (ExecutionException e) {
            throw new RmqException("pipeline failed", e.getCause());
        }
        try {
            Futures.getDone(ackFuture);
            MessageOutputResult result = Futures.getDone(outputFuture);
            logger.debug("pipeline complete. {} {}", result, dispatcher.stateDesc());
            return result;
        }
        catch (ExecutionException e) {
            throw new RmqException("pipeline task failed", e.getCause());
        }
    }

    /**
     * Raised by the output stage on a fatal write failure.
     */
    public CancellationSignal getAbort() {
        return abort;
    }

    public MessageOutput getOutput() {
        return output;
    }

    public AckDispatcher getDispatcher() {
        return dispatcher;
    }

    public boolean isDone() {
        return outputFuture.isDone() && ackFuture.isDone();
    }

}
