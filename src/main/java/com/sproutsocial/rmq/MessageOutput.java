package com.sproutsocial.rmq;

import com.sproutsocial.rmq.format.MessageFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Output stage of the pipeline. Takes messages off the receive queue in order, writes them and queues
 * one ack intent per message.
 * <p>
 * A written message gets the configured ack mode. A message that could not be written, or that arrives after
 * the user cancelled or after a fatal failure, is skipped and requeued. Subclasses decide whether a write
 * failure is fatal; a fatal failure raises the abort signal so retrieval stops.
 */
public abstract class MessageOutput implements Closeable {

    protected final MessageFormatter formatter;
    protected final boolean compact;

    private static final Logger logger = LoggerFactory.getLogger(MessageOutput.class);

    protected MessageOutput(MessageFormatter formatter, boolean compact) {
        this.formatter = checkNotNull(formatter);
        this.compact = compact;
    }

    public static MessageOutput create(OutputOptions options, FileConfig fileConfig, long messageCount) {
        MessageFormatter formatter = options.getFormat().newFormatter();
        if (options.isConsole()) {
            return new ConsoleOutput(formatter, options.isCompact(), System.out);
        }
        return new FileOutput(formatter, options.isCompact(), options.getOutputFile(), fileConfig,
                FileOutput.shouldRotate(messageCount, fileConfig.getMessagesPerFile()));
    }

    /**
     * Runs until the receive queue is closed and drained, then closes this output and the ack queue.
     *
     * @param cancellation the user's cancellation, the message in hand is finished and the rest are requeued
     * @param abort raised by this stage on a fatal write failure
     */
    public MessageOutputResult writeMessages(HandoffQueue<RetrievedMessage> receiveQueue,
                                             HandoffQueue<AckIntent> ackQueue,
                                             AckMode ackMode,
                                             CancellationSignal cancellation,
                                             CancellationSignal abort) {
        long processed = 0;
        long skipped = 0;
        long totalBytes = 0;
        boolean stopped = false;
        Throwable failure = null;
        try {
            RetrievedMessage message;
            while ((message = receiveQueue.take()) != null) {
                if (stopped || failure != null) {
                    requeue(ackQueue, message);
                    skipped++;
                    continue;
                }
                try {
                    writeMessage(message);
                    ackQueue.put(new AckIntent(message.getDeliveryTag(), ackMode));
                    processed++;
                    totalBytes += message.getBodySizeBytes();
                }
                catch (IOException | RuntimeException e) {
                    requeue(ackQueue, message);
                    skipped++;
                    if (isFailureFatal()) {
                        logger.error("failed writing message #{} to {}, stopping retrieval", message.getDeliveryTag(), getDestination(), e);
                        failure = e;
                        abort.cancel();
                    }
                    else {
                        logger.error("failed writing message #{} to {}, requeuing it", message.getDeliveryTag(), getDestination(), e);
                    }
                }
                if (!stopped && cancellation.isCancelled()) {
                    logger.debug("cancelled after {} messages, requeuing the rest", processed);
                    stopped = true;
                }
            }
        }
        catch (InterruptedException e) {
            logger.warn("output interrupted, unwritten messages return to the broker when the channel closes");
            Thread.currentThread().interrupt();
            if (failure == null) {
                failure = e;
            }
        }
        finally {
            try {
                close();
            }
            catch (IOException e) {
                logger.error("failed closing {}", getDestination(), e);
                if (failure == null) {
                    failure = e;
                }
            }
            ackQueue.close();
        }
        MessageOutputResult result = new MessageOutputResult(processed, skipped, totalBytes, failure);
        logger.debug("output finished. {}", result);
        return result;
    }

    private static void requeue(HandoffQueue<AckIntent> ackQueue, RetrievedMessage message) {
        ackQueue.put(new AckIntent(message.getDeliveryTag(), AckMode.REQUEUE));
    }

    protected abstract void writeMessage(RetrievedMessage message) throws IOException;

    /**
     * @return true if one failed write ends the retrieval
     */
    protected abstract boolean isFailureFatal();

    public abstract String getDestination();

    @Override
    public void close() throws IOException {
    }

}
