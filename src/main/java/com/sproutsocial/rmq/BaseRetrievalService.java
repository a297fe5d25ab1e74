package com.sproutsocial.rmq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One retrieval command: checks the queue, runs the strategy against the pipeline, reports the result.
 * Subclasses supply the retrieval policy.
 */
public abstract class BaseRetrievalService {

    protected final Client client;
    protected final RetrievalOptions retrievalOptions;
    protected final OutputOptions outputOptions;
    protected final FileConfig fileConfig;
    protected final StatusOutput status;
    private final RetrievalResultWriter resultWriter;

    private static final Logger logger = LoggerFactory.getLogger(BaseRetrievalService.class);

    protected BaseRetrievalService(Client client, RetrievalOptions retrievalOptions, OutputOptions outputOptions,
                                   FileConfig fileConfig, StatusOutput status, RetrievalResultWriter resultWriter) {
        this.client = checkNotNull(client);
        this.retrievalOptions = checkNotNull(retrievalOptions);
        this.outputOptions = checkNotNull(outputOptions);
        this.fileConfig = checkNotNull(fileConfig);
        this.status = checkNotNull(status);
        this.resultWriter = checkNotNull(resultWriter);
        checkArgument(!Util.isNullOrEmpty(retrievalOptions.getQueue()), "queue is required");
    }

    protected BaseRetrievalService(Client client, RetrievalOptions retrievalOptions, OutputOptions outputOptions,
                                   FileConfig fileConfig, PrintStream err) {
        this(client, retrievalOptions, outputOptions, fileConfig, new StatusOutput(err, outputOptions.isQuiet()),
                new RetrievalResultWriter(client.getObjectMapper(), err, outputOptions));
    }

    /**
     * Runs one retrieval to completion. Closing the channel at the end returns every unacknowledged message
     * to the queue.
     *
     * @param userCancellation raised on Ctrl+C
     */
    public RetrievalResult runRetrieval(CancellationSignal userCancellation) {
        checkNotNull(userCancellation);
        String queue = retrievalOptions.getQueue();
        long start = Util.clock();
        BrokerChannel channel;
        try {
            channel = client.openChannel();
        }
        catch (IOException | RuntimeException e) {
            logger.error("could not connect. {}", client.getBrokerConfig(), e);
            ErrorInfo error = ErrorInfo.connectionFailed(client.getBrokerConfig(), e);
            status.error("Failed to connect to broker", error);
            return RetrievalResult.failed(queue, error);
        }
        try {
            return retrieve(channel, queue, userCancellation, start);
        }
        finally {
            Util.closeQuietly(channel);
        }
    }

    private RetrievalResult retrieve(BrokerChannel channel, String queue, CancellationSignal userCancellation, long start) {
        QueueInfo queueInfo;
        try {
            queueInfo = channel.checkQueue(queue);
        }
        catch (QueueNotFoundException e) {
            logger.error("queue:{} not found", queue, e);
            ErrorInfo error = ErrorInfo.queueNotFound(queue);
            status.error("Failed to " + getOperation() + " from queue", error);
            return RetrievalResult.failed(queue, error);
        }
        catch (IOException e) {
            logger.error("queue check failed for queue:{}", queue, e);
            ErrorInfo error = ErrorInfo.retrievalFailed(e);
            status.error("Failed to " + getOperation() + " from queue", error);
            return RetrievalResult.failed(queue, error);
        }

        if (outputOptions.isVerbose()) {
            status.status("Queue " + queue + " has " + Util.messageCountString(queueInfo.getMessageCount())
                    + " and " + queueInfo.getConsumerCount() + " consumers");
        }
        long messageCount = getMessageCount(queueInfo);
        try {
            if (!beforeRetrieval(channel, queueInfo, messageCount)) {
                logger.debug("{} of queue:{} skipped", getOperation(), queue);
                RetrievalResult result = new RetrievalResult();
                result.setQueue(queue);
                return result;
            }
        }
        catch (RuntimeException e) {
            logger.error("{} setup failed for queue:{}", getOperation(), queue, e);
            return setupFailed(queue, e);
        }

        RetrievalStrategy strategy = createStrategy();
        AckMode ackMode = getAckMode();

        HandoffQueue<RetrievedMessage> receiveQueue = new HandoffQueue<RetrievedMessage>("receive:" + queue);
        HandoffQueue<AckIntent> ackQueue = new HandoffQueue<AckIntent>("ack:" + queue);
        ReceivedMessageCounter counter = new ReceivedMessageCounter();

        PipelineHandle handle;
        try {
            handle = new MessagePipeline(client.getExecutor()).start(receiveQueue, ackQueue, channel,
                    outputOptions, fileConfig, messageCount, ackMode, createAckDispatcher(), userCancellation);
        }
        catch (RuntimeException e) {
            logger.error("could not start output for queue:{}", queue, e);
            return setupFailed(queue, e);
        }
        showStartStatus(queue, messageCount, strategy);
        CancellationSignal retrievalCancellation =
                CancellationSignal.anyOf("retrieval:" + queue, userCancellation, handle.getAbort());

        Throwable retrievalFailure = null;
        try {
            strategy.retrieveMessages(channel, queue, receiveQueue, messageCount, counter, retrievalCancellation);
        }
        catch (IOException | RuntimeException e) {
            logger.error("{} retrieval from queue:{} failed", strategy.getName(), queue, e);
            retrievalFailure = e;
            receiveQueue.close();
        }

        MessageOutputResult outputResult;
        try {
            outputResult = handle.awaitCompletion();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RmqException("interrupted waiting for retrieval from " + queue, e);
        }

        long received = counter.getValue();
        if (outputResult.getProcessedCount() + outputResult.getSkippedCount() != received) {
            logger.warn("received:{} but output saw {}", received, outputResult);
        }

        RetrievalResult result = new RetrievalResult();
        result.setTimestamp(Instant.now().toString());
        result.setQueue(queue);
        result.setRetrievalMode(strategy.getName());
        result.setAckMode(ackMode.name().toLowerCase());
        result.setMessagesReceived(received);
        result.setMessagesProcessed(outputResult.getProcessedCount());
        result.setTotalSizeBytes(outputResult.getTotalBytes());
        result.setDurationMs(Util.clock() - start);
        result.setOutputDestination(outputOptions.isConsole() ? "STDOUT" : outputOptions.getOutputFile().getPath());
        result.setOutputFormat(outputOptions.getFormat().displayName());

        if (outputResult.isFailed()) {
            result.setStatus("error");
            result.setCancellationReason(RetrievalResult.OUTPUT_FAILURE);
            ErrorInfo error = new ErrorInfo("OUTPUT_FAILED", String.valueOf(outputResult.getFailure().getMessage()),
                    "output", "Check that the output file is writable and the disk is not full");
            result.setError(error);
            status.error("Failed writing messages to " + handle.getOutput().getDestination(), error);
        }
        else if (retrievalFailure != null) {
            result.setStatus("error");
            ErrorInfo error = ErrorInfo.retrievalFailed(retrievalFailure);
            result.setError(error);
            status.error("Failed to " + getOperation() + " from queue " + queue, error);
        }
        else if (userCancellation.isCancelled()) {
            result.setCancellationReason(RetrievalResult.USER_CANCELLATION);
            status.warning("Retrieval cancelled by user, unprocessed messages were returned to the queue", true);
        }

        afterRetrieval(result, messageCount);
        if (result.isSuccess()) {
            status.success(getCompletedVerb() + " " + Util.messageCountString(result.getMessagesProcessed())
                    + " from queue " + queue);
        }
        resultWriter.write(result);
        logger.debug("{}", result);
        return result;
    }

    private RetrievalResult setupFailed(String queue, Exception e) {
        ErrorInfo error = ErrorInfo.retrievalFailed(e);
        status.error("Failed to " + getOperation() + " from queue " + queue, error);
        return RetrievalResult.failed(queue, error);
    }

    private void showStartStatus(String queue, long messageCount, RetrievalStrategy strategy) {
        String upTo = messageCount > 0 ? " up to " + Util.messageCountString(messageCount) : " messages";
        status.status(getProgressVerb() + upTo + " from queue " + queue + " in " + strategy.getName()
                + " mode (Ctrl+C to stop)");
    }

    /**
     * @return the target message count for this run, zero or less for no limit
     */
    protected long getMessageCount(QueueInfo queueInfo) {
        return retrievalOptions.getMessageCount();
    }

    /**
     * Called after the queue check, before anything is retrieved.
     * @return false to end the run without retrieving
     */
    protected boolean beforeRetrieval(BrokerChannel channel, QueueInfo queueInfo, long messageCount) {
        return true;
    }

    protected void afterRetrieval(RetrievalResult result, long messageCount) {
    }

    protected abstract RetrievalStrategy createStrategy();

    protected abstract AckMode getAckMode();

    protected abstract AckDispatcher createAckDispatcher();

    /**
     * @return the command name, "consume" or "peek"
     */
    protected abstract String getOperation();

    protected abstract String getProgressVerb();

    protected abstract String getCompletedVerb();

}
