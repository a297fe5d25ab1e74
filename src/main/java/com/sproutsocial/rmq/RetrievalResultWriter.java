package com.sproutsocial.rmq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sproutsocial.rmq.format.OutputFormat;

import java.io.PrintStream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Writes the final result to standard error: a JSON line when the output format is JSON,
 * otherwise a short summary. Nothing when quiet.
 */
public class RetrievalResultWriter {

    private final ObjectMapper mapper;
    private final PrintStream err;
    private final OutputOptions outputOptions;

    public RetrievalResultWriter(ObjectMapper mapper, PrintStream err, OutputOptions outputOptions) {
        this.mapper = checkNotNull(mapper);
        this.err = checkNotNull(err);
        this.outputOptions = checkNotNull(outputOptions);
    }

    public void write(RetrievalResult result) {
        if (outputOptions.isQuiet()) {
            return;
        }
        if (outputOptions.getFormat() == OutputFormat.JSON) {
            try {
                err.println(mapper.writeValueAsString(result));
            }
            catch (JsonProcessingException e) {
                throw new RmqException("could not serialize result", e);
            }
            return;
        }
        err.println(summary(result));
    }

    static String summary(RetrievalResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("  Queue:      ").append(result.getQueue()).append('\n');
        sb.append("  Mode:       ").append(result.getRetrievalMode()).append('\n');
        sb.append("  Ack Mode:   ").append(result.getAckMode()).append('\n');
        sb.append("  Received:   ").append(Util.messageCountString(result.getMessagesReceived())).append('\n');
        sb.append("  Processed:  ").append(Util.messageCountString(result.getMessagesProcessed()));
        if (result.getMessagesSkipped() > 0) {
            sb.append(" (").append(result.getMessagesSkipped()).append(" skipped & returned to broker)");
        }
        sb.append('\n');
        sb.append("  Duration:   ").append(result.getDuration()).append('\n');
        sb.append("  Total size: ").append(result.getTotalSize());
        return sb.toString();
    }

}
