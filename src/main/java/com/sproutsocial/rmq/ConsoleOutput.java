package com.sproutsocial.rmq;

import com.sproutsocial.rmq.format.MessageFormatter;

import java.io.IOException;
import java.io.PrintStream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Writes messages to a print stream, standard out by default. A failed write skips that message only.
 */
public class ConsoleOutput extends MessageOutput {

    private final PrintStream out;

    public ConsoleOutput(MessageFormatter formatter, boolean compact, PrintStream out) {
        super(formatter, compact);
        this.out = checkNotNull(out);
    }

    @Override
    protected void writeMessage(RetrievedMessage message) throws IOException {
        String text = formatter.format(message, compact);
        out.println(text);
        out.flush();
        if (out.checkError()) {
            throw new IOException("console write failed for message #" + message.getDeliveryTag());
        }
    }

    @Override
    protected boolean isFailureFatal() {
        return false;
    }

    @Override
    public String getDestination() {
        return "console";
    }

}
