package com.sproutsocial.rmq;

import com.sproutsocial.rmq.format.OutputFormat;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.*;

public class ConsumeServiceTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private Client client;

    @After
    public void after() {
        if (client != null) {
            client.stop(1000);
        }
    }

    private ConsumeService service(FakeBrokerChannel channel, RetrievalOptions options, OutputOptions outputOptions) {
        return service(channel, options, outputOptions, new FileConfig());
    }

    private ConsumeService service(FakeBrokerChannel channel, RetrievalOptions options, OutputOptions outputOptions,
                                   FileConfig fileConfig) {
        client = new FakeClient(channel);
        return new ConsumeService(client, options, outputOptions, fileConfig, new PrintStream(err, true));
    }

    private String errText() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testOrdersScenario() throws Exception {
        FakeBrokerChannel channel = new FakeBrokerChannel().addQueue("orders", "o1", "o2", "o3", "o4", "o5");
        RetrievalResult result = service(channel, new RetrievalOptions("orders", AckMode.ACK, 3), new OutputOptions())
                .runRetrieval(new CancellationSignal("user"));

        assertTrue(result.isSuccess());
        assertEquals(3, result.getMessagesReceived());
        assertEquals(3, result.getMessagesProcessed());
        assertEquals(0, result.getMessagesSkipped());
        assertEquals("subscribe", result.getRetrievalMode());
        assertEquals("ack", result.getAckMode());
        List<AckIntent> acks = channel.getAcknowledgments();
        assertEquals(3, acks.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(new AckIntent(i + 1, AckMode.ACK), acks.get(i));
        }
        channel.awaitDeliveryStopped(5000);
        //everything past the limit went back to the queue when the channel closed
        assertFalse(channel.isOpen());
        assertEquals(2, channel.getQueueSize("orders"));
        assertTrue(errText().contains("Consumed 3 messages from queue orders"));
        assertTrue(errText().contains("  Received:   3 messages"));
    }

    @Test
    public void testQueueNotFound() {
        FakeBrokerChannel channel = new FakeBrokerChannel();
        RetrievalResult result = service(channel, new RetrievalOptions("missing", AckMode.ACK, 1), new OutputOptions())
                .runRetrieval(new CancellationSignal("user"));

        assertFalse(result.isSuccess());
        assertEquals(1, result.getExitCode());
        assertEquals("QUEUE_NOT_FOUND", result.getError().getCode());
        String text = errText();
        assertTrue(text.contains("✗ Failed to consume from queue"));
        assertTrue(text.contains("  Category:   routing"));
        assertTrue(text.contains("Check if the queue exists and is correctly configured"));
    }

    @Test
    public void testPrefetchFailureReturnsFailedResult() {
        FakeBrokerChannel channel = new FakeBrokerChannel() {
            @Override
            public synchronized void setPrefetchCount(int prefetchCount) throws IOException {
                throw new IOException("channel closed by broker");
            }
        }.addQueue("orders", "o1", "o2");
        RetrievalOptions options = new RetrievalOptions("orders", AckMode.ACK, 2);
        options.setPrefetchCount(10);

        RetrievalResult result = service(channel, options, new OutputOptions()).runRetrieval(new CancellationSignal("user"));

        assertFalse(result.isSuccess());
        assertEquals("RETRIEVAL_FAILED", result.getError().getCode());
        assertTrue(errText().contains("✗ Failed to consume from queue orders"));
        assertTrue(channel.getAcknowledgments().isEmpty());
        assertEquals(2, channel.getQueueSize("orders"));
    }

    @Test
    public void testInvalidFileConfigReturnsFailedResult() {
        FakeBrokerChannel channel = new FakeBrokerChannel().addQueue("orders", "o1");
        OutputOptions outputOptions = new OutputOptions();
        outputOptions.setOutputFile(new File(folder.getRoot(), "out.txt"));
        FileConfig fileConfig = new FileConfig();
        fileConfig.setMessagesPerFile(0);

        RetrievalResult result = service(channel, new RetrievalOptions("orders", AckMode.ACK, 0), outputOptions, fileConfig)
                .runRetrieval(new CancellationSignal("user"));

        assertFalse(result.isSuccess());
        assertEquals("RETRIEVAL_FAILED", result.getError().getCode());
        assertTrue(errText().contains("✗ Failed to consume from queue orders"));
        assertFalse(errText().contains("Ctrl+C to stop"));
        assertEquals(1, channel.getQueueSize("orders"));
    }

    @Test
    public void testUserCancellationConservesMessages() throws Exception {
        final FakeBrokerChannel channel = new FakeBrokerChannel().addQueue("orders", "o1", "o2", "o3", "o4", "o5", "o6");
        final CancellationSignal user = new CancellationSignal("user");
        OutputOptions outputOptions = new OutputOptions();
        outputOptions.setOutputFile(new File(folder.getRoot(), "cancel.txt"));
        outputOptions.setQuiet(true);
        ConsumeService service = service(channel, new RetrievalOptions("orders", AckMode.ACK, 0), outputOptions);
        //cancel once every message has been delivered
        Thread canceller = new Thread(new Runnable() {
            public void run() {
                while (channel.getQueueSize("orders") > 0) {
                    Util.sleepQuietly(5);
                }
                user.cancel();
            }
        });
        canceller.start();

        RetrievalResult result = service.runRetrieval(user);
        canceller.join(5000);

        assertTrue(result.isCancelled());
        assertEquals(RetrievalResult.USER_CANCELLATION, result.getCancellationReason());
        assertTrue(result.getMessagesProcessed() <= result.getMessagesReceived());
        List<AckIntent> acks = channel.getAcknowledgments();
        assertEquals(result.getMessagesReceived(), acks.size());
        assertEquals(result.getMessagesSkipped(), channel.getAcknowledgments(AckMode.REQUEUE).size());
        //nothing is lost: acked messages are gone, everything else is back in the queue
        assertEquals(6, channel.getAcknowledgments(AckMode.ACK).size() + channel.getQueueSize("orders"));
    }

    @Test
    public void testJsonResult() throws Exception {
        FakeBrokerChannel channel = new FakeBrokerChannel().addQueue("orders", "{\"id\":1}");
        OutputOptions outputOptions = new OutputOptions();
        outputOptions.setFormat(OutputFormat.JSON);
        outputOptions.setOutputFile(new File(folder.getRoot(), "out.json"));

        RetrievalResult result = service(channel, new RetrievalOptions("orders", AckMode.REJECT, 1), outputOptions)
                .runRetrieval(new CancellationSignal("user"));

        assertEquals(1, result.getMessagesProcessed());
        assertEquals(1, channel.getAcknowledgments(AckMode.REJECT).size());
        String text = errText();
        assertTrue(text.contains("\"messages_received\":1"));
        assertTrue(text.contains("\"ack_mode\":\"reject\""));
        assertTrue(text.contains("\"output_format\":\"json\""));
        assertFalse(text.contains("cancellation_reason"));
    }

}
