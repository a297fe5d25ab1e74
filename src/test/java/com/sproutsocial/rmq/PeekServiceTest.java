package com.sproutsocial.rmq;

import org.junit.After;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class PeekServiceTest {

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private Client client;

    @After
    public void after() {
        if (client != null) {
            client.stop(1000);
        }
    }

    private RetrievalResult peek(FakeBrokerChannel channel, String queue, AckMode ackMode, long count) {
        client = new FakeClient(channel);
        OutputOptions outputOptions = new OutputOptions();
        outputOptions.setCompact(true);
        return new PeekService(client, new RetrievalOptions(queue, ackMode, count), outputOptions, new FileConfig(),
                new PrintStream(err, true)).runRetrieval(new CancellationSignal("user"));
    }

    private String errText() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testPeekNeverAcks() {
        FakeBrokerChannel channel = new FakeBrokerChannel().addQueue("orders", "1", "2", "3", "4");

        RetrievalResult result = peek(channel, "orders", AckMode.ACK, 3);

        assertTrue(result.isSuccess());
        assertEquals("polling", result.getRetrievalMode());
        assertEquals("requeue", result.getAckMode());
        assertEquals(3, result.getMessagesReceived());
        assertEquals(3, result.getMessagesProcessed());
        assertTrue(channel.getAcknowledgments(AckMode.ACK).isEmpty());
        assertTrue(channel.getAcknowledgments(AckMode.REJECT).isEmpty());
        assertEquals(3, channel.getAcknowledgments(AckMode.REQUEUE).size());
        assertEquals(4, channel.getQueueSize("orders"));
    }

    @Test
    public void testFewerMessagesThanRequested() {
        FakeBrokerChannel channel = new FakeBrokerChannel().addQueue("orders", "1", "2");

        RetrievalResult result = peek(channel, "orders", AckMode.REQUEUE, 5);

        assertEquals(2, result.getMessagesReceived());
        assertEquals(2, channel.getAcknowledgments().size());
        assertTrue(errText().contains("⚠ Only 2 messages were available in queue."));
    }

    @Test
    public void testEmptyQueue() {
        FakeBrokerChannel channel = new FakeBrokerChannel().addQueue("orders");

        RetrievalResult result = peek(channel, "orders", AckMode.REQUEUE, 5);

        assertTrue(result.isSuccess());
        assertEquals(0, result.getMessagesReceived());
        assertTrue(errText().contains("Target queue is empty, no messages will be peeked."));
    }

    @Test
    public void testLargePeekWarns() {
        String[] bodies = new String[PeekService.LARGE_PEEK_WARNING + 1];
        for (int i = 0; i < bodies.length; i++) {
            bodies[i] = "m" + i;
        }
        FakeBrokerChannel channel = new FakeBrokerChannel().addQueue("orders", bodies);

        RetrievalResult result = peek(channel, "orders", AckMode.REQUEUE, 0);

        assertEquals(bodies.length, result.getMessagesReceived());
        assertTrue(errText().contains("Peek mode uses polling (basic.get)"));
    }

    @Test
    public void testQueueNotFound() {
        RetrievalResult result = peek(new FakeBrokerChannel(), "missing", AckMode.REQUEUE, 1);

        assertEquals("error", result.getStatus());
        assertTrue(errText().contains("✗ Failed to peek from queue"));
    }

}
