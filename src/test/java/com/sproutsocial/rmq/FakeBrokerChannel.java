package com.sproutsocial.rmq;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * In memory broker channel. Keeps queues of messages, hands out increasing delivery tags, records every
 * acknowledgment in call order and returns unacknowledged messages to their queue on close.
 */
public class FakeBrokerChannel implements BrokerChannel {

    private final Map<String, LinkedList<RetrievedMessage>> queues = new HashMap<String, LinkedList<RetrievedMessage>>();
    private final TreeMap<Long, RetrievedMessage> unacked = new TreeMap<Long, RetrievedMessage>();
    private final List<AckIntent> acknowledgments = new ArrayList<AckIntent>();
    private final Set<Long> failingAcks = new HashSet<Long>();
    private final Set<String> cancelledConsumers = new HashSet<String>();
    private long nextTag = 1;
    private int consumerCount = 0;
    private int prefetchCount = 0;
    private boolean open = true;
    private volatile Thread deliveryThread;

    public synchronized FakeBrokerChannel addQueue(String queue, String... bodies) {
        LinkedList<RetrievedMessage> messages = queues.get(queue);
        if (messages == null) {
            messages = new LinkedList<RetrievedMessage>();
            queues.put(queue, messages);
        }
        for (String body : bodies) {
            messages.add(RetrievedMessage.builder()
                    .body(body.getBytes(StandardCharsets.UTF_8))
                    .exchange("")
                    .routingKey(queue)
                    .queue(queue)
                    .build());
        }
        return this;
    }

    public synchronized void failAck(long deliveryTag) {
        failingAcks.add(deliveryTag);
    }

    @Override
    public synchronized QueueInfo checkQueue(String queue) throws IOException {
        LinkedList<RetrievedMessage> messages = queues.get(queue);
        if (messages == null) {
            throw new QueueNotFoundException(queue, null);
        }
        return new QueueInfo(queue, messages.size(), consumerCount);
    }

    @Override
    public synchronized RetrievedMessage fetch(String queue) throws IOException {
        checkOpen();
        LinkedList<RetrievedMessage> messages = queues.get(queue);
        if (messages == null || messages.isEmpty()) {
            return null;
        }
        return deliver(messages.removeFirst());
    }

    private RetrievedMessage deliver(RetrievedMessage stored) {
        long tag = nextTag++;
        RetrievedMessage delivered = RetrievedMessage.builder()
                .body(stored.getBody())
                .deliveryTag(tag)
                .redelivered(stored.isRedelivered())
                .exchange(stored.getExchange())
                .routingKey(stored.getRoutingKey())
                .queue(stored.getQueue())
                .properties(stored.getProperties())
                .headers(stored.getHeaders())
                .build();
        unacked.put(tag, delivered);
        return delivered;
    }

    private synchronized RetrievedMessage nextDelivery(String queue, String consumerTag) {
        if (!open || cancelledConsumers.contains(consumerTag)) {
            return null;
        }
        LinkedList<RetrievedMessage> messages = queues.get(queue);
        return messages.isEmpty() ? null : deliver(messages.removeFirst());
    }

    private synchronized boolean isConsuming(String consumerTag) {
        return open && !cancelledConsumers.contains(consumerTag);
    }

    /**
     * Delivers from a background thread until the consumer is cancelled or the channel closes.
     */
    @Override
    public synchronized String subscribe(final String queue, final DeliveryHandler handler) throws IOException {
        checkOpen();
        if (!queues.containsKey(queue)) {
            throw new QueueNotFoundException(queue, null);
        }
        final String consumerTag = "consumer-" + (++consumerCount);
        Thread thread = new Thread(new Runnable() {
            public void run() {
                while (isConsuming(consumerTag)) {
                    RetrievedMessage message = nextDelivery(queue, consumerTag);
                    if (message == null) {
                        Util.sleepQuietly(5);
                        continue;
                    }
                    handler.accept(message);
                }
            }
        }, "fake-delivery-" + consumerTag);
        thread.setDaemon(true);
        deliveryThread = thread;
        thread.start();
        return consumerTag;
    }

    @Override
    public synchronized void cancelSubscription(String consumerTag) throws IOException {
        cancelledConsumers.add(consumerTag);
    }

    @Override
    public synchronized void ack(long deliveryTag) throws IOException {
        settle(deliveryTag, AckMode.ACK);
    }

    @Override
    public synchronized void reject(long deliveryTag, boolean requeue) throws IOException {
        settle(deliveryTag, requeue ? AckMode.REQUEUE : AckMode.REJECT);
    }

    private void settle(long deliveryTag, AckMode outcome) throws IOException {
        checkOpen();
        if (failingAcks.contains(deliveryTag)) {
            throw new IOException("ack failed for " + deliveryTag);
        }
        RetrievedMessage message = unacked.remove(deliveryTag);
        if (message == null) {
            throw new IOException("unknown delivery tag " + deliveryTag);
        }
        acknowledgments.add(new AckIntent(deliveryTag, outcome));
        if (outcome == AckMode.REQUEUE) {
            returnToQueue(message);
        }
    }

    private void returnToQueue(RetrievedMessage message) {
        queues.get(message.getQueue()).addFirst(RetrievedMessage.builder()
                .body(message.getBody())
                .redelivered(true)
                .exchange(message.getExchange())
                .routingKey(message.getRoutingKey())
                .queue(message.getQueue())
                .properties(message.getProperties())
                .headers(message.getHeaders())
                .build());
    }

    @Override
    public synchronized void setPrefetchCount(int prefetchCount) throws IOException {
        this.prefetchCount = prefetchCount;
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    @Override
    public synchronized void close() throws IOException {
        if (!open) {
            return;
        }
        open = false;
        for (RetrievedMessage message : unacked.descendingMap().values()) {
            returnToQueue(message);
        }
        unacked.clear();
    }

    private void checkOpen() throws IOException {
        if (!open) {
            throw new IOException("channel closed");
        }
    }

    public void awaitDeliveryStopped(long timeoutMillis) throws InterruptedException {
        Thread thread = deliveryThread;
        if (thread != null) {
            thread.join(timeoutMillis);
        }
    }

    public synchronized List<AckIntent> getAcknowledgments() {
        return new ArrayList<AckIntent>(acknowledgments);
    }

    public synchronized List<AckIntent> getAcknowledgments(AckMode outcome) {
        List<AckIntent> matching = new ArrayList<AckIntent>();
        for (AckIntent ack : acknowledgments) {
            if (ack.getOutcome() == outcome) {
                matching.add(ack);
            }
        }
        return matching;
    }

    public synchronized int getQueueSize(String queue) {
        return queues.get(queue).size();
    }

    public synchronized Set<String> getCancelledConsumers() {
        return Collections.unmodifiableSet(new HashSet<String>(cancelledConsumers));
    }

    public synchronized int getPrefetchCount() {
        return prefetchCount;
    }

}
