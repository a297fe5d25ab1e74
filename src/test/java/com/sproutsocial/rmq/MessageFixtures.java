package com.sproutsocial.rmq;

import java.util.ArrayList;
import java.util.List;

public class MessageFixtures {

    public static RetrievedMessage message(long tag, String body) {
        return RetrievedMessage.builder()
                .body(body)
                .deliveryTag(tag)
                .exchange("amq.direct")
                .routingKey("orders")
                .queue("orders")
                .build();
    }

    /**
     * A closed receive queue holding messages tagged 1..count.
     */
    public static HandoffQueue<RetrievedMessage> receiveQueue(int count) {
        HandoffQueue<RetrievedMessage> queue = new HandoffQueue<RetrievedMessage>("receive");
        for (int i = 1; i <= count; i++) {
            queue.put(message(i, "message " + i));
        }
        queue.close();
        return queue;
    }

    public static List<AckIntent> drain(HandoffQueue<AckIntent> ackQueue) throws InterruptedException {
        List<AckIntent> intents = new ArrayList<AckIntent>();
        AckIntent intent;
        while ((intent = ackQueue.take()) != null) {
            intents.add(intent);
        }
        return intents;
    }

}
