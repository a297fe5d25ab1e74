package com.sproutsocial.rmq;

public enum AckMode {

    /** acknowledge, the broker removes the message from the queue */
    ACK,

    /** negative acknowledge without requeue, the message is dropped (or dead lettered) */
    REJECT,

    /** negative acknowledge with requeue, the message goes back on the queue */
    REQUEUE

}
