package com.sproutsocial.rmq;

/**
 * The broker answered a passive declare with 404, the queue does not exist on the virtual host.
 */
public class QueueNotFoundException extends RmqException {

    private final String queue;

    public QueueNotFoundException(String queue, Throwable cause) {
        super("Queue '" + queue + "' not found", cause);
        this.queue = queue;
    }

    public String getQueue() {
        return queue;
    }

}
