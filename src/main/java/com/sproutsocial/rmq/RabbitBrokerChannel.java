package com.sproutsocial.rmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link BrokerChannel} on an AMQP 0-9-1 channel. Owns the connection, closing the channel closes both.
 */
class RabbitBrokerChannel implements BrokerChannel {

    private final Connection connection;
    private final Channel channel;

    private static final Logger logger = LoggerFactory.getLogger(RabbitBrokerChannel.class);

    RabbitBrokerChannel(Connection connection, Channel channel) {
        this.connection = connection;
        this.channel = checkNotNull(channel);
    }

    @Override
    public QueueInfo checkQueue(String queue) throws IOException {
        try {
            AMQP.Queue.DeclareOk ok = channel.queueDeclarePassive(queue);
            logger.debug("queue:{} exists with {} messages and {} consumers", ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount());
            return new QueueInfo(ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount());
        }
        catch (IOException e) {
            if (isNotFound(e)) {
                throw new QueueNotFoundException(queue, e);
            }
            throw e;
        }
    }

    private static boolean isNotFound(IOException e) {
        if (!(e.getCause() instanceof ShutdownSignalException)) {
            return false;
        }
        Method reason = ((ShutdownSignalException) e.getCause()).getReason();
        return reason instanceof AMQP.Channel.Close && ((AMQP.Channel.Close) reason).getReplyCode() == AMQP.NOT_FOUND;
    }

    @Override
    public RetrievedMessage fetch(String queue) throws IOException {
        GetResponse response = channel.basicGet(queue, false);
        if (response == null) {
            return null;
        }
        return toMessage(queue, response.getEnvelope(), response.getProps(), response.getBody());
    }

    @Override
    public String subscribe(final String queue, final DeliveryHandler handler) throws IOException {
        checkNotNull(handler);
        DeliverCallback deliverCallback = new DeliverCallback() {
            @Override
            public void handle(String consumerTag, Delivery delivery) {
                try {
                    handler.accept(toMessage(queue, delivery.getEnvelope(), delivery.getProperties(), delivery.getBody()));
                }
                catch (Throwable t) {
                    logger.error("delivery handler error. consumer:{} tag:{}", consumerTag, delivery.getEnvelope().getDeliveryTag(), t);
                }
            }
        };
        CancelCallback cancelCallback = new CancelCallback() {
            @Override
            public void handle(String consumerTag) {
                logger.warn("consumer:{} cancelled by broker, queue:{}", consumerTag, queue);
                handler.cancelledByBroker(consumerTag);
            }
        };
        return channel.basicConsume(queue, false, deliverCallback, cancelCallback);
    }

    @Override
    public void cancelSubscription(String consumerTag) throws IOException {
        channel.basicCancel(consumerTag);
    }

    @Override
    public void ack(long deliveryTag) throws IOException {
        channel.basicAck(deliveryTag, false);
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) throws IOException {
        channel.basicNack(deliveryTag, false, requeue);
    }

    @Override
    public void setPrefetchCount(int prefetchCount) throws IOException {
        channel.basicQos(prefetchCount);
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        }
        catch (TimeoutException e) {
            throw new IOException("timed out closing channel " + channel.getChannelNumber(), e);
        }
        finally {
            if (connection != null && connection.isOpen()) {
                connection.close();
                logger.info("connection closed:{}", connection);
            }
        }
    }

    static RetrievedMessage toMessage(String queue, Envelope envelope, AMQP.BasicProperties props, byte[] body) {
        return RetrievedMessage.builder()
                .body(body == null ? new byte[0] : body)
                .deliveryTag(envelope.getDeliveryTag())
                .redelivered(envelope.isRedeliver())
                .exchange(envelope.getExchange())
                .routingKey(envelope.getRoutingKey())
                .queue(queue)
                .properties(MessagePropertyExtractor.extractProperties(props))
                .headers(MessagePropertyExtractor.extractHeaders(props))
                .build();
    }

    @Override
    public String toString() {
        return String.format("RabbitBrokerChannel:%d open:%s", channel.getChannelNumber(), channel.isOpen());
    }

}
