package com.sproutsocial.rmq;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Owns what retrieval runs share: the broker settings, the executor the pipeline stages run on
 * and the JSON mapper used for results.
 */
@ThreadSafe
public class Client {

    private final BrokerConfig brokerConfig;
    private final ObjectMapper mapper = new ObjectMapper();

    private ListeningExecutorService pipelineExecutor;

    private static final Logger logger = LoggerFactory.getLogger(Client.class);

    public Client(BrokerConfig brokerConfig) {
        this.brokerConfig = checkNotNull(brokerConfig);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public Client() {
        this(new BrokerConfig());
    }

    /**
     * Opens a connection and one channel on it. Closing the returned channel closes the connection.
     */
    public BrokerChannel openChannel() throws IOException {
        ConnectionFactory factory = newConnectionFactory();
        Connection connection = null;
        try {
            connection = factory.newConnection(brokerConfig.getClientName());
            Channel channel = connection.createChannel();
            logger.info("connected {}:{}{} client:{}", brokerConfig.getHost(), brokerConfig.getPort(),
                    brokerConfig.getVirtualHost(), brokerConfig.getClientName());
            return new RabbitBrokerChannel(connection, channel);
        }
        catch (TimeoutException e) {
            throw new IOException("timed out connecting to " + brokerConfig.getHost() + ":" + brokerConfig.getPort(), e);
        }
        catch (IOException | RuntimeException e) {
            Util.closeQuietly(connection);
            throw e;
        }
    }

    protected ConnectionFactory newConnectionFactory() {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(brokerConfig.getHost());
        factory.setPort(brokerConfig.getPort());
        factory.setVirtualHost(brokerConfig.getVirtualHost());
        factory.setUsername(brokerConfig.getUser());
        factory.setPassword(brokerConfig.getPassword());
        factory.setConnectionTimeout(brokerConfig.getConnectionTimeoutMillis());
        factory.setAutomaticRecoveryEnabled(false); //delivery tags do not survive a reconnect
        if (brokerConfig.isUseTls()) {
            try {
                factory.useSslProtocol();
            }
            catch (GeneralSecurityException e) {
                throw new RmqException("could not set up TLS", e);
            }
        }
        return factory;
    }

    public synchronized void setExecutor(ExecutorService exec) {
        checkNotNull(exec);
        checkState(this.pipelineExecutor == null, "executor can only be set once, must be set before the first retrieval");
        this.pipelineExecutor = MoreExecutors.listeningDecorator(exec);
    }

    public synchronized ListeningExecutorService getExecutor() {
        if (pipelineExecutor == null) {
            pipelineExecutor = MoreExecutors.listeningDecorator(
                    Executors.newCachedThreadPool(Util.threadFactory("rmq-pipeline")));
        }
        return pipelineExecutor;
    }

    /**
     * Stops the pipeline executor, waiting for running stages to finish.
     * @param waitMillis soft limit on the wait
     * @return true if everything stopped in time
     */
    public synchronized boolean stop(int waitMillis) {
        checkArgument(waitMillis > 0, "waitMillis must be greater than zero");
        if (pipelineExecutor == null) {
            return true;
        }
        logger.info("stopping rmq client");
        boolean isClean = MoreExecutors.shutdownAndAwaitTermination(pipelineExecutor, waitMillis, TimeUnit.MILLISECONDS);
        logger.debug("pipelineExecutor.isTerminated:{} isClean:{}", pipelineExecutor.isTerminated(), isClean);
        return isClean;
    }

    public BrokerConfig getBrokerConfig() {
        return brokerConfig;
    }

    public final ObjectMapper getObjectMapper() {
        return mapper;
    }

}
