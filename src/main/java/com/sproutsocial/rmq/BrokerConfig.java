package com.sproutsocial.rmq;

/**
 * Connection settings for the broker. Loading them (config file, command line) is up to the caller.
 */
public class BrokerConfig {

    private String host = "localhost";
    private int port = 5672;
    private String virtualHost = "/";
    private String user = "guest";
    private String password = "guest";
    private String clientName = "rmq-cli-tool";
    private boolean useTls = false;
    private int connectionTimeoutMillis = 30000;

    //region accessors
    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public void setVirtualHost(String virtualHost) {
        this.virtualHost = virtualHost;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public boolean isUseTls() {
        return useTls;
    }

    public void setUseTls(boolean useTls) {
        this.useTls = useTls;
    }

    public int getConnectionTimeoutMillis() {
        return connectionTimeoutMillis;
    }

    public void setConnectionTimeoutMillis(int connectionTimeoutMillis) {
        this.connectionTimeoutMillis = connectionTimeoutMillis;
    }
    //endregion

    @Override
    public String toString() {
        return "BrokerConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", virtualHost='" + virtualHost + '\'' +
                ", user='" + user + '\'' +
                ", clientName='" + clientName + '\'' +
                ", useTls=" + useTls +
                ", connectionTimeoutMillis=" + connectionTimeoutMillis +
                '}';
    }

}
