package com.carelog.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * NATS connection settings.
 *
 * <pre>
 * carelog:
 *   nats:
 *     url: nats://localhost:4222
 *     user: ...
 *     password: ...
 *     token: ...
 *     creds: /path/to/user.creds
 *     tls: false
 * </pre>
 *
 * Secrets should come from the environment, not from committed config files.
 */
@ConfigurationProperties(prefix = "carelog.nats")
public class NatsConnectionProperties {

    private String url = "nats://localhost:4222";

    /** Shown in the server's connection list. */
    private String connectionName = "carelog-core";

    private String user;

    private String password;

    private String token;

    /** Path to a {@code .creds} file for NKey/JWT auth. */
    private String creds;

    private boolean tls = false;

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getConnectionName() { return connectionName; }
    public void setConnectionName(String connectionName) { this.connectionName = connectionName; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public String getCreds() { return creds; }
    public void setCreds(String creds) { this.creds = creds; }

    public boolean isTls() { return tls; }
    public void setTls(boolean tls) { this.tls = tls; }
}
