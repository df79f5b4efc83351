package com.carelog.jetstream.config;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.carelog.chatwoot.ChatwootProperties;
import com.carelog.followup.FollowUpProperties;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * Spring configuration that wires up:
 * - NATS {@link Connection}
 * - JetStream client APIs ({@link JetStream} and {@link JetStreamManagement})
 * - Property binding for the connection, stream, follow-up and Chatwoot settings
 *
 * <h2>Auth modes</h2>
 * <ul>
 *   <li>none: {@code Nats.connect(url)}</li>
 *   <li>user/password, token or creds file, optionally with TLS: an {@link Options} connect</li>
 * </ul>
 * Secrets are never logged; the username is masked.
 */
@Configuration
@EnableConfigurationProperties({
        NatsConnectionProperties.class,
        JetStreamBootstrapProperties.class,
        CheckinStreamProperties.class,
        FollowUpProperties.class,
        ChatwootProperties.class
})
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsConnectionProperties props) throws IOException, InterruptedException {
        if (!wantsOptions(props)) {
            log.info("Connecting to NATS url={}", props.getUrl());
            return Nats.connect(props.getUrl());
        }

        Connection c = Nats.connect(buildOptions(props));
        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})",
                props.getUrl(),
                props.isTls(),
                props.getUser() == null ? "" : mask(props.getUser()),
                props.getCreds() == null ? "" : props.getCreds());
        return c;
    }

    @Bean
    public JetStream jetStream(Connection connection) throws IOException {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws IOException {
        return connection.jetStreamManagement();
    }

    static boolean wantsOptions(NatsConnectionProperties props) {
        return hasText(props.getUser())
                || hasText(props.getPassword())
                || hasText(props.getToken())
                || hasText(props.getCreds())
                || props.isTls();
    }

    static Options buildOptions(NatsConnectionProperties props) {
        Options.Builder builder = new Options.Builder()
                .server(props.getUrl())
                .connectionName(props.getConnectionName());

        if (props.isTls()) {
            try {
                builder.secure();
            } catch (Exception e) {
                throw new IllegalStateException("Unable to initialise TLS for NATS connection", e);
            }
        }
        if (hasText(props.getToken())) {
            builder.token(props.getToken().toCharArray());
        }
        if (hasText(props.getUser())) {
            String pass = props.getPassword() == null ? "" : props.getPassword();
            builder.userInfo(props.getUser().toCharArray(), pass.toCharArray());
        }
        if (hasText(props.getCreds())) {
            builder.authHandler(Nats.credentials(props.getCreds()));
        }
        return builder.build();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static String mask(String s) {
        if (s.length() <= 2) {
            return "**";
        }
        return s.charAt(0) + "***" + s.charAt(s.length() - 1);
    }
}
