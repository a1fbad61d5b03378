package com.city.services.bus.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * Spring configuration that wires up:
 * - NATS {@link Connection}
 * - JetStream client APIs ({@link JetStream} and {@link JetStreamManagement})
 * - Property binding for the bus configuration classes
 *
 * <h2>Connection strategy</h2>
 * <ol>
 *   <li>No auth/TLS configured: {@code Nats.connect(url)}.</li>
 *   <li>Otherwise an {@link Options} instance is built with whichever of token,
 *       user/password, creds file and TLS are set.</li>
 * </ol>
 */
@Configuration
@EnableConfigurationProperties({
        CityProperties.class,
        BusProperties.class
})
public class NatsBusConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsBusConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(CityProperties props) throws Exception {
        String url = props.getNatsUrl();

        if (!wantsOptions(props)) {
            return Nats.connect(url);
        }

        Options.Builder builder = new Options.Builder().server(url);

        if (props.isNatsTls()) {
            builder.secure();
        }
        if (notBlank(props.getNatsToken())) {
            builder.token(props.getNatsToken().toCharArray());
        }
        if (notBlank(props.getNatsUser())) {
            String pass = props.getNatsPassword() == null ? "" : props.getNatsPassword();
            builder.userInfo(props.getNatsUser(), pass);
        }
        if (notBlank(props.getNatsCreds())) {
            builder.authHandler(Nats.credentials(props.getNatsCreds()));
        }

        Connection c = Nats.connect(builder.build());

        // Never log secrets; the user name is masked.
        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})",
                url,
                props.isNatsTls(),
                props.getNatsUser() == null ? "" : mask(props.getNatsUser()),
                props.getNatsCreds() == null ? "" : props.getNatsCreds());

        return c;
    }

    @Bean
    public JetStream jetStream(Connection connection) throws Exception {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws Exception {
        return connection.jetStreamManagement();
    }

    private static boolean wantsOptions(CityProperties props) {
        return notBlank(props.getNatsUser())
                || notBlank(props.getNatsPassword())
                || notBlank(props.getNatsToken())
                || notBlank(props.getNatsCreds())
                || props.isNatsTls();
    }

    private static boolean notBlank(String v) {
        return v != null && !v.isBlank();
    }

    /**
     * Light obfuscation for logging: "admin" becomes "a***n".
     */
    static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
