package com.city.services.bus.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Identity of this city deployment plus NATS connection settings.
 *
 * <h2>Binding</h2>
 * Properties are bound from Spring Boot config using the prefix {@code city}, e.g.:
 * <pre>
 * city:
 *   id: springfield
 *   council-name: city_council
 *   dispatch-name: emergency_dispatch_center
 *   nats-url: nats://localhost:4222
 *   nats-user: ...
 *   nats-password: ...
 *   nats-token: ...
 *   nats-creds: /path/to/user.creds
 *   nats-tls: false
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>{@code id} is part of every durable consumer name; changing it orphans existing consumers.</li>
 *   <li>The service names are the recipient tokens other services address; they must stay stable.</li>
 *   <li>Secrets should come from the environment rather than committed config files.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "city")
public class CityProperties {

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    /**
     * Deployment identifier. Scopes durable consumer names so that two cities can share one
     * NATS account.
     *
     * <p><b>Default</b>: {@code springfield}</p>
     */
    private String id = "springfield";

    /**
     * Recipient token of the council (orchestrator). Departments send health replies and
     * analyzers send recommendations to {@code city.<type>.<councilName>}.
     */
    private String councilName = "city_council";

    /**
     * Recipient token of the dispatch center, the default routing-aware consumer.
     */
    private String dispatchName = "emergency_dispatch_center";

    /**
     * Recipient token used for announcements every service listens to.
     */
    private String broadcastName = "all";

    // ---------------------------------------------------------------------
    // NATS connectivity
    // ---------------------------------------------------------------------

    private String natsUrl = "nats://localhost:4222";

    /** Optional username for user/password authentication. */
    private String natsUser;

    /** Optional password. Treat as a secret; never logged. */
    private String natsPassword;

    /** Optional token for token-based authentication. */
    private String natsToken;

    /** Optional path to a {@code .creds} file used for NKey/JWT authentication. */
    private String natsCreds;

    /** Enables TLS at the client level. */
    private boolean natsTls = false;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getCouncilName() { return councilName; }
    public void setCouncilName(String councilName) { this.councilName = councilName; }

    public String getDispatchName() { return dispatchName; }
    public void setDispatchName(String dispatchName) { this.dispatchName = dispatchName; }

    public String getBroadcastName() { return broadcastName; }
    public void setBroadcastName(String broadcastName) { this.broadcastName = broadcastName; }

    public String getNatsUrl() { return natsUrl; }
    public void setNatsUrl(String natsUrl) { this.natsUrl = natsUrl; }

    public String getNatsUser() { return natsUser; }
    public void setNatsUser(String natsUser) { this.natsUser = natsUser; }

    public String getNatsPassword() { return natsPassword; }
    public void setNatsPassword(String natsPassword) { this.natsPassword = natsPassword; }

    public String getNatsToken() { return natsToken; }
    public void setNatsToken(String natsToken) { this.natsToken = natsToken; }

    public String getNatsCreds() { return natsCreds; }
    public void setNatsCreds(String natsCreds) { this.natsCreds = natsCreds; }

    public boolean isNatsTls() { return natsTls; }
    public void setNatsTls(boolean natsTls) { this.natsTls = natsTls; }
}
