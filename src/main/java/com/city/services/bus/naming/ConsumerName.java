package com.city.services.bus.naming;

import com.city.services.core.subject.CitySubject;

/**
 * Builds durable consumer names using a strict, deterministic convention.
 *
 * <h2>Format (LOCKED)</h2>
 * <pre>
 * &lt;city&gt;_&lt;role&gt;__&lt;channel&gt;
 * </pre>
 *
 * <p>The same service restart produces the same name, so subscribing is create-or-resume
 * rather than creating duplicates. {@code "__"} separates the service identity from the
 * channel because single underscores already occur inside service names.</p>
 *
 * <p><b>Examples</b></p>
 * <pre>
 * springfield_city_council__inbox
 * springfield_emergency_dispatch_center__announcements
 * </pre>
 *
 * <p>Changing the format orphans existing durable consumers.</p>
 */
public final class ConsumerName {

    private ConsumerName() {}

    /**
     * @param city    deployment id
     * @param role    service that owns the consumer
     * @param channel short label of what the consumer filters
     * @throws IllegalArgumentException when a part is not a valid subject token
     */
    public static String of(String city, String role, String channel) {
        CitySubject.requireToken(city, "city");
        CitySubject.requireToken(role, "role");
        CitySubject.requireToken(channel, "channel");
        return city + "_" + role + "__" + channel;
    }
}
