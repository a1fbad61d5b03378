package com.city.services.admin;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.city.services.council.CityCouncil;
import com.city.services.council.HealthSummary;
import com.city.services.dispatch.DispatchRouter;
import com.city.services.routing.RoutingTable;

/**
 * Read-only admin endpoints over the council and dispatch center of this node.
 *
 * Enabled by default; disable via:
 *   city.admin.enabled=false
 */
@RestController
@RequestMapping(path = "/admin", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "city.admin", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CouncilAdminController {

    private final ObjectProvider<CityCouncil> council;
    private final ObjectProvider<DispatchRouter> dispatch;

    public CouncilAdminController(ObjectProvider<CityCouncil> council, ObjectProvider<DispatchRouter> dispatch) {
        this.council = council;
        this.dispatch = dispatch;
    }

    @GetMapping("/ping")
    public Map<String, Object> ping() {
        return Map.of("status", "ok");
    }

    @GetMapping("/departments")
    public Map<String, Object> departments() {
        CityCouncil c = requireCouncil();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("departments", c.supervisor().snapshots());
        out.put("draining", c.supervisor().isDraining());
        return out;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        CityCouncil c = requireCouncil();
        HealthSummary s = c.healthSummary();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", c.status());
        out.put("healthy", s.healthy());
        out.put("warning", s.warning());
        out.put("unhealthy", s.unhealthy());
        out.put("monitored", s.monitored());
        return out;
    }

    @GetMapping("/routing")
    public Map<String, Object> routing() {
        Map<String, Object> out = new LinkedHashMap<>();
        CityCouncil c = council.getIfAvailable();
        if (c != null) {
            out.put("council", describe(c.routing()));
        }
        DispatchRouter d = dispatch.getIfAvailable();
        if (d != null) {
            Map<String, Object> mirror = describe(d.routing());
            mirror.put("available", d.directory().names());
            mirror.put("staged", d.stagedCount());
            out.put("dispatch", mirror);
        }
        return out;
    }

    @GetMapping("/routing/resolve/{name}")
    public Map<String, Object> resolve(@PathVariable String name) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        CityCouncil c = council.getIfAvailable();
        if (c != null) {
            out.put("council", c.routing().resolve(name));
        }
        DispatchRouter d = dispatch.getIfAvailable();
        if (d != null) {
            out.put("dispatch", d.routing().resolve(name));
        }
        return out;
    }

    @GetMapping("/dispatch/stats")
    public Object dispatchStats() {
        DispatchRouter d = dispatch.getIfAvailable();
        if (d == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "dispatch center not enabled on this node");
        }
        return d.stats();
    }

    private CityCouncil requireCouncil() {
        CityCouncil c = council.getIfAvailable();
        if (c == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "council not enabled on this node");
        }
        return c;
    }

    private static Map<String, Object> describe(RoutingTable table) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("edges", table.edges());
        out.put("fallbacks", table.fallbacks());
        return out;
    }
}
