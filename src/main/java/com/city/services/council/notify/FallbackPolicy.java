package com.city.services.council.notify;

import java.util.List;
import java.util.Locale;

import com.city.services.council.supervisor.DepartmentRoster;

/**
 * Chooses where work for a terminated department goes.
 *
 * <p>Category rules, first match on the lower-cased name:</p>
 * <pre>
 *   police, fire          -> emergency_dispatch_center
 *   health, medical       -> fire_department
 *   animal                -> police_department
 *   parks, recreation     -> public_works_department
 *   water, utility        -> public_works_department
 *   anything else         -> emergency_dispatch_center
 * </pre>
 *
 * <p>A fallback is never a permanently failed department: when the category target is known to
 * the roster but not live, the default is used instead.</p>
 */
public class FallbackPolicy {

    public static final String DISPATCH_CENTER = "emergency_dispatch_center";

    private record Rule(List<String> keywords, String fallback) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(List.of("police", "fire"), DISPATCH_CENTER),
            new Rule(List.of("health", "medical"), "fire_department"),
            new Rule(List.of("animal"), "police_department"),
            new Rule(List.of("parks", "recreation"), "public_works_department"),
            new Rule(List.of("water", "utility"), "public_works_department")
    );

    private final DepartmentRoster roster;
    private final String defaultFallback;

    public FallbackPolicy(DepartmentRoster roster, String defaultFallback) {
        this.roster = roster;
        this.defaultFallback = defaultFallback;
    }

    public String fallbackFor(String terminatedDepartment) {
        String name = terminatedDepartment.toLowerCase(Locale.ROOT);
        String candidate = defaultFallback;
        for (Rule rule : RULES) {
            if (rule.keywords().stream().anyMatch(name::contains)) {
                candidate = rule.fallback();
                break;
            }
        }
        if (candidate.equals(terminatedDepartment)
                || (roster.isKnown(candidate) && !roster.isLive(candidate))) {
            return defaultFallback;
        }
        return candidate;
    }
}
