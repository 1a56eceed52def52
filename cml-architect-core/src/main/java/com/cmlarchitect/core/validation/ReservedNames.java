package com.cmlarchitect.core.validation;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Names that Context Mapper tooling treats as structural and that therefore cannot name an
 * aggregate, entity, value object, domain event, command or service.
 *
 * <p>Unlike attribute names, these are never escaped: a document using them is rejected.
 */
public final class ReservedNames {

    private static final Set<String> RESERVED = Set.of(
        "resource", "aggregate", "entity", "valueobject", "domainevent", "command",
        "commandevent", "service", "module", "boundedcontext", "contextmap", "repository",
        "application", "domain", "subdomain", "trait", "datatransferobject"
    );

    private ReservedNames() {
        // Utility class
    }

    /**
     * Checks a domain object name against the blacklist, ignoring case.
     *
     * @param name candidate name
     * @return check result with replacement suggestions when reserved
     */
    public static ReservedNameCheck isReservedDomainObjectName(String name) {
        if (name == null || !RESERVED.contains(name.toLowerCase(Locale.ROOT))) {
            return ReservedNameCheck.allowed();
        }
        String base = capitalize(name);
        List<String> suggestions = Stream.of(base + "Item", base + "Info", "Managed" + base)
            .filter(candidate -> !RESERVED.contains(candidate.toLowerCase(Locale.ROOT)))
            .toList();
        return new ReservedNameCheck(true, suggestions);
    }

    private static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
