package org.opensase.upo.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A user or group that can appear as the source of an egress rule.
 *
 * @param cidrs source addresses the identity is known to originate from; lets
 *              address-based targets match the identity
 */
public record Identity(
        String name,
        IdentityType type,
        Map<String, String> attributes,
        List<String> members,
        List<String> cidrs
) {
    public Identity {
        attributes = attributes != null ? Collections.unmodifiableMap(new TreeMap<>(attributes)) : Map.of();
        members = members != null ? List.copyOf(members) : List.of();
        cidrs = cidrs != null ? List.copyOf(cidrs) : List.of();
    }

    public enum IdentityType {
        USER("user"),
        GROUP("group");

        private final String value;

        IdentityType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }
}
