package org.opensase.upo.adapter;

/**
 * A rule the target cannot express at all. Attached to the {@link CompiledConfig}
 * instead of dropping the rule.
 *
 * @param construct the inexpressible part, e.g. {@code source:segment} or {@code inspection:deep}
 */
public record CapabilityError(String ruleId, String construct, String message) {

    @Override
    public String toString() {
        return ruleId + ": " + message;
    }
}
