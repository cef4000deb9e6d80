package org.opensase.upo.adapter;

import org.opensase.upo.graph.PolicyDestination;
import org.opensase.upo.graph.ResolvedRule;

import java.util.Locale;

/**
 * Stable native object names. Names derive from the (source, destination) pair only, so a
 * rule keeps its name across compiles and diffs see a modification, not a replacement.
 */
public final class NativeNames {

    private NativeNames() {}

    public static String slug(String raw) {
        String s = raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        s = s.replaceAll("^-+", "").replaceAll("-+$", "");
        return s.isEmpty() ? "x" : s;
    }

    public static String ruleName(ResolvedRule rule) {
        return slug(rule.source().name()) + "-to-" + destinationSlug(rule.destination());
    }

    public static String destinationSlug(PolicyDestination destination) {
        switch (destination.kind()) {
            case APPLICATION:
                return slug(destination.name() + "-" + destination.protocol() + "-" + destination.port());
            case SEGMENT:
                return "seg-" + slug(destination.name());
            default:
                return "net-" + slug(destination.name());
        }
    }
}
