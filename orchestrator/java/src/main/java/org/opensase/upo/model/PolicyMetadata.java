package org.opensase.upo.model;

import java.time.Instant;

/**
 * Provenance of an intent document.
 */
public record PolicyMetadata(
        String version,
        String author,
        Instant timestamp
) {}
