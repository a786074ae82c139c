package dev.hypecheck.model;

import lombok.Builder;

import java.util.List;

/**
 * Company the story is about, as known to the content store.
 */
@Builder
public record CompanyContext(
        String id,
        String name,
        List<String> sectorTags,
        String ethicsStatementUrl,
        String privacyPolicyUrl,
        Double credibilityScore,
        Double ethicsScore) {

    public CompanyContext {
        sectorTags = sectorTags == null ? List.of() : List.copyOf(sectorTags);
    }
}
