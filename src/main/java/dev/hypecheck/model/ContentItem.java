package dev.hypecheck.model;

import lombok.Builder;

/**
 * A submitted story as read from the content store. The enhancement worker
 * never mutates it.
 */
@Builder
public record ContentItem(
        String id,
        String title,
        String body,
        String sourceUrl,
        CompanyContext companyContext) {

    public boolean hasCompany() {
        return companyContext != null && companyContext.id() != null && !companyContext.id().isBlank();
    }
}
