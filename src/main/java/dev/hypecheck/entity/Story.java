package dev.hypecheck.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A submitted story with its current scores.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "stories", indexes = {
        @Index(name = "idx_enhanced", columnList = "enhanced"),
        @Index(name = "idx_created_at", columnList = "createdAt")
})
public class Story {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String body;

    @Column(length = 2048)
    private String sourceUrl;

    @Column(length = 64)
    private String companyId;

    private String companyName;

    /**
     * Comma-separated sector tags.
     */
    @Column(length = 1000)
    private String companySectorTags;

    private Double companyCredibilityScore;

    private Double companyEthicsScore;

    @Column(length = 2048)
    private String companyEthicsStatementUrl;

    @Column(length = 2048)
    private String companyPrivacyPolicyUrl;

    private Double hypeScore;

    private Double ethicsScore;

    /**
     * Comma-separated impact tags.
     */
    @Column(length = 500)
    private String impactTags;

    @Column(columnDefinition = "TEXT")
    private String realityCheck;

    @Column(columnDefinition = "TEXT")
    private String eli5Summary;

    @Column(length = 1000)
    private String hypeJustification;

    @Column(length = 1000)
    private String ethicsJustification;

    private Double confidence;

    @Column(nullable = false)
    private boolean enhanced;

    private LocalDateTime scoredAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
