package dev.hypecheck.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexicons and weights for the heuristic scorer.
 * Loaded from application.yml under 'scoring' prefix; the defaults below are
 * the production lexicons.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private double hypeBase = 1.0;
    private double hypeTermWeight = 0.8;
    private double exclamationWeight = 0.3;
    private double technicalTermWeight = 0.2;

    private double ethicsBase = 5.0;
    private double privacyTermWeight = 0.5;
    private double laborPenalty = 2.0;
    private double environmentBonus = 1.0;

    private List<String> hypeTerms = new ArrayList<>(List.of(
            "revolutionary", "breakthrough", "unprecedented", "groundbreaking", "game-changing",
            "game-changer", "cutting-edge", "disruptive", "transformative", "paradigm shift",
            "amazing", "incredible", "mind-blowing", "world-changing", "life-changing",
            "first-ever", "never-before-seen", "world-class", "best-in-class", "industry-leading"));

    private List<String> technicalTerms = new ArrayList<>(List.of(
            "version", "algorithm", "module", "fixes", "database", "authentication",
            "benchmark", "methodology", "implementation", "architecture", "latency",
            "peer-reviewed", "dataset", "evaluation"));

    private List<String> privacyTerms = new ArrayList<>(List.of(
            "privacy", "encryption", "encrypted", "consent", "audit", "audits",
            "opt-out", "data minimization", "transparent", "transparency"));

    private List<String> laborTerms = new ArrayList<>(List.of(
            "replaces", "replace", "replacing", "layoff", "layoffs", "laid off",
            "automation", "workers", "job cuts", "headcount reduction"));

    private List<String> environmentTerms = new ArrayList<>(List.of(
            "environment", "environmental", "carbon", "emissions", "sustainability",
            "sustainable", "renewable", "climate"));

    private List<String> safetyTerms = new ArrayList<>(List.of(
            "safety", "unsafe", "recall", "hazard", "injury", "injuries",
            "vulnerability", "risk", "risks"));
}
