package com.learnscraper.scrape.model;

import com.learnscraper.scrape.content.StructuredDocument;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record JobPosting(
    String url,
    Instant scrapedAt,
    String source,
    String title,
    String company,
    String location,
    String salary,
    String jobType,
    String postedDate,
    String deadline,
    String experienceLevel,
    String education,
    boolean remote,
    StructuredDocument description,
    List<String> requirements,
    List<String> responsibilities,
    List<String> benefits,
    List<String> skills,
    Map<String, String> contactInfo,
    String rawText
) {
    public JobPosting {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        responsibilities = responsibilities == null ? List.of() : List.copyOf(responsibilities);
        benefits = benefits == null ? List.of() : List.copyOf(benefits);
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
