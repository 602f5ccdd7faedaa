package com.learnscraper.scrape.jobs;

import com.learnscraper.scrape.extract.FieldRule;

import java.util.List;

/**
 * Rule chains for one family of job sites. {@code source} is null for the generic set.
 */
public record JobRuleSet(
    String source,
    List<FieldRule> title,
    List<FieldRule> company,
    List<FieldRule> location,
    List<FieldRule> salary,
    List<FieldRule> jobType,
    List<FieldRule> description,
    List<FieldRule> postedDate
) {
}
