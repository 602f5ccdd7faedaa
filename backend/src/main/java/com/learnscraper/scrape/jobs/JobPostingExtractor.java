package com.learnscraper.scrape.jobs;

import com.learnscraper.scrape.content.ContentStructurer;
import com.learnscraper.scrape.content.StructuredDocument;
import com.learnscraper.scrape.extract.FieldExtractor;
import com.learnscraper.scrape.extract.FieldRule;
import com.learnscraper.scrape.extract.HarvestField;
import com.learnscraper.scrape.extract.KeywordHarvester;
import com.learnscraper.scrape.extract.TextPatternExtractor;
import com.learnscraper.scrape.model.JobPosting;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Builds a {@link JobPosting} from a parsed page using rule chains, keyword harvesting and
 * page-text patterns. Misses leave fields null or lists empty; extraction itself never fails.
 */
@Component
public class JobPostingExtractor {
    private static final String NON_CONTENT_QUERY = "script, style, nav, footer, header";

    private final FieldExtractor fieldExtractor;
    private final KeywordHarvester keywordHarvester;
    private final TextPatternExtractor textPatternExtractor;
    private final ContentStructurer contentStructurer;

    public JobPostingExtractor(
        FieldExtractor fieldExtractor,
        KeywordHarvester keywordHarvester,
        TextPatternExtractor textPatternExtractor,
        ContentStructurer contentStructurer
    ) {
        this.fieldExtractor = fieldExtractor;
        this.keywordHarvester = keywordHarvester;
        this.textPatternExtractor = textPatternExtractor;
        this.contentStructurer = contentStructurer;
    }

    public JobPosting extract(Document document, String sourceUrl, Instant scrapedAt) {
        JobRuleSet rules = JobFieldRules.forUrl(sourceUrl);
        String pageText = textPatternExtractor.pageText(document);

        Element descriptionElement = fieldExtractor.locate(document, rules.description());
        StructuredDocument description = descriptionElement == null
            ? null
            : contentStructurer.structure(descriptionElement);

        return new JobPosting(
            sourceUrl,
            scrapedAt,
            rules.source(),
            fieldExtractor.extract(document, rules.title()),
            fieldExtractor.extract(document, rules.company()),
            fieldExtractor.extract(document, rules.location()),
            extractSalary(document, rules, pageText),
            extractJobType(document, rules, pageText),
            fieldExtractor.extract(document, rules.postedDate()),
            textPatternExtractor.deadline(pageText),
            textPatternExtractor.experienceLevel(pageText),
            textPatternExtractor.education(pageText),
            textPatternExtractor.mentionsRemoteWork(pageText),
            description,
            keywordHarvester.harvest(document, HarvestField.REQUIREMENTS),
            keywordHarvester.harvest(document, HarvestField.RESPONSIBILITIES),
            keywordHarvester.harvest(document, HarvestField.BENEFITS),
            keywordHarvester.harvest(document, HarvestField.SKILLS),
            textPatternExtractor.contactInfo(pageText),
            rawText(document)
        );
    }

    private String extractSalary(Document document, JobRuleSet rules, String pageText) {
        String labeled = fieldExtractor.extract(document, rules.salary());
        if (labeled != null) {
            return labeled;
        }
        return textPatternExtractor.salary(pageText);
    }

    // Exact site rules are trusted as-is; class-name matches must name a known job type.
    private String extractJobType(Document document, JobRuleSet rules, String pageText) {
        for (FieldRule rule : rules.jobType()) {
            String value = fieldExtractor.extract(document, List.of(rule));
            if (value == null) {
                continue;
            }
            if (rule.exactValue() != null) {
                return value;
            }
            String normalized = textPatternExtractor.jobType(value);
            if (normalized != null) {
                return normalized;
            }
        }
        return textPatternExtractor.jobType(pageText);
    }

    private String rawText(Document document) {
        Document copy = document.clone();
        copy.select(NON_CONTENT_QUERY).remove();
        return copy.text();
    }
}
