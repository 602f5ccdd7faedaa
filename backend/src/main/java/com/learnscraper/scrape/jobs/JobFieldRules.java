package com.learnscraper.scrape.jobs;

import com.learnscraper.scrape.extract.FieldRule;
import com.learnscraper.scrape.util.UrlUtils;

import java.util.ArrayList;
import java.util.List;

import static com.learnscraper.scrape.extract.FieldRule.classMatching;
import static com.learnscraper.scrape.extract.FieldRule.exact;
import static com.learnscraper.scrape.extract.FieldRule.idMatching;
import static com.learnscraper.scrape.extract.FieldRule.metaContent;
import static com.learnscraper.scrape.extract.FieldRule.tag;

public final class JobFieldRules {
    private static final String SEEK_HOST = "seek.com.au";
    private static final String SEEK_ATTRIBUTE = "data-automation";

    static final JobRuleSet GENERIC = new JobRuleSet(
        null,
        List.of(
            classMatching("h1", "job.*title"),
            classMatching("h1", "title"),
            tag("h1"),
            classMatching("h2", "job.*title"),
            metaContent("property", "og:title"),
            tag("title")
        ),
        List.of(
            classMatching("span", "company"),
            classMatching("div", "company"),
            classMatching("a", "company"),
            metaContent("property", "og:site_name")
        ),
        List.of(
            classMatching("span", "location"),
            classMatching("div", "location"),
            classMatching("p", "location")
        ),
        List.of(
            classMatching("span", "salary|compensation|pay"),
            classMatching("div", "salary|compensation|pay")
        ),
        List.of(
            classMatching("span", "job.*type|employment.*type|work.*type"),
            classMatching("div", "job.*type|employment.*type|work.*type")
        ),
        List.of(
            classMatching("div", "job.*description|description"),
            classMatching("section", "job.*description|description"),
            idMatching("div", "job.*description|description")
        ),
        List.of(
            tag("time").preferringAttribute("datetime"),
            classMatching("span", "date|posted"),
            classMatching("div", "date|posted")
        )
    );

    static final JobRuleSet SEEK = new JobRuleSet(
        SEEK_HOST,
        withGeneric(GENERIC.title(), exact("h1", SEEK_ATTRIBUTE, "job-detail-title")),
        withGeneric(
            GENERIC.company(),
            exact("span", SEEK_ATTRIBUTE, "advertiser-name"),
            exact("a", SEEK_ATTRIBUTE, "company-link")
        ),
        withGeneric(
            GENERIC.location(),
            exact("span", SEEK_ATTRIBUTE, "job-detail-location"),
            exact("a", SEEK_ATTRIBUTE, "job-detail-location")
        ),
        withGeneric(GENERIC.salary(), exact("span", SEEK_ATTRIBUTE, "job-detail-salary")),
        withGeneric(GENERIC.jobType(), exact("span", SEEK_ATTRIBUTE, "job-detail-work-type")),
        withGeneric(GENERIC.description(), exact("div", SEEK_ATTRIBUTE, "jobAdDetails")),
        withGeneric(GENERIC.postedDate(), exact("span", SEEK_ATTRIBUTE, "job-detail-date"))
    );

    private JobFieldRules() {
    }

    public static JobRuleSet forUrl(String url) {
        String host = UrlUtils.host(url);
        if (host != null && (host.equals(SEEK_HOST) || host.endsWith("." + SEEK_HOST))) {
            return SEEK;
        }
        return GENERIC;
    }

    private static List<FieldRule> withGeneric(List<FieldRule> generic, FieldRule... siteSpecific) {
        List<FieldRule> rules = new ArrayList<>(List.of(siteSpecific));
        rules.addAll(generic);
        return List.copyOf(rules);
    }
}
