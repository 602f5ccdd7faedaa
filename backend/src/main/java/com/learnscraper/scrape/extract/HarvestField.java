package com.learnscraper.scrape.extract;

import java.util.List;

public enum HarvestField {
    REQUIREMENTS(List.of("requirement", "qualification", "must have", "essential", "you will have", "you'll have")),
    RESPONSIBILITIES(List.of("responsibilit", "duties", "you will", "role", "day to day", "what you'll do")),
    BENEFITS(List.of("benefit", "perk", "we offer", "what we offer", "why join")),
    SKILLS(List.of("skill", "technical", "competenc", "experience with"));

    private final List<String> keywords;

    HarvestField(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<String> keywords() {
        return keywords;
    }

    public boolean matchesHeader(String lowerCasedText) {
        for (String keyword : keywords) {
            if (lowerCasedText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
