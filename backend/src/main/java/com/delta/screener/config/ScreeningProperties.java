package com.delta.screener.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "screening")
public class ScreeningProperties {
    private int minTextLength = 50;
    private Integer referenceYear;
    private int batchConcurrency = 4;
    private Skills skills = new Skills();
    private Bias bias = new Bias();

    public int getMinTextLength() {
        return Math.max(1, minTextLength);
    }

    public void setMinTextLength(int minTextLength) {
        this.minTextLength = Math.max(1, minTextLength);
    }

    public Integer getReferenceYear() {
        return referenceYear;
    }

    public void setReferenceYear(Integer referenceYear) {
        this.referenceYear = referenceYear;
    }

    public int getBatchConcurrency() {
        return Math.max(1, batchConcurrency);
    }

    public void setBatchConcurrency(int batchConcurrency) {
        this.batchConcurrency = Math.max(1, batchConcurrency);
    }

    public Skills getSkills() {
        return skills;
    }

    public void setSkills(Skills skills) {
        this.skills = skills;
    }

    public Bias getBias() {
        return bias;
    }

    public void setBias(Bias bias) {
        this.bias = bias;
    }

    public static class Skills {
        private List<String> keywords = new ArrayList<>(List.of(
            "python", "java", "javascript", "react", "angular", "vue", "node.js",
            "sql", "postgresql", "mysql", "mongodb", "redis",
            "docker", "kubernetes", "aws", "azure", "gcp",
            "git", "github", "gitlab", "ci/cd", "jenkins",
            "machine learning", "deep learning", "tensorflow", "pytorch",
            "fastapi", "django", "flask", "express", "spring",
            "html", "css", "typescript", "rest api", "graphql",
            "agile", "scrum", "devops", "microservices"
        ));

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords == null ? new ArrayList<>() : keywords;
        }
    }

    public static class Bias {
        private Map<String, Category> categories = defaultCategories();
        private List<String> photoTerms = new ArrayList<>(List.of("photo", "picture", "image"));

        public Map<String, Category> getCategories() {
            return categories;
        }

        public void setCategories(Map<String, Category> categories) {
            this.categories = categories == null ? new LinkedHashMap<>() : categories;
        }

        public List<String> getPhotoTerms() {
            return photoTerms;
        }

        public void setPhotoTerms(List<String> photoTerms) {
            this.photoTerms = photoTerms == null ? new ArrayList<>() : photoTerms;
        }

        private static Map<String, Category> defaultCategories() {
            Map<String, Category> out = new LinkedHashMap<>();
            // case-sensitive: capitalized word pairs only
            out.put("name", new Category("\\b[A-Z][a-z]+\\s+[A-Z][a-z]+\\b", true));
            out.put("age", new Category("\\b\\d{1,2}\\s*(?:years?\\s*old|y\\.?o\\.?)\\b", false));
            out.put("gender", new Category("\\b(?:he|she|him|her|his|hers|male|female|man|woman)\\b", false));
            out.put("location", new Category("\\b(?:lives?|resides?|located|from)\\s+[A-Z][a-z]+", false));
            out.put("nationality", new Category("\\b(?:american|indian|chinese|british|canadian|australian)\\b", false));
            out.put("religion", new Category("\\b(?:christian|muslim|hindu|jewish|buddhist|sikh)\\b", false));
            out.put("marital-status", new Category("\\b(?:married|single|divorced|widowed)\\b", false));
            return out;
        }
    }

    public static class Category {
        private String pattern;
        private boolean caseSensitive;

        public Category() {
        }

        public Category(String pattern, boolean caseSensitive) {
            this.pattern = pattern;
            this.caseSensitive = caseSensitive;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public boolean isCaseSensitive() {
            return caseSensitive;
        }

        public void setCaseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
        }
    }
}
