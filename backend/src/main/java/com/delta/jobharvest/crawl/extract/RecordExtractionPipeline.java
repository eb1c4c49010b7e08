package com.delta.jobharvest.crawl.extract;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.model.CrawlTask;
import com.delta.jobharvest.crawl.model.ExtractionTier;
import com.delta.jobharvest.crawl.model.JobRecord;
import com.delta.jobharvest.crawl.util.ContentFingerprint;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Structured-data-first extraction. JSON-LD fields are taken as-is; every field still missing
 * afterwards is filled from the configured selector cascade. A page without a title after both
 * tiers produces no record.
 */
@Component
public class RecordExtractionPipeline {
    private final JsonLdJobPostingReader jsonLdReader;
    private final DetailLinkExtractor linkExtractor;
    private final HeuristicFieldExtractors heuristics;
    private final Clock clock;
    private final int descriptionMaxChars;

    public RecordExtractionPipeline(
        JsonLdJobPostingReader jsonLdReader,
        DetailLinkExtractor linkExtractor,
        HarvestProperties properties,
        Clock clock
    ) {
        this.jsonLdReader = jsonLdReader;
        this.linkExtractor = linkExtractor;
        this.heuristics = HeuristicFieldExtractors.fromSelectors(properties.getExtraction().getSelectors());
        this.clock = clock;
        this.descriptionMaxChars = properties.getExtraction().getDescriptionMaxChars();
    }

    public List<String> extractLinks(String body, String baseUrl) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        return linkExtractor.extract(Jsoup.parse(body, baseUrl));
    }

    public Optional<JobRecord> extractRecord(String body, CrawlTask task) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(body, task.url());
        Map<RecordField, FieldValue> fields = new EnumMap<>(RecordField.class);
        fields.putAll(jsonLdReader.read(document));
        boolean structured = !fields.isEmpty();
        boolean heuristic = false;
        for (RecordField field : RecordField.values()) {
            if (fields.containsKey(field)) {
                continue;
            }
            Optional<FieldValue> fallback = heuristics.firstMatch(field, document);
            if (fallback.isPresent()) {
                fields.put(field, fallback.get());
                heuristic = true;
            }
        }

        String title = text(fields, RecordField.TITLE);
        if (title == null) {
            return Optional.empty();
        }
        FieldValue description = fields.get(RecordField.DESCRIPTION);
        String descriptionText = description == null ? null : TextNormalizer.truncate(description.text(), descriptionMaxChars);
        String descriptionHtml = description == null ? null : description.html();

        ExtractionTier tier;
        if (structured && heuristic) {
            tier = ExtractionTier.MIXED;
        } else if (structured) {
            tier = ExtractionTier.STRUCTURED_DATA;
        } else {
            tier = ExtractionTier.HEURISTIC;
        }

        String company = text(fields, RecordField.COMPANY);
        String location = text(fields, RecordField.LOCATION);
        String compensation = text(fields, RecordField.COMPENSATION);
        String employmentType = text(fields, RecordField.EMPLOYMENT_TYPE);
        String postedAt = text(fields, RecordField.POSTED_AT);
        String category = text(fields, RecordField.CATEGORY);

        Map<String, String> fingerprintFields = new TreeMap<>();
        fingerprintFields.put("source_url", task.url());
        fingerprintFields.put("title", title);
        fingerprintFields.put("company", company);
        fingerprintFields.put("location", location);
        fingerprintFields.put("compensation", compensation);
        fingerprintFields.put("employment_type", employmentType);
        fingerprintFields.put("posted_at", postedAt);
        fingerprintFields.put("category", category);
        fingerprintFields.put("description", descriptionText);

        return Optional.of(new JobRecord(
            task.url(),
            title,
            company,
            location,
            compensation,
            employmentType,
            postedAt,
            category,
            descriptionText,
            descriptionHtml,
            task.referer(),
            task.pageNumber(),
            tier,
            clock.instant(),
            ContentFingerprint.of(fingerprintFields)
        ));
    }

    private String text(Map<RecordField, FieldValue> fields, RecordField field) {
        FieldValue value = fields.get(field);
        return value == null || !value.isPresent() ? null : value.text();
    }
}
