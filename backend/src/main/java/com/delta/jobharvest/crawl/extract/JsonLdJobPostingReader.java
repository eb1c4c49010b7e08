package com.delta.jobharvest.crawl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structured-data tier: reads the first schema.org {@code JobPosting} found in the page's
 * JSON-LD blocks. Postings may be nested in arrays, {@code @graph} or other objects, and
 * {@code @type} may be a string or an array.
 */
@Component
public class JsonLdJobPostingReader {
    private static final Logger log = LoggerFactory.getLogger(JsonLdJobPostingReader.class);

    private final ObjectMapper objectMapper;

    public JsonLdJobPostingReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the populated fields of the first posting, or an empty map when the page carries
     * no usable structured data.
     */
    public Map<RecordField, FieldValue> read(Document document) {
        List<JsonNode> postings = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collectJobPostingNodes(objectMapper.readTree(payload), postings);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block on {}: {}", document.location(), e.getOriginalMessage());
            }
        }
        if (postings.isEmpty()) {
            return Map.of();
        }
        return toFields(postings.get(0));
    }

    private void collectJobPostingNodes(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (isJobPostingType(node.get("@type"))) {
                out.add(node);
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collectJobPostingNodes(value, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectJobPostingNodes(child, out);
            }
        }
    }

    private boolean isJobPostingType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return "jobposting".equalsIgnoreCase(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && "jobposting".equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private Map<RecordField, FieldValue> toFields(JsonNode node) {
        Map<RecordField, FieldValue> out = new EnumMap<>(RecordField.class);
        putText(out, RecordField.TITLE, firstNonBlank(text(node, "title"), text(node, "name")));
        putText(out, RecordField.COMPANY, companyName(node.get("hiringOrganization")));
        putText(out, RecordField.LOCATION, extractLocation(node.get("jobLocation")));
        putText(out, RecordField.COMPENSATION, extractSalary(node.get("baseSalary")));
        putText(out, RecordField.EMPLOYMENT_TYPE, joinValues(node.get("employmentType")));
        putText(out, RecordField.POSTED_AT, text(node, "datePosted"));
        putText(out, RecordField.CATEGORY, firstNonBlank(joinValues(node.get("occupationalCategory")), joinValues(node.get("industry"))));

        String description = text(node, "description");
        if (description != null && !description.isBlank()) {
            Document fragment = Jsoup.parseBodyFragment(description);
            String plain = TextNormalizer.collapseWhitespace(fragment.body().text());
            if (plain != null) {
                out.put(RecordField.DESCRIPTION, new FieldValue(plain, TextNormalizer.passThroughOrClean(description, fragment.body())));
            }
        }
        return out;
    }

    private String companyName(JsonNode organization) {
        if (organization == null || organization.isNull()) {
            return null;
        }
        if (organization.isTextual()) {
            return organization.asText();
        }
        return text(organization, "name");
    }

    private String extractLocation(JsonNode jobLocation) {
        if (jobLocation == null || jobLocation.isNull()) {
            return null;
        }
        LinkedHashSet<String> locations = new LinkedHashSet<>();
        collectLocationStrings(jobLocation, locations);
        if (locations.isEmpty()) {
            return null;
        }
        return String.join(" | ", locations);
    }

    private void collectLocationStrings(JsonNode node, LinkedHashSet<String> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collectLocationStrings(item, out);
            }
            return;
        }
        if (!node.isObject()) {
            if (node.isTextual() && !node.asText().isBlank()) {
                out.add(node.asText().trim());
            }
            return;
        }
        JsonNode address = node.has("address") ? node.get("address") : node;
        if (address.isTextual()) {
            collectLocationStrings(address, out);
            return;
        }
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, text(address, "addressLocality"));
        addIfPresent(parts, text(address, "addressRegion"));
        addIfPresent(parts, countryName(address.get("addressCountry")));
        if (!parts.isEmpty()) {
            out.add(String.join(", ", parts));
            return;
        }
        String fallback = firstNonBlank(text(node, "name"), text(address, "name"));
        if (fallback != null) {
            out.add(fallback);
        }
    }

    private String countryName(JsonNode country) {
        if (country == null || country.isNull()) {
            return null;
        }
        if (country.isObject()) {
            return text(country, "name");
        }
        return country.asText();
    }

    /**
     * Formats a {@code MonetaryAmount} as e.g. {@code USD 90000-120000 / YEAR}. Plain strings and
     * numbers are passed through.
     */
    private String extractSalary(JsonNode salary) {
        if (salary == null || salary.isNull()) {
            return null;
        }
        if (salary.isTextual() || salary.isNumber()) {
            return salary.asText();
        }
        if (!salary.isObject()) {
            return null;
        }
        String currency = text(salary, "currency");
        JsonNode value = salary.get("value");
        String amount;
        String unit = text(salary, "unitText");
        if (value == null || value.isNull()) {
            amount = null;
        } else if (value.isObject()) {
            String min = text(value, "minValue");
            String max = text(value, "maxValue");
            String exact = text(value, "value");
            if (min != null && max != null) {
                amount = min + "-" + max;
            } else {
                amount = firstNonBlank(exact, min, max);
            }
            unit = firstNonBlank(text(value, "unitText"), unit);
        } else {
            amount = value.asText();
        }
        if (amount == null || amount.isBlank()) {
            return null;
        }
        StringBuilder out = new StringBuilder();
        if (currency != null) {
            out.append(currency).append(' ');
        }
        out.append(amount);
        if (unit != null) {
            out.append(" / ").append(unit);
        }
        return out.toString();
    }

    private String joinValues(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode item : node) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            }
            return values.isEmpty() ? null : values.stream().distinct().collect(Collectors.joining(", "));
        }
        if (node.isObject()) {
            return text(node, "name");
        }
        return node.asText();
    }

    private void putText(Map<RecordField, FieldValue> out, RecordField field, String raw) {
        String value = TextNormalizer.collapseWhitespace(raw);
        if (value != null) {
            out.put(field, FieldValue.ofText(value));
        }
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return null;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private void addIfPresent(List<String> list, String value) {
        if (value != null && !value.isBlank()) {
            list.add(value.trim());
        }
    }
}
