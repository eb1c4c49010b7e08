package com.delta.jobharvest.crawl.block;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.model.Classification;
import com.delta.jobharvest.crawl.model.FetchResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a fetched page is usable. Status-level denials are hard blocks; pages that
 * load but carry verification or consent-wall copy are soft blocks. The result depends only on
 * the status code, the transport error and the body.
 */
@Component
public class BlockClassifier {
    private static final Set<Integer> HARD_BLOCK_STATUSES = Set.of(401, 403, 429);

    private final List<String> blockSignals;

    @Autowired
    public BlockClassifier(HarvestProperties properties) {
        this(properties.getExtraction().getBlockSignals());
    }

    public BlockClassifier(List<String> blockSignals) {
        this.blockSignals = blockSignals == null
            ? List.of()
            : blockSignals.stream()
                .filter(Objects::nonNull)
                .map(signal -> signal.trim().toLowerCase(Locale.ROOT))
                .filter(signal -> !signal.isEmpty())
                .distinct()
                .toList();
    }

    public Classification classify(FetchResult result) {
        if (result == null || result.hasTransportError()) {
            return Classification.TRANSPORT_ERROR;
        }
        int status = result.statusCode();
        if (HARD_BLOCK_STATUSES.contains(status)) {
            return Classification.HARD_BLOCK;
        }
        if (status >= 400) {
            return Classification.TRANSPORT_ERROR;
        }
        if (matchedSignal(result.body()) != null) {
            return Classification.SOFT_BLOCK;
        }
        return Classification.OK;
    }

    public String matchedSignal(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        for (String signal : blockSignals) {
            if (lower.contains(signal)) {
                return signal;
            }
        }
        return null;
    }
}
