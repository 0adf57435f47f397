package org.mcpkubernetes.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Shapes result sets before serialization: mask secrets, slim, truncate to the item limit, then drop trailing items
 * until the payload fits the byte budget. Inputs are never mutated.
 */
public class ResponseProcessor {

    private static final Logger LOG = Logger.getLogger(ResponseProcessor.class);

    private final OutputConfig config;
    private final ResourceSlimmer slimmer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ResponseProcessor(OutputConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper, Clock.systemUTC());
    }

    public ResponseProcessor(OutputConfig config, ObjectMapper objectMapper, Clock clock) {
        this.config = config.validated();
        this.slimmer = new ResourceSlimmer(this.config.excludedFields());
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public OutputConfig config() {
        return config;
    }

    public ProcessingResult process(List<Map<String, Object>> items) {
        return process(items, config.maxItems());
    }

    /**
     * @param maxItems item ceiling for this call, already resolved through {@link Limits#effectiveLimit}
     */
    public ProcessingResult process(List<Map<String, Object>> items, int maxItems) {
        int originalCount = items.size();
        int limit = Limits.effectiveLimit(maxItems, config.maxItems(), OutputConfig.ABSOLUTE_MAX_ITEMS);

        List<TruncationWarning> warnings = new ArrayList<>();
        List<Map<String, Object>> kept = items.size() > limit ? items.subList(0, limit) : items;
        if (items.size() > limit) {
            warnings.add(TruncationWarning.forItems(limit, originalCount));
        }

        List<Map<String, Object>> shaped = new ArrayList<>(kept.size());
        for (Map<String, Object> item : kept) {
            shaped.add(shape(item));
        }

        int beforeByteBudget = shaped.size();
        shaped = fitByteBudget(shaped);
        if (shaped.size() < beforeByteBudget) {
            warnings.add(TruncationWarning.forResponseSize(shaped.size(), originalCount, config.maxResponseBytes()));
        }

        boolean truncated = shaped.size() < originalCount;
        ProcessingMetadata metadata = new ProcessingMetadata(clock.instant(), originalCount, shaped.size(),
                truncated, config.slimOutput(), config.maskSecrets());
        return new ProcessingResult(List.copyOf(shaped), metadata, List.copyOf(warnings));
    }

    /**
     * Masking and slimming for a single object.
     */
    public Map<String, Object> shape(Map<String, Object> item) {
        Map<String, Object> result = config.maskSecrets() ? SecretMasker.mask(item) : JsonMaps.deepCopy(item);
        if (config.slimOutput()) {
            result = slimmer.slim(result);
        }
        return result;
    }

    private List<Map<String, Object>> fitByteBudget(List<Map<String, Object>> items) {
        long budget = config.maxResponseBytes();
        long used = 2;
        List<Map<String, Object>> fitted = new ArrayList<>(items.size());
        for (Map<String, Object> item : items) {
            long size = sizeOf(item) + 1;
            if (used + size > budget) {
                LOG.debugf("Response byte budget of %d reached after %d items", budget, fitted.size());
                break;
            }
            used += size;
            fitted.add(item);
        }
        return fitted;
    }

    private long sizeOf(Map<String, Object> item) {
        try {
            return objectMapper.writeValueAsBytes(item).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize resource for size accounting", e);
        }
    }
}
