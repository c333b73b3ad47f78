package com.costpilot.analytics.analytics;

import com.costpilot.analytics.model.Recommendation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static optimization hints for the metered services we know how to advise on.
 */
final class ServiceOptimizationCatalog {

    private static final Map<String, Recommendation> HINTS = new LinkedHashMap<>();

    static {
        register("openai",
                "Optimize OpenAI Usage",
                "Optimize AI model usage and prompting",
                List.of(
                        "Use more efficient models where appropriate",
                        "Implement prompt caching",
                        "Optimize token usage in prompts",
                        "Consider batch processing for similar requests"
                ),
                "Reduce AI processing costs while maintaining quality");
        register("semrush",
                "Optimize SEMrush API Usage",
                "Optimize SEO data retrieval patterns",
                List.of(
                        "Cache frequently requested data",
                        "Implement intelligent data freshness checks",
                        "Use bulk API endpoints where available",
                        "Optimize query parameters to reduce cost"
                ),
                "Reduce SEO data costs through efficient querying");
    }

    private ServiceOptimizationCatalog() {
    }

    private static void register(String service, String title, String description, List<String> actions, String impact) {
        HINTS.put(service, new Recommendation(
                Recommendation.Type.SERVICE_OPTIMIZATION,
                Recommendation.Priority.LOW,
                title,
                description,
                actions,
                0d,
                impact,
                Optional.of(service)
        ));
    }

    /**
     * Hints for the filtered service only, or every catalogued hint when the analysis covered all
     * services.
     */
    static List<Recommendation> hintsFor(Optional<String> service) {
        if (service.isEmpty()) {
            return List.copyOf(HINTS.values());
        }
        Recommendation hint = HINTS.get(service.get().trim().toLowerCase(Locale.ROOT));
        return hint == null ? List.of() : List.of(hint);
    }
}
