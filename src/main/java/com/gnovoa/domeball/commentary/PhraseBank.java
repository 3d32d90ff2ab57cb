package com.gnovoa.domeball.commentary;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

/**
 * Immutable lookup table from {@link PhraseCategory} to template strings.
 *
 * <p>The bank is data only: templates hold text and {@code {placeholder}} markers, never
 * control flow. It is normally loaded from a JSON object keyed by category name, e.g.
 * {@code classpath:commentary/phrases.json}.
 */
public final class PhraseBank {

    private static final Logger log = LoggerFactory.getLogger(PhraseBank.class);

    private static final TypeReference<Map<PhraseCategory, List<String>>> SHAPE = new TypeReference<>() {};

    private final Map<PhraseCategory, List<String>> templates;

    /**
     * @throws IllegalStateException if any category is missing or has no templates
     */
    public PhraseBank(Map<PhraseCategory, List<String>> templates) {
        EnumMap<PhraseCategory, List<String>> copy = new EnumMap<>(PhraseCategory.class);
        for (PhraseCategory category : PhraseCategory.values()) {
            List<String> pool = templates.get(category);
            if (pool == null || pool.isEmpty()) {
                throw new IllegalStateException("Phrase bank has no templates for " + category);
            }
            copy.put(category, List.copyOf(pool));
        }
        this.templates = copy;
    }

    /**
     * Loads a phrase bank through Spring's resource abstraction.
     *
     * @param mapper Jackson mapper used to parse the JSON
     * @param location resource location ({@code classpath:} or {@code file:} prefix)
     * @throws IllegalStateException if the resource cannot be read, parsed or is incomplete
     */
    public static PhraseBank load(ObjectMapper mapper, String location) {
        Resource resource = new DefaultResourceLoader().getResource(location);
        Map<PhraseCategory, List<String>> raw;
        try (InputStream in = resource.getInputStream()) {
            raw = mapper.readValue(in, SHAPE);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load phrase bank from " + location, e);
        }
        PhraseBank bank = new PhraseBank(raw);
        log.info("Loaded phrase bank from {} ({} templates)", location, bank.size());
        return bank;
    }

    /** @return templates of the category, never empty */
    public List<String> templates(PhraseCategory category) {
        return templates.get(category);
    }

    public int size() {
        return templates.values().stream().mapToInt(List::size).sum();
    }
}
