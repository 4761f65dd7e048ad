package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.OptionKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Per-question display order for options. Only the order changes: keys keep
 * their canonical meaning, so answers and scoring never need translating.
 */
@Component
@RequiredArgsConstructor
public class OptionShuffler {

    private final Random random;

    /** Fresh random order over the keys the question actually has. */
    public List<OptionKey> shuffledOrder(Map<OptionKey, String> options) {
        List<OptionKey> order = canonicalOrder(options);
        Collections.shuffle(order, random);
        return order;
    }

    /**
     * Options in the stored display order. A missing order falls back to
     * canonical order; keys the order does not mention are appended.
     */
    public List<PresentedOption> present(Map<OptionKey, String> options, List<OptionKey> order) {
        List<PresentedOption> presented = new ArrayList<>();
        if (options == null || options.isEmpty()) {
            return presented;
        }
        List<OptionKey> seen = new ArrayList<>();
        if (order != null) {
            for (OptionKey key : order) {
                if (options.containsKey(key) && !seen.contains(key)) {
                    presented.add(new PresentedOption(key, options.get(key)));
                    seen.add(key);
                }
            }
        }
        for (OptionKey key : canonicalOrder(options)) {
            if (!seen.contains(key)) {
                presented.add(new PresentedOption(key, options.get(key)));
            }
        }
        return presented;
    }

    private static List<OptionKey> canonicalOrder(Map<OptionKey, String> options) {
        List<OptionKey> keys = new ArrayList<>();
        for (OptionKey key : OptionKey.values()) {
            if (options.containsKey(key)) {
                keys.add(key);
            }
        }
        return keys;
    }
}
