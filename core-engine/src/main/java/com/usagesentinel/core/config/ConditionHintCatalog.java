package com.usagesentinel.core.config;

import com.usagesentinel.core.model.ConditionHint;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Top-level POJO for the condition-hints YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * hints:
 *   - item: ORS Packets
 *     conditions: [Diarrhea, Cholera, Gastroenteritis]
 *     description: Spike in ORS usage suggests a waterborne disease outbreak
 * </pre>
 *
 * @since 1.0.0
 */
public class ConditionHintCatalog implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<ConditionHint> hints = new ArrayList<>();

    /**
     * @return unmodifiable list of hints in file order
     */
    public List<ConditionHint> getHints() {
        return Collections.unmodifiableList(hints);
    }

    /**
     * Set the hints list (used by SnakeYAML during deserialization).
     *
     * @param hints the hints
     */
    public void setHints(List<ConditionHint> hints) {
        this.hints = hints != null ? new ArrayList<>(hints) : new ArrayList<>();
    }

    /**
     * Find the hint for an item, ignoring case.
     *
     * @param item item name; {@code null} yields empty
     * @return the matching hint, or empty if none is configured
     */
    public Optional<ConditionHint> lookup(String item) {
        if (item == null || item.isBlank()) {
            return Optional.empty();
        }
        String wanted = item.trim().toLowerCase(Locale.ROOT);
        return hints.stream()
                .filter(h -> h.getItem().trim().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    /**
     * Validate every hint and reject duplicate items.
     *
     * @throws IllegalStateException if one or more hints are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < hints.size(); i++) {
            ConditionHint hint = Objects.requireNonNull(hints.get(i),
                    "Hint at index " + i + " is null");
            try {
                hint.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (hint.getItem() != null && !seen.add(hint.getItem().trim().toLowerCase(Locale.ROOT))) {
                errors.add("Duplicate hint for item '" + hint.getItem() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Condition hints validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "ConditionHintCatalog{hints=" + hints + '}';
    }
}
