package com.usagesentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Public-health conditions commonly associated with a surge in one item's
 * consumption, loaded from configuration.
 *
 * <p>
 * Call {@link #validate()} after deserialization to verify that the item
 * name, at least one condition and a description are present.
 * </p>
 *
 * @since 1.0.0
 */
public class ConditionHint implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Item name the hint applies to; matched case-insensitively. */
    private String item;

    /** Conditions a surge may point to, most likely first. */
    private List<String> conditions = new ArrayList<>();

    /** One-sentence explanation shown next to an alert. */
    private String description;

    public ConditionHint() {
    }

    public ConditionHint(String item, List<String> conditions, String description) {
        this.item = item;
        setConditions(conditions);
        this.description = description;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if a required field is missing
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (item == null || item.isBlank()) {
            errors.add("Hint 'item' is required");
        }
        if (conditions.isEmpty() || conditions.stream().anyMatch(c -> c == null || c.isBlank())) {
            errors.add("Hint '" + item + "' requires at least one non-blank condition");
        }
        if (description == null || description.isBlank()) {
            errors.add("Hint '" + item + "' requires 'description'");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid ConditionHint: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getItem() {
        return item;
    }

    public void setItem(String item) {
        this.item = item;
    }

    public List<String> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public void setConditions(List<String> conditions) {
        this.conditions = conditions != null ? new ArrayList<>(conditions) : new ArrayList<>();
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConditionHint that))
            return false;
        return Objects.equals(item, that.item)
                && Objects.equals(conditions, that.conditions)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, conditions, description);
    }

    @Override
    public String toString() {
        return "ConditionHint{item='" + item + "', conditions=" + conditions + '}';
    }
}
