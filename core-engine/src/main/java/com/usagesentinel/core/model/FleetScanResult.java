package com.usagesentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Ranked outcome of a fleet scan.
 *
 * <p>
 * Counts are derived from the alert list on every call rather than stored.
 * </p>
 *
 * @since 1.0.0
 */
public final class FleetScanResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<FleetAlert> alerts;

    /**
     * @param alerts alerts already in ranked order; copied defensively
     */
    public FleetScanResult(List<FleetAlert> alerts) {
        Objects.requireNonNull(alerts, "alerts must not be null");
        this.alerts = List.copyOf(alerts);
    }

    public List<FleetAlert> getAlerts() {
        return alerts;
    }

    public int getTotalAlerts() {
        return alerts.size();
    }

    public int getCriticalCount() {
        return count(Severity.CRITICAL);
    }

    public int getWarningCount() {
        return count(Severity.WARNING);
    }

    private int count(Severity severity) {
        return (int) alerts.stream().filter(a -> a.getSeverity() == severity).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FleetScanResult that))
            return false;
        return alerts.equals(that.alerts);
    }

    @Override
    public int hashCode() {
        return alerts.hashCode();
    }

    @Override
    public String toString() {
        return "FleetScanResult{total=" + getTotalAlerts()
                + ", critical=" + getCriticalCount()
                + ", warning=" + getWarningCount() + '}';
    }
}
