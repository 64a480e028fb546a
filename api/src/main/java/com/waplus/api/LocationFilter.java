package com.waplus.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reporting-unit and infrastructure id sets of a request. Either, both or neither may be empty.
 */
public record LocationFilter(List<Long> reportingUnitIds, List<Long> infrastructureIds) {

    public enum Scope { GLOBAL, REPORTING_UNITS, INFRASTRUCTURE, BOTH }

    public LocationFilter {
        reportingUnitIds = normalize(reportingUnitIds);
        infrastructureIds = normalize(infrastructureIds);
    }

    public static LocationFilter global() {
        return new LocationFilter(List.of(), List.of());
    }

    public static LocationFilter of(Long reportingUnitId, Long infrastructureId) {
        return new LocationFilter(
            reportingUnitId == null ? List.of() : List.of(reportingUnitId),
            infrastructureId == null ? List.of() : List.of(infrastructureId)
        );
    }

    public boolean hasReportingUnits() {
        return !reportingUnitIds.isEmpty();
    }

    public boolean hasInfrastructure() {
        return !infrastructureIds.isEmpty();
    }

    public Scope scope() {
        if (hasReportingUnits() && hasInfrastructure()) return Scope.BOTH;
        if (hasReportingUnits()) return Scope.REPORTING_UNITS;
        if (hasInfrastructure()) return Scope.INFRASTRUCTURE;
        return Scope.GLOBAL;
    }

    private static List<Long> normalize(List<Long> ids) {
        if (ids == null) return List.of();
        LinkedHashSet<Long> distinct = new LinkedHashSet<>();
        for (Long id : ids) {
            if (id != null) distinct.add(id);
        }
        return List.copyOf(new ArrayList<>(distinct));
    }

    @Override
    public String toString() {
        return "reportingUnits=" + reportingUnitIds + ", infrastructure=" + infrastructureIds;
    }
}
