package tech.compendium.sdk.dto;

import tech.compendium.sdk.enums.JobSortField;
import tech.compendium.sdk.enums.JobStatus;
import tech.compendium.sdk.enums.SortOrder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filters for listing jobs. Every field is optional; the server defaults to newest first.
 */
public record JobFilters(
    JobStatus status,
    JobSortField sortBy,
    SortOrder sortOrder
) {

    public static JobFilters none() {
        return new JobFilters(null, null, null);
    }

    public static JobFilters byStatus(JobStatus status) {
        return new JobFilters(status, null, null);
    }

    /**
     * Query parameters for the job listing, in a stable order.
     */
    public Map<String, String> toQueryParams() {
        Map<String, String> params = new LinkedHashMap<>();
        if (status != null && status != JobStatus.UNKNOWN) {
            params.put("status", status.getValue());
        }
        if (sortBy != null) {
            params.put("sort_by", sortBy.getValue());
        }
        if (sortOrder != null) {
            params.put("sort_order", sortOrder.getValue());
        }
        return params;
    }
}
