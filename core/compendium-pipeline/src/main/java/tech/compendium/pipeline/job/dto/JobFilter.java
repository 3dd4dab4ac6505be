package tech.compendium.pipeline.job.dto;

import tech.compendium.pipeline.job.model.JobStatus;

/**
 * Listing filter. A null status matches every job; ordering defaults to newest first.
 */
public record JobFilter(
    JobStatus status,
    JobSortField sortBy,
    SortOrder sortOrder
) {
    public JobFilter {
        if (sortBy == null) {
            sortBy = JobSortField.DATE;
        }
        if (sortOrder == null) {
            sortOrder = SortOrder.DESC;
        }
    }

    public static JobFilter all() {
        return new JobFilter(null, null, null);
    }

    public static JobFilter byStatus(JobStatus status) {
        return new JobFilter(status, null, null);
    }
}
