package tech.compendium.sdk.store;

import tech.compendium.sdk.dto.Job;

import java.util.List;
import java.util.Set;

/**
 * Receives changes to a {@link JobStore}'s local collection. Callbacks run on the thread that
 * completed the request, outside the store's lock.
 */
public interface JobStoreListener {

    /**
     * The whole collection was replaced by a server listing.
     */
    default void onJobsReplaced(List<Job> jobs) {
    }

    /**
     * One job was inserted ({@code previous} is null) or replaced.
     */
    default void onJobUpdated(Job previous, Job current) {
    }

    default void onJobsRemoved(Set<String> ids) {
    }
}
