package tech.compendium.sdk.store;

import tech.compendium.sdk.dto.Job;
import tech.compendium.sdk.enums.JobStatus;

final class SdkFixtures {

    private SdkFixtures() {
    }

    static Job job(String id, JobStatus status) {
        return Job.builder()
            .id(id)
            .deckName("Deck " + id)
            .fileName(id + ".pdf")
            .status(status)
            .progress(status == JobStatus.COMPLETED ? 100 : 0)
            .currentStage(status == JobStatus.COMPLETED ? 8 : 1)
            .build();
    }
}
