package io.cronlattice.core.job;

import io.cronlattice.core.schedule.ScheduleKind;
import org.immutables.value.Value;

@Value.Immutable
public interface JobDefinition
{
    JobId getId();

    String getCronExpression();

    /**
     * Dispatch payload, passed through uninterpreted.
     */
    String getPayload();

    ScheduleKind getScheduleKind();

    static JobDefinition of(JobId id, String cronExpression, String payload, ScheduleKind kind)
    {
        return ImmutableJobDefinition.builder()
            .id(id)
            .cronExpression(cronExpression)
            .payload(payload)
            .scheduleKind(kind)
            .build();
    }
}
