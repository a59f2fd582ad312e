package io.cronlattice.core.job;

import org.immutables.value.Value;

/**
 * A link between a scheduler provider and a target component.
 */
@Value.Immutable
public interface LinkId
{
    String getTargetId();

    String getLinkName();

    static LinkId of(String targetId, String linkName)
    {
        return ImmutableLinkId.builder()
            .targetId(targetId)
            .linkName(linkName)
            .build();
    }
}
