package io.cronlattice.core.job;

import java.nio.charset.StandardCharsets;
import org.immutables.value.Value;

@Value.Immutable
public interface JobId
{
    String getTargetId();

    String getLinkName();

    String getJobName();

    default LinkId getLinkId()
    {
        return LinkId.of(getTargetId(), getLinkName());
    }

    /**
     * Name of this job in the trigger log and the key-value store, in the
     * form {@code target.link.job}. Each part keeps letters, digits and
     * {@code -}; every other byte of its UTF-8 form is written as {@code _}
     * followed by two hex digits, so distinct ids never share a key.
     */
    default String key()
    {
        return escapeKeyPart(getTargetId()) + "." + escapeKeyPart(getLinkName()) + "." + escapeKeyPart(getJobName());
    }

    static String escapeKeyPart(String part)
    {
        StringBuilder sb = new StringBuilder(part.length());
        for (byte b : part.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xff);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-') {
                sb.append(c);
            }
            else {
                sb.append('_').append(String.format("%02X", b & 0xff));
            }
        }
        return sb.toString();
    }

    static JobId of(LinkId link, String jobName)
    {
        return of(link.getTargetId(), link.getLinkName(), jobName);
    }

    static JobId of(String targetId, String linkName, String jobName)
    {
        return ImmutableJobId.builder()
            .targetId(targetId)
            .linkName(linkName)
            .jobName(jobName)
            .build();
    }
}
