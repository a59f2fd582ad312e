package io.cronlattice.core.job;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import com.google.inject.Inject;
import io.cronlattice.core.config.ConfigException;
import io.cronlattice.core.schedule.ScheduleClassifier;
import io.cronlattice.core.schedule.ScheduleKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the {@code cronjobs} link property.
 *
 * <pre>
 * catalog = entry ((';' | newline) entry)*
 * entry   = name '=' cron_expr [':' json_payload]
 * </pre>
 *
 * A bad entry is reported as a {@link CatalogError} and skipped. Valid
 * entries are always returned.
 */
public class JobCatalogParser
{
    private static final Logger logger = LoggerFactory.getLogger(JobCatalogParser.class);

    private static final Pattern ENTRY_SEPARATOR = Pattern.compile("[;\\r\\n]");

    static final String DEFAULT_PAYLOAD = "{}";

    private final ScheduleClassifier classifier;

    @Inject
    public JobCatalogParser(ScheduleClassifier classifier)
    {
        this.classifier = classifier;
    }

    public JobCatalog parse(LinkId link, String text)
    {
        ImmutableJobCatalog.Builder builder = ImmutableJobCatalog.builder()
            .linkId(link);
        Set<String> names = new HashSet<>();

        for (String raw : ENTRY_SEPARATOR.split(text)) {
            String entry = raw.trim();
            if (entry.isEmpty()) {
                continue;
            }

            int eq = entry.indexOf('=');
            if (eq < 0) {
                builder.addErrors(CatalogError.of(entry, "Entry must be in 'name=cron_expression:payload' format"));
                continue;
            }
            String name = entry.substring(0, eq).trim();
            String rest = entry.substring(eq + 1);

            String expression;
            String payload;
            int colon = rest.indexOf(':');
            if (colon < 0) {
                expression = rest.trim();
                payload = DEFAULT_PAYLOAD;
            }
            else {
                expression = rest.substring(0, colon).trim();
                payload = rest.substring(colon + 1).trim();
                if (payload.isEmpty()) {
                    payload = DEFAULT_PAYLOAD;
                }
            }

            if (name.isEmpty()) {
                builder.addErrors(CatalogError.of(entry, "Job name must not be empty"));
                continue;
            }
            if (names.contains(name)) {
                builder.addErrors(CatalogError.of(entry, "Job '" + name + "' is defined more than once"));
                continue;
            }

            ScheduleKind kind;
            try {
                kind = classifier.classify(expression);
            }
            catch (ConfigException ex) {
                builder.addErrors(CatalogError.of(entry, "Job '" + name + "': " + ex.getMessage()));
                continue;
            }
            catch (RuntimeException ex) {
                // one entry must not reject the rest of the catalog
                logger.warn("Failed to classify job '{}' of {}", name, link, ex);
                builder.addErrors(CatalogError.of(entry, "Job '" + name + "': " + ex));
                continue;
            }

            names.add(name);
            builder.addJobs(JobDefinition.of(JobId.of(link, name), expression, payload, kind));
        }

        return builder.build();
    }
}
