package io.cronlattice.core.schedule;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.field.CronFieldName;
import com.cronutils.model.field.expression.Always;
import com.cronutils.model.field.expression.And;
import com.cronutils.model.field.expression.Every;
import com.cronutils.model.field.expression.FieldExpression;
import com.cronutils.model.field.expression.QuestionMark;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Six-field cron expression: second, minute, hour, day-of-month, month
 * and day-of-week, evaluated in UTC.
 *
 * When both day-of-month and day-of-week are restricted, a day matches if
 * either of them matches.
 */
public class CronExpression
{
    static final int SEARCH_HORIZON_YEARS = 5;

    private static final CronDefinition DEFINITION = CronDefinitionBuilder.defineCron()
        .withSeconds().withValidRange(0, 59).and()
        .withMinutes().withValidRange(0, 59).and()
        .withHours().withValidRange(0, 23).and()
        .withDayOfMonth().supportsQuestionMark().withValidRange(1, 31).and()
        .withMonth().withValidRange(1, 12).and()
        .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1).supportsQuestionMark().withIntMapping(7, 0).and()
        .instance();

    private static final CronParser PARSER = new CronParser(DEFINITION);

    private static final ImmutableMap<CronFieldName, Integer> MAX_STEPS = ImmutableMap.<CronFieldName, Integer>builder()
        .put(CronFieldName.SECOND, 59)
        .put(CronFieldName.MINUTE, 59)
        .put(CronFieldName.HOUR, 23)
        .put(CronFieldName.DAY_OF_MONTH, 31)
        .put(CronFieldName.MONTH, 12)
        .put(CronFieldName.DAY_OF_WEEK, 7)
        .build();

    private final String expression;
    private final Cron cron;
    private final List<ExecutionTime> executionTimes;

    private CronExpression(String expression, Cron cron, List<ExecutionTime> executionTimes)
    {
        this.expression = expression;
        this.cron = cron;
        this.executionTimes = executionTimes;
    }

    public static CronExpression parse(String expression)
    {
        String trimmed = expression.trim();
        // month and weekday names are case-insensitive
        String[] parts = trimmed.isEmpty() ? new String[0] : trimmed.toUpperCase(Locale.ENGLISH).split("\\s+");
        if (parts.length != 6) {
            throw new CronExpressionException(
                    "Cron expression must have exactly 6 fields (second minute hour day-of-month month day-of-week) but got " +
                    parts.length + ": '" + expression + "'");
        }
        String normalized = String.join(" ", parts);
        Cron cron = parseCron(normalized, normalized);
        for (CronFieldName name : MAX_STEPS.keySet()) {
            checkSteps(name, cron.retrieve(name).getExpression(), expression);
        }

        // day-of-month and day-of-week are evaluated one at a time with the
        // other one set to '?'. The first match of the variants wins.
        boolean dayOfMonthRestricted = !isWildcard(cron.retrieve(CronFieldName.DAY_OF_MONTH).getExpression());
        boolean dayOfWeekRestricted = !isWildcard(cron.retrieve(CronFieldName.DAY_OF_WEEK).getExpression());
        ImmutableList.Builder<ExecutionTime> variants = ImmutableList.builder();
        if (dayOfMonthRestricted || !dayOfWeekRestricted) {
            String dayOfMonth = dayOfMonthRestricted ? parts[3] : "*";
            variants.add(ExecutionTime.forCron(parseCron(withDays(parts, dayOfMonth, "?"), expression)));
        }
        if (dayOfWeekRestricted) {
            variants.add(ExecutionTime.forCron(parseCron(withDays(parts, "?", parts[5]), expression)));
        }
        return new CronExpression(normalized, cron, variants.build());
    }

    private static String withDays(String[] parts, String dayOfMonth, String dayOfWeek)
    {
        return String.join(" ", parts[0], parts[1], parts[2], dayOfMonth, parts[4], dayOfWeek);
    }

    private static Cron parseCron(String text, String source)
    {
        try {
            return PARSER.parse(text).validate();
        }
        catch (IllegalArgumentException ex) {
            throw new CronExpressionException("Invalid cron expression '" + source + "': " + ex.getMessage(), ex);
        }
    }

    private static void checkSteps(CronFieldName name, FieldExpression field, String source)
    {
        if (field instanceof Every) {
            Every every = (Every) field;
            int step = every.getPeriod().getValue();
            if (step < 1 || step > MAX_STEPS.get(name)) {
                throw new CronExpressionException("Invalid " + displayName(name) + " step " + step +
                        " in '" + source + "': must be 1-" + MAX_STEPS.get(name));
            }
            checkSteps(name, every.getExpression(), source);
        }
        else if (field instanceof And) {
            for (FieldExpression part : ((And) field).getExpressions()) {
                checkSteps(name, part, source);
            }
        }
    }

    static boolean isWildcard(FieldExpression field)
    {
        return field instanceof Always || field instanceof QuestionMark;
    }

    static String displayName(CronFieldName name)
    {
        return name.name().toLowerCase(Locale.ENGLISH).replace('_', '-');
    }

    public String getExpression()
    {
        return expression;
    }

    public FieldExpression getField(CronFieldName name)
    {
        return cron.retrieve(name).getExpression();
    }

    /**
     * Returns the first matching instant strictly after {@code now}, or
     * absent if nothing matches within {@value #SEARCH_HORIZON_YEARS} years.
     */
    public Optional<Instant> nextMatch(Instant now)
    {
        ZonedDateTime from = now.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
        ZonedDateTime limit = from.plusYears(SEARCH_HORIZON_YEARS);

        ZonedDateTime earliest = null;
        for (ExecutionTime executionTime : executionTimes) {
            java.util.Optional<ZonedDateTime> next = executionTime.nextExecution(from);
            if (next.isPresent() && (earliest == null || next.get().isBefore(earliest))) {
                earliest = next.get();
            }
        }
        if (earliest == null || earliest.isAfter(limit)) {
            return Optional.absent();
        }
        return Optional.of(earliest.toInstant());
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return expression.equals(((CronExpression) o).expression);
    }

    @Override
    public int hashCode()
    {
        return expression.hashCode();
    }

    @Override
    public String toString()
    {
        return expression;
    }
}
