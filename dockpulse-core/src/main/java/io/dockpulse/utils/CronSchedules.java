package io.dockpulse.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cron helpers on top of Quartz {@link CronExpression}.
 * <p>
 * Accepted input:
 * <ul>
 *   <li>5-field Unix cron: "*&#47;5 * * * *" (seconds are pinned to 0)</li>
 *   <li>6-field cron with a leading seconds field: "0 *&#47;10 * * * *"</li>
 *   <li>Native Quartz expressions (with '?' or a year field) are passed through unchanged</li>
 * </ul>
 * Day-of-week numbers follow Unix cron (0 or 7 = Sunday) and are translated to Quartz numbering.
 */
public final class CronSchedules {

    private static final Pattern DOW_NUMBER = Pattern.compile("(^|[,\\-])(\\d+)");

    private CronSchedules() {
    }

    /**
     * Normalize a cron spec into Quartz syntax.
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if (!"?".equals(dom) && !"?".equals(dow)) {
            if ("*".equals(dow)) {
                dow = "?";
            } else if ("*".equals(dom)) {
                dom = "?";
            }
        }
        if (!"?".equals(dow)) {
            dow = toQuartzDayOfWeek(dow);
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    // Unix 0-7 (Sunday = 0 or 7) to Quartz 1-7 (Sunday = 1). Step values after '/' are left alone.
    private static String toQuartzDayOfWeek(String dow) {
        Matcher m = DOW_NUMBER.matcher(dow);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            int unix = Integer.parseInt(m.group(2));
            int quartz = (unix % 7) + 1;
            m.appendReplacement(sb, m.group(1) + quartz);
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Parse a cron spec for the given zone.
     *
     * @throws IllegalArgumentException with the parser's message when the spec is invalid
     */
    public static CronExpression parse(String spec, ZoneId zone) {
        String cron = normalizeCron(spec);
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException(ex.getMessage(), ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone != null ? zone : ZoneId.of("UTC")));
        return exp;
    }

    /**
     * First trigger instant strictly after {@code from}, or null when the expression has no further runs.
     */
    public static Instant nextAfter(String spec, ZoneId zone, Instant from) {
        if (from == null) {
            throw new IllegalArgumentException("from must not be null");
        }
        Date next = parse(spec, zone).getNextValidTimeAfter(Date.from(from));
        return next == null ? null : next.toInstant();
    }
}
