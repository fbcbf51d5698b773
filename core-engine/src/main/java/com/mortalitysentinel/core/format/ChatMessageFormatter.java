package com.mortalitysentinel.core.format;

import com.mortalitysentinel.core.engine.EvaluationOutcome;
import com.mortalitysentinel.core.model.AlertResult;
import com.mortalitysentinel.core.model.Metric;
import com.mortalitysentinel.core.model.ModelDefinition;
import com.mortalitysentinel.core.model.TrendInfo;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders the {@code Alert} entries of an evaluation as a chat message.
 *
 * <p>
 * Layout: a headline with the model name, period and alert date, one block
 * per alerting hospital, then totals. When nothing alerts an all-clear
 * message is produced instead, so a scheduled run always reports something.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChatMessageFormatter {

    private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter ALERT_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public ChatMessageFormatter() {
        this(Clock.systemDefaultZone());
    }

    /**
     * @param clock source of the alert date shown in the headline
     */
    public ChatMessageFormatter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param outcome a successful evaluation
     * @return the message
     * @throws IllegalArgumentException if {@code outcome} is a failure
     */
    public ChatMessage format(EvaluationOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (!outcome.isSuccess() || outcome.getModel().isEmpty()) {
            throw new IllegalArgumentException("Cannot format a failed evaluation: " + outcome);
        }
        ModelDefinition model = outcome.getModel().get();
        YearMonth period = outcome.getCurrentPeriod().orElseGet(() -> YearMonth.now(clock));
        List<AlertResult> alerts = outcome.getAlerts();

        String headline = "*Quality Alert - " + model.getDisplayName() + "*\n"
                + "*Period:* " + period.format(PERIOD_FORMAT) + "\n"
                + "*Alert Date:* " + LocalDateTime.now(clock).format(ALERT_DATE_FORMAT);

        if (alerts.isEmpty()) {
            return new ChatMessage("✅ " + headline
                    + "\n\nNo hospital has a mortality rate that meets the set threshold.");
        }

        List<String> lines = new ArrayList<>();
        lines.add("🚨 " + headline);
        lines.add("");
        lines.add("*Hospitals with Alerts: " + alerts.size() + "*");
        lines.add("");

        for (int i = 0; i < alerts.size(); i++) {
            AlertResult alert = alerts.get(i);
            lines.add("*" + (i + 1) + ". " + alert.getHospitalName() + "*");
            lines.add("   • This Month Mortality Rate: *" + percent(alert.getMortalityRate()) + "*");
            lines.add("   • This Month Deaths: *" + alert.getDeaths() + "*");
            if (alert.getThreshold() != null) {
                lines.add("   • Threshold: " + formatThreshold(model.getMetric(), alert.getThreshold()));
            }
            if (alert.getSmr() != null) {
                lines.add("   • SMR: " + decimal(alert.getSmr()));
            }
            TrendInfo trend = alert.getTrendInfo();
            if (trend != null) {
                lines.add("   • Trend: " + trend.getMonth1() + " " + percent(trend.getRate1())
                        + " → " + trend.getMonth2() + " " + percent(trend.getRate2())
                        + " → " + trend.getMonth3() + " " + percent(trend.getRate3()));
            }
            if (!alert.getLast6MonthsMortality().isEmpty()) {
                lines.add("   • Last 6 Months: " + alert.getLast6MonthsMortality().stream()
                        .map(p -> p.getPeriod() + ": " + percent(p.getMortalityRate()))
                        .collect(Collectors.joining(", ")));
            }
            lines.add("");
        }

        int totalDeaths = alerts.stream().mapToInt(AlertResult::getDeaths).sum();
        double averageRate = alerts.stream().mapToDouble(AlertResult::getMortalityRate).average().orElse(0.0);

        lines.add("---");
        lines.add("*Summary:*");
        lines.add("• Total Hospitals with Alerts: " + alerts.size());
        lines.add("• Total Deaths This Month: " + totalDeaths);
        lines.add("• Average Mortality Rate: " + percent(averageRate));

        return new ChatMessage(String.join("\n", lines));
    }

    private static String formatThreshold(Metric metric, double threshold) {
        return metric == Metric.MORTALITY_RATE ? percent(threshold) : decimal(threshold);
    }

    private static String percent(double value) {
        return decimal(value) + "%";
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
