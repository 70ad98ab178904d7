package com.errorsentinel.service.report;

import com.errorsentinel.core.model.ClassifiedGroup;
import com.errorsentinel.core.model.ErrorReport;

import java.io.PrintStream;
import java.util.List;
import java.util.stream.Collectors;

public final class ConsoleReportPrinter {
    static final int NOISE_SUMMARY_LIMIT = 5;
    private static final String RULE = "-".repeat(50);

    private ConsoleReportPrinter() {
    }

    public static void print(ErrorReport report, PrintStream out) {
        out.println(RULE);
        out.println("Error analysis");
        out.println(RULE);
        out.println(report.totalRecords() + " records -> " + report.patternCount() + " patterns ("
                + report.attention().size() + " attention, " + report.noise().size() + " ignored)");

        if (report.attention().isEmpty()) {
            out.println();
            out.println("No errors need attention");
        } else {
            out.println();
            out.println("Needs attention (" + report.attention().size() + ")");
            for (ClassifiedGroup group : report.attention()) {
                String newMark = report.isNew(group.signature()) ? "[NEW] " : "";
                out.println("  " + newMark + group.signature() + " (" + group.count() + ")");
                String lastTime = timeOfDay(group.aggregate().lastSeenTimestamp());
                out.println("     " + shortSources(group) + (lastTime.isEmpty() ? "" : " | last: " + lastTime));
            }
        }

        if (!report.noise().isEmpty()) {
            out.println();
            out.println("Ignored (" + report.noise().size() + " patterns, " + report.noiseRecordCount() + " records)");
            out.println("  " + noiseSummary(report.noise()));
        }
        out.println(RULE);
    }

    static String noiseSummary(List<ClassifiedGroup> noise) {
        String summary = noise.stream()
                .limit(NOISE_SUMMARY_LIMIT)
                .map(group -> headOf(group.signature()) + "(" + group.count() + ")")
                .collect(Collectors.joining(", "));
        int remaining = noise.size() - NOISE_SUMMARY_LIMIT;
        return remaining > 0 ? summary + ", ...+" + remaining + " more" : summary;
    }

    static String shortSource(String source) {
        String trimmed = source;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int lastSlash = trimmed.lastIndexOf('/');
        return lastSlash < 0 ? trimmed : trimmed.substring(lastSlash + 1);
    }

    private static String shortSources(ClassifiedGroup group) {
        return group.aggregate().sources().stream()
                .map(ConsoleReportPrinter::shortSource)
                .collect(Collectors.joining(", "));
    }

    // HH:mm out of an ISO-8601 timestamp
    private static String timeOfDay(String timestamp) {
        return timestamp != null && timestamp.length() >= 16 ? timestamp.substring(11, 16) : "";
    }

    private static String headOf(String signature) {
        int colon = signature.indexOf(':');
        return colon < 0 ? signature : signature.substring(0, colon);
    }
}
