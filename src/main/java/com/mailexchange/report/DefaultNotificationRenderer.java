package com.mailexchange.report;

import com.mailexchange.delivery.RecipientResult;

/**
 * Default sender report renderer.
 *
 * <p>Produces a subject that states whether every recipient was reached, a plain text
 * summary and an inline styled HTML table suitable for most mail clients.
 * <p>All interpolated values are HTML escaped in the HTML body.
 */
public class DefaultNotificationRenderer implements NotificationRenderer {

    static final String BRAND = "Mail Exchange";

    private static final String COLOR_SUCCESS = "#10B981";
    private static final String COLOR_WARNING = "#F59E0B";
    private static final String COLOR_FAILED = "#EF4444";
    private static final String COLOR_MUTED = "#d1d5db";

    @Override
    public String getSubject(ForwardReport report) {
        return report.isAllSuccess()
                ? "[" + BRAND + "] Forwarded successfully - " + report.getSubject()
                : "[" + BRAND + "] Partially failed - " + report.getSubject();
    }

    @Override
    public String getText(ForwardReport report) {
        StringBuilder text = new StringBuilder();
        text.append("[").append(BRAND).append("] Forward report\n\n");
        text.append("Original subject: ").append(report.getSubject()).append("\n");
        text.append("Summary: success ").append(report.getSuccessCount())
                .append(" / failed ").append(report.getFailCount())
                .append(" / total ").append(report.getTotalCount()).append("\n\n");

        text.append("Details:\n");
        for (RecipientResult result : report.getResults()) {
            text.append("  ").append(result.getRecipient()).append(": ");
            if (result.isSuccess()) {
                text.append("success");
            } else {
                text.append("failed - ").append(result.getError() != null ? result.getError() : "unknown");
            }
            text.append("\n");
        }

        text.append("\nDuration: ").append(report.getDurationMillis()).append("ms\n");
        text.append("Completed: ").append(report.getTimestamp());
        return text.toString();
    }

    @Override
    public String getHtml(ForwardReport report) {
        boolean allSuccess = report.isAllSuccess();
        String theme = allSuccess ? COLOR_SUCCESS : COLOR_WARNING;

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html>\n<head><meta charset=\"UTF-8\"></head>\n")
                .append("<body style=\"margin:0;padding:0;font-family:Arial,sans-serif;\">\n")
                .append("<table width=\"100%\" cellpadding=\"0\" cellspacing=\"0\" style=\"background-color:#f3f4f6;\">\n")
                .append("<tr><td align=\"center\" style=\"padding:20px;\">\n")
                .append("<table width=\"600\" cellpadding=\"0\" cellspacing=\"0\" style=\"background-color:#ffffff;border:1px solid #e5e7eb;\">\n")
                .append("<tr><td style=\"height:6px;background-color:").append(theme).append(";\"></td></tr>\n")
                .append("<tr><td style=\"padding:24px 32px;\">\n");

        // Heading.
        html.append("<h1 style=\"margin:0 0 8px 0;font-size:20px;color:#111827;\">")
                .append(allSuccess ? "Mail forwarded successfully" : "Mail forwarding partially failed")
                .append("</h1>\n")
                .append("<p style=\"margin:0 0 20px 0;color:#6b7280;font-size:14px;\">Original subject: ")
                .append("<span style=\"color:#111827;font-weight:bold;\">").append(escapeHtml(report.getSubject())).append("</span></p>\n");

        // Counters.
        html.append("<table width=\"100%\" cellpadding=\"0\" cellspacing=\"0\" style=\"background-color:#f9fafb;margin-bottom:24px;\"><tr>\n");
        appendCounter(html, "Total", report.getTotalCount(), "#374151", true);
        appendCounter(html, "Success", report.getSuccessCount(), COLOR_SUCCESS, true);
        appendCounter(html, "Failed", report.getFailCount(), report.getFailCount() > 0 ? COLOR_FAILED : COLOR_MUTED, false);
        html.append("</tr></table>\n");

        // Recipient rows.
        html.append("<p style=\"margin:0 0 12px 0;font-size:14px;color:#4b5563;font-weight:bold;\">Delivery details</p>\n")
                .append("<table width=\"100%\" cellpadding=\"0\" cellspacing=\"0\" style=\"font-size:14px;\">\n")
                .append("<tr style=\"background-color:#f9fafb;\">")
                .append("<td style=\"padding:10px 12px;color:#6b7280;font-weight:bold;\">Recipient</td>")
                .append("<td style=\"padding:10px 12px;color:#6b7280;font-weight:bold;text-align:right;\">Status</td></tr>\n");
        for (RecipientResult result : report.getResults()) {
            html.append("<tr><td style=\"padding:12px;border-bottom:1px solid #f0f0f0;color:#374151;\">")
                    .append(escapeHtml(result.getRecipient()));
            if (result.getError() != null) {
                html.append("<div style=\"margin-top:4px;font-size:12px;color:#DC2626;\">")
                        .append(escapeHtml(result.getError())).append("</div>");
            }
            html.append("</td><td style=\"padding:12px;border-bottom:1px solid #f0f0f0;text-align:right;vertical-align:top;\">")
                    .append(result.isSuccess()
                            ? "<span style=\"display:inline-block;padding:4px 10px;background-color:#D1FAE5;color:#065F46;font-size:12px;font-weight:bold;\">&#10003; Success</span>"
                            : "<span style=\"display:inline-block;padding:4px 10px;background-color:#FEE2E2;color:#991B1B;font-size:12px;font-weight:bold;\">&#10007; Failed</span>")
                    .append("</td></tr>\n");
        }
        html.append("</table>\n</td></tr>\n");

        // Footer.
        html.append("<tr><td style=\"background-color:#f9fafb;padding:16px 32px;border-top:1px solid #e5e7eb;font-size:12px;color:#9ca3af;text-align:center;\">")
                .append("<p style=\"margin:0 0 4px 0;font-weight:bold;\">").append(BRAND).append("</p>")
                .append("<p style=\"margin:0;\">Duration: ").append(report.getDurationMillis()).append("ms &middot; ")
                .append(escapeHtml(report.getTimestamp())).append("</p>")
                .append("</td></tr>\n")
                .append("</table>\n</td></tr>\n</table>\n</body>\n</html>");

        return html.toString();
    }

    private void appendCounter(StringBuilder html, String label, int value, String color, boolean border) {
        html.append("<td width=\"33%\" align=\"center\" style=\"padding:12px;")
                .append(border ? "border-right:1px solid #e5e7eb;" : "").append("\">")
                .append("<div style=\"font-size:12px;color:#6b7280;text-transform:uppercase;\">").append(label).append("</div>")
                .append("<div style=\"font-size:24px;font-weight:bold;color:").append(color).append(";\">").append(value).append("</div>")
                .append("</td>\n");
    }

    /**
     * Escapes the HTML special characters.
     *
     * @param s Raw text, may be null.
     * @return Escaped text, empty for null.
     */
    private String escapeHtml(String s) {
        if (s == null) return "";
        StringBuilder out = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                case '&' -> out.append("&amp;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
