package com.mailexchange.report;

/**
 * Sender report renderer.
 *
 * <p>Pure formatting, implementations must hold no state between calls.
 */
public interface NotificationRenderer {

    /**
     * Renders the report subject line.
     *
     * @param report Forward report.
     * @return Subject.
     */
    String getSubject(ForwardReport report);

    /**
     * Renders the plain text body.
     *
     * @param report Forward report.
     * @return Text body.
     */
    String getText(ForwardReport report);

    /**
     * Renders the HTML body.
     *
     * @param report Forward report.
     * @return HTML body.
     */
    String getHtml(ForwardReport report);
}
