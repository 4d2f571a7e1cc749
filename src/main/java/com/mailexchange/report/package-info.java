/**
 * Sender reports.
 */
package com.mailexchange.report;
