/**
 * The main package for Mail Exchange, a tag based IMAP mail forwarder.
 *
 * <p>Mail arriving in a watched IMAP folder is matched against subject tags.
 * <br>Each match is forwarded to the rule's recipients with per-recipient retry,
 * <br>and the original sender receives a report of what was delivered.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar mail-exchange.jar --help
 *      java -jar mail-exchange.jar
 *       Tag based IMAP mail forwarder
 *
 *      usage:   [-c &lt;arg&gt;] [-h]
 *       -c,--config &lt;arg&gt;   Config file or directory containing forwarder.json5
 *       -h,--help           Show usage
 * </pre>
 *
 * @see com.mailexchange.main.Server
 */
package com.mailexchange;
