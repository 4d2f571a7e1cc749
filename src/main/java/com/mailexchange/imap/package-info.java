/**
 * IMAP mailbox source.
 *
 * <p>{@link com.mailexchange.imap.ImapListener} keeps a connection open, processes unseen mail
 * <br>and waits for new mail with IDLE, falling back to polling where the server lacks it.
 */
package com.mailexchange.imap;
