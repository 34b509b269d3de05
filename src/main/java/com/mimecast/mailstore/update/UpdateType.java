package com.mimecast.mailstore.update;

/**
 * Kinds of mailbox state change.
 */
public enum UpdateType {
    MESSAGE_ADDED,
    FLAGS_CHANGED,
    MESSAGE_EXPUNGED,
    MAILBOX_CREATED,
    MAILBOX_DELETED,
    MAILBOX_RENAMED,
    MAILBOX_STATUS
}
