/**
 * Mailbox update events and the bounded streams that carry them.
 *
 * <p>{@link com.mimecast.mailstore.update.MailboxUpdate} is the immutable event.
 * <br>{@link com.mimecast.mailstore.update.UpdateQueue} is the bounded FIFO used both for the storage engine
 * update channel and for the node's local update stream.
 */
package com.mimecast.mailstore.update;
