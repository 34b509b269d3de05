package com.mimecast.mailstore.storage;

import com.mimecast.mailstore.update.MailboxUpdate;
import com.mimecast.mailstore.update.UpdateQueue;
import com.mimecast.mailstore.update.UpdateSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of StorageBackend for testing or embedded nodes.
 * <p>This implementation does not persist data and is lost on application restart.
 * <p>Every mutation publishes its updates while holding the store lock, so update order matches mutation order.
 * <br>When the update source is full, mutations wait for the reader.
 */
public class InMemoryStorageBackend implements StorageBackend {
    private static final Logger log = LogManager.getLogger(InMemoryStorageBackend.class);

    /**
     * Update source capacity used when none is given.
     */
    public static final int DEFAULT_UPDATES_CAPACITY = 20;

    public static final String FLAG_SEEN = "\\Seen";
    public static final String FLAG_DELETED = "\\Deleted";

    private final int updatesCapacity;
    private final Object updatesLock = new Object();
    private volatile UpdateQueue updates;
    private volatile boolean closed = false;

    // username -> mailbox name -> mailbox.
    private final Map<String, Map<String, Mailbox>> accounts = new HashMap<>();

    private static final class Message {
        private final long uid;
        private List<String> flags;

        private Message(long uid, List<String> flags) {
            this.uid = uid;
            this.flags = List.copyOf(flags);
        }
    }

    private static final class Mailbox {
        private final List<Message> messages = new ArrayList<>();
        private long nextUid = 1L;

        private int unseen() {
            int count = 0;
            for (Message message : messages) {
                if (!message.flags.contains(FLAG_SEEN)) {
                    count++;
                }
            }
            return count;
        }
    }

    /**
     * Constructs a new InMemoryStorageBackend instance with the default update capacity.
     */
    public InMemoryStorageBackend() {
        this(DEFAULT_UPDATES_CAPACITY);
    }

    /**
     * Constructs a new InMemoryStorageBackend instance.
     *
     * @param updatesCapacity Update source capacity.
     */
    public InMemoryStorageBackend(int updatesCapacity) {
        if (updatesCapacity < 1) {
            throw new IllegalArgumentException("Update capacity must be positive: " + updatesCapacity);
        }
        this.updatesCapacity = updatesCapacity;
    }

    @Override
    public int getUpdatesCapacity() {
        return updatesCapacity;
    }

    @Override
    public UpdateSource getUpdates() {
        UpdateQueue current = updates;
        if (current == null) {
            synchronized (updatesLock) {
                current = updates;
                if (current == null) {
                    current = new UpdateQueue(updatesCapacity);
                    if (closed) {
                        current.close();
                    }
                    updates = current;
                }
            }
        }
        return current;
    }

    /**
     * Creates a mailbox.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @return false if the mailbox already exists.
     */
    public synchronized boolean createMailbox(String username, String mailbox) {
        checkOpen();
        Map<String, Mailbox> boxes = accounts.computeIfAbsent(username, k -> new LinkedHashMap<>());
        if (boxes.containsKey(mailbox)) {
            return false;
        }
        boxes.put(mailbox, new Mailbox());
        publish(MailboxUpdate.mailboxCreated(username, mailbox));
        return true;
    }

    /**
     * Deletes a mailbox and its messages.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @return false if the mailbox does not exist.
     */
    public synchronized boolean deleteMailbox(String username, String mailbox) {
        checkOpen();
        Map<String, Mailbox> boxes = accounts.get(username);
        if (boxes == null || boxes.remove(mailbox) == null) {
            return false;
        }
        publish(MailboxUpdate.mailboxDeleted(username, mailbox));
        return true;
    }

    /**
     * Renames a mailbox.
     *
     * @param username Account name.
     * @param mailbox  Current name.
     * @param newName  New name.
     * @return false if the source is missing or the target exists.
     */
    public synchronized boolean renameMailbox(String username, String mailbox, String newName) {
        checkOpen();
        Map<String, Mailbox> boxes = accounts.get(username);
        if (boxes == null || !boxes.containsKey(mailbox) || boxes.containsKey(newName)) {
            return false;
        }
        boxes.put(newName, boxes.remove(mailbox));
        publish(MailboxUpdate.mailboxRenamed(username, mailbox, newName));
        return true;
    }

    /**
     * Appends a message.
     * <p>Publishes the new message followed by the mailbox status.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @param flags    Initial flags.
     * @return Assigned UID.
     * @throws IllegalArgumentException Mailbox does not exist.
     */
    public synchronized long appendMessage(String username, String mailbox, List<String> flags) {
        checkOpen();
        Mailbox box = mailbox(username, mailbox);
        long uid = box.nextUid++;
        box.messages.add(new Message(uid, flags));
        publish(MailboxUpdate.messageAdded(username, mailbox, uid, box.messages.size(), flags));
        publish(MailboxUpdate.mailboxStatus(username, mailbox, box.messages.size(), box.unseen()));
        return uid;
    }

    /**
     * Replaces the flags of a message.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @param uid      Message UID.
     * @param flags    New flags.
     * @return false if no message has that UID.
     * @throws IllegalArgumentException Mailbox does not exist.
     */
    public synchronized boolean setFlags(String username, String mailbox, long uid, List<String> flags) {
        checkOpen();
        Mailbox box = mailbox(username, mailbox);
        for (int i = 0; i < box.messages.size(); i++) {
            Message message = box.messages.get(i);
            if (message.uid == uid) {
                message.flags = List.copyOf(flags);
                publish(MailboxUpdate.flagsChanged(username, mailbox, uid, i + 1, flags));
                return true;
            }
        }
        return false;
    }

    /**
     * Removes every message flagged as deleted.
     * <p>Expunge updates go out highest sequence number first so each number is valid when received.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @return Number of messages removed.
     * @throws IllegalArgumentException Mailbox does not exist.
     */
    public synchronized int expunge(String username, String mailbox) {
        checkOpen();
        Mailbox box = mailbox(username, mailbox);
        int removed = 0;
        for (int i = box.messages.size() - 1; i >= 0; i--) {
            if (box.messages.get(i).flags.contains(FLAG_DELETED)) {
                box.messages.remove(i);
                publish(MailboxUpdate.messageExpunged(username, mailbox, i + 1));
                removed++;
            }
        }
        if (removed > 0) {
            publish(MailboxUpdate.mailboxStatus(username, mailbox, box.messages.size(), box.unseen()));
        }
        return removed;
    }

    /**
     * Gets the number of messages in a mailbox.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @return Message count.
     * @throws IllegalArgumentException Mailbox does not exist.
     */
    public synchronized int getMessageCount(String username, String mailbox) {
        return mailbox(username, mailbox).messages.size();
    }

    /**
     * Lists mailbox names of an account in creation order.
     *
     * @param username Account name.
     * @return List of mailbox names.
     */
    public synchronized List<String> listMailboxes(String username) {
        Map<String, Mailbox> boxes = accounts.get(username);
        return boxes == null ? List.of() : new ArrayList<>(boxes.keySet());
    }

    private Mailbox mailbox(String username, String mailbox) {
        Map<String, Mailbox> boxes = accounts.get(username);
        Mailbox box = boxes != null ? boxes.get(mailbox) : null;
        if (box == null) {
            throw new IllegalArgumentException("No such mailbox: " + username + "/" + mailbox);
        }
        return box;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Storage backend is closed");
        }
    }

    private void publish(MailboxUpdate update) {
        UpdateQueue current = updates;
        if (current == null) {
            // Nobody asked for updates yet.
            return;
        }
        try {
            if (!current.put(update)) {
                log.debug("Update source closed, dropping {}", update.describe());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing " + update.describe(), e);
        }
    }

    /**
     * Stops generating updates and closes the update source.
     * <p>Does not wait for the store lock so a mutation blocked on a full source is released.
     */
    @Override
    public void close() {
        closed = true;
        synchronized (updatesLock) {
            if (updates != null) {
                updates.close();
            }
        }
    }
}
