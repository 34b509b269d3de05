package com.mimecast.mailstore.update;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one mailbox state change.
 *
 * <p>Updates carry no global identity. Two nodes may emit equal updates and both are delivered.
 * <p>Numeric fields not meaningful for a given {@link UpdateType} are zero and {@code newName} is null
 * unless the update is a rename.
 */
public final class MailboxUpdate implements Serializable {
    private static final long serialVersionUID = 1L;

    private final UpdateType type;
    private final String username;
    private final String mailbox;
    private final long uid;
    private final int seqNum;
    private final List<String> flags;
    private final int messageCount;
    private final int unseenCount;
    private final String newName;

    private MailboxUpdate(UpdateType type, String username, String mailbox, long uid, int seqNum,
                          List<String> flags, int messageCount, int unseenCount, String newName) {
        this.type = Objects.requireNonNull(type, "type");
        this.username = Objects.requireNonNull(username, "username");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.uid = uid;
        this.seqNum = seqNum;
        this.flags = flags == null || flags.isEmpty() ? List.of() : new ArrayList<>(flags);
        this.messageCount = messageCount;
        this.unseenCount = unseenCount;
        this.newName = newName;
    }

    /**
     * New message appended to a mailbox.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @param uid      Message UID.
     * @param seqNum   Message sequence number.
     * @param flags    Initial flags.
     * @return MailboxUpdate instance.
     */
    public static MailboxUpdate messageAdded(String username, String mailbox, long uid, int seqNum, List<String> flags) {
        return new MailboxUpdate(UpdateType.MESSAGE_ADDED, username, mailbox, uid, seqNum, flags, 0, 0, null);
    }

    /**
     * Message flags replaced.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @param uid      Message UID.
     * @param seqNum   Message sequence number.
     * @param flags    New flag set.
     * @return MailboxUpdate instance.
     */
    public static MailboxUpdate flagsChanged(String username, String mailbox, long uid, int seqNum, List<String> flags) {
        return new MailboxUpdate(UpdateType.FLAGS_CHANGED, username, mailbox, uid, seqNum, flags, 0, 0, null);
    }

    /**
     * Message removed by expunge.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @param seqNum   Sequence number the message had before removal.
     * @return MailboxUpdate instance.
     */
    public static MailboxUpdate messageExpunged(String username, String mailbox, int seqNum) {
        return new MailboxUpdate(UpdateType.MESSAGE_EXPUNGED, username, mailbox, 0L, seqNum, null, 0, 0, null);
    }

    /**
     * Mailbox created.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @return MailboxUpdate instance.
     */
    public static MailboxUpdate mailboxCreated(String username, String mailbox) {
        return new MailboxUpdate(UpdateType.MAILBOX_CREATED, username, mailbox, 0L, 0, null, 0, 0, null);
    }

    /**
     * Mailbox deleted.
     *
     * @param username Account name.
     * @param mailbox  Mailbox name.
     * @return MailboxUpdate instance.
     */
    public static MailboxUpdate mailboxDeleted(String username, String mailbox) {
        return new MailboxUpdate(UpdateType.MAILBOX_DELETED, username, mailbox, 0L, 0, null, 0, 0, null);
    }

    /**
     * Mailbox renamed.
     *
     * @param username Account name.
     * @param mailbox  Old mailbox name.
     * @param newName  New mailbox name.
     * @return MailboxUpdate instance.
     */
    public static MailboxUpdate mailboxRenamed(String username, String mailbox, String newName) {
        return new MailboxUpdate(UpdateType.MAILBOX_RENAMED, username, mailbox, 0L, 0, null, 0, 0,
                Objects.requireNonNull(newName, "newName"));
    }

    /**
     * Mailbox counters changed.
     *
     * @param username     Account name.
     * @param mailbox      Mailbox name.
     * @param messageCount Total messages.
     * @param unseenCount  Messages without the seen flag.
     * @return MailboxUpdate instance.
     */
    public static MailboxUpdate mailboxStatus(String username, String mailbox, int messageCount, int unseenCount) {
        return new MailboxUpdate(UpdateType.MAILBOX_STATUS, username, mailbox, 0L, 0, null, messageCount, unseenCount, null);
    }

    public UpdateType getType() {
        return type;
    }

    public String getUsername() {
        return username;
    }

    public String getMailbox() {
        return mailbox;
    }

    public long getUid() {
        return uid;
    }

    public int getSeqNum() {
        return seqNum;
    }

    /**
     * Gets flags.
     *
     * @return Unmodifiable list, never null.
     */
    public List<String> getFlags() {
        return flags == null ? List.of() : Collections.unmodifiableList(flags);
    }

    public int getMessageCount() {
        return messageCount;
    }

    public int getUnseenCount() {
        return unseenCount;
    }

    public String getNewName() {
        return newName;
    }

    /**
     * Short human readable description for logs.
     *
     * @return String.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append(type).append(' ')
                .append(username).append('/').append(mailbox);
        switch (type) {
            case MESSAGE_ADDED:
            case FLAGS_CHANGED:
                sb.append(" uid=").append(uid).append(" seq=").append(seqNum).append(" flags=").append(getFlags());
                break;
            case MESSAGE_EXPUNGED:
                sb.append(" seq=").append(seqNum);
                break;
            case MAILBOX_RENAMED:
                sb.append(" -> ").append(newName);
                break;
            case MAILBOX_STATUS:
                sb.append(" messages=").append(messageCount).append(" unseen=").append(unseenCount);
                break;
            default:
                break;
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MailboxUpdate)) return false;
        MailboxUpdate that = (MailboxUpdate) o;
        return uid == that.uid
                && seqNum == that.seqNum
                && messageCount == that.messageCount
                && unseenCount == that.unseenCount
                && type == that.type
                && username.equals(that.username)
                && mailbox.equals(that.mailbox)
                && getFlags().equals(that.getFlags())
                && Objects.equals(newName, that.newName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, username, mailbox, uid, seqNum, getFlags(), messageCount, unseenCount, newName);
    }

    @Override
    public String toString() {
        return "MailboxUpdate{" + describe() + "}";
    }
}
