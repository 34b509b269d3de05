package com.mimecast.mailstore.pipe;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.mimecast.mailstore.update.MailboxUpdate;
import com.mimecast.mailstore.update.UpdateType;

/**
 * JSON codec for updates travelling between nodes.
 *
 * <p>Each update is wrapped in an envelope naming the pipe instance that sent it:
 * <pre>{"sender":"4711-1b6d3586","update":{"type":"MESSAGE_ADDED","username":"tony@example.com",...}}</pre>
 * <p>Encoded envelopes never contain line breaks, so stream transports may use one envelope per line.
 */
public final class UpdateCodec {

    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    /**
     * Private constructor for utility class.
     */
    private UpdateCodec() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Decoded envelope.
     */
    public static final class Envelope {
        private final String sender;
        private final MailboxUpdate update;

        public Envelope(String sender, MailboxUpdate update) {
            this.sender = sender;
            this.update = update;
        }

        public String getSender() {
            return sender;
        }

        public MailboxUpdate getUpdate() {
            return update;
        }
    }

    /**
     * Encodes an update into a single line envelope.
     *
     * @param sender Sender id.
     * @param update Update.
     * @return JSON string without line breaks.
     */
    public static String encode(String sender, MailboxUpdate update) {
        return GSON.toJson(new Envelope(sender, update));
    }

    /**
     * Decodes an envelope.
     *
     * @param line JSON envelope.
     * @return Envelope.
     * @throws IllegalArgumentException Malformed or incomplete envelope, or null flags.
     */
    public static Envelope decode(String line) {
        Envelope envelope;
        try {
            envelope = GSON.fromJson(line, Envelope.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed update envelope: " + e.getMessage(), e);
        }
        if (envelope == null || envelope.sender == null || envelope.update == null) {
            throw new IllegalArgumentException("Incomplete update envelope");
        }
        MailboxUpdate update = envelope.update;
        if (update.getType() == null || update.getUsername() == null || update.getMailbox() == null) {
            throw new IllegalArgumentException("Update missing type, username or mailbox");
        }
        if (update.getType() == UpdateType.MAILBOX_RENAMED && update.getNewName() == null) {
            throw new IllegalArgumentException("Rename update missing new name");
        }
        for (String flag : update.getFlags()) {
            if (flag == null) {
                throw new IllegalArgumentException("Update flags contain null");
            }
        }
        return envelope;
    }
}
