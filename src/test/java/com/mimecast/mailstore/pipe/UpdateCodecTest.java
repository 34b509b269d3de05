package com.mimecast.mailstore.pipe;

import com.mimecast.mailstore.update.MailboxUpdate;
import com.mimecast.mailstore.update.UpdateType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UpdateCodec.
 */
class UpdateCodecTest {

    @Test
    void testEncodeIsSingleLine() {
        MailboxUpdate update = MailboxUpdate.mailboxRenamed("alice", "Line\nBreak", "<Archive>");
        String json = UpdateCodec.encode("123-abc", update);

        assertFalse(json.contains("\n"), "Envelope should fit on one line");
        assertTrue(json.contains("\"sender\":\"123-abc\""), "Sender should be encoded");
        assertTrue(json.contains("<Archive>"), "HTML characters should not be escaped");
    }

    @Test
    void testDecode() {
        MailboxUpdate update = MailboxUpdate.flagsChanged("alice", "INBOX", 12L, 4, List.of("\\Seen", "\\Flagged"));
        UpdateCodec.Envelope envelope = UpdateCodec.decode(UpdateCodec.encode("123-abc", update));

        assertEquals("123-abc", envelope.getSender(), "Sender should be decoded");
        assertEquals(update, envelope.getUpdate(), "Update should be decoded");
        assertEquals(UpdateType.FLAGS_CHANGED, envelope.getUpdate().getType(), "Type should be decoded");
        assertEquals(List.of("\\Seen", "\\Flagged"), envelope.getUpdate().getFlags(), "Flags should be decoded");
    }

    @Test
    void testDecodeWithoutFlags() {
        UpdateCodec.Envelope envelope = UpdateCodec.decode(
                "{\"sender\":\"p\",\"update\":{\"type\":\"MAILBOX_CREATED\",\"username\":\"bob\",\"mailbox\":\"Sent\"}}");
        assertEquals(MailboxUpdate.mailboxCreated("bob", "Sent"), envelope.getUpdate(), "Missing fields should default");
        assertTrue(envelope.getUpdate().getFlags().isEmpty(), "Missing flags should be empty");
    }

    @Test
    void testDecodeRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> UpdateCodec.decode("{not json"), "Malformed JSON");
        assertThrows(IllegalArgumentException.class, () -> UpdateCodec.decode("{\"sender\":\"p\"}"), "Missing update");
        assertThrows(IllegalArgumentException.class,
                () -> UpdateCodec.decode("{\"update\":{\"type\":\"MAILBOX_CREATED\",\"username\":\"a\",\"mailbox\":\"b\"}}"),
                "Missing sender");
        assertThrows(IllegalArgumentException.class,
                () -> UpdateCodec.decode("{\"sender\":\"p\",\"update\":{\"type\":\"TELEPORTED\",\"username\":\"a\",\"mailbox\":\"b\"}}"),
                "Unknown type");
        assertThrows(IllegalArgumentException.class,
                () -> UpdateCodec.decode("{\"sender\":\"p\",\"update\":{\"type\":\"MAILBOX_CREATED\",\"mailbox\":\"b\"}}"),
                "Missing username");
    }

    @Test
    void testDecodeRejectsIncompleteContent() {
        assertThrows(IllegalArgumentException.class,
                () -> UpdateCodec.decode("{\"sender\":\"p\",\"update\":{\"type\":\"MAILBOX_RENAMED\",\"username\":\"a\",\"mailbox\":\"b\"}}"),
                "Rename without new name");
        assertThrows(IllegalArgumentException.class,
                () -> UpdateCodec.decode("{\"sender\":\"p\",\"update\":{\"type\":\"MESSAGE_ADDED\",\"username\":\"a\",\"mailbox\":\"b\",\"uid\":1,\"flags\":[\"\\\\Seen\",null]}}"),
                "Null flag");

        UpdateCodec.Envelope renamed = UpdateCodec.decode(
                "{\"sender\":\"p\",\"update\":{\"type\":\"MAILBOX_RENAMED\",\"username\":\"a\",\"mailbox\":\"b\",\"newName\":\"c\"}}");
        assertEquals("c", renamed.getUpdate().getNewName(), "Complete rename should decode");
    }
}
