package com.mimecast.mailstore.pipe;

import com.mimecast.mailstore.update.MailboxUpdate;
import com.mimecast.mailstore.update.UpdateQueue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UnixSockPipe.
 */
class UnixSockPipeTest {

    @TempDir
    Path tempDir;

    private Path sockPath() {
        return tempDir.resolve("sql-test.sock");
    }

    @Test
    void testPeerUpdatesDelivered() throws Exception {
        UpdateQueue local = new UpdateQueue(8);
        UnixSockPipe listener = new UnixSockPipe(sockPath());
        UnixSockPipe pusher = new UnixSockPipe(sockPath());
        try {
            listener.listen(local);
            assertTrue(Files.exists(sockPath()), "Socket file should exist while listening");

            pusher.initPush();
            MailboxUpdate first = MailboxUpdate.messageAdded("alice", "INBOX", 7L, 3, List.of("\\Seen"));
            MailboxUpdate second = MailboxUpdate.mailboxRenamed("alice", "Drafts", "Old Drafts");
            pusher.push(first);
            pusher.push(second);

            assertEquals(first, local.poll(5, TimeUnit.SECONDS), "First update should arrive");
            assertEquals(second, local.poll(5, TimeUnit.SECONDS), "Second update should arrive in order");
        } finally {
            pusher.close();
            listener.close();
        }
        assertFalse(Files.exists(sockPath()), "Socket file should be removed on close");
    }

    @Test
    void testOwnEchoesDropped() throws Exception {
        UpdateQueue local = new UpdateQueue(8);
        UnixSockPipe pipe = new UnixSockPipe(sockPath());
        UnixSockPipe other = new UnixSockPipe(sockPath());
        try {
            pipe.listen(local);
            pipe.initPush();
            pipe.push(MailboxUpdate.mailboxCreated("alice", "Mine"));

            other.push(MailboxUpdate.mailboxCreated("bob", "Theirs"));
            assertEquals(MailboxUpdate.mailboxCreated("bob", "Theirs"), local.poll(5, TimeUnit.SECONDS),
                    "Only the other sender's update should arrive");
            assertNull(local.poll(200, TimeUnit.MILLISECONDS), "Own update should be dropped");
        } finally {
            other.close();
            pipe.close();
        }
    }

    @Test
    void testMalformedLinesSkipped() throws Exception {
        UpdateQueue local = new UpdateQueue(8);
        UnixSockPipe pipe = new UnixSockPipe(sockPath());
        try {
            pipe.listen(local);

            MailboxUpdate valid = MailboxUpdate.mailboxDeleted("alice", "Trash");
            String payload = "not json\n"
                    + "{\"sender\":\"x\"}\n"
                    + "\n"
                    + UpdateCodec.encode("peer-1", valid) + "\n";
            try (SocketChannel raw = SocketChannel.open(UnixDomainSocketAddress.of(sockPath()))) {
                ByteBuffer buffer = ByteBuffer.wrap(payload.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    raw.write(buffer);
                }
                assertEquals(valid, local.poll(5, TimeUnit.SECONDS), "Valid update should survive malformed lines");
            }
        } finally {
            pipe.close();
        }
    }

    @Test
    void testOversizedLineDropsPeer() throws Exception {
        UpdateQueue local = new UpdateQueue(8);
        UnixSockPipe pipe = new UnixSockPipe(sockPath());
        try {
            pipe.listen(local);

            byte[] flood = "x".repeat(UnixSockPipe.MAX_LINE_LENGTH + 1024).getBytes(StandardCharsets.UTF_8);
            try (SocketChannel raw = SocketChannel.open(UnixDomainSocketAddress.of(sockPath()))) {
                ByteBuffer buffer = ByteBuffer.wrap(flood);
                while (buffer.hasRemaining()) {
                    raw.write(buffer);
                }
            } catch (IOException e) {
                // Listener hung up mid write.
            }
            assertNull(local.poll(200, TimeUnit.MILLISECONDS), "Oversized line should not produce an update");

            MailboxUpdate valid = MailboxUpdate.mailboxCreated("alice", "After");
            try (SocketChannel raw = SocketChannel.open(UnixDomainSocketAddress.of(sockPath()))) {
                ByteBuffer buffer = ByteBuffer.wrap((UpdateCodec.encode("peer-2", valid) + "\n").getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    raw.write(buffer);
                }
                assertEquals(valid, local.poll(5, TimeUnit.SECONDS), "Listener should keep serving other peers");
            }
        } finally {
            pipe.close();
        }
    }

    @Test
    void testReadLineBounds() throws Exception {
        StringReader reader = new StringReader("first\r\nsecond\n\nlast");
        assertEquals("first", UnixSockPipe.readLine(reader, 16), "Carriage return should be stripped");
        assertEquals("second", UnixSockPipe.readLine(reader, 16), "Plain newline");
        assertEquals("", UnixSockPipe.readLine(reader, 16), "Empty line");
        assertEquals("last", UnixSockPipe.readLine(reader, 16), "Unterminated last line");
        assertNull(UnixSockPipe.readLine(reader, 16), "End of stream");

        assertEquals("12345678", UnixSockPipe.readLine(new StringReader("12345678\n"), 8), "Line at the limit");
        assertThrows(IOException.class, () -> UnixSockPipe.readLine(new StringReader("123456789\n"), 8),
                "Line over the limit");
        assertThrows(IOException.class, () -> UnixSockPipe.readLine(new StringReader("123456789"), 8),
                "Unterminated line over the limit");
    }

    @Test
    void testDoubleActivationThrows() throws Exception {
        UnixSockPipe pipe = new UnixSockPipe(sockPath());
        try {
            pipe.listen(new UpdateQueue(4));
            pipe.initPush();
            assertThrows(AlreadyActiveException.class, () -> pipe.listen(new UpdateQueue(4)), "Second listen should fail");
            assertThrows(AlreadyActiveException.class, pipe::initPush, "Second initPush should fail");
        } finally {
            pipe.close();
        }
    }

    @Test
    void testLiveSocketNotTakenOver() throws Exception {
        UnixSockPipe first = new UnixSockPipe(sockPath());
        UnixSockPipe second = new UnixSockPipe(sockPath());
        try {
            first.listen(new UpdateQueue(4));
            TransportUnavailableException e = assertThrows(TransportUnavailableException.class,
                    () -> second.listen(new UpdateQueue(4)), "Bound socket should not be taken over");
            assertTrue(e.getMessage().contains("already in use"), "Message should explain the conflict");
        } finally {
            second.close();
            first.close();
        }
    }

    @Test
    void testStaleSocketReplaced() throws Exception {
        ServerSocketChannel dead = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        dead.bind(UnixDomainSocketAddress.of(sockPath()));
        dead.close();
        assertTrue(Files.exists(sockPath()), "Stale socket file should be left behind");

        UpdateQueue local = new UpdateQueue(4);
        UnixSockPipe pipe = new UnixSockPipe(sockPath());
        UnixSockPipe pusher = new UnixSockPipe(sockPath());
        try {
            pipe.listen(local);
            pusher.push(MailboxUpdate.mailboxCreated("alice", "INBOX"));
            assertEquals(MailboxUpdate.mailboxCreated("alice", "INBOX"), local.poll(5, TimeUnit.SECONDS),
                    "Listener should work on the replaced socket");
        } finally {
            pusher.close();
            pipe.close();
        }
    }

    @Test
    void testNoListenerFailures() {
        UnixSockPipe pipe = new UnixSockPipe(sockPath());
        try {
            assertThrows(TransportUnavailableException.class, pipe::initPush, "initPush without listener should fail");
            assertThrows(TransmitFailureException.class, () -> pipe.push(MailboxUpdate.mailboxCreated("alice", "INBOX")),
                    "Push without listener should fail");
        } finally {
            pipe.close();
        }
    }

    @Test
    void testCloseIsIdempotent() throws Exception {
        UnixSockPipe idle = new UnixSockPipe(sockPath());
        idle.close();
        idle.close();
        assertThrows(TransportUnavailableException.class, () -> idle.listen(new UpdateQueue(4)),
                "Closed pipe should not listen");

        UnixSockPipe pipe = new UnixSockPipe(sockPath());
        pipe.listen(new UpdateQueue(4));
        pipe.close();
        pipe.close();
        assertFalse(Files.exists(sockPath()), "Socket file should be removed");
    }
}
