/**
 * Replication pipe carrying mailbox updates between storage nodes that share one mail store.
 *
 * <p>{@link com.mimecast.mailstore.pipe.UpdatePipe} separates the three capabilities:
 * <br>listen for remote updates, push local ones and release the transport.
 *
 * <h2>Transports:</h2>
 * <ul>
 *     <li><b>Unix socket</b> - {@link com.mimecast.mailstore.pipe.UnixSockPipe}, for processes sharing a host
 *     and an SQLite store (default for the sqlite3 driver)</li>
 *     <li><b>Redis</b> - {@link com.mimecast.mailstore.pipe.RedisUpdatePipe}, pub/sub for networked SQL stores</li>
 * </ul>
 *
 * <p>Both exchange {@link com.mimecast.mailstore.pipe.UpdateCodec} JSON envelopes and drop their own echoes.
 * <p>Pushing is fire once. A failed push is reported with
 * {@link com.mimecast.mailstore.pipe.TransmitFailureException} and never retried.
 *
 * @see com.mimecast.mailstore.pipe.UpdatePipeFactory
 */
package com.mimecast.mailstore.pipe;
