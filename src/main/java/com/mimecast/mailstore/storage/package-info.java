/**
 * Storage node and the forwarding of backend updates.
 *
 * <p>{@link com.mimecast.mailstore.storage.MailStorage} wires a
 * {@link com.mimecast.mailstore.storage.StorageBackend} to local consumers and, optionally, to other nodes
 * through an update pipe.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MailStorage storage = new MailStorage(new InMemoryStorageBackend()).open();
 * UpdateSource updates = storage.getUpdates();
 * ...
 * storage.close();
 * </pre>
 *
 * @see com.mimecast.mailstore.storage.UpdateForwarder
 */
package com.mimecast.mailstore.storage;
