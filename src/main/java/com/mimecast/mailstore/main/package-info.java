/**
 * Configuration container for the storage node.
 *
 * <p>The {@code storage.json5} filename is resolved relative to the configuration directory given to
 * {@link com.mimecast.mailstore.main.Config#init(String)}.
 */
package com.mimecast.mailstore.main;
