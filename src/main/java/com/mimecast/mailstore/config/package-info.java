/**
 * Handles the configuration of the storage node update pipe.
 *
 * <p>Provides the configuration foundation and typed accessors.
 * <br>Configuration lives in {@code storage.json5} and is parsed with Gson.
 *
 * <p><b>Example:</b>
 * <pre>
 * {
 *   driver: "sqlite3",
 *   dsn: ["/var/lib/mailstore/imapsql.db"],
 *   updatePipe: {
 *     enabled: true,
 *     mode: "replicate",
 *     transport: "auto",
 *     runtimeDirectory: "/run/mailstore"
 *   }
 * }
 * </pre>
 *
 * @see com.mimecast.mailstore.config.StorageConfig
 * @see com.mimecast.mailstore.config.UpdatePipeConfig
 */
package com.mimecast.mailstore.config;
