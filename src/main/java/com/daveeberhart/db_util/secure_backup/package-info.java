/**
 * A utility to take encrypted database backups into S3-compatible object storage,
 * and restore them on demand.
 * <p>
 * Dumps are compressed and encrypted locally using chunked AES-GCM before upload; plaintext never
 * outlives the job that produced it.
 */
package com.daveeberhart.db_util.secure_backup;
