package ru.tsdb.config;

import org.jetbrains.annotations.NotNull;

public class StorageConfig {

    static final String DEFAULT_DATA_FILE = "data.tsv";
    static final long DEFAULT_MAX_FILE_SIZE = 1L << 30;
    static final String DEFAULT_BACKUP_DIR = "backups";

    @NotNull
    private final String dataFile;
    private final long maxFileSize;
    @NotNull
    private final String backupDir;
    private final boolean compression;

    /**
     * @param maxFileSize size in bytes that triggers rotation, {@code 0} or less disables it
     * @param compression whether rotated files are gzip-compressed
     */
    public StorageConfig(@NotNull String dataFile,
                         long maxFileSize,
                         @NotNull String backupDir,
                         boolean compression) {
        this.dataFile = dataFile;
        this.maxFileSize = maxFileSize;
        this.backupDir = backupDir;
        this.compression = compression;
    }

    @NotNull
    public static StorageConfig defaults() {
        return new StorageConfig(DEFAULT_DATA_FILE, DEFAULT_MAX_FILE_SIZE, DEFAULT_BACKUP_DIR, false);
    }

    @NotNull
    static StorageConfig from(@NotNull EnvVars env) {
        return new StorageConfig(
                env.getString("DATA_FILE", DEFAULT_DATA_FILE),
                env.getLong("MAX_FILE_SIZE", DEFAULT_MAX_FILE_SIZE),
                env.getString("BACKUP_DIR", DEFAULT_BACKUP_DIR),
                env.getBoolean("COMPRESSION", false));
    }

    @NotNull
    public String getDataFile() {
        return dataFile;
    }

    public long getMaxFileSize() {
        return maxFileSize;
    }

    @NotNull
    public String getBackupDir() {
        return backupDir;
    }

    public boolean isCompression() {
        return compression;
    }
}
