package com.example.scenegen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "scenes")
public class SceneProperties {

    private Duration signedUrlTtl = Duration.ofSeconds(3600);
    /** Prefix every keyframe key must start with; {owner} and {project} are substituted. */
    private String keyPrefixPattern = "{owner}/{project}/photos/";
    private String archivePrefixPattern = "users/{owner}/Scenes/{project}/";
    private Duration pollInterval = Duration.ofSeconds(3);
    private int pollMaxAttempts = 100;
    private long downloadTimeoutSeconds = 60;
    private int watchPoolSize = 4;
    private final Idempotency idempotency = new Idempotency();

    public Duration getSignedUrlTtl() {
        return signedUrlTtl;
    }

    public void setSignedUrlTtl(Duration signedUrlTtl) {
        this.signedUrlTtl = signedUrlTtl;
    }

    public String getKeyPrefixPattern() {
        return keyPrefixPattern;
    }

    public void setKeyPrefixPattern(String keyPrefixPattern) {
        this.keyPrefixPattern = keyPrefixPattern;
    }

    public String getArchivePrefixPattern() {
        return archivePrefixPattern;
    }

    public void setArchivePrefixPattern(String archivePrefixPattern) {
        this.archivePrefixPattern = archivePrefixPattern;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getPollMaxAttempts() {
        return pollMaxAttempts;
    }

    public void setPollMaxAttempts(int pollMaxAttempts) {
        this.pollMaxAttempts = pollMaxAttempts;
    }

    public long getDownloadTimeoutSeconds() {
        return downloadTimeoutSeconds;
    }

    public void setDownloadTimeoutSeconds(long downloadTimeoutSeconds) {
        this.downloadTimeoutSeconds = downloadTimeoutSeconds;
    }

    public int getWatchPoolSize() {
        return watchPoolSize;
    }

    public void setWatchPoolSize(int watchPoolSize) {
        this.watchPoolSize = watchPoolSize;
    }

    public Idempotency getIdempotency() {
        return idempotency;
    }

    public String keyPrefix(String owner, String project) {
        return keyPrefixPattern.replace("{owner}", owner).replace("{project}", project);
    }

    public String archivePrefix(String owner, String project) {
        return archivePrefixPattern.replace("{owner}", owner).replace("{project}", project);
    }

    public static class Idempotency {
        /** When true an identical in-flight request returns the existing generation instead of resubmitting. */
        private boolean enforce = false;

        public boolean isEnforce() {
            return enforce;
        }

        public void setEnforce(boolean enforce) {
            this.enforce = enforce;
        }
    }
}
