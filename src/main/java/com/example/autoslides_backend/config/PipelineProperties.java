package com.example.autoslides_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Concurrency limits for the image phase of a pipeline run.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private int imageFetchThreads = 4;
    private int imageFetchQueueCapacity = 200;
    private int candidateMultiplier = 3;
    private String scratchDir;

    public int getImageFetchThreads() {
        return imageFetchThreads;
    }

    public void setImageFetchThreads(int imageFetchThreads) {
        this.imageFetchThreads = imageFetchThreads;
    }

    public int getImageFetchQueueCapacity() {
        return imageFetchQueueCapacity;
    }

    public void setImageFetchQueueCapacity(int imageFetchQueueCapacity) {
        this.imageFetchQueueCapacity = imageFetchQueueCapacity;
    }

    /**
     * How many search candidates to request per wanted image, so that slides can avoid reusing images.
     *
     * @return multiplier applied to images-per-slide.
     */
    public int getCandidateMultiplier() {
        return candidateMultiplier;
    }

    public void setCandidateMultiplier(int candidateMultiplier) {
        this.candidateMultiplier = candidateMultiplier;
    }

    public String getScratchDir() {
        return scratchDir;
    }

    public void setScratchDir(String scratchDir) {
        this.scratchDir = scratchDir;
    }
}
