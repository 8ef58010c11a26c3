package com.example.autoslides_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Output location, template override and the bounds applied to every deck request.
 */
@ConfigurationProperties(prefix = "deck")
public class DeckProperties {
    private String outputDir = "./slides";
    private String templatePath;
    private String downloadBasePath = "/v1/files/decks/";
    private int maxSlides = 20;
    private int maxImagesPerSlide = 4;
    private int bulletMaxChars = 160;

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public String getTemplatePath() { return templatePath; }
    public void setTemplatePath(String templatePath) { this.templatePath = templatePath; }

    public String getDownloadBasePath() { return downloadBasePath; }
    public void setDownloadBasePath(String downloadBasePath) { this.downloadBasePath = downloadBasePath; }

    public int getMaxSlides() { return maxSlides; }
    public void setMaxSlides(int maxSlides) { this.maxSlides = maxSlides; }

    public int getMaxImagesPerSlide() { return maxImagesPerSlide; }
    public void setMaxImagesPerSlide(int maxImagesPerSlide) { this.maxImagesPerSlide = maxImagesPerSlide; }

    public int getBulletMaxChars() { return bulletMaxChars; }
    public void setBulletMaxChars(int bulletMaxChars) { this.bulletMaxChars = bulletMaxChars; }

    public boolean hasTemplatePath() {
        return templatePath != null && !templatePath.isBlank();
    }
}
