package com.tennis.matchdata.config;

import com.tennis.matchdata.model.SourceTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Locations of the yearly results files. Templates contain a {@code {year}} placeholder.
 */
@ConfigurationProperties(prefix = "tennis.source")
public class SourceProperties {

    public static final String YEAR_PLACEHOLDER = "{year}";

    private String tourUrlTemplate =
            "https://raw.githubusercontent.com/JeffSackmann/tennis_wta/master/wta_matches_{year}.csv";
    private String lowerTierUrlTemplate =
            "https://raw.githubusercontent.com/JeffSackmann/tennis_wta/master/wta_matches_qual_itf_{year}.csv";
    private int timeoutSeconds = 60;
    private int maxFileSizeMb = 64;
    private Charset charset = StandardCharsets.ISO_8859_1;

    public String urlFor(SourceTier tier, int year) {
        String template = tier == SourceTier.TOUR ? tourUrlTemplate : lowerTierUrlTemplate;
        return template.replace(YEAR_PLACEHOLDER, String.valueOf(year));
    }

    public String getTourUrlTemplate() {
        return tourUrlTemplate;
    }

    public void setTourUrlTemplate(String tourUrlTemplate) {
        this.tourUrlTemplate = tourUrlTemplate;
    }

    public String getLowerTierUrlTemplate() {
        return lowerTierUrlTemplate;
    }

    public void setLowerTierUrlTemplate(String lowerTierUrlTemplate) {
        this.lowerTierUrlTemplate = lowerTierUrlTemplate;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxFileSizeMb() {
        return maxFileSizeMb;
    }

    public void setMaxFileSizeMb(int maxFileSizeMb) {
        this.maxFileSizeMb = maxFileSizeMb;
    }

    public Charset getCharset() {
        return charset;
    }

    public void setCharset(Charset charset) {
        this.charset = charset;
    }
}
