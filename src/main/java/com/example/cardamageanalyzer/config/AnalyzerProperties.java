package com.example.cardamageanalyzer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties {

    @Valid
    private final Normalization normalization = new Normalization();

    @Valid
    private final Scoring scoring = new Scoring();

    public Normalization getNormalization() {
        return normalization;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public static class Normalization {

        @Min(1)
        private int targetSize = 512;

        @Min(-255)
        @Max(255)
        private int brightness = 15;

        // 259 would divide by zero in the contrast factor
        @Min(-255)
        @Max(258)
        private int contrast = 10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private float jpegQuality = 0.9f;

        public int getTargetSize() {
            return targetSize;
        }

        public void setTargetSize(int targetSize) {
            this.targetSize = targetSize;
        }

        public int getBrightness() {
            return brightness;
        }

        public void setBrightness(int brightness) {
            this.brightness = brightness;
        }

        public int getContrast() {
            return contrast;
        }

        public void setContrast(int contrast) {
            this.contrast = contrast;
        }

        public float getJpegQuality() {
            return jpegQuality;
        }

        public void setJpegQuality(float jpegQuality) {
            this.jpegQuality = jpegQuality;
        }
    }

    public static class Scoring {

        @NotBlank
        private String url = "http://127.0.0.1:8000/api/analyze/";

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(60);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }
}
