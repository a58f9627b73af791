package com.linlay.skillplatform.skill;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "agent.skill")
public class SkillCatalogProperties {

    private String dataDir = "./data";
    private long maxImportBytes = 50L * 1024 * 1024;
    private int maxReadLines = 2_000;

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public long getMaxImportBytes() {
        return maxImportBytes;
    }

    public void setMaxImportBytes(long maxImportBytes) {
        this.maxImportBytes = maxImportBytes;
    }

    public int getMaxReadLines() {
        return maxReadLines;
    }

    public void setMaxReadLines(int maxReadLines) {
        this.maxReadLines = maxReadLines;
    }

    public Path resolveDataDir() {
        return Path.of(dataDir).toAbsolutePath().normalize();
    }

    public Path resolveIndexFile() {
        return resolveDataDir().resolve("skills.json");
    }
}
