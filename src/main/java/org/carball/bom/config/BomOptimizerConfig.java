package org.carball.bom.config;

import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
public class BomOptimizerConfig {
    private Path catalogFile;
    private Path orderFile;
    private Path cacheFile;
    private Path quoteFeedFile;
    private Path settingsFile;
    private String profileName;
    private String outputFile;
    private OutputFormat outputFormat;
    private List<String> excludedVendors = new ArrayList<>();
    private List<String> allowedVendors = new ArrayList<>();
    private boolean verbose;
}
