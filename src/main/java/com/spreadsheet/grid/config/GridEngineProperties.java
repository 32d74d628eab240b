package com.spreadsheet.grid.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine settings bound from {@code grid.engine.*}.
 */
@Component
@ConfigurationProperties(prefix = "grid.engine")
public class GridEngineProperties {

    private String defaultSheetName = "Sheet1";
    private double defaultColumnWidth = 100.0;
    private double defaultRowHeight = 24.0;
    private int maxDependencyDepth = 10000;
    private boolean autoRecalculate = true;

    public String getDefaultSheetName() {
        return defaultSheetName;
    }

    public void setDefaultSheetName(String defaultSheetName) {
        this.defaultSheetName = defaultSheetName;
    }

    public double getDefaultColumnWidth() {
        return defaultColumnWidth;
    }

    public void setDefaultColumnWidth(double defaultColumnWidth) {
        this.defaultColumnWidth = defaultColumnWidth;
    }

    public double getDefaultRowHeight() {
        return defaultRowHeight;
    }

    public void setDefaultRowHeight(double defaultRowHeight) {
        this.defaultRowHeight = defaultRowHeight;
    }

    public int getMaxDependencyDepth() {
        return maxDependencyDepth;
    }

    public void setMaxDependencyDepth(int maxDependencyDepth) {
        this.maxDependencyDepth = maxDependencyDepth;
    }

    public boolean isAutoRecalculate() {
        return autoRecalculate;
    }

    public void setAutoRecalculate(boolean autoRecalculate) {
        this.autoRecalculate = autoRecalculate;
    }
}
