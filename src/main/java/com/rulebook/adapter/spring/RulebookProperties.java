package com.rulebook.adapter.spring;

import com.rulebook.compiler.CompilerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the rulebook compiler.
 */
@ConfigurationProperties(prefix = "rulebook")
public class RulebookProperties {

    /**
     * Whether the compiler is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to a rulebook document to compile at startup.
     * Supports classpath: prefix for classpath resources.
     */
    private String path;

    /**
     * Entities compiled concurrently.
     */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Package of the generated calculation classes.
     */
    private String generatedPackage = CompilerSettings.DEFAULT_PACKAGE;

    /**
     * Whether string fields that compute to "" become null.
     */
    private boolean blankStringsAsNull = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public String getGeneratedPackage() {
        return generatedPackage;
    }

    public void setGeneratedPackage(String generatedPackage) {
        this.generatedPackage = generatedPackage;
    }

    public boolean isBlankStringsAsNull() {
        return blankStringsAsNull;
    }

    public void setBlankStringsAsNull(boolean blankStringsAsNull) {
        this.blankStringsAsNull = blankStringsAsNull;
    }

    public CompilerSettings toSettings() {
        return new CompilerSettings(parallelism, generatedPackage, blankStringsAsNull);
    }
}
