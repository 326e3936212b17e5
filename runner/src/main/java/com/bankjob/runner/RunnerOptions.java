package com.bankjob.runner;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * What a run produces and where it goes. A {@code null} CSV or OFX target means the console; a
 * target that is an existing directory gets a file named after the statement's date range. With
 * no output requested at all, OFX goes to the console.
 */
public final class RunnerOptions {
    private final boolean csv;
    private final Path csvTarget;
    private final boolean ofx;
    private final Path ofxTarget;
    private final boolean upload;
    private final boolean strictAmounts;
    private final List<String> scraperArgs;
    private final Path input;

    private RunnerOptions(Builder builder) {
        this.csv = builder.csv;
        this.csvTarget = builder.csvTarget;
        this.ofx = builder.ofx || !(builder.csv || builder.upload);
        this.ofxTarget = builder.ofxTarget;
        this.upload = builder.upload;
        this.strictAmounts = builder.strictAmounts;
        this.scraperArgs = List.copyOf(builder.scraperArgs);
        this.input = builder.input;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isCsv() {
        return csv;
    }

    public Path getCsvTarget() {
        return csvTarget;
    }

    public boolean isOfx() {
        return ofx;
    }

    public Path getOfxTarget() {
        return ofxTarget;
    }

    public boolean isUpload() {
        return upload;
    }

    /** Refuse to export amounts that do not parse instead of writing them as zero. */
    public boolean isStrictAmounts() {
        return strictAmounts;
    }

    public List<String> getScraperArgs() {
        return scraperArgs;
    }

    /** A saved page to extract from instead of fetching, or {@code null}. */
    public Path getInput() {
        return input;
    }

    public static final class Builder {
        private boolean csv;
        private Path csvTarget;
        private boolean ofx;
        private Path ofxTarget;
        private boolean upload;
        private boolean strictAmounts;
        private List<String> scraperArgs = List.of();
        private Path input;

        private Builder() {}

        public Builder csv(Path target) {
            this.csv = true;
            this.csvTarget = target;
            return this;
        }

        public Builder ofx(Path target) {
            this.ofx = true;
            this.ofxTarget = target;
            return this;
        }

        public Builder upload() {
            this.upload = true;
            return this;
        }

        public Builder strictAmounts() {
            this.strictAmounts = true;
            return this;
        }

        public Builder scraperArgs(List<String> scraperArgs) {
            this.scraperArgs = Objects.requireNonNull(scraperArgs, "scraperArgs");
            return this;
        }

        public Builder input(Path input) {
            this.input = input;
            return this;
        }

        public RunnerOptions build() {
            return new RunnerOptions(this);
        }
    }
}
