package com.prettyprinter.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only layout and formatting options of a print session.
 */
public class FormattingConfig {
    public static final int DEFAULT_TAB_WIDTH = 8;
    public static final int DEFAULT_MAX_NEWLINES = 3;

    private final int tabWidth;
    private final boolean useTabs;
    private final boolean respectNewlines;
    private final int maxNewlines;
    private final boolean printComments;
    private final boolean optionalSemicolons;
    private final boolean html;
    private final boolean experimentalDef;
    private final boolean debug;

    private FormattingConfig(Builder builder) {
        this.tabWidth = builder.tabWidth;
        this.useTabs = builder.useTabs;
        this.respectNewlines = builder.respectNewlines;
        this.maxNewlines = builder.maxNewlines;
        this.printComments = builder.printComments;
        this.optionalSemicolons = builder.optionalSemicolons;
        this.html = builder.html;
        this.experimentalDef = builder.experimentalDef;
        this.debug = builder.debug;
    }

    public static FormattingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .tabWidth(tabWidth)
                .useTabs(useTabs)
                .respectNewlines(respectNewlines)
                .maxNewlines(maxNewlines)
                .printComments(printComments)
                .optionalSemicolons(optionalSemicolons)
                .html(html)
                .experimentalDef(experimentalDef)
                .debug(debug);
    }

    public FormattingConfig withHtml(boolean html) {
        return html == this.html ? this : toBuilder().html(html).build();
    }

    public int getTabWidth() { return tabWidth; }
    public boolean isUseTabs() { return useTabs; }
    public boolean isRespectNewlines() { return respectNewlines; }
    public int getMaxNewlines() { return maxNewlines; }
    public boolean isPrintComments() { return printComments; }
    public boolean isOptionalSemicolons() { return optionalSemicolons; }
    public boolean isHtml() { return html; }
    public boolean isExperimentalDef() { return experimentalDef; }
    public boolean isDebug() { return debug; }

    /**
     * Gets the configuration as nested section maps, in the layout of the YAML file.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> layout = new LinkedHashMap<>();
        layout.put("tabWidth", tabWidth);
        layout.put("useTabs", useTabs);
        layout.put("respectNewlines", respectNewlines);
        layout.put("maxNewlines", maxNewlines);

        Map<String, Object> formatting = new LinkedHashMap<>();
        formatting.put("comments", printComments);
        formatting.put("optionalSemicolons", optionalSemicolons);
        formatting.put("html", html);
        formatting.put("experimentalDef", experimentalDef);
        formatting.put("debug", debug);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("layout", layout);
        result.put("formatting", formatting);
        return result;
    }

    @Override
    public String toString() {
        return "FormattingConfig" + toMap();
    }

    public static class Builder {
        private int tabWidth = DEFAULT_TAB_WIDTH;
        private boolean useTabs = true;
        private boolean respectNewlines = true;
        private int maxNewlines = DEFAULT_MAX_NEWLINES;
        private boolean printComments = true;
        private boolean optionalSemicolons;
        private boolean html;
        private boolean experimentalDef;
        private boolean debug;

        public Builder tabWidth(int tabWidth) {
            this.tabWidth = tabWidth;
            return this;
        }

        public Builder useTabs(boolean useTabs) {
            this.useTabs = useTabs;
            return this;
        }

        public Builder respectNewlines(boolean respectNewlines) {
            this.respectNewlines = respectNewlines;
            return this;
        }

        public Builder maxNewlines(int maxNewlines) {
            this.maxNewlines = maxNewlines;
            return this;
        }

        public Builder printComments(boolean printComments) {
            this.printComments = printComments;
            return this;
        }

        public Builder optionalSemicolons(boolean optionalSemicolons) {
            this.optionalSemicolons = optionalSemicolons;
            return this;
        }

        public Builder html(boolean html) {
            this.html = html;
            return this;
        }

        // prints "def" in place of the keyword of grouped declarations
        public Builder experimentalDef(boolean experimentalDef) {
            this.experimentalDef = experimentalDef;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public FormattingConfig build() {
            if (tabWidth < 1) {
                throw new IllegalArgumentException("Tab width must be positive: " + tabWidth);
            }
            if (maxNewlines < 1) {
                throw new IllegalArgumentException("Max newlines must be positive: " + maxNewlines);
            }
            return new FormattingConfig(this);
        }
    }
}
