package com.legacylens.core.config;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration, loaded from {@code legacylens.yaml}.
 *
 * <p>Missing sections and fields fall back to {@link #defaults()}, so accessors never return
 * null.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Payroll Estate"
 *   version: "2024.1"
 *
 * source:
 *   extensions: [".cbl", ".cob", ".cpy"]
 *   encoding: "ISO-8859-1"
 *
 * output:
 *   directory: "./docs/legacy"
 *   formats: [json, markdown, mermaid]
 *   encoding: "UTF-8"
 * }</pre>
 *
 * @param project project metadata
 * @param source source discovery settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("source") SourceSettings source,
    @JsonProperty("output") OutputSettings output
) {
    public static final List<String> DEFAULT_EXTENSIONS = List.of(".cbl", ".cob", ".cobol", ".cpy", ".txt");
    public static final String DEFAULT_ENCODING = "UTF-8";
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./legacylens-output";
    public static final List<String> DEFAULT_FORMATS = List.of("json", "markdown", "mermaid");

    public AnalyzerConfig {
        if (project == null) {
            project = new ProjectInfo(null, null);
        }
        if (source == null) {
            source = new SourceSettings(null, null);
        }
        if (output == null) {
            output = new OutputSettings(null, null, null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(null, null, null);
    }

    /**
     * Returns a copy with the source encoding replaced.
     *
     * @param encoding charset name
     * @return updated configuration
     */
    public AnalyzerConfig withEncoding(String encoding) {
        return new AnalyzerConfig(project, new SourceSettings(source.extensions(), encoding), output);
    }

    /**
     * Returns a copy with the output encoding replaced.
     *
     * @param encoding charset name
     * @return updated configuration
     */
    public AnalyzerConfig withOutputEncoding(String encoding) {
        return new AnalyzerConfig(project, source, new OutputSettings(output.directory(), output.formats(), encoding));
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version
    ) {
        public ProjectInfo {
            if (name == null || name.isBlank()) {
                name = "legacy-estate";
            }
            if (version == null || version.isBlank()) {
                version = "1.0.0";
            }
        }
    }

    /**
     * Source discovery settings.
     *
     * @param extensions file extensions analyzed when walking directories, leading dot included
     * @param encoding charset used to decode source files
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourceSettings(
        @JsonProperty("extensions") List<String> extensions,
        @JsonProperty("encoding") String encoding
    ) {
        public SourceSettings {
            extensions = extensions == null || extensions.isEmpty()
                ? DEFAULT_EXTENSIONS
                : extensions.stream().map(SourceSettings::withLeadingDot).toList();
            if (encoding == null || encoding.isBlank()) {
                encoding = DEFAULT_ENCODING;
            }
        }

        private static String withLeadingDot(String extension) {
            return extension.startsWith(".") ? extension : "." + extension;
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory
     * @param formats output formats: {@code json}, {@code markdown} and diagram generator ids
     * @param encoding charset of written files
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("formats") List<String> formats,
        @JsonProperty("encoding") String encoding
    ) {
        public OutputSettings {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_OUTPUT_DIRECTORY;
            }
            formats = formats == null || formats.isEmpty() ? DEFAULT_FORMATS : List.copyOf(formats);
            if (encoding == null || encoding.isBlank()) {
                encoding = DEFAULT_ENCODING;
            }
        }
    }
}
