package com.sopgenerator.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sopgenerator.core.linearizer.BranchOrder;

import java.util.List;

/**
 * Root configuration of the SOP generator.
 *
 * <p>Loaded from {@code sop-generator.yaml}. Every section is optional; missing sections and
 * values fall back to the Guideline V2 defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * document:
 *   issuedBy: "Business Excellence"
 *   releaseDate: "TBD"
 *   purposeTemplate: "This document defines the {processName} process."
 *
 * linearizer:
 *   branchOrder: DOCUMENT
 *
 * sections:
 *   diagramReference: true
 *
 * style:
 *   fontFamily: "Avenir LT Std 45 Book"
 *   bodySize: 11
 *
 * session:
 *   ttlMinutes: 60
 *   maxEntries: 100
 * }</pre>
 *
 * @param document document defaults
 * @param linearizer traversal settings
 * @param sections auxiliary section settings
 * @param style styling of synthesized content
 * @param session session store settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SopConfig(
    @JsonProperty("document") DocumentSettings document,
    @JsonProperty("linearizer") LinearizerSettings linearizer,
    @JsonProperty("sections") SectionSettings sections,
    @JsonProperty("style") StyleSettings style,
    @JsonProperty("session") SessionSettings session
) {
    /**
     * Compact constructor, absent sections become their defaults.
     */
    public SopConfig {
        if (document == null) {
            document = DocumentSettings.defaults();
        }
        if (linearizer == null) {
            linearizer = LinearizerSettings.defaults();
        }
        if (sections == null) {
            sections = SectionSettings.defaults();
        }
        if (style == null) {
            style = StyleSettings.defaults();
        }
        if (session == null) {
            session = SessionSettings.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static SopConfig defaults() {
        return new SopConfig(null, null, null, null, null);
    }

    /**
     * Document defaults. Templates may use the {@code {processName}} token.
     *
     * @param issuedBy default issuing department
     * @param releaseDate default release date
     * @param unassignedLane actor named for elements outside any lane
     * @param purposeTemplate default purpose text
     * @param scopeTemplate default scope text
     * @param policyTemplates default general policies
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentSettings(
        @JsonProperty("issuedBy") String issuedBy,
        @JsonProperty("releaseDate") String releaseDate,
        @JsonProperty("unassignedLane") String unassignedLane,
        @JsonProperty("purposeTemplate") String purposeTemplate,
        @JsonProperty("scopeTemplate") String scopeTemplate,
        @JsonProperty("policyTemplates") List<String> policyTemplates
    ) {
        public static final String PROCESS_NAME_TOKEN = "{processName}";

        public DocumentSettings {
            if (issuedBy == null) {
                issuedBy = "Business Excellence";
            }
            if (releaseDate == null) {
                releaseDate = "TBD";
            }
            if (unassignedLane == null || unassignedLane.isBlank()) {
                unassignedLane = "[LANE UNREADABLE]";
            }
            if (purposeTemplate == null) {
                purposeTemplate = "This document defines the {processName} process, the activities it consists of "
                    + "and the responsibilities of every party involved.";
            }
            if (scopeTemplate == null) {
                scopeTemplate = "This procedure applies to all activities of the {processName} process.";
            }
            policyTemplates = policyTemplates == null
                ? List.of(
                    "All activities of the {processName} process shall be performed as described in this procedure.",
                    "Any deviation from this procedure shall be approved by the process owner.")
                : List.copyOf(policyTemplates);
        }

        public static DocumentSettings defaults() {
            return new DocumentSettings(null, null, null, null, null, null);
        }

        /**
         * Replaces the process name token in a template.
         *
         * @param template template text
         * @param processName process name
         * @return filled template
         */
        public static String fill(String template, String processName) {
            return template.replace(PROCESS_NAME_TOKEN, processName);
        }
    }

    /**
     * Step linearizer settings.
     *
     * @param branchOrder order of branches at a split
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LinearizerSettings(
        @JsonProperty("branchOrder") BranchOrder branchOrder
    ) {
        public LinearizerSettings {
            if (branchOrder == null) {
                branchOrder = BranchOrder.DOCUMENT;
            }
        }

        public static LinearizerSettings defaults() {
            return new LinearizerSettings(null);
        }
    }

    /**
     * Auxiliary section settings.
     *
     * @param diagramReference whether to list the process diagram as a referenced document
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SectionSettings(
        @JsonProperty("diagramReference") Boolean diagramReference
    ) {
        public SectionSettings {
            if (diagramReference == null) {
                diagramReference = Boolean.FALSE;
            }
        }

        public static SectionSettings defaults() {
            return new SectionSettings(null);
        }
    }

    /**
     * Styling applied to every synthesized run.
     *
     * @param fontFamily font family
     * @param bodySize body text size in points
     * @param titleSize step title size in points
     * @param refSize step reference size in points
     * @param refColor step reference colour (hex RGB)
     * @param routingShade fill of decision and branch rows (hex RGB)
     * @param slaShade fill of SLA cells (hex RGB)
     * @param indentPerLevel left indentation per branch level, in twentieths of a point
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StyleSettings(
        @JsonProperty("fontFamily") String fontFamily,
        @JsonProperty("bodySize") Integer bodySize,
        @JsonProperty("titleSize") Integer titleSize,
        @JsonProperty("refSize") Integer refSize,
        @JsonProperty("refColor") String refColor,
        @JsonProperty("routingShade") String routingShade,
        @JsonProperty("slaShade") String slaShade,
        @JsonProperty("indentPerLevel") Integer indentPerLevel
    ) {
        public StyleSettings {
            if (fontFamily == null || fontFamily.isBlank()) {
                fontFamily = "Avenir LT Std 45 Book";
            }
            if (bodySize == null) {
                bodySize = 11;
            }
            if (titleSize == null) {
                titleSize = 12;
            }
            if (refSize == null) {
                refSize = 14;
            }
            if (refColor == null) {
                refColor = "FF0000";
            }
            if (routingShade == null) {
                routingShade = "D9D9D9";
            }
            if (slaShade == null) {
                slaShade = "F2F2F2";
            }
            if (indentPerLevel == null) {
                indentPerLevel = 360;
            }
        }

        public static StyleSettings defaults() {
            return new StyleSettings(null, null, null, null, null, null, null, null);
        }
    }

    /**
     * Session store settings.
     *
     * @param ttlMinutes minutes of inactivity after which a session expires
     * @param maxEntries maximum number of sessions kept
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SessionSettings(
        @JsonProperty("ttlMinutes") Long ttlMinutes,
        @JsonProperty("maxEntries") Integer maxEntries
    ) {
        public SessionSettings {
            if (ttlMinutes == null || ttlMinutes <= 0) {
                ttlMinutes = 60L;
            }
            if (maxEntries == null || maxEntries <= 0) {
                maxEntries = 100;
            }
        }

        public static SessionSettings defaults() {
            return new SessionSettings(null, null);
        }
    }
}
