package dumb.obligato;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.obligato.util.Json;

import java.io.IOException;
import java.util.List;

import static dumb.obligato.util.Log.message;
import static dumb.obligato.util.Log.warning;

/** Settings of program mode, read from {@code obligato.json} on the classpath. */
public record Configuration(
        @JsonProperty("transparentObligations") boolean transparentObligations,
        @JsonProperty("autoSolve") boolean autoSolve,
        @JsonProperty("hideObligations") boolean hideObligations,
        @JsonProperty("requiredLibraries") List<String> requiredLibraries,
        @JsonProperty("defaultTactic") String defaultTactic
) {
    public static final String RESOURCE = "obligato.json";
    static final List<String> DEFAULT_LIBRARIES = List.of("Program.Tactics", "Program.Wf");
    static final String DEFAULT_TACTIC = "program_simpl";

    @JsonCreator
    public Configuration(
            @JsonProperty("transparentObligations") Boolean transparentObligations,
            @JsonProperty("autoSolve") Boolean autoSolve,
            @JsonProperty("hideObligations") Boolean hideObligations,
            @JsonProperty("requiredLibraries") List<String> requiredLibraries,
            @JsonProperty("defaultTactic") String defaultTactic
    ) {
        this(
                transparentObligations != null && transparentObligations,
                autoSolve == null || autoSolve,
                hideObligations != null && hideObligations,
                requiredLibraries != null ? List.copyOf(requiredLibraries) : DEFAULT_LIBRARIES,
                defaultTactic != null ? defaultTactic : DEFAULT_TACTIC
        );
    }

    public Configuration() {
        this(false, true, false, DEFAULT_LIBRARIES, DEFAULT_TACTIC);
    }

    public static Configuration load() {
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                message("No " + RESOURCE + " found, using defaults");
                return new Configuration();
            }
            return Json.obj(in, Configuration.class);
        } catch (IOException e) {
            warning("Could not read " + RESOURCE + ", using defaults: " + e.getMessage());
            return new Configuration();
        }
    }

    /** The tactic used when neither the command nor the obligation names one. */
    public Tactic tactic() {
        return Tactics.named(defaultTactic)
                .orElseThrow(() -> new ProgramException("Unknown default tactic " + defaultTactic));
    }

    public Configuration withAutoSolve(boolean autoSolve) {
        return new Configuration(transparentObligations, autoSolve, hideObligations, requiredLibraries, defaultTactic);
    }

    public Configuration withTransparentObligations(boolean transparentObligations) {
        return new Configuration(transparentObligations, autoSolve, hideObligations, requiredLibraries, defaultTactic);
    }

    public Configuration withHideObligations(boolean hideObligations) {
        return new Configuration(transparentObligations, autoSolve, hideObligations, requiredLibraries, defaultTactic);
    }
}
