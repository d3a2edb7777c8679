package com.phillippitts.gesturelauncher.config.properties;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import com.phillippitts.gesturelauncher.domain.ActionMapping;
import com.phillippitts.gesturelauncher.service.action.resolve.ProgramLookupTable;
import com.phillippitts.gesturelauncher.service.platform.Platform;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Typed properties for the finger-count to action mapping and the program lookup table.
 *
 * <pre>
 * actions.mapping.1.kind=open-url
 * actions.mapping.1.parameter=https://www.youtube.com/
 * actions.program-lookup.chrome.linux=google-chrome,chromium
 * </pre>
 *
 * When a section is absent the built-in defaults apply.
 */
@Validated
@ConfigurationProperties(prefix = "actions")
public class ActionProperties {

    /**
     * One mapping entry.
     *
     * @param kind      action kind (no-op, open-url, open-program, say-text)
     * @param parameter URL, program or text; optional
     */
    public record Entry(ActionKind kind, String parameter) { }

    private final Map<Integer, Entry> mapping;
    private final Map<String, Map<String, List<String>>> programLookup;

    @ConstructorBinding
    public ActionProperties(Map<Integer, Entry> mapping,
                            Map<String, Map<String, List<String>>> programLookup) {
        this.mapping = (mapping == null || mapping.isEmpty())
                ? defaultMapping(Platform.current())
                : new TreeMap<>(mapping);
        this.programLookup = (programLookup == null || programLookup.isEmpty())
                ? ProgramLookupTable.defaults().asMap()
                : new LinkedHashMap<>(programLookup);
    }

    static Map<Integer, Entry> defaultMapping(Platform platform) {
        Map<Integer, Entry> m = new TreeMap<>();
        m.put(0, new Entry(ActionKind.NO_OP, null));
        m.put(1, new Entry(ActionKind.OPEN_URL, "https://www.youtube.com/"));
        m.put(2, new Entry(ActionKind.OPEN_PROGRAM, "chrome"));
        m.put(3, new Entry(ActionKind.OPEN_PROGRAM, "code"));
        m.put(4, new Entry(ActionKind.OPEN_PROGRAM, platform == Platform.WINDOWS ? "explorer" : "nautilus"));
        m.put(5, new Entry(ActionKind.OPEN_PROGRAM, null));
        return m;
    }

    public Map<Integer, Entry> getMapping() {
        return mapping;
    }

    public Map<String, Map<String, List<String>>> getProgramLookup() {
        return programLookup;
    }

    /** Entries without a kind are skipped here; the configuration validator rejects them at startup. */
    public ActionMapping toActionMapping() {
        Map<Integer, ActionDescriptor> descriptors = new TreeMap<>();
        mapping.forEach((count, entry) -> {
            if (entry != null && entry.kind() != null) {
                descriptors.put(count, ActionDescriptor.of(entry.kind(), entry.parameter()));
            }
        });
        return new ActionMapping(descriptors);
    }

    public ProgramLookupTable toProgramLookupTable() {
        return new ProgramLookupTable(programLookup);
    }
}
