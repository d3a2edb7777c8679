package com.phillippitts.gesturelauncher.service.action.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static table of logical program names to per-platform executable candidates, e.g.
 * {@code chrome -> {win32: [...], darwin: [...], linux: [...]}}. Group and candidate order is
 * preserved and significant.
 */
public final class ProgramLookupTable {

    private final Map<String, Map<String, List<String>>> programs;

    public ProgramLookupTable(Map<String, Map<String, List<String>>> programs) {
        Map<String, Map<String, List<String>>> copy = new LinkedHashMap<>();
        if (programs != null) {
            programs.forEach((name, groups) -> {
                Map<String, List<String>> g = new LinkedHashMap<>();
                if (groups != null) {
                    groups.forEach((platform, candidates) ->
                            g.put(platform, candidates == null ? List.of() : List.copyOf(candidates)));
                }
                copy.put(name, Collections.unmodifiableMap(g));
            });
        }
        this.programs = Collections.unmodifiableMap(copy);
    }

    /** Built-in candidates for common browsers and tools. */
    public static ProgramLookupTable defaults() {
        Map<String, Map<String, List<String>>> t = new LinkedHashMap<>();
        t.put("chrome", groups(
                List.of("chrome",
                        "C:\\Program Files\\Google\\Chrome\\Application\\chrome.exe",
                        "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe"),
                List.of("/Applications/Google Chrome.app/Contents/MacOS/Google Chrome"),
                List.of("google-chrome", "chrome", "chromium", "chromium-browser")));
        t.put("code", groups(
                List.of("code"),
                List.of("code", "/Applications/Visual Studio Code.app/Contents/Resources/app/bin/code"),
                List.of("code")));
        t.put("explorer", groups(
                List.of("explorer"),
                List.of("open"),
                List.of("xdg-open", "nautilus", "nemo")));
        return new ProgramLookupTable(t);
    }

    private static Map<String, List<String>> groups(List<String> win32, List<String> darwin, List<String> linux) {
        Map<String, List<String>> g = new LinkedHashMap<>();
        g.put("win32", win32);
        g.put("darwin", darwin);
        g.put("linux", linux);
        return g;
    }

    /** @return platform key to candidates for {@code program}, empty when the name is unknown */
    public Map<String, List<String>> candidates(String program) {
        if (program == null) {
            return Map.of();
        }
        return programs.getOrDefault(program, Map.of());
    }

    public Map<String, Map<String, List<String>>> asMap() {
        return programs;
    }
}
