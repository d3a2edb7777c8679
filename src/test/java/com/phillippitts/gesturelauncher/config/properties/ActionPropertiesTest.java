package com.phillippitts.gesturelauncher.config.properties;

import com.phillippitts.gesturelauncher.domain.ActionDescriptor;
import com.phillippitts.gesturelauncher.domain.ActionKind;
import com.phillippitts.gesturelauncher.domain.ActionMapping;
import com.phillippitts.gesturelauncher.service.platform.Platform;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ActionPropertiesTest {

    @Test
    void defaultsMapFingerCountsToBuiltInActions() {
        Map<Integer, ActionProperties.Entry> linux = ActionProperties.defaultMapping(Platform.LINUX);

        assertThat(linux).containsOnlyKeys(0, 1, 2, 3, 4, 5);
        assertThat(linux.get(0).kind()).isEqualTo(ActionKind.NO_OP);
        assertThat(linux.get(1)).isEqualTo(new ActionProperties.Entry(ActionKind.OPEN_URL, "https://www.youtube.com/"));
        assertThat(linux.get(4).parameter()).isEqualTo("nautilus");
        assertThat(linux.get(5)).isEqualTo(new ActionProperties.Entry(ActionKind.OPEN_PROGRAM, null));
        assertThat(ActionProperties.defaultMapping(Platform.WINDOWS).get(4).parameter()).isEqualTo("explorer");
    }

    @Test
    void configuredMappingReplacesDefaults() {
        ActionProperties props = new ActionProperties(
                Map.of(3, new ActionProperties.Entry(ActionKind.SAY_TEXT, "three")), null);

        ActionMapping mapping = props.toActionMapping();

        assertThat(mapping.asMap()).containsOnlyKeys(3);
        assertThat(mapping.descriptorFor(3)).isEqualTo(ActionDescriptor.sayText("three"));
        assertThat(mapping.descriptorFor(1)).isEqualTo(ActionDescriptor.NO_OP);
    }

    @Test
    void entriesWithoutKindAreSkipped() {
        Map<Integer, ActionProperties.Entry> raw = new HashMap<>();
        raw.put(1, new ActionProperties.Entry(null, "https://example.com"));
        raw.put(2, new ActionProperties.Entry(ActionKind.OPEN_PROGRAM, "code"));

        assertThat(new ActionProperties(raw, null).toActionMapping().asMap()).containsOnlyKeys(2);
    }

    @Test
    void programLookupDefaultsWhenAbsent() {
        ActionProperties props = new ActionProperties(null, null);
        assertThat(props.toProgramLookupTable().candidates("code")).isNotEmpty();

        ActionProperties custom = new ActionProperties(null, Map.of("editor", Map.of("linux", List.of("gedit"))));
        assertThat(custom.toProgramLookupTable().asMap()).containsOnlyKeys("editor");
    }
}
