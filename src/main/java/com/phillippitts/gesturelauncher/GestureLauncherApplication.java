package com.phillippitts.gesturelauncher;

import com.phillippitts.gesturelauncher.config.properties.ActionProperties;
import com.phillippitts.gesturelauncher.config.properties.FeedbackProperties;
import com.phillippitts.gesturelauncher.config.properties.GestureProperties;
import com.phillippitts.gesturelauncher.config.properties.ObservationSourceProperties;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        GestureProperties.class,
        ActionProperties.class,
        ObservationSourceProperties.class,
        FeedbackProperties.class
})
public class GestureLauncherApplication {

    public static void main(String[] args) {
        // Desktop.browse needs a non-headless AWT toolkit
        new SpringApplicationBuilder(GestureLauncherApplication.class)
                .headless(false)
                .run(args);
    }

}
