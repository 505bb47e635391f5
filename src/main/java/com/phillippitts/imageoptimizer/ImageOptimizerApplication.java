package com.phillippitts.imageoptimizer;

import com.phillippitts.imageoptimizer.config.properties.BatchProperties;
import com.phillippitts.imageoptimizer.config.properties.HttpProperties;
import com.phillippitts.imageoptimizer.config.properties.ProtocolProperties;
import com.phillippitts.imageoptimizer.config.properties.SidecarProperties;
import com.phillippitts.imageoptimizer.config.properties.WarmupProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SidecarProperties.class,
        BatchProperties.class,
        ProtocolProperties.class,
        WarmupProperties.class,
        HttpProperties.class
})
@EnableScheduling
public class ImageOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageOptimizerApplication.class, args);
    }

}
