package by.greenmobile.speedsfeedscalc;

import by.greenmobile.speedsfeedscalc.config.MachiningProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(value = {MachiningProperties.class})
@SpringBootApplication
public class SpeedsFeedsCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeedsFeedsCalcApplication.class, args);
    }

}
