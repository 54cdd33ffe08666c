package by.greenmobile.wavepackcalc;

import by.greenmobile.wavepackcalc.config.WavepackProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(value = {WavepackProperties.class})
@SpringBootApplication
public class WavepackCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(WavepackCalcApplication.class, args);
    }

}
