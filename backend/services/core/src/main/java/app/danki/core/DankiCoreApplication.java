package app.danki.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DankiCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(DankiCoreApplication.class, args);
    }
}
