package tech.andrefsramos.elearning_harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ElearningHarvesterApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ElearningHarvesterApplication.class, args)));
    }
}
